package com.questrail.options.api;

/**
 * Root of the option codec error taxonomy.
 *
 * <p>All codec failures are synchronous and carry a message suitable for a
 * configuration error report. They are never retried or recovered inside the
 * codec layer.</p>
 */
public class OptionCodecException extends RuntimeException
{
    public OptionCodecException(String message) {
        super(message);
    }

    public OptionCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
