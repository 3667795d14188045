package com.questrail.options.api;

/**
 * Indicates that a text could not be parsed into the target value shape.
 *
 * This typically reflects:
 * <ul>
 *   <li>Wrong number of separated fields (tuples, coordinates, map pairs)</li>
 *   <li>An unparseable scalar</li>
 *   <li>An unrecognized boolean, enum or flag word</li>
 * </ul>
 */
public final class InvalidOptionFormatException extends OptionCodecException
{
    public InvalidOptionFormatException(String message) {
        super(message);
    }

    public InvalidOptionFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
