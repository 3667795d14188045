package com.questrail.options.api;

/**
 * Indicates that a merge was requested on a value shape that defines no merge
 * semantics (booleans, maps, bare tuples, coordinates, strings, plain enums).
 */
public final class UnsupportedOptionOperationException extends OptionCodecException
{
    public UnsupportedOptionOperationException(String message) {
        super(message);
    }
}
