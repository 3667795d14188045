package com.questrail.options.model;

/**
 * StronglyTypedNumber
 * -----------------------------------------------------------------------------
 * Contract shared by integer newtypes.
 *
 * <p>Line counts, byte offsets and display columns are all plain integers at
 * the representation level, but they measure different things. Treating them as
 * raw {@code int} values would allow accidental mixing (adding a byte offset to
 * a line number). Each quantity therefore gets its own small value type that
 * wraps the integer and nothing else.</p>
 *
 * <p>The option codec renders and parses a newtype exactly like its underlying
 * integer; only the reconstructed Java type differs.</p>
 */
public interface StronglyTypedNumber
{
    /**
     * Returns the wrapped integer.
     */
    int value();
}
