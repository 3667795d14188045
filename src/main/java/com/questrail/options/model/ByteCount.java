package com.questrail.options.model;

/**
 * A count of bytes, or a 0-based byte offset within a line.
 */
public record ByteCount(int value) implements StronglyTypedNumber
{
    public static final ByteCount ZERO = new ByteCount(0);

    public ByteCount plus(int delta) {
        return new ByteCount(Math.addExact(value, delta));
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
