package com.questrail.options.model;

/**
 * A count of lines, or a 0-based line index.
 */
public record LineCount(int value) implements StronglyTypedNumber
{
    public static final LineCount ZERO = new LineCount(0);

    public LineCount plus(int delta) {
        return new LineCount(Math.addExact(value, delta));
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
