package com.questrail.options.model;

/**
 * A count of display columns, or a 0-based display column.
 */
public record ColumnCount(int value) implements StronglyTypedNumber
{
    public static final ColumnCount ZERO = new ColumnCount(0);

    public ColumnCount plus(int delta) {
        return new ColumnCount(Math.addExact(value, delta));
    }

    @Override
    public String toString() {
        return Integer.toString(value);
    }
}
