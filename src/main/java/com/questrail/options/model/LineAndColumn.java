package com.questrail.options.model;

/**
 * A (line, column) position, e.g. a cursor location or the anchor of a
 * selection. Both components are 0-based integers.
 */
public record LineAndColumn(int line, int column)
{
    @Override
    public String toString() {
        return line + "," + column;
    }
}
