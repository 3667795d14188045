package com.questrail.options.codec;

import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.OptionCodec;
import com.questrail.options.model.LineAndColumn;

import java.util.List;
import java.util.Objects;

/**
 * Codec for {@link LineAndColumn} positions, rendered {@code <line>,<column>}.
 *
 * <p>Independent of the container codecs: the comma is not escapable because
 * neither component can contain one.</p>
 */
public final class LineAndColumnCodec implements OptionCodec<LineAndColumn>
{
    LineAndColumnCodec() {}

    @Override
    public String toText(LineAndColumn value) {
        Objects.requireNonNull(value, "value");
        return value.line() + "," + value.column();
    }

    @Override
    public LineAndColumn fromText(String text) {
        List<String> fields = OptionEscaping.split(text, ',');
        if (fields.size() != 2) {
            throw new InvalidOptionFormatException("expected <line>,<column>");
        }
        return new LineAndColumn(IntCodec.parse(fields.get(0)), IntCodec.parse(fields.get(1)));
    }

    @Override
    public String typeName() {
        return "coord";
    }
}
