package com.questrail.options.codec;

import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.OptionCodec;

import java.util.Objects;

/**
 * Codec for {@code bool} options.
 *
 * <p>Renders {@code true}/{@code false}; also accepts {@code yes}/{@code no}
 * on input. Booleans define no merge.</p>
 */
public final class BoolCodec implements OptionCodec<Boolean>
{
    BoolCodec() {}

    @Override
    public String toText(Boolean value) {
        return Objects.requireNonNull(value, "value") ? "true" : "false";
    }

    @Override
    public Boolean fromText(String text) {
        Objects.requireNonNull(text, "text");
        return switch (text) {
            case "true", "yes" -> Boolean.TRUE;
            case "false", "no" -> Boolean.FALSE;
            default -> throw new InvalidOptionFormatException(
                    "boolean values are either true, yes, false or no");
        };
    }

    @Override
    public String typeName() {
        return "bool";
    }
}
