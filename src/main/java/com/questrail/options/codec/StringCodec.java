package com.questrail.options.codec;

import com.questrail.options.api.OptionCodec;

import java.util.Objects;

/**
 * Identity codec for free-form {@code str} options.
 */
public final class StringCodec implements OptionCodec<String>
{
    StringCodec() {}

    @Override
    public String toText(String value) {
        return Objects.requireNonNull(value, "value");
    }

    @Override
    public String fromText(String text) {
        return Objects.requireNonNull(text, "text");
    }

    @Override
    public String typeName() {
        return "str";
    }
}
