package com.questrail.options.codec;

import com.questrail.options.api.Addition;
import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.OptionCodec;

import java.util.Objects;

/**
 * Codec for {@code int} options. Merging adds the delta.
 */
public final class IntCodec implements OptionCodec<Integer>
{
    IntCodec() {}

    @Override
    public String toText(Integer value) {
        return Integer.toString(Objects.requireNonNull(value, "value"));
    }

    @Override
    public Integer fromText(String text) {
        return parse(text);
    }

    @Override
    public Addition<Integer> add(Integer current, String delta) {
        Objects.requireNonNull(current, "current");
        int increment = parse(delta);
        return new Addition<>(addExact(current, increment), increment != 0);
    }

    @Override
    public String typeName() {
        return "int";
    }

    /**
     * Parses a base-10 {@code int}: an optional {@code '-'} followed by ASCII
     * digits only. No {@code '+'}, no whitespace, no non-ASCII digits.
     */
    static int parse(String text) {
        requireDecimal(text);
        try {
            return Integer.parseInt(text, 10);
        } catch (NumberFormatException e) {
            throw new InvalidOptionFormatException("'" + text + "' is not a number", e);
        }
    }

    /**
     * Rejects anything but {@code -?[0-9]+}.
     */
    static void requireDecimal(String text) {
        Objects.requireNonNull(text, "text");
        int start = text.startsWith("-") ? 1 : 0;
        if (start == text.length()) {
            throw new InvalidOptionFormatException("'" + text + "' is not a number");
        }
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw new InvalidOptionFormatException("'" + text + "' is not a number");
            }
        }
    }

    static int addExact(int value, int increment) {
        try {
            return Math.addExact(value, increment);
        } catch (ArithmeticException e) {
            throw new InvalidOptionFormatException("integer overflow", e);
        }
    }
}
