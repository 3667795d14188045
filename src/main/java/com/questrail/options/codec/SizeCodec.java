package com.questrail.options.codec;

import com.questrail.options.api.Addition;
import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.OptionCodec;

import java.util.Objects;

/**
 * Codec for unsigned sizes and counters, held as non-negative {@code long}.
 *
 * <p>Merging adds a signed delta; a merge that would make the size negative
 * is rejected.</p>
 */
public final class SizeCodec implements OptionCodec<Long>
{
    SizeCodec() {}

    @Override
    public String toText(Long value) {
        Objects.requireNonNull(value, "value");
        if (value < 0) {
            throw new IllegalArgumentException("size must be non-negative (was " + value + ")");
        }
        return Long.toString(value);
    }

    @Override
    public Long fromText(String text) {
        long value = parseSigned(text);
        if (value < 0) {
            throw new InvalidOptionFormatException("'" + text + "' is not a valid size");
        }
        return value;
    }

    @Override
    public Addition<Long> add(Long current, String delta) {
        Objects.requireNonNull(current, "current");
        long increment = parseSigned(delta);

        long sum;
        try {
            sum = Math.addExact(current, increment);
        } catch (ArithmeticException e) {
            throw new InvalidOptionFormatException("integer overflow", e);
        }
        if (sum < 0) {
            throw new InvalidOptionFormatException("size cannot become negative");
        }
        return new Addition<>(sum, increment != 0);
    }

    @Override
    public String typeName() {
        return "size";
    }

    private static long parseSigned(String text) {
        IntCodec.requireDecimal(text);
        try {
            return Long.parseLong(text, 10);
        } catch (NumberFormatException e) {
            throw new InvalidOptionFormatException("'" + text + "' is not a number", e);
        }
    }
}
