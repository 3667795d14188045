package com.questrail.options.codec;

import com.questrail.options.api.Addition;
import com.questrail.options.api.OptionCodec;
import com.questrail.options.model.StronglyTypedNumber;

import java.util.Objects;
import java.util.function.IntFunction;

/**
 * NumericNewtypeCodec
 * -----------------------------------------------------------------------------
 * Codec for an integer newtype such as {@code LineCount} or {@code ByteCount}.
 *
 * <p>Text handling is identical to {@link IntCodec}; the decoded integer is
 * rewrapped with {@code factory}. Merging adds a plain integer delta to the
 * wrapped value.</p>
 *
 * @param <T> the newtype
 */
public final class NumericNewtypeCodec<T extends StronglyTypedNumber> implements OptionCodec<T>
{
    private final String typeName;
    private final IntFunction<T> factory;

    NumericNewtypeCodec(String typeName, IntFunction<T> factory) {
        this.typeName = Objects.requireNonNull(typeName, "typeName");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public String toText(T value) {
        return Integer.toString(Objects.requireNonNull(value, "value").value());
    }

    @Override
    public T fromText(String text) {
        return factory.apply(IntCodec.parse(text));
    }

    @Override
    public Addition<T> add(T current, String delta) {
        Objects.requireNonNull(current, "current");
        int increment = IntCodec.parse(delta);
        T sum = factory.apply(IntCodec.addExact(current.value(), increment));
        return new Addition<>(sum, increment != 0);
    }

    @Override
    public String typeName() {
        return typeName;
    }
}
