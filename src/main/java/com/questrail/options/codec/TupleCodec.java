package com.questrail.options.codec;

import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.OptionCodec;
import com.questrail.options.model.OptionTuple;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static com.questrail.options.codec.OptionEscaping.ESCAPE;
import static com.questrail.options.codec.OptionEscaping.TUPLE_SEPARATOR;

/**
 * TupleCodec
 * -----------------------------------------------------------------------------
 * Codec for a fixed-arity, heterogeneous {@link OptionTuple}.
 *
 * <p>Slot {@code i} is handled by element codec {@code i}. Fields are escaped
 * against {@code '|'} and joined with {@code '|'}, always from slot 0 upwards.
 * Decoding requires exactly as many fields as there are slots.</p>
 *
 * <p>Tuples define no merge.</p>
 */
public final class TupleCodec implements OptionCodec<OptionTuple>
{
    private final List<OptionCodec<?>> elementCodecs;

    TupleCodec(List<? extends OptionCodec<?>> elementCodecs) {
        Objects.requireNonNull(elementCodecs, "elementCodecs");
        if (elementCodecs.isEmpty()) {
            throw new IllegalArgumentException("A tuple needs at least one element");
        }
        this.elementCodecs = List.copyOf(elementCodecs);
    }

    public int arity() {
        return elementCodecs.size();
    }

    @Override
    public String toText(OptionTuple value) {
        Objects.requireNonNull(value, "value");
        if (value.size() != arity()) {
            throw new IllegalArgumentException(
                    "tuple has " + value.size() + " elements, codec expects " + arity());
        }

        StringBuilder out = new StringBuilder();
        for (int i = 0; i < arity(); i++) {
            if (i != 0) {
                out.append(TUPLE_SEPARATOR);
            }
            String field = encode(i, elementCodecs.get(i), value.get(i));
            out.append(OptionEscaping.escape(field, TUPLE_SEPARATOR, ESCAPE));
        }
        return out.toString();
    }

    @Override
    public OptionTuple fromText(String text) {
        List<String> fields = OptionEscaping.split(text, TUPLE_SEPARATOR, ESCAPE);
        if (fields.size() != arity()) {
            throw new InvalidOptionFormatException(fields.size() < arity()
                    ? "not enough elements in tuple"
                    : "too many elements in tuple");
        }

        List<Object> decoded = new ArrayList<>(arity());
        for (int i = 0; i < arity(); i++) {
            decoded.add(elementCodecs.get(i).fromText(fields.get(i)));
        }
        return OptionTuple.fromList(decoded);
    }

    /**
     * Returns {@code tuple(<slot0>,<slot1>,...)}.
     */
    @Override
    public String typeName() {
        return elementCodecs.stream()
                .map(OptionCodec::typeName)
                .collect(Collectors.joining(",", "tuple(", ")"));
    }

    @SuppressWarnings("unchecked")
    private static <V> String encode(int slot, OptionCodec<V> codec, Object element) {
        try {
            return codec.toText((V) element);
        } catch (ClassCastException e) {
            throw new IllegalArgumentException(
                    "tuple element " + slot + " does not match codec " + codec.typeName(), e);
        }
    }
}
