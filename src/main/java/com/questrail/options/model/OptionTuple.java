package com.questrail.options.model;

import java.util.List;
import java.util.Objects;

/**
 * OptionTuple
 * -----------------------------------------------------------------------------
 * Fixed-arity, heterogeneous, ordered sequence of values.
 *
 * <p>The slot types are not tracked here; they are defined by the
 * {@code TupleCodec} that produced or consumes the tuple. Accessors with a
 * {@link Class} argument check the slot type at the point of use.</p>
 *
 * <p>Instances are immutable and never contain {@code null}.</p>
 */
public final class OptionTuple
{
    private final List<Object> elements;

    private OptionTuple(List<Object> elements) {
        this.elements = elements;
    }

    /**
     * Creates a tuple holding {@code elements} in order.
     */
    public static OptionTuple of(Object... elements) {
        Objects.requireNonNull(elements, "elements");
        return new OptionTuple(List.of(elements));
    }

    public static OptionTuple fromList(List<?> elements) {
        Objects.requireNonNull(elements, "elements");
        return new OptionTuple(List.copyOf(elements));
    }

    public int size() {
        return elements.size();
    }

    public Object get(int index) {
        return elements.get(index);
    }

    /**
     * Returns slot {@code index} cast to {@code type}.
     *
     * @throws ClassCastException if the slot holds a value of another type
     */
    public <V> V get(int index, Class<V> type) {
        return type.cast(elements.get(index));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OptionTuple that)) return false;
        return elements.equals(that.elements);
    }

    @Override
    public int hashCode() {
        return elements.hashCode();
    }

    @Override
    public String toString() {
        return "OptionTuple" + elements;
    }
}
