package com.questrail.options.model;

import java.util.List;
import java.util.Objects;

/**
 * PrefixedList
 * -----------------------------------------------------------------------------
 * A single scalar {@code prefix} followed by an ordered list of elements.
 *
 * <p>The canonical use is the <em>timestamped list</em>: the prefix is an
 * unsigned revision counter recording when the list was last recomputed, and
 * the list holds per-revision data (highlight ranges, completion candidates).
 * Merging text into a prefixed list only ever appends to the list; the prefix
 * is left untouched.</p>
 *
 * <p>Instances are immutable. Two prefixed lists are equal iff both their
 * prefixes and their lists are equal.</p>
 *
 * @param <P> prefix type
 * @param <T> element type
 */
public final class PrefixedList<P, T>
{
    private final P prefix;
    private final List<T> list;

    private PrefixedList(P prefix, List<T> list) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.list = List.copyOf(list);
    }

    public static <P, T> PrefixedList<P, T> of(P prefix, List<T> list) {
        Objects.requireNonNull(list, "list");
        return new PrefixedList<>(prefix, list);
    }

    public static <P, T> PrefixedList<P, T> empty(P prefix) {
        return new PrefixedList<>(prefix, List.of());
    }

    public P prefix() {
        return prefix;
    }

    public List<T> list() {
        return list;
    }

    /**
     * Returns a copy with the same prefix and {@code list} as elements.
     */
    public PrefixedList<P, T> withList(List<T> list) {
        Objects.requireNonNull(list, "list");
        return new PrefixedList<>(prefix, list);
    }

    /**
     * Returns a copy with the same elements and a new prefix.
     */
    public PrefixedList<P, T> withPrefix(P prefix) {
        return new PrefixedList<>(prefix, list);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PrefixedList<?, ?> that)) return false;
        return prefix.equals(that.prefix) && list.equals(that.list);
    }

    @Override
    public int hashCode() {
        return Objects.hash(prefix, list);
    }

    @Override
    public String toString() {
        return "PrefixedList[" + prefix + ", " + list + "]";
    }
}
