package com.questrail.options.api;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * EnumDescriptor
 * -----------------------------------------------------------------------------
 * Immutable, ordered descriptor table for an enumerated option type.
 *
 * <p>The table lists every legal value together with its canonical lowercase
 * name, in a fixed declaration order. That order drives both the type name
 * ({@code flags(hooks|shell)}) and the rendering order of flag sets.</p>
 *
 * <p>Whether the type is a <em>flag</em> type (any combination of values is a
 * legal option value) or a plain <em>enum</em> (exactly one value) is part of
 * the table. Tables are meant to be created once, held in a {@code static final}
 * field, and read concurrently afterwards.</p>
 *
 * @param <E> the described enum type
 */
public final class EnumDescriptor<E extends Enum<E>>
{
    /**
     * One row of the table.
     */
    public record Entry<E extends Enum<E>>(E value, String name)
    {
        public Entry {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(name, "name");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Enum name must not be empty");
            }
        }
    }

    private final Class<E> type;
    private final boolean flags;
    private final List<Entry<E>> entries;
    private final Map<String, E> valueByName;
    private final Map<E, String> nameByValue;

    private EnumDescriptor(Class<E> type, boolean flags, List<Entry<E>> entries) {
        this.type = Objects.requireNonNull(type, "type");
        this.flags = flags;
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("At least one entry is required");
        }

        Map<String, E> byName = new HashMap<>();
        Map<E, String> byValue = new EnumMap<>(type);
        for (Entry<E> entry : entries) {
            if (byName.put(entry.name(), entry.value()) != null) {
                throw new IllegalArgumentException("Duplicate name in descriptor: " + entry.name());
            }
            if (byValue.put(entry.value(), entry.name()) != null) {
                throw new IllegalArgumentException("Duplicate value in descriptor: " + entry.value());
            }
        }

        this.entries = List.copyOf(entries);
        this.valueByName = Collections.unmodifiableMap(byName);
        this.nameByValue = Collections.unmodifiableMap(byValue);
    }

    /**
     * Starts a descriptor for a type whose values combine bitwise.
     */
    public static <E extends Enum<E>> Builder<E> flags(Class<E> type) {
        return new Builder<>(type, true);
    }

    /**
     * Starts a descriptor for a type that takes exactly one value.
     */
    public static <E extends Enum<E>> Builder<E> plain(Class<E> type) {
        return new Builder<>(type, false);
    }

    public Class<E> type() {
        return type;
    }

    /**
     * Returns {@code true} if values of this type combine as a set.
     */
    public boolean isFlags() {
        return flags;
    }

    public List<Entry<E>> entries() {
        return entries;
    }

    public Optional<E> valueOf(String name) {
        return Optional.ofNullable(valueByName.get(name));
    }

    /**
     * Returns the canonical name of {@code value}.
     *
     * @throws IllegalArgumentException if the value is not listed in this table
     */
    public String nameOf(E value) {
        Objects.requireNonNull(value, "value");
        String name = nameByValue.get(value);
        if (name == null) {
            throw new IllegalArgumentException("Value not described: " + value);
        }
        return name;
    }

    /**
     * Returns all names in declaration order joined with {@code |}.
     */
    public String joinedNames() {
        return entries.stream().map(Entry::name).collect(Collectors.joining("|"));
    }

    /**
     * Returns {@code flags(a|b|...)} or {@code enum(a|b|...)}.
     */
    public String typeName() {
        return (flags ? "flags" : "enum") + "(" + joinedNames() + ")";
    }

    public static final class Builder<E extends Enum<E>>
    {
        private final Class<E> type;
        private final boolean flags;
        private final List<Entry<E>> entries = new ArrayList<>();

        private Builder(Class<E> type, boolean flags) {
            this.type = Objects.requireNonNull(type, "type");
            this.flags = flags;
        }

        public Builder<E> add(E value, String name) {
            entries.add(new Entry<>(value, name));
            return this;
        }

        public EnumDescriptor<E> build() {
            return new EnumDescriptor<>(type, flags, entries);
        }
    }
}
