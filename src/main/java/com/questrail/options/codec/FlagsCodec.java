package com.questrail.options.codec;

import com.questrail.options.api.Addition;
import com.questrail.options.api.EnumDescriptor;
import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.OptionCodec;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import static com.questrail.options.codec.OptionEscaping.FLAG_SEPARATOR;

/**
 * FlagsCodec
 * -----------------------------------------------------------------------------
 * Codec for a set of flags drawn from a closed enumeration.
 *
 * <p>Active flag names are joined with {@code '|'}, in descriptor order,
 * matching the listing in the type name ({@code flags(hooks|shell)}). The
 * empty set is the empty string. Only values present in the descriptor are
 * accepted, in either direction.</p>
 *
 * <p>Merging is set union; it reports a change iff the delta named at least
 * one flag.</p>
 *
 * @param <E> the flag enum type
 */
public final class FlagsCodec<E extends Enum<E>> implements OptionCodec<Set<E>>
{
    private final EnumDescriptor<E> descriptor;

    FlagsCodec(EnumDescriptor<E> descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        if (!descriptor.isFlags()) {
            throw new IllegalArgumentException(
                    "descriptor for " + descriptor.type().getSimpleName() + " does not describe flags");
        }
    }

    @Override
    public String toText(Set<E> value) {
        Objects.requireNonNull(value, "value");
        for (E flag : value) {
            descriptor.nameOf(flag);
        }

        StringBuilder out = new StringBuilder();
        for (EnumDescriptor.Entry<E> entry : descriptor.entries()) {
            if (value.contains(entry.value())) {
                if (out.length() != 0) {
                    out.append(FLAG_SEPARATOR);
                }
                out.append(entry.name());
            }
        }
        return out.toString();
    }

    @Override
    public Set<E> fromText(String text) {
        Objects.requireNonNull(text, "text");

        EnumSet<E> flags = EnumSet.noneOf(descriptor.type());
        if (text.isEmpty()) {
            return Collections.unmodifiableSet(flags);
        }

        for (String name : OptionEscaping.split(text, FLAG_SEPARATOR)) {
            E flag = descriptor.valueOf(name).orElseThrow(
                    () -> new InvalidOptionFormatException("invalid flag value '" + name + "'"));
            flags.add(flag);
        }
        return Collections.unmodifiableSet(flags);
    }

    @Override
    public Addition<Set<E>> add(Set<E> current, String delta) {
        Objects.requireNonNull(current, "current");

        Set<E> added = fromText(delta);
        if (added.isEmpty()) {
            return new Addition<>(current, false);
        }

        EnumSet<E> union = EnumSet.noneOf(descriptor.type());
        union.addAll(current);
        union.addAll(added);
        return new Addition<>(Collections.unmodifiableSet(union), true);
    }

    @Override
    public String typeName() {
        return descriptor.typeName();
    }
}
