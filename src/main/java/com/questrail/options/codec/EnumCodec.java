package com.questrail.options.codec;

import com.questrail.options.api.EnumDescriptor;
import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.OptionCodec;

import java.util.Objects;

/**
 * Codec for a plain enum option holding exactly one value, named by its
 * {@link EnumDescriptor}. Plain enums define no merge.
 *
 * @param <E> the enum type
 */
public final class EnumCodec<E extends Enum<E>> implements OptionCodec<E>
{
    private final EnumDescriptor<E> descriptor;

    EnumCodec(EnumDescriptor<E> descriptor) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor.isFlags()) {
            throw new IllegalArgumentException(
                    "descriptor for " + descriptor.type().getSimpleName() + " describes flags, not an enum");
        }
    }

    @Override
    public String toText(E value) {
        return descriptor.nameOf(value);
    }

    @Override
    public E fromText(String text) {
        Objects.requireNonNull(text, "text");
        return descriptor.valueOf(text).orElseThrow(() -> new InvalidOptionFormatException(
                "invalid enum value '" + text + "', expected one of " + descriptor.joinedNames()));
    }

    @Override
    public String typeName() {
        return descriptor.typeName();
    }
}
