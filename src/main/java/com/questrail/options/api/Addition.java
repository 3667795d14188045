package com.questrail.options.api;

import java.util.Objects;

/**
 * Result of {@link OptionCodec#add(Object, String)}.
 *
 * @param value   the merged value
 * @param changed {@code false} when the delta was a no-op (zero increment,
 *                empty list, no flags)
 */
public record Addition<T>(T value, boolean changed)
{
    public Addition {
        Objects.requireNonNull(value, "value");
    }
}
