package com.questrail.options.model;

import com.questrail.options.api.EnumDescriptor;

/**
 * Categories of diagnostic output that can be switched on independently.
 *
 * <p>Held in a {@code flags(...)} option: any combination is legal, including
 * none at all.</p>
 */
public enum DebugFlags
{
    HOOKS,
    SHELL,
    PROFILE,
    KEYS;

    public static final EnumDescriptor<DebugFlags> DESCRIPTOR =
            EnumDescriptor.flags(DebugFlags.class)
                    .add(HOOKS, "hooks")
                    .add(SHELL, "shell")
                    .add(PROFILE, "profile")
                    .add(KEYS, "keys")
                    .build();
}
