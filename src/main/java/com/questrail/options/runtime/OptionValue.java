package com.questrail.options.runtime;

import com.questrail.options.api.Addition;
import com.questrail.options.api.OptionCodec;
import com.questrail.options.api.OptionCodecException;
import com.questrail.options.observability.OptionChangeEvent;
import com.questrail.options.observability.OptionErrorEvent;

import java.time.Instant;
import java.util.Objects;

/**
 * OptionValue
 * -----------------------------------------------------------------------------
 * The current value of one declared option.
 *
 * <p>All text-facing operations go through the declaration's
 * {@link OptionCodec}. Updates are all-or-nothing: the new value is fully
 * decoded (or merged) before it replaces the current one, so a rejected update
 * leaves the option exactly as it was.</p>
 *
 * <h2>Observability</h2>
 * <p>Every update that actually changes the value is reported to the
 * declaration's sink, as is every rejected update. Updates that leave the value
 * equal to what it was are silent.</p>
 *
 * <h2>Mutability</h2>
 * This class is mutable by design and makes no thread-safety guarantees.
 * Owners that share an option between threads must serialize updates.
 */
public final class OptionValue<T>
{
    private final OptionDeclaration<T> declaration;
    private T value;

    public OptionValue(OptionDeclaration<T> declaration) {
        this.declaration = Objects.requireNonNull(declaration, "declaration");
        this.value = declaration.defaultValue();
    }

    public OptionDeclaration<T> declaration() {
        return declaration;
    }

    public String name() {
        return declaration.name();
    }

    public String typeName() {
        return declaration.typeName();
    }

    public T get() {
        return value;
    }

    /**
     * Renders the current value in canonical text form.
     */
    public String toText() {
        return declaration.codec().toText(value);
    }

    /**
     * Replaces the current value.
     */
    public void set(T newValue) {
        Objects.requireNonNull(newValue, "newValue");
        replace(newValue);
    }

    /**
     * Replaces the current value with the value decoded from {@code text}.
     *
     * @throws com.questrail.options.api.InvalidOptionFormatException if the text is malformed
     */
    public void setFromText(String text) {
        T decoded;
        try {
            decoded = declaration.codec().fromText(text);
        } catch (OptionCodecException e) {
            reportError("cannot set to '" + text + "': " + e.getMessage(), e);
            throw e;
        }
        replace(decoded);
    }

    /**
     * Merges {@code delta} into the current value (numeric addition, list
     * append, flag union, depending on the type).
     *
     * @return {@code true} if the merge changed the value
     * @throws com.questrail.options.api.UnsupportedOptionOperationException if the type defines no merge
     * @throws com.questrail.options.api.InvalidOptionFormatException        if the delta is malformed
     */
    public boolean addFromText(String delta) {
        Addition<T> addition;
        try {
            addition = declaration.codec().add(value, delta);
        } catch (OptionCodecException e) {
            reportError("cannot add '" + delta + "': " + e.getMessage(), e);
            throw e;
        }
        if (addition.changed()) {
            replace(addition.value());
        }
        return addition.changed();
    }

    /**
     * Restores the declared default value.
     */
    public void reset() {
        replace(declaration.defaultValue());
    }

    private void replace(T newValue) {
        T oldValue = value;
        value = newValue;
        if (!oldValue.equals(newValue)) {
            OptionCodec<T> codec = declaration.codec();
            declaration.sink().onChange(new OptionChangeEvent(
                    Instant.now(), name(), codec.toText(oldValue), codec.toText(newValue)));
        }
    }

    private void reportError(String message, OptionCodecException cause) {
        declaration.sink().onError(new OptionErrorEvent(Instant.now(), name(), message, cause));
    }

    @Override
    public String toString() {
        return "OptionValue[" + name() + "=" + toText() + "]";
    }
}
