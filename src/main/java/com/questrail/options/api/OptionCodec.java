package com.questrail.options.api;

/**
 * OptionCodec
 * -----------------------------------------------------------------------------
 * Text codec for a single option value shape.
 *
 * <p>An {@code OptionCodec} converts a strongly-typed value into its canonical
 * textual form (for persistence, display and editing), parses that form back,
 * merges a textual delta into an existing value, and names the value shape for
 * introspection and error messages.</p>
 *
 * <h2>Composition</h2>
 * <p>Container codecs (lists, maps, tuples, prefixed lists) are parameterized
 * over the codecs of their elements and delegate to them recursively. Each
 * nesting level reserves its own separator and escapes the text produced by
 * the level below, so nested structures decode unambiguously:</p>
 *
 * <pre>
 *   list      ':'   (elements escaped against ':')
 *   map       ':'   between pairs, '=' inside a pair (both escaped)
 *   tuple     '|'   (elements escaped against '|')
 *   escape    '\'
 * </pre>
 *
 * <h2>Statelessness</h2>
 * <p>Implementations hold no mutable state and perform no I/O. They may be
 * shared freely across threads. Values they produce are immutable.</p>
 *
 * @param <T> the value type handled by this codec
 */
public interface OptionCodec<T>
{
    /**
     * Renders {@code value} in its canonical textual form.
     *
     * @param value the value to render (must not be {@code null})
     * @return the canonical text, never {@code null}
     */
    String toText(T value);

    /**
     * Parses {@code text} into a fresh value.
     *
     * <p>The whole text must be consumed; trailing garbage is a format error.</p>
     *
     * @param text the text to parse (must not be {@code null})
     * @return the decoded value
     * @throws InvalidOptionFormatException if the text does not describe a value of this shape
     */
    T fromText(String text);

    /**
     * Merges the textual {@code delta} into {@code current}.
     *
     * <p>The delta is decoded completely before anything is combined, so a
     * malformed delta never yields a partially merged value.</p>
     *
     * <p>Value shapes without merge semantics inherit this default, which
     * always rejects the request.</p>
     *
     * @param current the value to merge into
     * @param delta   textual delta
     * @return the merged value and whether the merge changed anything
     * @throws UnsupportedOptionOperationException if this shape defines no merge
     * @throws InvalidOptionFormatException        if the delta cannot be decoded
     */
    default Addition<T> add(T current, String delta)
    {
        throw new UnsupportedOptionOperationException("no add operation supported for this option type");
    }

    /**
     * Returns the descriptive name of this value shape, e.g. {@code int-list}
     * or {@code str-to-bool-map}.
     */
    String typeName();
}
