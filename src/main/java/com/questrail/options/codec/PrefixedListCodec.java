package com.questrail.options.codec;

import com.questrail.options.api.Addition;
import com.questrail.options.api.OptionCodec;
import com.questrail.options.model.PrefixedList;

import java.util.List;
import java.util.Objects;

import static com.questrail.options.codec.OptionEscaping.ESCAPE;
import static com.questrail.options.codec.OptionEscaping.LIST_SEPARATOR;

/**
 * PrefixedListCodec
 * -----------------------------------------------------------------------------
 * Codec for {@link PrefixedList}: a prefix value, a {@code ':'}, then a list
 * in {@link ListCodec} form.
 *
 * <pre>
 *   5:1:2    prefix 5, list [1, 2]
 *   5:       prefix 5, empty list
 *   5        prefix 5, empty list
 * </pre>
 *
 * <p>Decoding splits at the first unescaped {@code ':'}. Merging appends to
 * the list through {@link ListCodec#add(List, String)} and never touches the
 * prefix.</p>
 *
 * @param <P> prefix type
 * @param <T> element type
 */
public final class PrefixedListCodec<P, T> implements OptionCodec<PrefixedList<P, T>>
{
    private final OptionCodec<P> prefixCodec;
    private final ListCodec<T> listCodec;

    PrefixedListCodec(OptionCodec<P> prefixCodec, OptionCodec<T> elementCodec) {
        this.prefixCodec = Objects.requireNonNull(prefixCodec, "prefixCodec");
        this.listCodec = new ListCodec<>(elementCodec);
    }

    @Override
    public String toText(PrefixedList<P, T> value) {
        Objects.requireNonNull(value, "value");
        return OptionEscaping.escape(prefixCodec.toText(value.prefix()), LIST_SEPARATOR, ESCAPE)
                + LIST_SEPARATOR
                + listCodec.toText(value.list());
    }

    @Override
    public PrefixedList<P, T> fromText(String text) {
        Objects.requireNonNull(text, "text");

        int split = OptionEscaping.indexOfUnescaped(text, LIST_SEPARATOR, ESCAPE);
        String prefixText = split < 0 ? text : text.substring(0, split);
        P prefix = prefixCodec.fromText(OptionEscaping.unescape(prefixText, LIST_SEPARATOR, ESCAPE));

        if (split < 0) {
            return PrefixedList.empty(prefix);
        }
        return PrefixedList.of(prefix, listCodec.fromText(text.substring(split + 1)));
    }

    @Override
    public Addition<PrefixedList<P, T>> add(PrefixedList<P, T> current, String delta) {
        Objects.requireNonNull(current, "current");

        Addition<List<T>> merged = listCodec.add(current.list(), delta);
        if (!merged.changed()) {
            return new Addition<>(current, false);
        }
        return new Addition<>(current.withList(merged.value()), true);
    }

    @Override
    public String typeName() {
        return prefixCodec.typeName() + "-prefixed-" + listCodec.typeName();
    }
}
