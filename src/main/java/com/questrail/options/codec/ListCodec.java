package com.questrail.options.codec;

import com.questrail.options.api.Addition;
import com.questrail.options.api.OptionCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static com.questrail.options.codec.OptionEscaping.ESCAPE;
import static com.questrail.options.codec.OptionEscaping.LIST_SEPARATOR;

/**
 * ListCodec
 * -----------------------------------------------------------------------------
 * Codec for an ordered, homogeneous list, generic over the element codec.
 *
 * <h2>Text form</h2>
 * <p>Element texts escaped against {@code ':'} and joined with {@code ':'}.
 * The empty list is the empty string, and the empty string always decodes to
 * the empty list. As a consequence a list holding a single element whose own
 * text is empty renders as {@code ""} and does not survive a round trip; two
 * or more empty elements do ({@code ":"} decodes to two).</p>
 *
 * <h2>Merge</h2>
 * <p>The delta is decoded as a complete list and appended in order. The merge
 * reports a change iff the delta list was non-empty.</p>
 *
 * @param <T> element type
 */
public final class ListCodec<T> implements OptionCodec<List<T>>
{
    private final OptionCodec<T> elementCodec;

    ListCodec(OptionCodec<T> elementCodec) {
        this.elementCodec = Objects.requireNonNull(elementCodec, "elementCodec");
    }

    @Override
    public String toText(List<T> value) {
        Objects.requireNonNull(value, "value");

        StringBuilder out = new StringBuilder();
        for (int i = 0; i < value.size(); i++) {
            if (i != 0) {
                out.append(LIST_SEPARATOR);
            }
            out.append(OptionEscaping.escape(elementCodec.toText(value.get(i)), LIST_SEPARATOR, ESCAPE));
        }
        return out.toString();
    }

    @Override
    public List<T> fromText(String text) {
        Objects.requireNonNull(text, "text");
        if (text.isEmpty()) {
            return List.of();
        }

        List<String> elements = OptionEscaping.split(text, LIST_SEPARATOR, ESCAPE);
        List<T> decoded = new ArrayList<>(elements.size());
        for (String element : elements) {
            decoded.add(elementCodec.fromText(element));
        }
        return Collections.unmodifiableList(decoded);
    }

    @Override
    public Addition<List<T>> add(List<T> current, String delta) {
        Objects.requireNonNull(current, "current");

        // Decode fully before touching anything so a bad delta merges nothing.
        List<T> appended = fromText(delta);
        if (appended.isEmpty()) {
            return new Addition<>(current, false);
        }

        List<T> merged = new ArrayList<>(current.size() + appended.size());
        merged.addAll(current);
        merged.addAll(appended);
        return new Addition<>(Collections.unmodifiableList(merged), true);
    }

    @Override
    public String typeName() {
        return elementCodec.typeName() + "-list";
    }
}
