package com.questrail.options.codec;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * OptionEscaping
 * -----------------------------------------------------------------------------
 * Escaping and splitting primitives shared by every container codec.
 *
 * <p>A container embeds the text of its elements next to its own separator.
 * To keep that unambiguous, element text is escaped before embedding: every
 * occurrence of the separator <em>and</em> of the escape character itself is
 * prefixed with the escape character. Splitting reverses exactly one level of
 * escaping, so for any text {@code s}:</p>
 *
 * <pre>
 *   split(escape(s, c, e), c, e) == [s]
 * </pre>
 *
 * <p>An escape character followed by anything other than the separator or
 * another escape character is kept literally, as is a dangling escape at the
 * end of the input.</p>
 *
 * <p>Splitting never drops segments: the empty string splits into one empty
 * segment, and adjacent separators produce empty segments between them.
 * Callers that want "empty text means empty container" must check for that
 * before splitting.</p>
 */
final class OptionEscaping
{
    /** Escape character used at every nesting level. */
    static final char ESCAPE = '\\';

    /** Separates list elements and map pairs. */
    static final char LIST_SEPARATOR = ':';

    /** Separates a map key from its value. */
    static final char MAP_SEPARATOR = '=';

    /** Separates tuple fields. */
    static final char TUPLE_SEPARATOR = '|';

    /** Separates active flag names; never escaped. */
    static final char FLAG_SEPARATOR = '|';

    private OptionEscaping() {}

    /**
     * Prefixes every {@code reserved} and every {@code escape} character in
     * {@code text} with {@code escape}.
     */
    static String escape(String text, char reserved, char escape)
    {
        Objects.requireNonNull(text, "text");

        // Fast path: most option text carries no reserved characters.
        if (text.indexOf(reserved) < 0 && text.indexOf(escape) < 0) {
            return text;
        }

        StringBuilder out = new StringBuilder(text.length() + 8);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == reserved || c == escape) {
                out.append(escape);
            }
            out.append(c);
        }
        return out.toString();
    }

    /**
     * Splits {@code text} on every unescaped {@code separator}, removing one
     * level of escaping from each segment.
     *
     * @return the segments in order; never empty
     */
    static List<String> split(String text, char separator, char escape)
    {
        Objects.requireNonNull(text, "text");

        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            if (c == escape && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == separator || next == escape) {
                    current.append(next);
                    i++;
                    continue;
                }
            }

            if (c == separator) {
                segments.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }

        segments.add(current.toString());
        return segments;
    }

    /**
     * Splits {@code text} on every {@code separator}; no escaping is
     * recognized. Used for fields whose content never contains the separator
     * (numbers, enum names).
     */
    static List<String> split(String text, char separator)
    {
        Objects.requireNonNull(text, "text");

        List<String> segments = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == separator) {
                segments.add(text.substring(start, i));
                start = i + 1;
            }
        }
        segments.add(text.substring(start));
        return segments;
    }

    /**
     * Returns the index of the first unescaped {@code separator} in
     * {@code text}, or {@code -1} if there is none.
     */
    static int indexOfUnescaped(String text, char separator, char escape)
    {
        Objects.requireNonNull(text, "text");

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == escape && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == separator || next == escape) {
                    i++;
                    continue;
                }
            }
            if (c == separator) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Removes one level of escaping for {@code reserved} from {@code text}.
     * Inverse of {@link #escape(String, char, char)}.
     */
    static String unescape(String text, char reserved, char escape)
    {
        Objects.requireNonNull(text, "text");
        if (text.indexOf(escape) < 0) {
            return text;
        }

        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == escape && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                if (next == reserved || next == escape) {
                    out.append(next);
                    i++;
                    continue;
                }
            }
            out.append(c);
        }
        return out.toString();
    }
}
