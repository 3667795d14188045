package com.questrail.options.codec;

import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.OptionCodec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.questrail.options.codec.OptionEscaping.ESCAPE;
import static com.questrail.options.codec.OptionEscaping.LIST_SEPARATOR;
import static com.questrail.options.codec.OptionEscaping.MAP_SEPARATOR;

/**
 * MapCodec
 * -----------------------------------------------------------------------------
 * Codec for a key/value mapping, generic over the key and value codecs.
 *
 * <h2>Text form</h2>
 * <pre>
 *   pair  = escape(key, '=') "=" escape(value, '=')
 *   map   = escape(pair, ':') { ":" escape(pair, ':') }
 * </pre>
 *
 * <p>Pairs are written in the iteration order of the map being rendered; the
 * order carries no meaning. Decoded maps preserve the textual order, and a key
 * that appears more than once keeps its last value. The empty string decodes to
 * the empty map.</p>
 *
 * <p>Maps define no merge.</p>
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class MapCodec<K, V> implements OptionCodec<Map<K, V>>
{
    private final OptionCodec<K> keyCodec;
    private final OptionCodec<V> valueCodec;

    MapCodec(OptionCodec<K> keyCodec, OptionCodec<V> valueCodec) {
        this.keyCodec = Objects.requireNonNull(keyCodec, "keyCodec");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
    }

    @Override
    public String toText(Map<K, V> value) {
        Objects.requireNonNull(value, "value");

        StringBuilder out = new StringBuilder();
        boolean first = true;
        for (Map.Entry<K, V> entry : value.entrySet()) {
            if (!first) {
                out.append(LIST_SEPARATOR);
            }
            first = false;

            String pair = OptionEscaping.escape(keyCodec.toText(entry.getKey()), MAP_SEPARATOR, ESCAPE)
                    + MAP_SEPARATOR
                    + OptionEscaping.escape(valueCodec.toText(entry.getValue()), MAP_SEPARATOR, ESCAPE);
            out.append(OptionEscaping.escape(pair, LIST_SEPARATOR, ESCAPE));
        }
        return out.toString();
    }

    @Override
    public Map<K, V> fromText(String text) {
        Objects.requireNonNull(text, "text");

        Map<K, V> decoded = new LinkedHashMap<>();
        if (text.isEmpty()) {
            return Collections.unmodifiableMap(decoded);
        }

        for (String element : OptionEscaping.split(text, LIST_SEPARATOR, ESCAPE)) {
            List<String> pair = OptionEscaping.split(element, MAP_SEPARATOR, ESCAPE);
            if (pair.size() != 2) {
                throw new InvalidOptionFormatException("map option expects key=value");
            }
            K key = keyCodec.fromText(pair.get(0));
            V val = valueCodec.fromText(pair.get(1));
            decoded.put(key, val);
        }
        return Collections.unmodifiableMap(decoded);
    }

    @Override
    public String typeName() {
        return keyCodec.typeName() + "-to-" + valueCodec.typeName() + "-map";
    }
}
