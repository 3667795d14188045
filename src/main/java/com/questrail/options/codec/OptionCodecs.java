package com.questrail.options.codec;

import com.questrail.options.api.EnumDescriptor;
import com.questrail.options.api.OptionCodec;
import com.questrail.options.model.ByteCount;
import com.questrail.options.model.ColumnCount;
import com.questrail.options.model.LineAndColumn;
import com.questrail.options.model.LineCount;
import com.questrail.options.model.StronglyTypedNumber;

import java.util.Arrays;
import java.util.function.IntFunction;

/**
 * OptionCodecs
 * -----------------------------------------------------------------------------
 * Entry point for obtaining and composing option codecs.
 *
 * <p>Scalar codecs are shared singletons. Container codecs are built from
 * their element codecs, and their type names are derived recursively from the
 * element type names:</p>
 *
 * <pre>
 *   listOf(integers())                          int-list
 *   mapOf(strings(), booleans())                str-to-bool-map
 *   tupleOf(integers(), strings())              tuple(int,str)
 *   timestampedListOf(strings())                size-prefixed-str-list
 *   flagsOf(DebugFlags.DESCRIPTOR)              flags(hooks|shell|profile|keys)
 * </pre>
 */
public final class OptionCodecs
{
    private static final IntCodec INT = new IntCodec();
    private static final SizeCodec SIZE = new SizeCodec();
    private static final BoolCodec BOOL = new BoolCodec();
    private static final StringCodec STRING = new StringCodec();
    private static final LineAndColumnCodec COORD = new LineAndColumnCodec();

    private static final NumericNewtypeCodec<LineCount> LINE =
            new NumericNewtypeCodec<>("line", LineCount::new);
    private static final NumericNewtypeCodec<ByteCount> BYTE =
            new NumericNewtypeCodec<>("byte", ByteCount::new);
    private static final NumericNewtypeCodec<ColumnCount> COLUMN =
            new NumericNewtypeCodec<>("column", ColumnCount::new);

    private OptionCodecs() {}

    // ========================================================================
    // Scalars
    // ========================================================================

    public static OptionCodec<Integer> integers() {
        return INT;
    }

    public static OptionCodec<Long> sizes() {
        return SIZE;
    }

    public static OptionCodec<Boolean> booleans() {
        return BOOL;
    }

    public static OptionCodec<String> strings() {
        return STRING;
    }

    public static OptionCodec<LineCount> lineCounts() {
        return LINE;
    }

    public static OptionCodec<ByteCount> byteCounts() {
        return BYTE;
    }

    public static OptionCodec<ColumnCount> columnCounts() {
        return COLUMN;
    }

    /**
     * Returns a codec for a further integer newtype.
     *
     * @param typeName name reported by {@link OptionCodec#typeName()}
     * @param factory  wraps a decoded integer
     */
    public static <T extends StronglyTypedNumber> OptionCodec<T> newtype(String typeName, IntFunction<T> factory) {
        return new NumericNewtypeCodec<>(typeName, factory);
    }

    public static OptionCodec<LineAndColumn> coordinates() {
        return COORD;
    }

    public static <E extends Enum<E>> EnumCodec<E> enumOf(EnumDescriptor<E> descriptor) {
        return new EnumCodec<>(descriptor);
    }

    public static <E extends Enum<E>> FlagsCodec<E> flagsOf(EnumDescriptor<E> descriptor) {
        return new FlagsCodec<>(descriptor);
    }

    // ========================================================================
    // Containers
    // ========================================================================

    public static <T> ListCodec<T> listOf(OptionCodec<T> elementCodec) {
        return new ListCodec<>(elementCodec);
    }

    public static <K, V> MapCodec<K, V> mapOf(OptionCodec<K> keyCodec, OptionCodec<V> valueCodec) {
        return new MapCodec<>(keyCodec, valueCodec);
    }

    public static TupleCodec tupleOf(OptionCodec<?>... elementCodecs) {
        return new TupleCodec(Arrays.asList(elementCodecs));
    }

    public static <P, T> PrefixedListCodec<P, T> prefixedListOf(OptionCodec<P> prefixCodec, OptionCodec<T> elementCodec) {
        return new PrefixedListCodec<>(prefixCodec, elementCodec);
    }

    /**
     * Returns a prefixed-list codec whose prefix is an unsigned revision
     * counter.
     */
    public static <T> PrefixedListCodec<Long, T> timestampedListOf(OptionCodec<T> elementCodec) {
        return new PrefixedListCodec<>(SIZE, elementCodec);
    }
}
