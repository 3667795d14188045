package com.questrail.options.codec;

import com.questrail.options.api.Addition;
import com.questrail.options.api.InvalidOptionFormatException;
import com.questrail.options.api.OptionCodec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ListCodecTest
{
    private final ListCodec<Integer> ints = OptionCodecs.listOf(OptionCodecs.integers());
    private final ListCodec<String> strings = OptionCodecs.listOf(OptionCodecs.strings());

    @Test
    void joinsElementsWithColon() {
        assertEquals("1:2:3", ints.toText(List.of(1, 2, 3)));
        assertEquals(List.of(1, 2, 3), ints.fromText("1:2:3"));
        assertEquals("-4", ints.toText(List.of(-4)));
    }

    @Test
    void emptyListIsEmptyString() {
        assertEquals("", ints.toText(List.of()));
        assertEquals(List.of(), ints.fromText(""));
    }

    /**
     * The empty string always decodes to the empty list, so a list whose only
     * element renders as empty text cannot be told apart from an empty list.
     * Two empty elements are distinguishable and round-trip.
     */
    @Test
    void singleEmptyElementCollapsesButTwoDoNot() {
        assertEquals("", strings.toText(List.of("")));
        assertEquals(List.of(), strings.fromText(""));

        assertEquals(":", strings.toText(List.of("", "")));
        assertEquals(List.of("", ""), strings.fromText(":"));
    }

    @Test
    void escapesSeparatorsInsideElements() {
        List<String> value = List.of("a:b", "c\\d", "e");

        assertEquals("a\\:b:c\\\\d:e", strings.toText(value));
        assertEquals(value, strings.fromText(strings.toText(value)));
    }

    @Test
    void elementErrorsPropagate() {
        InvalidOptionFormatException e =
                assertThrows(InvalidOptionFormatException.class, () -> ints.fromText("1::3"));
        assertEquals("'' is not a number", e.getMessage());
    }

    @Test
    void decodedListIsImmutable() {
        List<Integer> decoded = ints.fromText("1:2");
        assertThrows(UnsupportedOperationException.class, () -> decoded.add(3));
    }

    @Test
    void addAppendsInOrder() {
        Addition<List<Integer>> result = ints.add(List.of(0), ints.toText(List.of(1, 2)));

        assertTrue(result.changed());
        assertEquals(List.of(0, 1, 2), result.value());
    }

    @Test
    void addOfEmptyDeltaIsNoOp() {
        List<Integer> current = List.of(7);
        Addition<List<Integer>> result = ints.add(current, "");

        assertFalse(result.changed());
        assertSame(current, result.value());
    }

    @Test
    void malformedDeltaLeavesCurrentUntouched() {
        List<Integer> current = List.of(7);

        assertThrows(InvalidOptionFormatException.class, () -> ints.add(current, "1:x"));
        assertEquals(List.of(7), current);
    }

    @Test
    void typeNameNestsRecursively() {
        assertEquals("int-list", ints.typeName());
        assertEquals("str-list", strings.typeName());

        OptionCodec<List<List<Integer>>> nested = OptionCodecs.listOf(ints);
        assertEquals("int-list-list", nested.typeName());
    }
}
