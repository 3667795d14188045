package com.questrail.options.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelValueTest
{
    @Test
    void prefixedListCopiesItsList() {
        List<Integer> source = new ArrayList<>(List.of(1, 2));
        PrefixedList<Long, Integer> value = PrefixedList.of(1L, source);

        source.add(3);

        assertEquals(List.of(1, 2), value.list());
        assertThrows(UnsupportedOperationException.class, () -> value.list().add(4));
    }

    @Test
    void prefixedListWithersKeepTheOtherPart() {
        PrefixedList<Long, Integer> value = PrefixedList.of(1L, List.of(1));

        assertEquals(PrefixedList.of(2L, List.of(1)), value.withPrefix(2L));
        assertEquals(PrefixedList.of(1L, List.of(9)), value.withList(List.of(9)));
    }

    @Test
    void tupleRejectsNullsAndChecksSlotTypes() {
        assertThrows(NullPointerException.class, () -> OptionTuple.of(1, null));

        OptionTuple tuple = OptionTuple.of(1, "a");
        assertEquals(2, tuple.size());
        assertEquals("a", tuple.get(1, String.class));
        assertThrows(ClassCastException.class, () -> tuple.get(1, Integer.class));
    }

    @Test
    void newtypesAreDistinctFromEachOther() {
        assertNotEquals(new LineCount(3), new ByteCount(3));
        assertEquals(new LineCount(5), new LineCount(3).plus(2));
        assertThrows(ArithmeticException.class, () -> new ColumnCount(Integer.MAX_VALUE).plus(1));
    }
}
