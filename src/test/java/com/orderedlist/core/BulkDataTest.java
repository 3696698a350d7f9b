package com.orderedlist.core;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.junit.Assert.*;

public class BulkDataTest {

    @Test
    public void testCopyFromReplacesContents() {
        OrderedList<String> list = new OrderedList<>(List.of("old1", "old2"));
        list.copyFrom(List.of("a", "b", "c"));
        assertEquals(List.of("a", "b", "c"), list.toList());
    }

    @Test
    public void testCopyFromOwnArrayKeepsContents() {
        OrderedList<String> list = new OrderedList<>(List.of("a", "b", "c"));
        list.copyFrom(list.toArray());
        assertEquals(List.of("a", "b", "c"), list.toList());
    }

    @Test
    public void testCopyFromItself() {
        OrderedList<String> list = new OrderedList<>(List.of("a", "b"));
        list.copyFrom(list);
        assertEquals(List.of("a", "b"), list.toList());
    }

    @Test
    public void testCopyFromNullLeavesContents() {
        OrderedList<String> list = new OrderedList<>(List.of("a"));
        list.copyFrom((Iterable<String>) null);
        list.copyFrom((Object) null);
        assertEquals(List.of("a"), list.toList());
    }

    @Test
    public void testMergeWithAppends() {
        OrderedList<String> list = new OrderedList<>(List.of("a"));
        list.mergeWith(List.of("b", "c"));
        list.mergeWith((Object) null);
        assertEquals(List.of("a", "b", "c"), list.toList());
    }

    @Test
    public void testMergeWithItselfDoublesContents() {
        OrderedList<String> list = new OrderedList<>(List.of("a", "b"));
        list.mergeWith(list);
        assertEquals(List.of("a", "b", "a", "b"), list.toList());
    }

    @Test
    public void testAcceptedShapes() {
        OrderedList<Object> list = new OrderedList<>();

        list.copyFrom(new String[] { "a", "b" });
        assertEquals(List.of("a", "b"), list.toList());

        list.copyFrom(new int[] { 1, 2, 3 });
        assertEquals(List.of(1, 2, 3), list.toList());

        list.copyFrom((Object) List.of("x").iterator());
        assertEquals(List.of("x"), list.toList());

        list.mergeWith(Stream.of("y", "z"));
        assertEquals(List.of("x", "y", "z"), list.toList());

        list.copyFrom(IntStream.range(0, 3));
        assertEquals(List.of(0, 1, 2), list.toList());
    }

    @Test
    public void testInvalidDataType() {
        OrderedList<Object> list = new OrderedList<>(List.of("a"));
        try {
            list.copyFrom((Object) "not iterable");
            fail("Should throw InvalidDataTypeException");
        } catch (InvalidDataTypeException e) {
            assertEquals(String.class, e.dataType());
        }
        try {
            list.mergeWith((Object) 42);
            fail("Should throw InvalidDataTypeException");
        } catch (InvalidDataTypeException e) {
            assertEquals(Integer.class, e.dataType());
        }
        // Nothing was cleared or appended
        assertEquals(List.of("a"), list.toList());
    }

    @Test
    public void testConstructorRejectsInvalidData() {
        try {
            new OrderedList<>(new Object(), null, ItemEquality.EQUALS);
            fail("Should throw InvalidDataTypeException");
        } catch (InvalidDataTypeException e) {
            // Expected
        }
    }

    @Test
    public void testCopyFromClearsThroughRemoveAt() {
        List<Integer> removed = new ArrayList<>();
        OrderedList<String> list = new OrderedList<>() {
            @Override
            public String removeAt(int index) {
                removed.add(index);
                return super.removeAt(index);
            }
        };
        list.add("a");
        list.add("b");
        list.add("c");

        list.copyFrom(List.of("x"));
        assertEquals(List.of(2, 1, 0), removed);
        assertEquals(List.of("x"), list.toList());
    }
}
