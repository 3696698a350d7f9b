package com.orderedlist.dsl;

import com.orderedlist.api.ListChangeListener;
import com.orderedlist.api.OrderedCollection;
import com.orderedlist.core.InvalidDataTypeException;
import com.orderedlist.core.ItemEquality;
import com.orderedlist.core.OrderedList;
import com.orderedlist.core.ReadOnlyState;
import com.orderedlist.observe.ObservableOrderedList;

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class OrderedListBuilderTest {

    @Test
    public void testDefaults() {
        OrderedList<String> list = OrderedListBuilder.<String>create().build();
        assertEquals(0, list.count());
        assertEquals(ReadOnlyState.UNSET, list.readOnlyState());
        assertEquals(ItemEquality.EQUALS, list.equality());
        assertFalse(list instanceof ObservableOrderedList);
    }

    @Test
    public void testFromAndReadOnly() {
        OrderedList<String> list = OrderedListBuilder.<String>create()
                .from(List.of("a", "b"))
                .readOnly(true)
                .build();
        assertEquals(List.of("a", "b"), list.toList());
        assertTrue(list.isReadOnly());
    }

    @Test
    public void testFromWithoutFlagIsUnlocked() {
        OrderedList<String> list = OrderedListBuilder.<String>create()
                .from(new String[] { "a" })
                .build();
        assertEquals(ReadOnlyState.UNLOCKED, list.readOnlyState());
    }

    @Test
    public void testReadOnlyWithoutData() {
        OrderedList<String> list = OrderedListBuilder.<String>create().readOnly(false).build();
        assertEquals(ReadOnlyState.UNLOCKED, list.readOnlyState());
    }

    @Test
    public void testEquality() {
        OrderedList<String> list = OrderedListBuilder.<String>create()
                .equality(ItemEquality.IDENTITY)
                .from(List.of(new String("k")))
                .build();
        assertEquals(ItemEquality.IDENTITY, list.equality());
        assertFalse(list.contains(new String("k")));
    }

    @Test
    public void testListenerMakesObservableList() {
        List<String> events = new ArrayList<>();
        OrderedList<String> list = OrderedListBuilder.<String>create()
                .from(List.of("a"))
                .listener(new ListChangeListener<>() {
                    @Override
                    public void onItemInserted(OrderedCollection<String> source, int index, String item) {
                        events.add("+" + item);
                    }

                    @Override
                    public void onItemRemoved(OrderedCollection<String> source, int index, String item) {
                        events.add("-" + item);
                    }
                })
                .build();

        assertTrue(list instanceof ObservableOrderedList);
        list.add("b");
        list.remove("a");
        assertEquals(List.of("+a", "+b", "-a"), events);
    }

    @Test
    public void testInvalidDataFailsEarly() {
        OrderedListBuilder<String> builder = OrderedListBuilder.create();
        try {
            builder.from(new Object());
            fail("Should throw InvalidDataTypeException");
        } catch (InvalidDataTypeException e) {
            // Expected
        }
    }

    @Test
    public void testNullArguments() {
        OrderedListBuilder<String> builder = OrderedListBuilder.create();
        builder.from(null);
        try {
            builder.equality(null);
            fail("Should throw IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // Expected
        }
        try {
            builder.listener(null);
            fail("Should throw IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            // Expected
        }
    }

    @Test
    public void testBuildOnlyOnce() {
        OrderedListBuilder<String> builder = OrderedListBuilder.create();
        builder.build();
        try {
            builder.build();
            fail("Should throw IllegalStateException");
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage().contains("already been built"));
        }
        try {
            builder.readOnly(true);
            fail("Should throw IllegalStateException");
        } catch (IllegalStateException e) {
            // Expected
        }
    }
}
