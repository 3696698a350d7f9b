package com.orderedlist.util;

import com.orderedlist.core.InvalidDataTypeException;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.stream.BaseStream;

/**
 * Adapts loosely typed bulk data to an ordered list of items.
 *
 * Accepted shapes: Iterable, Iterator, Stream (any BaseStream, primitive
 * streams are boxed) and arrays (object or primitive). Everything is copied
 * into a fresh list before the caller touches its own state, so a failing or
 * self-referencing source cannot leave a half-applied update behind.
 */
public final class ListData {

    private ListData() {
    }

    /**
     * @param data The data to adapt, may be null.
     * @return A private copy of the items in iteration order, or null if data is
     *         null.
     * @throws InvalidDataTypeException if data is not null and not one of the
     *                                  accepted shapes.
     */
    @SuppressWarnings("unchecked")
    public static <T> List<T> materialize(Object data) {
        if (data == null) {
            return null;
        }
        if (data instanceof Collection<?> c) {
            return new ArrayList<>((Collection<T>) c);
        }
        if (data instanceof Iterable<?> it) {
            return drain((Iterator<T>) it.iterator());
        }
        if (data instanceof Iterator<?> it) {
            return drain((Iterator<T>) it);
        }
        if (data instanceof BaseStream<?, ?> stream) {
            return drain((Iterator<T>) stream.iterator());
        }
        if (data.getClass().isArray()) {
            int n = Array.getLength(data);
            List<T> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                out.add((T) Array.get(data, i));
            }
            return out;
        }
        throw new InvalidDataTypeException(data.getClass());
    }

    /** Whether {@link #materialize(Object)} accepts the given data. */
    public static boolean isIterable(Object data) {
        return data == null
                || data instanceof Iterable<?>
                || data instanceof Iterator<?>
                || data instanceof BaseStream<?, ?>
                || data.getClass().isArray();
    }

    private static <T> List<T> drain(Iterator<T> it) {
        List<T> out = new ArrayList<>();
        while (it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }
}
