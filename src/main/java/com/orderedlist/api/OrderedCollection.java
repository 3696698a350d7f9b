package com.orderedlist.api;

import java.util.List;

/**
 * Read side of an integer-indexed, insertion-ordered collection.
 *
 * Indices are zero-based and dense: a collection of count n holds exactly the
 * indices 0..n-1. Items are opaque references; the collection never copies or
 * owns them.
 *
 * Iteration:
 * Each call to iterator() walks a snapshot of the contents taken at that
 * moment, so re-iterating yields a fresh pass over the current items and a
 * mutation during iteration never disturbs a pass already in progress.
 */
public interface OrderedCollection<T> extends Iterable<T> {

    /** Number of items currently held. */
    int count();

    /** Same as {@link #count()}, for call sites that expect a sized collection. */
    default int size() {
        return count();
    }

    default boolean isEmpty() {
        return count() == 0;
    }

    /**
     * Returns the item at the given index.
     *
     * @param index Zero-based index, 0 <= index < count.
     * @return The item, possibly null if a null item was stored.
     * @throws IndexOutOfBoundsException if the index is outside 0..count-1.
     */
    T itemAt(int index);

    /**
     * @param item The item to look for.
     * @return The first index holding the item, or -1 if absent.
     */
    int indexOf(Object item);

    default boolean contains(Object item) {
        return indexOf(item) != -1;
    }

    /** Whether mutating operations are currently rejected. */
    boolean isReadOnly();

    /** Snapshot of the items in order. Later mutations are not reflected. */
    List<T> toList();

    /** Snapshot of the items in order, as an array. */
    Object[] toArray();
}
