package com.orderedlist.api;

/**
 * Receives structural changes of an observable ordered collection.
 *
 * Callbacks run synchronously on the mutating thread, after the change has
 * been applied. Indices are those the item had at the moment of the change.
 *
 * A replacement through offset assignment is reported as a removal followed
 * by an insertion at the same index. clear() is reported as one removal per
 * item, highest index first.
 *
 * Implementations must not mutate the collection they observe.
 */
public interface ListChangeListener<T> {

    /**
     * Called after an item has been inserted.
     *
     * @param source The collection that changed.
     * @param index  The index the item now occupies.
     * @param item   The inserted item.
     */
    void onItemInserted(OrderedCollection<T> source, int index, T item);

    /**
     * Called after an item has been removed.
     *
     * @param source The collection that changed.
     * @param index  The index the item occupied before removal.
     * @param item   The removed item.
     */
    void onItemRemoved(OrderedCollection<T> source, int index, T item);
}
