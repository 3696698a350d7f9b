package com.orderedlist.observe;

import com.orderedlist.api.ListChangeListener;
import com.orderedlist.core.ItemEquality;
import com.orderedlist.core.OrderedList;
import com.orderedlist.util.CompositeListChangeListener;

/**
 * An {@link OrderedList} that reports every insertion and removal to its
 * {@link ListChangeListener}s.
 *
 * Notification hooks into {@link #insertAt} and {@link #removeAt}, so all
 * mutations are covered: add, remove, clear, insertBefore, insertAfter, offset
 * assignment and bulk copy/merge. Listeners run after the change, only when it
 * succeeded.
 *
 * Items passed to {@link #ObservableOrderedList(Object, Boolean, ItemEquality)}
 * are stored before any listener can be registered and are not reported; use
 * the constructor taking initial listeners to have them reported.
 */
public class ObservableOrderedList<T> extends OrderedList<T> {
    // Null while the OrderedList constructor seeds initial data.
    private final CompositeListChangeListener<T> listeners = new CompositeListChangeListener<>();

    public ObservableOrderedList() {
        super();
    }

    public ObservableOrderedList(ItemEquality equality) {
        super(equality);
    }

    public ObservableOrderedList(Object data, Boolean readOnly, ItemEquality equality) {
        super(data, readOnly, equality);
    }

    /**
     * Registers the listeners first, then seeds the data, so the initial items
     * are reported to them.
     */
    public ObservableOrderedList(Iterable<? extends ListChangeListener<T>> initialListeners, Object data,
            Boolean readOnly, ItemEquality equality) {
        super(equality);
        for (ListChangeListener<T> l : initialListeners) {
            listeners.addForComposite(l);
        }
        initialize(data, readOnly);
    }

    public void addListener(ListChangeListener<T> listener) {
        listeners.addForComposite(listener);
    }

    public boolean removeListener(ListChangeListener<T> listener) {
        return listeners.removeFromComposite(listener);
    }

    public int listenerCount() {
        return listeners.listenerCount();
    }

    @Override
    public void insertAt(int index, T item) {
        super.insertAt(index, item);
        if (listeners != null) {
            listeners.onItemInserted(this, index, item);
        }
    }

    @Override
    public T removeAt(int index) {
        T item = super.removeAt(index);
        if (listeners != null) {
            listeners.onItemRemoved(this, index, item);
        }
        return item;
    }
}
