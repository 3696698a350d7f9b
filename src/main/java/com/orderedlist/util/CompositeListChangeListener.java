package com.orderedlist.util;

import com.orderedlist.api.ListChangeListener;
import com.orderedlist.api.OrderedCollection;

import java.util.Arrays;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fans a change out to several {@link ListChangeListener} instances, in
 * registration order.
 *
 * A listener that throws does not stop delivery to the ones after it; the
 * failure is logged through a {@link ListenerErrorLog} and dropped, since the
 * change it reports has already been applied.
 */
public class CompositeListChangeListener<T> implements ListChangeListener<T> {
    private static final Logger log = LogManager.getLogger(CompositeListChangeListener.class);
    private static final long ERROR_LOG_INTERVAL_MILLIS = 1_000;

    @SuppressWarnings("unchecked")
    private ListChangeListener<T>[] listeners = new ListChangeListener[0];
    private final ListenerErrorLog errorLog;

    public CompositeListChangeListener() {
        this(new ListenerErrorLog(log, ERROR_LOG_INTERVAL_MILLIS));
    }

    public CompositeListChangeListener(ListenerErrorLog errorLog) {
        this.errorLog = errorLog;
    }

    public void addForComposite(ListChangeListener<T> listener) {
        ListChangeListener<T>[] old = listeners;
        ListChangeListener<T>[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    /**
     * Removes the first registration of the listener.
     *
     * @return false if it was not registered.
     */
    public boolean removeFromComposite(ListChangeListener<T> listener) {
        ListChangeListener<T>[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                ListChangeListener<T>[] next = Arrays.copyOf(old, old.length - 1);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int listenerCount() {
        return listeners.length;
    }

    @Override
    public void onItemInserted(OrderedCollection<T> source, int index, T item) {
        for (ListChangeListener<T> l : listeners) {
            try {
                l.onItemInserted(source, index, item);
            } catch (RuntimeException e) {
                errorLog.log("Listener " + l.getClass().getName() + " failed on insert at " + index, e);
            }
        }
    }

    @Override
    public void onItemRemoved(OrderedCollection<T> source, int index, T item) {
        for (ListChangeListener<T> l : listeners) {
            try {
                l.onItemRemoved(source, index, item);
            } catch (RuntimeException e) {
                errorLog.log("Listener " + l.getClass().getName() + " failed on removal at " + index, e);
            }
        }
    }
}
