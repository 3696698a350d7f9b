package com.orderedlist.dsl;

import com.orderedlist.api.ListChangeListener;
import com.orderedlist.core.InvalidDataTypeException;
import com.orderedlist.core.ItemEquality;
import com.orderedlist.core.OrderedList;
import com.orderedlist.observe.ObservableOrderedList;
import com.orderedlist.util.ListData;

import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * OrderedList Builder -- fluent construction of configured lists.
 *
 * Usage Pattern:
 * 1. Create a builder: var b = OrderedListBuilder.&lt;String&gt;create();
 * 2. Configure: b.from(List.of("a", "b")).readOnly(true);
 * 3. Optionally observe: b.listener(myListener);
 * 4. Build: OrderedList&lt;String&gt; list = b.build();
 *
 * Without listeners the result is a plain {@link OrderedList}; with at least
 * one it is an {@link ObservableOrderedList} whose listeners also see the
 * initial items. A builder builds exactly once.
 */
public final class OrderedListBuilder<T> {
    private static final Logger log = LogManager.getLogger(OrderedListBuilder.class);

    private final List<ListChangeListener<T>> listeners = new ArrayList<>();
    private Object data;
    private Boolean readOnly;
    private ItemEquality equality = ItemEquality.EQUALS;

    // Flag to prevent reuse after building
    private boolean built;

    private OrderedListBuilder() {
    }

    public static <T> OrderedListBuilder<T> create() {
        return new OrderedListBuilder<>();
    }

    /**
     * Initial contents. Checked here so a bad argument fails at the call that
     * supplied it.
     *
     * @param data Iterable, Iterator, Stream, array, or null for none.
     * @throws InvalidDataTypeException if data has an unsupported type.
     */
    public OrderedListBuilder<T> from(Object data) {
        checkNotBuilt();
        if (!ListData.isIterable(data)) {
            throw new InvalidDataTypeException(data.getClass());
        }
        this.data = data;
        return this;
    }

    public OrderedListBuilder<T> readOnly(boolean readOnly) {
        checkNotBuilt();
        this.readOnly = readOnly;
        return this;
    }

    public OrderedListBuilder<T> equality(ItemEquality equality) {
        checkNotBuilt();
        if (equality == null) {
            throw new IllegalArgumentException("equality must not be null");
        }
        this.equality = equality;
        return this;
    }

    public OrderedListBuilder<T> listener(ListChangeListener<T> listener) {
        checkNotBuilt();
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        listeners.add(listener);
        return this;
    }

    /**
     * @return The configured list.
     * @throws IllegalStateException if this builder has already built a list.
     */
    public OrderedList<T> build() {
        checkNotBuilt();
        built = true;

        OrderedList<T> list;
        if (listeners.isEmpty()) {
            list = new OrderedList<>(data, readOnly, equality);
        } else {
            list = new ObservableOrderedList<>(listeners, data, readOnly, equality);
        }

        log.debug("Built {} with {} items, state={}, equality={}, listeners={}",
                list.getClass().getSimpleName(), list.count(), list.readOnlyState(), equality, listeners.size());
        return list;
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("OrderedListBuilder has already been built");
        }
    }
}
