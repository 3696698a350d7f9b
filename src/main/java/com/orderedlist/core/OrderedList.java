package com.orderedlist.core;

import com.orderedlist.api.OrderedCollection;
import com.orderedlist.util.ListData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import lombok.extern.log4j.Log4j2;

/**
 * OrderedList -- an integer-indexed collection with a one-way read-only lock.
 *
 * Items are accessed, appended, inserted and removed by zero-based index
 * ({@link #itemAt}, {@link #add}, {@link #insertAt}, {@link #removeAt}) or by
 * value ({@link #indexOf}, {@link #remove}, {@link #insertBefore},
 * {@link #insertAfter}). Array-like offset access is available through
 * {@link #get}, {@link #set}, {@link #exists} and {@link #delete}.
 *
 * Read-only lock:
 * The list starts in {@link ReadOnlyState#UNSET}. A caller may resolve it once
 * with {@link #setReadOnly(Boolean)}; any later call fails. The first mutation
 * resolves an UNSET list to UNLOCKED, which also closes the public setter.
 * Subclasses can still change the state through
 * {@link #setReadOnlyInternal(boolean)}.
 *
 * Extension:
 * Every mutation ends in {@link #insertAt} or {@link #removeAt}. Subclasses
 * that need to act on each addition or removal override these two methods and
 * call super.
 *
 * Thread Safety:
 * None. A list belongs to one owner at a time.
 */
@Log4j2
public class OrderedList<T> implements OrderedCollection<T> {
    private final List<T> items = new ArrayList<>();
    private final ItemEquality equality;
    private ReadOnlyState readOnlyState = ReadOnlyState.UNSET;

    public OrderedList() {
        this(ItemEquality.EQUALS);
    }

    public OrderedList(ItemEquality equality) {
        this.equality = equality;
    }

    /**
     * Creates a list holding the given items. The list is left UNLOCKED.
     */
    public OrderedList(Iterable<? extends T> data) {
        this(data, null, ItemEquality.EQUALS);
    }

    public OrderedList(Iterable<? extends T> data, Boolean readOnly) {
        this(data, readOnly, ItemEquality.EQUALS);
    }

    /**
     * Creates a list from loosely typed data.
     *
     * When data is not null the read-only flag is resolved right away, an absent
     * flag counting as false. When data is null the flag is applied only if
     * given, leaving the list UNSET otherwise.
     *
     * @param data     Initial items (Iterable, Iterator, Stream, array) or null.
     * @param readOnly Whether to lock the list, or null to leave it undecided.
     * @param equality Lookup semantics.
     * @throws InvalidDataTypeException if data is of an unsupported type.
     */
    public OrderedList(Object data, Boolean readOnly, ItemEquality equality) {
        this.equality = equality;
        initialize(data, readOnly);
    }

    /**
     * Seeds the initial contents and resolves the read-only flag, following the
     * rules of {@link #OrderedList(Object, Boolean, ItemEquality)}. For
     * subclass constructors that must finish their own setup before the data
     * goes in.
     */
    protected final void initialize(Object data, Boolean readOnly) {
        if (data != null) {
            copyFrom(data);
            setReadOnlyInternal(readOnly != null && readOnly);
        } else if (readOnly != null) {
            setReadOnlyInternal(readOnly);
        }
    }

    // ── Read-only state ─────────────────────────────────────────

    /** Whether mutations are rejected. An UNSET list is writable. */
    @Override
    public boolean isReadOnly() {
        return readOnlyState.isLocked();
    }

    public ReadOnlyState readOnlyState() {
        return readOnlyState;
    }

    public ItemEquality equality() {
        return equality;
    }

    /**
     * Resolves the read-only flag. Allowed once, and only while the list is still
     * UNSET. A null value is ignored.
     *
     * @throws InvalidListOperationException if the flag was already resolved.
     */
    public void setReadOnly(Boolean value) {
        if (value == null) {
            return;
        }
        if (!readOnlyState.isSettable()) {
            throw new InvalidListOperationException(getClass(), readOnlyState);
        }
        setReadOnlyInternal(value);
    }

    /**
     * Unguarded setter for the list itself and its subclasses.
     */
    protected void setReadOnlyInternal(boolean value) {
        ReadOnlyState next = ReadOnlyState.of(value);
        if (next != readOnlyState) {
            log.debug("{} read only state {} -> {}", getClass().getSimpleName(), readOnlyState, next);
            readOnlyState = next;
        }
    }

    /** Resolves UNSET to UNLOCKED. */
    protected void collapseReadOnly() {
        if (readOnlyState == ReadOnlyState.UNSET) {
            readOnlyState = ReadOnlyState.UNLOCKED;
        }
    }

    /**
     * Collapses the read-only state and fails if the list is locked. Every
     * mutating operation calls this before touching the items.
     *
     * @throws ReadOnlyListException if the list is locked.
     */
    protected final void ensureWritable() {
        collapseReadOnly();
        if (readOnlyState.isLocked()) {
            throw new ReadOnlyListException(getClass());
        }
    }

    // ── Reads ────────────────────────────────────────────────────

    @Override
    public int count() {
        return items.size();
    }

    @Override
    public T itemAt(int index) {
        if (index < 0 || index >= items.size()) {
            throw new ListIndexOutOfRangeException(index, items.size());
        }
        return items.get(index);
    }

    @Override
    public int indexOf(Object item) {
        for (int i = 0, n = items.size(); i < n; i++) {
            if (equality.matches(items.get(i), item)) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public boolean contains(Object item) {
        return indexOf(item) != -1;
    }

    @Override
    public List<T> toList() {
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    @Override
    public Object[] toArray() {
        return items.toArray();
    }

    @Override
    public Iterator<T> iterator() {
        return toList().iterator();
    }

    public Stream<T> stream() {
        return toList().stream();
    }

    // ── Index based mutations ───────────────────────────────────

    /**
     * Appends an item.
     *
     * @return The index the item was stored at, count-1 after the call.
     * @throws ReadOnlyListException if the list is locked.
     */
    public int add(T item) {
        insertAt(items.size(), item);
        return items.size() - 1;
    }

    /**
     * Inserts an item. The item previously at the index and all after it move
     * one position towards the end.
     *
     * @param index 0 <= index <= count.
     * @throws ListIndexOutOfRangeException if the index is out of range.
     * @throws ReadOnlyListException        if the list is locked.
     */
    public void insertAt(int index, T item) {
        ensureWritable();
        if (index < 0 || index > items.size()) {
            throw new ListIndexOutOfRangeException(index, items.size());
        }
        items.add(index, item);
    }

    /**
     * Removes the item at the index. Later items move one position back.
     *
     * @param index 0 <= index < count.
     * @return The removed item.
     * @throws ListIndexOutOfRangeException if the index is out of range.
     * @throws ReadOnlyListException        if the list is locked.
     */
    public T removeAt(int index) {
        ensureWritable();
        if (index < 0 || index >= items.size()) {
            throw new ListIndexOutOfRangeException(index, items.size());
        }
        return items.remove(index);
    }

    /**
     * Removes all items, highest index first, each through {@link #removeAt}.
     *
     * @throws ReadOnlyListException if the list is locked, even when empty.
     */
    public void clear() {
        ensureWritable();
        for (int i = items.size() - 1; i >= 0; --i) {
            removeAt(i);
        }
    }

    // ── Value based mutations ───────────────────────────────────

    /**
     * Removes the first occurrence of an item.
     *
     * @return The index the item was removed from.
     * @throws ItemNotFoundException if the item is not in the list.
     * @throws ReadOnlyListException if the list is locked.
     */
    public int remove(T item) {
        ensureWritable();
        int index = indexOf(item);
        if (index < 0) {
            throw new ItemNotFoundException(item);
        }
        removeAt(index);
        return index;
    }

    /**
     * Inserts an item right before the first occurrence of baseItem.
     *
     * @return The index the new item was stored at.
     * @throws ItemNotFoundException if baseItem is not in the list.
     * @throws ReadOnlyListException if the list is locked.
     */
    public int insertBefore(T baseItem, T item) {
        ensureWritable();
        int index = indexOf(baseItem);
        if (index < 0) {
            throw new ItemNotFoundException(baseItem);
        }
        insertAt(index, item);
        return index;
    }

    /**
     * Inserts an item right after the first occurrence of baseItem.
     *
     * @return The index the new item was stored at.
     * @throws ItemNotFoundException if baseItem is not in the list.
     * @throws ReadOnlyListException if the list is locked.
     */
    public int insertAfter(T baseItem, T item) {
        ensureWritable();
        int index = indexOf(baseItem);
        if (index < 0) {
            throw new ItemNotFoundException(baseItem);
        }
        insertAt(index + 1, item);
        return index + 1;
    }

    // ── Bulk ─────────────────────────────────────────────────────

    /**
     * Replaces the contents with the given items.
     *
     * @throws ReadOnlyListException if the list is locked.
     */
    public void copyFrom(Iterable<? extends T> data) {
        copyFrom((Object) data);
    }

    /**
     * Replaces the contents with loosely typed data. The data is read completely
     * before the list is cleared, so copying a list into itself keeps its items.
     * Null data leaves the list as it is.
     *
     * @param data Iterable, Iterator, Stream, array, or null.
     * @throws InvalidDataTypeException if data has an unsupported type.
     * @throws ReadOnlyListException    if the list is locked.
     */
    public void copyFrom(Object data) {
        ensureWritable();
        List<T> incoming = ListData.materialize(data);
        if (incoming == null) {
            return;
        }
        if (!items.isEmpty()) {
            clear();
        }
        for (T item : incoming) {
            add(item);
        }
    }

    /**
     * Appends the given items.
     *
     * @throws ReadOnlyListException if the list is locked.
     */
    public void mergeWith(Iterable<? extends T> data) {
        mergeWith((Object) data);
    }

    /**
     * Appends loosely typed data in iteration order. Null data is ignored.
     *
     * @param data Iterable, Iterator, Stream, array, or null.
     * @throws InvalidDataTypeException if data has an unsupported type.
     * @throws ReadOnlyListException    if the list is locked.
     */
    public void mergeWith(Object data) {
        ensureWritable();
        List<T> incoming = ListData.materialize(data);
        if (incoming == null) {
            return;
        }
        for (T item : incoming) {
            add(item);
        }
    }

    // ── Offset access ────────────────────────────────────────────

    /** Whether offset addresses an existing item. */
    public boolean exists(int offset) {
        return offset >= 0 && offset < items.size();
    }

    /** Same as {@link #itemAt(int)}. */
    public T get(int offset) {
        return itemAt(offset);
    }

    /**
     * Array-style assignment. A null offset or an offset equal to count appends.
     * Any other offset replaces the item there by removing it and inserting the
     * new one at the same position.
     *
     * @throws ListIndexOutOfRangeException if offset is neither null nor within
     *                                      0..count.
     * @throws ReadOnlyListException        if the list is locked.
     */
    public void set(Integer offset, T item) {
        if (offset == null || offset == items.size()) {
            insertAt(items.size(), item);
        } else {
            removeAt(offset);
            insertAt(offset, item);
        }
    }

    /** Same as {@link #removeAt(int)}. */
    public T delete(int offset) {
        return removeAt(offset);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + items;
    }
}
