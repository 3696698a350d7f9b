package com.orderedlist.core;

/**
 * Mutability state of an {@link OrderedList}.
 *
 * A list starts UNSET. It leaves UNSET exactly once, either through an
 * explicit setReadOnly(...) call or silently, to UNLOCKED, on its first
 * mutation. Only LOCKED rejects mutations.
 */
public enum ReadOnlyState {
    UNSET,
    UNLOCKED,
    LOCKED;

    public boolean isLocked() {
        return this == LOCKED;
    }

    /** Whether the public setter may still change this state. */
    public boolean isSettable() {
        return this == UNSET;
    }

    static ReadOnlyState of(boolean readOnly) {
        return readOnly ? LOCKED : UNLOCKED;
    }
}
