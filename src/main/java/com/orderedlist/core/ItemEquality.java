package com.orderedlist.core;

import java.util.Objects;

/**
 * How lookups by value (indexOf, contains, remove, insertBefore, insertAfter)
 * decide that a stored item matches the one asked for.
 */
public enum ItemEquality {
    /** Objects.equals semantics, as java.util.List does. */
    EQUALS {
        @Override
        public boolean matches(Object stored, Object wanted) {
            return Objects.equals(stored, wanted);
        }
    },
    /** Reference comparison. Two equal but distinct strings do not match. */
    IDENTITY {
        @Override
        public boolean matches(Object stored, Object wanted) {
            return stored == wanted;
        }
    };

    public abstract boolean matches(Object stored, Object wanted);
}
