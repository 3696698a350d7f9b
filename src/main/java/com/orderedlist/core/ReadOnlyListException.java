package com.orderedlist.core;

/**
 * Thrown when a mutating operation is attempted on a locked list.
 */
public class ReadOnlyListException extends UnsupportedOperationException {
    private static final long serialVersionUID = 1L;

    public ReadOnlyListException(Class<?> listType) {
        super(listType.getSimpleName() + " is read only");
    }
}
