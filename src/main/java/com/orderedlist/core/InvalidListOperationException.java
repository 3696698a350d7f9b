package com.orderedlist.core;

/**
 * Thrown when the read-only flag of a list is set from outside after it has
 * already been resolved, explicitly or by a first mutation.
 */
public class InvalidListOperationException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public InvalidListOperationException(Class<?> listType, ReadOnlyState current) {
        super("The read only state of " + listType.getSimpleName() + " is already resolved (" + current
                + ") and can no longer be set");
    }
}
