package com.orderedlist.core;

import java.util.NoSuchElementException;

/**
 * Thrown by lookup-by-value mutations (remove, insertBefore, insertAfter) when
 * the item they are given is not in the list.
 */
public class ItemNotFoundException extends NoSuchElementException {
    private static final long serialVersionUID = 1L;

    public ItemNotFoundException(Object item) {
        super("The item " + item + " does not exist in the list");
    }
}
