package com.orderedlist.core;

/**
 * Thrown when an index lies outside the range an operation accepts:
 * 0..count-1 for reads and removals, 0..count for insertions.
 */
public class ListIndexOutOfRangeException extends IndexOutOfBoundsException {
    private static final long serialVersionUID = 1L;

    private final int index;
    private final int count;

    public ListIndexOutOfRangeException(int index, int count) {
        super("List index " + index + " is out of range (count=" + count + ")");
        this.index = index;
        this.count = count;
    }

    public int index() {
        return index;
    }

    public int count() {
        return count;
    }
}
