package com.orderedlist.core;

/**
 * Thrown when bulk data handed to copyFrom/mergeWith, or to a constructor, is
 * neither null nor something that can be iterated.
 */
public class InvalidDataTypeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    private final Class<?> dataType;

    public InvalidDataTypeException(Class<?> dataType) {
        super("List data must be an Iterable, Iterator, Stream or array, got: " + dataType.getName());
        this.dataType = dataType;
    }

    public Class<?> dataType() {
        return dataType;
    }
}
