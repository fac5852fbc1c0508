package com.lazyframe.types;

import java.util.Objects;

/**
 * Data type representing a variable-length list of elements of the same type.
 *
 * <p>Values are carried as {@link java.util.List}. Lists are the input of the
 * explode operator, which turns every element into its own row.
 */
public final class ListType implements DataType {

    private final DataType elementType;

    /**
     * Creates a list type with the given element type.
     *
     * @param elementType the type of elements in the list
     */
    public ListType(DataType elementType) {
        this.elementType = Objects.requireNonNull(elementType, "elementType must not be null");
    }

    /**
     * Returns the element type.
     *
     * @return the element type
     */
    public DataType elementType() {
        return elementType;
    }

    @Override
    public String typeName() {
        return "list[" + elementType.typeName() + "]";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ListType)) return false;
        return elementType.equals(((ListType) obj).elementType);
    }

    @Override
    public int hashCode() {
        return Objects.hash("list", elementType);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
