package com.lazyframe.types;

/**
 * Data type of the untyped null literal. Coerces to every other type.
 */
public final class NullType implements DataType {

    private static final NullType INSTANCE = new NullType();

    private NullType() {}

    public static NullType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public int defaultSize() {
        return 0;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof NullType;
    }

    @Override
    public int hashCode() {
        return typeName().hashCode();
    }

    @Override
    public String toString() {
        return typeName();
    }
}
