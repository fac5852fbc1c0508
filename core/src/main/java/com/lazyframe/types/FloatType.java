package com.lazyframe.types;

/**
 * Data type representing a single-precision floating point number. Values are carried as {@link Float}.
 */
public final class FloatType implements DataType {

    private static final FloatType INSTANCE = new FloatType();

    private FloatType() {}

    public static FloatType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "f32";
    }

    @Override
    public int defaultSize() {
        return 4;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FloatType;
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
