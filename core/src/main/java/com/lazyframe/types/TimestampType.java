package com.lazyframe.types;

/**
 * Data type representing a time-zone naive timestamp with microsecond precision.
 * Values are carried as {@link java.time.LocalDateTime}.
 */
public final class TimestampType implements DataType {

    private static final TimestampType INSTANCE = new TimestampType();

    private TimestampType() {}

    public static TimestampType get() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "datetime";
    }

    @Override
    public int defaultSize() {
        return 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof TimestampType;
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
