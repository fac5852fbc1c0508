package com.lazyframe.types;

/**
 * Sealed interface for all data types in the lazyframe type system.
 *
 * <p>This represents the data type of a column or expression. Every value stored in a
 * {@link com.lazyframe.data.Column} is carried as the Java type documented on the
 * concrete data type (for example {@link Long} for {@link LongType}).
 *
 * <p>Common data types include:
 * <ul>
 *   <li>Primitive types: BooleanType, IntegerType, LongType, FloatType, DoubleType, StringType</li>
 *   <li>Temporal types: DateType, TimestampType</li>
 *   <li>Nested types: ListType, StructType</li>
 *   <li>Placeholders: NullType (untyped null literal), UnresolvedType (before resolution)</li>
 * </ul>
 */
public sealed interface DataType
    permits BooleanType, IntegerType, LongType, FloatType, DoubleType,
            StringType, DateType, TimestampType, ListType, StructType,
            NullType, UnresolvedType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String, List).
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }
}
