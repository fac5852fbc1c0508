package com.lazyframe.types;

import java.util.List;
import java.util.Optional;

/**
 * Centralized type coercion rules.
 *
 * <h2>Supertype rules</h2>
 * <ul>
 *   <li>Identical types: the type itself</li>
 *   <li>Null with anything: the other type</li>
 *   <li>Numeric: i32 &lt; i64 &lt; f32 &lt; f64, except that an integer combined with f32
 *       widens to f64 so no integer precision is lost</li>
 *   <li>Date with timestamp: timestamp</li>
 *   <li>Lists: list of the element supertype</li>
 *   <li>Anything else: no supertype (a schema error where one is required)</li>
 * </ul>
 *
 * <h2>Cast rules</h2>
 * <p>Numeric and boolean types cast among each other, every type casts to string,
 * strings cast to every primitive type (parsing, which may fail at runtime), date and
 * timestamp cast to each other, and the null type casts to everything.
 */
public final class TypeCoercion {

    private TypeCoercion() {
        // Utility class - prevent instantiation
    }

    // ========================================================================
    // Type classification
    // ========================================================================

    public static boolean isNumeric(DataType type) {
        return isIntegral(type) || isFloating(type);
    }

    public static boolean isIntegral(DataType type) {
        return type instanceof IntegerType || type instanceof LongType;
    }

    public static boolean isFloating(DataType type) {
        return type instanceof FloatType || type instanceof DoubleType;
    }

    public static boolean isTemporal(DataType type) {
        return type instanceof DateType || type instanceof TimestampType;
    }

    /**
     * Returns whether values of this type have a total order usable by sort, min/max,
     * comparison operators and as-of joins.
     *
     * @param type the type
     * @return true if orderable
     */
    public static boolean isOrderable(DataType type) {
        return isNumeric(type) || isTemporal(type)
            || type instanceof StringType || type instanceof BooleanType || type instanceof NullType;
    }

    private static int numericRank(DataType type) {
        if (type instanceof IntegerType) return 1;
        if (type instanceof LongType) return 2;
        if (type instanceof FloatType) return 3;
        if (type instanceof DoubleType) return 4;
        return -1;
    }

    // ========================================================================
    // Supertypes
    // ========================================================================

    /**
     * Finds the narrowest type both arguments can be widened to without loss.
     *
     * @param left the first type
     * @param right the second type
     * @return the supertype, or empty if none exists
     */
    public static Optional<DataType> commonSupertype(DataType left, DataType right) {
        if (left.equals(right)) {
            return Optional.of(left);
        }
        if (left instanceof NullType) {
            return Optional.of(right);
        }
        if (right instanceof NullType) {
            return Optional.of(left);
        }
        if (isNumeric(left) && isNumeric(right)) {
            return Optional.of(promoteNumeric(left, right));
        }
        if (isTemporal(left) && isTemporal(right)) {
            return Optional.of(TimestampType.get());
        }
        if (left instanceof ListType l && right instanceof ListType r) {
            return commonSupertype(l.elementType(), r.elementType()).map(ListType::new);
        }
        return Optional.empty();
    }

    /**
     * Finds the common supertype of all given types.
     *
     * @param types the types (must not be empty)
     * @return the supertype, or empty if none exists
     */
    public static Optional<DataType> commonSupertype(List<DataType> types) {
        if (types.isEmpty()) {
            return Optional.empty();
        }
        DataType result = types.get(0);
        for (int i = 1; i < types.size(); i++) {
            Optional<DataType> next = commonSupertype(result, types.get(i));
            if (next.isEmpty()) {
                return Optional.empty();
            }
            result = next.get();
        }
        return Optional.of(result);
    }

    /**
     * Promotes two numeric types.
     *
     * @param left the left operand type
     * @param right the right operand type
     * @return the promoted type
     */
    public static DataType promoteNumeric(DataType left, DataType right) {
        int l = numericRank(left);
        int r = numericRank(right);
        if (l < 0 || r < 0) {
            throw new IllegalArgumentException("not numeric: " + left + ", " + right);
        }
        boolean mixedIntegerFloat = (isIntegral(left) && right instanceof FloatType)
            || (left instanceof FloatType && isIntegral(right));
        if (mixedIntegerFloat) {
            return DoubleType.get();
        }
        return l >= r ? left : right;
    }

    // ========================================================================
    // Casts
    // ========================================================================

    /**
     * Returns whether a value of {@code from} may be cast to {@code to}.
     *
     * <p>A castable pair may still fail at runtime for individual values when parsing
     * strings under a strict cast.
     *
     * @param from the source type
     * @param to the target type
     * @return true if a cast exists
     */
    public static boolean canCast(DataType from, DataType to) {
        if (from.equals(to) || from instanceof NullType) {
            return true;
        }
        if (to instanceof StringType) {
            return !(from instanceof StructType);
        }
        if (from instanceof StringType) {
            return isNumeric(to) || isTemporal(to) || to instanceof BooleanType;
        }
        boolean fromScalar = isNumeric(from) || from instanceof BooleanType;
        boolean toScalar = isNumeric(to) || to instanceof BooleanType;
        if (fromScalar && toScalar) {
            return true;
        }
        if (isTemporal(from) && isTemporal(to)) {
            return true;
        }
        if (isTemporal(from) && to instanceof LongType) {
            return true;
        }
        if (from instanceof ListType l && to instanceof ListType r) {
            return canCast(l.elementType(), r.elementType());
        }
        return false;
    }
}
