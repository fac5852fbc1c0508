package com.lazyframe.data;

import com.lazyframe.exception.ComputeException;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DateType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.FloatType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.ListType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TimestampType;
import com.lazyframe.types.TypeCoercion;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-type value operations used by the expression engine: comparison, arithmetic,
 * key normalization and casting.
 *
 * <p>All methods operate on the boxed Java representation documented on each
 * {@link DataType}. Callers handle nulls before calling the arithmetic and comparison
 * helpers unless a method says otherwise.
 */
public final class ValueOps {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd HH:mm:ss")
        .optionalStart()
        .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
        .optionalEnd()
        .toFormatter();

    private static final DateTimeFormatter TIMESTAMP_PARSE = new DateTimeFormatterBuilder()
        .appendPattern("yyyy-MM-dd")
        .optionalStart().appendLiteral(' ').optionalEnd()
        .optionalStart().appendLiteral('T').optionalEnd()
        .optionalStart()
        .appendPattern("HH:mm")
        .optionalStart().appendPattern(":ss").optionalEnd()
        .optionalStart().appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true).optionalEnd()
        .optionalEnd()
        .parseDefaulting(ChronoField.HOUR_OF_DAY, 0)
        .parseDefaulting(ChronoField.MINUTE_OF_HOUR, 0)
        .parseDefaulting(ChronoField.SECOND_OF_MINUTE, 0)
        .toFormatter();

    private ValueOps() {
        // Utility class - prevent instantiation
    }

    // ========================================================================
    // Type of a Java value
    // ========================================================================

    /**
     * Infers the data type of a Java value.
     *
     * @param value the value (may be null)
     * @return the data type; {@link NullType} for null
     * @throws IllegalArgumentException if the value has no corresponding data type
     */
    public static DataType typeOf(Object value) {
        if (value == null) return NullType.get();
        if (value instanceof Boolean) return BooleanType.get();
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) return IntegerType.get();
        if (value instanceof Long) return LongType.get();
        if (value instanceof Float) return FloatType.get();
        if (value instanceof Double) return DoubleType.get();
        if (value instanceof String) return StringType.get();
        if (value instanceof LocalDate) return DateType.get();
        if (value instanceof LocalDateTime) return TimestampType.get();
        if (value instanceof List<?> list) {
            DataType element = NullType.get();
            for (Object item : list) {
                if (item != null) {
                    element = typeOf(item);
                    break;
                }
            }
            return new ListType(element);
        }
        throw new IllegalArgumentException("Unsupported value type: " + value.getClass().getName());
    }

    /**
     * Converts a Java value into the canonical representation for its inferred type
     * (for example {@link Short} to {@link Integer}).
     *
     * @param value the value
     * @return the canonical value
     */
    public static Object canonical(Object value) {
        if (value instanceof Short s) return s.intValue();
        if (value instanceof Byte b) return b.intValue();
        return value;
    }

    // ========================================================================
    // Comparison
    // ========================================================================

    /**
     * Compares two non-null values of compatible types.
     *
     * <p>Floating point NaN orders greater than every other value, including positive
     * infinity. Integral values of different widths compare numerically.
     *
     * @param left the left value
     * @param right the right value
     * @return negative, zero or positive
     */
    public static int compare(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegralValue(l) && isIntegralValue(r)) {
                return Long.compare(l.longValue(), r.longValue());
            }
            return Double.compare(normalizeZero(l.doubleValue()), normalizeZero(r.doubleValue()));
        }
        if (left instanceof LocalDate l && right instanceof LocalDateTime r) {
            return l.atStartOfDay().compareTo(r);
        }
        if (left instanceof LocalDateTime l && right instanceof LocalDate r) {
            return l.compareTo(r.atStartOfDay());
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            int n = Math.min(l.size(), r.size());
            for (int i = 0; i < n; i++) {
                int c = compareNullable(l.get(i), r.get(i), false);
                if (c != 0) {
                    return c;
                }
            }
            return Integer.compare(l.size(), r.size());
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return Boolean.compare(l, r);
        }
        if (left instanceof LocalDate l && right instanceof LocalDate r) {
            return l.compareTo(r);
        }
        if (left instanceof LocalDateTime l && right instanceof LocalDateTime r) {
            return l.compareTo(r);
        }
        throw new ComputeException("cannot compare " + left.getClass().getSimpleName()
            + " with " + right.getClass().getSimpleName());
    }

    /**
     * Compares two values where either may be null.
     *
     * @param left the left value
     * @param right the right value
     * @param nullsLast whether null orders after every non-null value
     * @return negative, zero or positive
     */
    public static int compareNullable(Object left, Object right, boolean nullsLast) {
        if (left == null || right == null) {
            if (left == right) {
                return 0;
            }
            int nullFirst = left == null ? -1 : 1;
            return nullsLast ? -nullFirst : nullFirst;
        }
        return compare(left, right);
    }

    /**
     * Tests two non-null values for equality under comparison semantics.
     *
     * @param left the left value
     * @param right the right value
     * @return true if equal
     */
    public static boolean valuesEqual(Object left, Object right) {
        return compare(left, right) == 0;
    }

    private static boolean isIntegralValue(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte;
    }

    private static double normalizeZero(double d) {
        return d == 0.0 ? 0.0 : d;
    }

    // ========================================================================
    // Keys
    // ========================================================================

    /**
     * Normalizes a value for use as a hash key so that values equal under
     * {@link #compare} hash identically. Integral values become {@link Long}, floating
     * values {@link Double}, and negative zero becomes positive zero.
     *
     * @param value the value (may be null)
     * @return the normalized key value
     */
    public static Object normalizeKey(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return normalizeZero(f.doubleValue());
        }
        if (value instanceof Double d) {
            return normalizeZero(d);
        }
        if (value instanceof LocalDate d) {
            return d.atStartOfDay();
        }
        return value;
    }

    /**
     * Builds a composite hash key from the given columns at a row.
     *
     * @param columns the key columns
     * @param row the row index
     * @return the key, as a list with value semantics
     */
    public static List<Object> rowKey(List<Column> columns, int row) {
        List<Object> key = new ArrayList<>(columns.size());
        for (Column column : columns) {
            key.add(normalizeKey(column.get(row)));
        }
        return key;
    }

    // ========================================================================
    // Arithmetic
    // ========================================================================

    /**
     * Adds two non-null values, producing a value of the result type.
     *
     * @param left the left operand
     * @param right the right operand
     * @param resultType the result type (numeric or string)
     * @return the sum
     */
    public static Object add(Object left, Object right, DataType resultType) {
        if (resultType instanceof StringType) {
            return String.valueOf(left) + right;
        }
        if (resultType instanceof IntegerType) return toInt(left) + toInt(right);
        if (resultType instanceof LongType) return toLong(left) + toLong(right);
        if (resultType instanceof FloatType) return toFloat(left) + toFloat(right);
        return toDouble(left) + toDouble(right);
    }

    public static Object subtract(Object left, Object right, DataType resultType) {
        if (resultType instanceof IntegerType) return toInt(left) - toInt(right);
        if (resultType instanceof LongType) return toLong(left) - toLong(right);
        if (resultType instanceof FloatType) return toFloat(left) - toFloat(right);
        return toDouble(left) - toDouble(right);
    }

    public static Object multiply(Object left, Object right, DataType resultType) {
        if (resultType instanceof IntegerType) return toInt(left) * toInt(right);
        if (resultType instanceof LongType) return toLong(left) * toLong(right);
        if (resultType instanceof FloatType) return toFloat(left) * toFloat(right);
        return toDouble(left) * toDouble(right);
    }

    /**
     * True division. Division by zero follows IEEE 754 (infinity or NaN).
     *
     * @param left the dividend
     * @param right the divisor
     * @param resultType the result type (f32 or f64)
     * @return the quotient
     */
    public static Object divide(Object left, Object right, DataType resultType) {
        if (resultType instanceof FloatType) return toFloat(left) / toFloat(right);
        return toDouble(left) / toDouble(right);
    }

    /**
     * Floor division. Integral division by zero yields null.
     *
     * @param left the dividend
     * @param right the divisor
     * @param resultType the result type
     * @return the floored quotient, or null
     */
    public static Object floorDivide(Object left, Object right, DataType resultType) {
        if (resultType instanceof IntegerType) {
            int divisor = toInt(right);
            return divisor == 0 ? null : Math.floorDiv(toInt(left), divisor);
        }
        if (resultType instanceof LongType) {
            long divisor = toLong(right);
            return divisor == 0 ? null : Math.floorDiv(toLong(left), divisor);
        }
        if (resultType instanceof FloatType) {
            return (float) Math.floor(toFloat(left) / toFloat(right));
        }
        return Math.floor(toDouble(left) / toDouble(right));
    }

    /**
     * Modulo with the sign of the divisor. Integral modulo by zero yields null.
     *
     * @param left the dividend
     * @param right the divisor
     * @param resultType the result type
     * @return the remainder, or null
     */
    public static Object modulo(Object left, Object right, DataType resultType) {
        if (resultType instanceof IntegerType) {
            int divisor = toInt(right);
            return divisor == 0 ? null : Math.floorMod(toInt(left), divisor);
        }
        if (resultType instanceof LongType) {
            long divisor = toLong(right);
            return divisor == 0 ? null : Math.floorMod(toLong(left), divisor);
        }
        double l = toDouble(left);
        double r = toDouble(right);
        double m = l - Math.floor(l / r) * r;
        return resultType instanceof FloatType ? (Object) (float) m : (Object) m;
    }

    /**
     * Negates a non-null numeric value.
     *
     * @param value the value
     * @return the negated value, of the same type
     */
    public static Object negate(Object value) {
        if (value instanceof Integer i) return -i;
        if (value instanceof Long l) return -l;
        if (value instanceof Float f) return -f;
        if (value instanceof Double d) return -d;
        throw new ComputeException("cannot negate value of type " + value.getClass().getSimpleName());
    }

    public static int toInt(Object value) {
        if (value instanceof Boolean b) return b ? 1 : 0;
        return ((Number) value).intValue();
    }

    public static long toLong(Object value) {
        if (value instanceof Boolean b) return b ? 1L : 0L;
        return ((Number) value).longValue();
    }

    public static float toFloat(Object value) {
        if (value instanceof Boolean b) return b ? 1f : 0f;
        return ((Number) value).floatValue();
    }

    public static double toDouble(Object value) {
        if (value instanceof Boolean b) return b ? 1d : 0d;
        return ((Number) value).doubleValue();
    }

    /**
     * Converts a non-null numeric value to the given numeric type without range checks.
     *
     * @param value the value
     * @param type the numeric target type
     * @return the converted value
     */
    public static Object toNumeric(Object value, DataType type) {
        if (type instanceof IntegerType) return toInt(value);
        if (type instanceof LongType) return toLong(value);
        if (type instanceof FloatType) return toFloat(value);
        return toDouble(value);
    }

    // ========================================================================
    // Casting
    // ========================================================================

    /**
     * Casts a value to the target type.
     *
     * <p>A value that cannot be represented in the target type (an unparseable string,
     * a NaN or out-of-range float cast to an integer) raises {@link ComputeException}
     * under a strict cast and becomes null otherwise.
     *
     * @param value the value (may be null)
     * @param to the target type
     * @param strict whether failed conversions raise instead of producing null
     * @return the converted value
     */
    public static Object cast(Object value, DataType to, boolean strict) {
        if (value == null || to instanceof NullType) {
            return null;
        }
        try {
            Object result = castValue(value, to);
            if (result == null && strict) {
                throw new ComputeException("strict cast of value '" + format(value) + "' to " + to + " failed");
            }
            return result;
        } catch (NumberFormatException | DateTimeParseException | ArithmeticException e) {
            if (strict) {
                throw new ComputeException(
                    "strict cast of value '" + format(value) + "' to " + to + " failed", e);
            }
            return null;
        }
    }

    private static Object castValue(Object value, DataType to) {
        if (to instanceof StringType) {
            return format(value);
        }
        if (value instanceof String s) {
            return parse(s.trim(), to);
        }
        if (to instanceof BooleanType) {
            if (value instanceof Boolean) return value;
            return toDouble(value) != 0.0;
        }
        if (value instanceof LocalDate d) {
            if (to instanceof DateType) return d;
            if (to instanceof TimestampType) return d.atStartOfDay();
            if (to instanceof LongType) return d.toEpochDay();
        }
        if (value instanceof LocalDateTime ts) {
            if (to instanceof TimestampType) return ts;
            if (to instanceof DateType) return ts.toLocalDate();
            if (to instanceof LongType) return epochMicros(ts);
        }
        if (to instanceof ListType listType && value instanceof List<?> list) {
            List<Object> converted = new ArrayList<>(list.size());
            for (Object item : list) {
                converted.add(castValue(item, listType.elementType()));
            }
            return converted;
        }
        if (TypeCoercion.isNumeric(to) && (value instanceof Number || value instanceof Boolean)) {
            return castNumber(value, to);
        }
        throw new ComputeException("unsupported cast of " + typeOf(value) + " to " + to);
    }

    private static Object castNumber(Object value, DataType to) {
        if (TypeCoercion.isFloating(to) || value instanceof Boolean
                || value instanceof Integer || value instanceof Long) {
            if (to instanceof IntegerType && value instanceof Long l) {
                return Math.toIntExact(l);
            }
            return toNumeric(value, to);
        }
        double d = toDouble(value);
        if (Double.isNaN(d) || Double.isInfinite(d)) {
            return null;
        }
        double truncated = d < 0 ? Math.ceil(d) : Math.floor(d);
        if (to instanceof IntegerType) {
            if (truncated < Integer.MIN_VALUE || truncated > Integer.MAX_VALUE) return null;
            return (int) truncated;
        }
        if (truncated < Long.MIN_VALUE || truncated > Long.MAX_VALUE) return null;
        return (long) truncated;
    }

    private static Object parse(String s, DataType to) {
        if (to instanceof IntegerType) return Integer.parseInt(s);
        if (to instanceof LongType) return Long.parseLong(s);
        if (to instanceof FloatType) return Float.parseFloat(s);
        if (to instanceof DoubleType) return Double.parseDouble(s);
        if (to instanceof BooleanType) {
            if (s.equalsIgnoreCase("true")) return Boolean.TRUE;
            if (s.equalsIgnoreCase("false")) return Boolean.FALSE;
            return null;
        }
        if (to instanceof DateType) return LocalDate.parse(s);
        if (to instanceof TimestampType) return LocalDateTime.parse(s, TIMESTAMP_PARSE);
        throw new ComputeException("unsupported cast of str to " + to);
    }

    /**
     * Formats a value as it appears after a cast to string.
     *
     * @param value the value (may be null)
     * @return the string form, or null for null
     */
    public static String format(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof LocalDateTime ts) {
            return TIMESTAMP_FORMAT.format(ts);
        }
        if (value instanceof List<?> list) {
            List<String> items = new ArrayList<>(list.size());
            for (Object item : list) {
                items.add(item == null ? "null" : format(item));
            }
            return "[" + String.join(", ", items) + "]";
        }
        return value.toString();
    }

    /**
     * Returns microseconds since the Unix epoch for a timestamp.
     *
     * @param ts the timestamp
     * @return epoch microseconds
     */
    public static long epochMicros(LocalDateTime ts) {
        return ChronoUnit.MICROS.between(LocalDateTime.of(1970, 1, 1, 0, 0), ts);
    }

    /**
     * Returns the timestamp for microseconds since the Unix epoch.
     *
     * @param micros epoch microseconds
     * @return the timestamp
     */
    public static LocalDateTime fromEpochMicros(long micros) {
        long seconds = Math.floorDiv(micros, 1_000_000L);
        int nanos = (int) Math.floorMod(micros, 1_000_000L) * 1000;
        return LocalDateTime.ofEpochSecond(seconds, nanos, ZoneOffset.UTC);
    }

    /**
     * Checks that a Java value is acceptable for a column of the given type.
     *
     * @param value the value (may be null)
     * @param type the column type
     * @return true if the value conforms
     */
    public static boolean conforms(Object value, DataType type) {
        if (value == null) {
            return true;
        }
        if (type instanceof BooleanType) return value instanceof Boolean;
        if (type instanceof IntegerType) return value instanceof Integer;
        if (type instanceof LongType) return value instanceof Long;
        if (type instanceof FloatType) return value instanceof Float;
        if (type instanceof DoubleType) return value instanceof Double;
        if (type instanceof StringType) return value instanceof String;
        if (type instanceof DateType) return value instanceof LocalDate;
        if (type instanceof TimestampType) return value instanceof LocalDateTime;
        if (type instanceof ListType) return value instanceof List;
        if (type instanceof StructType) return value instanceof List;
        return false;
    }
}
