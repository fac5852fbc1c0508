package com.lazyframe.data;

import com.lazyframe.exception.InvalidOperationException;
import com.lazyframe.exception.ResourceExhaustedException;
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
import com.lazyframe.types.TimestampType;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.OutOfMemoryException;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.BaseFixedWidthVector;
import org.apache.arrow.vector.BaseVariableWidthVector;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.SmallIntVector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.TinyIntVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.complex.ListVector;
import org.apache.arrow.vector.types.DateUnit;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;

/**
 * Arrow vectors backing {@link Column}s.
 *
 * <p>Maps engine types to Arrow types and reads and writes single slots:
 * <ul>
 *   <li>boolean - Bool, int32 - Int(32), int64 - Int(64)</li>
 *   <li>float32 / float64 - FloatingPoint(SINGLE / DOUBLE)</li>
 *   <li>string - Utf8, date - Date(DAY), timestamp - Timestamp(MICROSECOND, no zone)</li>
 *   <li>list - List, null - Null</li>
 * </ul>
 *
 * <p>Reading also accepts Int(8/16) as int32, Date(MILLISECOND) and timestamps of any
 * unit (converted to microseconds), so vectors produced elsewhere can be read directly.
 *
 * <p>Column vectors are allocated from one process-wide allocator because columns are
 * shared between batches, cached subplan results and query results that outlive the
 * execution producing them.
 */
public final class ColumnVectors {

    private static final RootAllocator allocator = new RootAllocator(Long.MAX_VALUE);

    private static final String LIST_ITEM = "item";

    private ColumnVectors() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns the allocator that owns column memory.
     *
     * @return the root allocator
     */
    public static BufferAllocator allocator() {
        return allocator;
    }

    // ==================== Types ====================

    /**
     * Returns the Arrow field of a column.
     *
     * @param name the column name
     * @param type the engine type
     * @return the nullable Arrow field
     * @throws InvalidOperationException if the type has no Arrow representation
     */
    public static Field field(String name, DataType type) {
        if (type instanceof ListType list) {
            Field item = field(LIST_ITEM, list.elementType());
            return new Field(name, FieldType.nullable(ArrowType.List.INSTANCE), List.of(item));
        }
        return new Field(name, FieldType.nullable(arrowType(type)), null);
    }

    private static ArrowType arrowType(DataType type) {
        if (type instanceof BooleanType) {
            return ArrowType.Bool.INSTANCE;
        } else if (type instanceof IntegerType) {
            return new ArrowType.Int(32, true);
        } else if (type instanceof LongType) {
            return new ArrowType.Int(64, true);
        } else if (type instanceof FloatType) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.SINGLE);
        } else if (type instanceof DoubleType) {
            return new ArrowType.FloatingPoint(FloatingPointPrecision.DOUBLE);
        } else if (type instanceof StringType) {
            return ArrowType.Utf8.INSTANCE;
        } else if (type instanceof DateType) {
            return new ArrowType.Date(DateUnit.DAY);
        } else if (type instanceof TimestampType) {
            return new ArrowType.Timestamp(TimeUnit.MICROSECOND, null);
        } else if (type instanceof NullType) {
            return ArrowType.Null.INSTANCE;
        }
        throw new InvalidOperationException("type " + type + " has no Arrow representation");
    }

    /**
     * Returns the engine type of an Arrow field.
     *
     * @param field the Arrow field
     * @return the engine type
     * @throws InvalidOperationException if the field has an unsupported type
     */
    public static DataType dataType(Field field) {
        ArrowType type = field.getType();
        switch (type.getTypeID()) {
            case Bool:
                return BooleanType.get();
            case Int:
                ArrowType.Int intType = (ArrowType.Int) type;
                if (!intType.getIsSigned()) {
                    break;
                }
                return intType.getBitWidth() == 64 ? LongType.get() : IntegerType.get();
            case FloatingPoint:
                ArrowType.FloatingPoint fpType = (ArrowType.FloatingPoint) type;
                return fpType.getPrecision() == FloatingPointPrecision.DOUBLE ? DoubleType.get() : FloatType.get();
            case Utf8:
                return StringType.get();
            case Date:
                return DateType.get();
            case Timestamp:
                return TimestampType.get();
            case Null:
                return NullType.get();
            case List:
                return new ListType(dataType(field.getChildren().get(0)));
            default:
                break;
        }
        throw new InvalidOperationException("Arrow field '" + field.getName() + "' has unsupported type " + type);
    }

    // ==================== Allocation ====================

    /**
     * Allocates an empty vector with room for the given number of slots.
     *
     * @param field the Arrow field of the vector
     * @param capacity the expected slot count
     * @return the vector; its owner must close it
     * @throws ResourceExhaustedException if off-heap memory is exhausted
     */
    static FieldVector allocate(Field field, int capacity) {
        try {
            return tryAllocate(field, capacity);
        } catch (OutOfMemoryException e) {
            // Memory of unreachable columns returns once the collector has seen them
            System.gc();
            try {
                return tryAllocate(field, capacity);
            } catch (OutOfMemoryException retry) {
                throw new ResourceExhaustedException(
                    "out of column memory allocating " + capacity + " values of " + field, retry);
            }
        }
    }

    private static FieldVector tryAllocate(Field field, int capacity) {
        FieldVector vector = field.createVector(allocator);
        try {
            vector.setInitialCapacity(Math.max(1, capacity));
            vector.allocateNew();
            return vector;
        } catch (RuntimeException e) {
            vector.close();
            throw e;
        }
    }

    // ==================== Slots ====================

    /**
     * Writes one value, growing the vector when needed.
     *
     * @param vector the vector
     * @param index the slot
     * @param value the value in its Java representation, or null
     * @throws IllegalArgumentException if the value does not fit the vector
     */
    public static void write(FieldVector vector, int index, Object value) {
        if (value == null) {
            setNull(vector, index);
            return;
        }
        if (vector instanceof BitVector v) {
            v.setSafe(index, toBoolean(value) ? 1 : 0);
        } else if (vector instanceof IntVector v) {
            v.setSafe(index, number(value, vector).intValue());
        } else if (vector instanceof BigIntVector v) {
            v.setSafe(index, number(value, vector).longValue());
        } else if (vector instanceof Float4Vector v) {
            v.setSafe(index, number(value, vector).floatValue());
        } else if (vector instanceof Float8Vector v) {
            v.setSafe(index, number(value, vector).doubleValue());
        } else if (vector instanceof VarCharVector v) {
            String text = value instanceof String s ? s : ValueOps.format(value);
            v.setSafe(index, text.getBytes(StandardCharsets.UTF_8));
        } else if (vector instanceof DateDayVector v) {
            LocalDate date = value instanceof LocalDateTime ts ? ts.toLocalDate() : (LocalDate) temporal(value, vector);
            v.setSafe(index, Math.toIntExact(date.toEpochDay()));
        } else if (vector instanceof TimeStampVector v) {
            LocalDateTime ts = value instanceof LocalDate d ? d.atStartOfDay() : (LocalDateTime) temporal(value, vector);
            v.setSafe(index, ValueOps.epochMicros(ts));
        } else if (vector instanceof ListVector v) {
            if (!(value instanceof List<?> items)) {
                throw mismatch(value, vector);
            }
            FieldVector data = (FieldVector) v.getDataVector();
            int offset = v.startNewValue(index);
            for (int i = 0; i < items.size(); i++) {
                write(data, offset + i, items.get(i));
            }
            data.setValueCount(offset + items.size());
            v.endValue(index, items.size());
        } else {
            throw mismatch(value, vector);
        }
    }

    /**
     * Marks a slot null. List and null vectors leave unwritten slots null.
     *
     * @param vector the vector
     * @param index the slot
     */
    public static void setNull(FieldVector vector, int index) {
        if (vector instanceof BaseFixedWidthVector fixed) {
            fixed.setNull(index);
        } else if (vector instanceof BaseVariableWidthVector variable) {
            variable.setNull(index);
        }
    }

    /**
     * Reads one value into its Java representation.
     *
     * @param vector the vector
     * @param index the slot
     * @return the value, or null
     */
    public static Object read(FieldVector vector, int index) {
        if (vector.isNull(index)) {
            return null;
        }
        if (vector instanceof BitVector v) {
            return v.get(index) != 0;
        } else if (vector instanceof TinyIntVector v) {
            return (int) v.get(index);
        } else if (vector instanceof SmallIntVector v) {
            return (int) v.get(index);
        } else if (vector instanceof IntVector v) {
            return v.get(index);
        } else if (vector instanceof BigIntVector v) {
            return v.get(index);
        } else if (vector instanceof Float4Vector v) {
            return v.get(index);
        } else if (vector instanceof Float8Vector v) {
            return v.get(index);
        } else if (vector instanceof VarCharVector v) {
            return new String(v.get(index), StandardCharsets.UTF_8);
        } else if (vector instanceof DateDayVector v) {
            return LocalDate.ofEpochDay(v.get(index));
        } else if (vector instanceof DateMilliVector v) {
            return LocalDate.ofEpochDay(Math.floorDiv(v.get(index), 86_400_000L));
        } else if (vector instanceof TimeStampVector v) {
            ArrowType.Timestamp type = (ArrowType.Timestamp) v.getField().getType();
            return ValueOps.fromEpochMicros(toMicros(v.get(index), type.getUnit()));
        } else if (vector instanceof ListVector v) {
            FieldVector data = (FieldVector) v.getDataVector();
            int start = v.getElementStartIndex(index);
            int end = v.getElementEndIndex(index);
            List<Object> items = new ArrayList<>(end - start);
            for (int i = start; i < end; i++) {
                items.add(read(data, i));
            }
            return items;
        }
        throw new InvalidOperationException("unsupported Arrow vector " + vector.getClass().getSimpleName());
    }

    /**
     * Copies one slot between vectors, without boxing when both have the same layout.
     *
     * @param from the source vector
     * @param fromIndex the source slot
     * @param to the target vector
     * @param toIndex the target slot
     */
    public static void copy(FieldVector from, int fromIndex, FieldVector to, int toIndex) {
        if (from.getMinorType() == to.getMinorType()) {
            if (to instanceof BaseFixedWidthVector fixed) {
                fixed.copyFromSafe(fromIndex, toIndex, from);
                return;
            }
            if (to instanceof BaseVariableWidthVector variable) {
                variable.copyFromSafe(fromIndex, toIndex, from);
                return;
            }
        }
        write(to, toIndex, read(from, fromIndex));
    }

    private static long toMicros(long value, TimeUnit unit) {
        return switch (unit) {
            case SECOND -> value * 1_000_000L;
            case MILLISECOND -> value * 1_000L;
            case MICROSECOND -> value;
            case NANOSECOND -> Math.floorDiv(value, 1_000L);
        };
    }

    private static boolean toBoolean(Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new IllegalArgumentException("value " + value + " does not fit a boolean column");
    }

    private static Number number(Object value, FieldVector vector) {
        if (value instanceof Number n) {
            return n;
        }
        throw mismatch(value, vector);
    }

    private static Object temporal(Object value, FieldVector vector) {
        if (value instanceof LocalDate || value instanceof LocalDateTime) {
            return value;
        }
        throw mismatch(value, vector);
    }

    private static IllegalArgumentException mismatch(Object value, FieldVector vector) {
        return new IllegalArgumentException(String.format("value %s (%s) does not fit Arrow vector %s",
            value, value.getClass().getSimpleName(), vector.getClass().getSimpleName()));
    }
}
