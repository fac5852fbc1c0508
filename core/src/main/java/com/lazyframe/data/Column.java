package com.lazyframe.data;

import com.lazyframe.types.DataType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.StructField;
import java.lang.ref.Cleaner;
import java.lang.ref.Reference;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.vector.BigIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.IntVector;
import org.apache.arrow.vector.types.pojo.Field;

/**
 * A named, typed column of values held in an Arrow {@link FieldVector}.
 *
 * <p>Null slots are tracked by the vector's validity buffer. Columns are immutable once
 * built: every operation returns a new column, and renamed columns share their vector.
 * The vector's off-heap buffers are released once no column refers to it.
 *
 * <p>Values cross the API in their Java representation ({@link #get}); numeric and boolean
 * kernels use the primitive accessors and {@link Builder} setters instead.
 */
public final class Column {

    private static final Cleaner cleaner = Cleaner.create();

    private final String name;
    private final DataType dataType;
    private final Storage storage;

    /** Owns one vector and closes it when it becomes unreachable. */
    private static final class Storage {
        private final FieldVector vector;

        private Storage(FieldVector vector) {
            this.vector = vector;
            cleaner.register(this, vector::close);
        }
    }

    private Column(String name, DataType dataType, Storage storage) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.dataType = Objects.requireNonNull(dataType, "dataType must not be null");
        this.storage = storage;
    }

    /**
     * Creates a builder for a column of a fixed length. Unset slots are null.
     *
     * @param name the column name
     * @param dataType the column type
     * @param length the row count
     * @return the builder
     */
    public static Builder builder(String name, DataType dataType, int length) {
        return new Builder(name, dataType, length);
    }

    /**
     * Creates a column over the given values without checking them against the type.
     *
     * @param name the column name
     * @param dataType the column type
     * @param values the values, with null marking invalid slots
     * @return the column
     */
    public static Column fromValues(String name, DataType dataType, Object[] values) {
        Builder builder = builder(name, dataType, values.length);
        for (int i = 0; i < values.length; i++) {
            if (values[i] != null) {
                builder.set(i, values[i]);
            }
        }
        return builder.build();
    }

    /**
     * Creates a column from literal values, checking that each conforms to the type.
     *
     * @param name the column name
     * @param dataType the column type
     * @param values the values
     * @return the column
     * @throws IllegalArgumentException if a value does not conform to the type
     */
    public static Column of(String name, DataType dataType, Object... values) {
        Object[] copy = new Object[values.length];
        for (int i = 0; i < values.length; i++) {
            Object value = ValueOps.canonical(values[i]);
            if (!ValueOps.conforms(value, dataType)) {
                throw new IllegalArgumentException(String.format(
                    "value %s at row %d does not conform to %s", value, i, dataType));
            }
            copy[i] = value;
        }
        return fromValues(name, dataType, copy);
    }

    /**
     * Creates a column from a list of values.
     *
     * @param name the column name
     * @param dataType the column type
     * @param values the values
     * @return the column
     */
    public static Column of(String name, DataType dataType, List<?> values) {
        return of(name, dataType, values.toArray());
    }

    /**
     * Creates an all-null column.
     *
     * @param name the column name
     * @param dataType the column type
     * @param length the row count
     * @return the column
     */
    public static Column nulls(String name, DataType dataType, int length) {
        return builder(name, dataType, length).build();
    }

    /**
     * Creates a column repeating one value.
     *
     * @param name the column name
     * @param dataType the column type
     * @param value the value (may be null)
     * @param length the row count
     * @return the column
     */
    public static Column constant(String name, DataType dataType, Object value, int length) {
        Builder builder = builder(name, dataType, length);
        if (value != null) {
            for (int i = 0; i < length; i++) {
                builder.set(i, value);
            }
        }
        return builder.build();
    }

    /**
     * Copies an Arrow vector into a new column, converting values the engine reads but does
     * not store natively, such as Int(16) or millisecond timestamps.
     *
     * @param name the column name
     * @param dataType the column type
     * @param source the vector; it stays owned by the caller
     * @return the column
     */
    public static Column copyOf(String name, DataType dataType, FieldVector source) {
        int size = source.getValueCount();
        Builder builder = builder(name, dataType, size);
        for (int i = 0; i < size; i++) {
            builder.copy(i, source, i);
        }
        return builder.build();
    }

    public String name() {
        return name;
    }

    public DataType dataType() {
        return dataType;
    }

    public StructField field() {
        return new StructField(name, dataType);
    }

    public int size() {
        try {
            return storage.vector.getValueCount();
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Returns the value at a row in its Java representation.
     *
     * @param row the row index
     * @return the value, or null if invalid
     */
    public Object get(int row) {
        try {
            return ColumnVectors.read(storage.vector, row);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    public boolean isNull(int row) {
        try {
            return storage.vector.isNull(row);
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Returns a non-null integral value at a row.
     *
     * @param row the row index
     * @return the value
     * @throws IllegalStateException if the column is not int32 or int64
     */
    public long getLong(int row) {
        try {
            FieldVector vector = storage.vector;
            if (vector instanceof BigIntVector v) {
                return v.get(row);
            }
            if (vector instanceof IntVector v) {
                return v.get(row);
            }
            throw new IllegalStateException("column '" + name + "' of type " + dataType + " is not integral");
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Returns a non-null numeric value at a row as a double.
     *
     * @param row the row index
     * @return the value
     * @throws IllegalStateException if the column is not numeric
     */
    public double getDouble(int row) {
        try {
            FieldVector vector = storage.vector;
            if (vector instanceof Float8Vector v) {
                return v.get(row);
            }
            if (vector instanceof Float4Vector v) {
                return v.get(row);
            }
            if (vector instanceof BigIntVector v) {
                return v.get(row);
            }
            if (vector instanceof IntVector v) {
                return v.get(row);
            }
            throw new IllegalStateException("column '" + name + "' of type " + dataType + " is not numeric");
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Returns a non-null boolean value at a row.
     *
     * @param row the row index
     * @return the value
     * @throws IllegalStateException if the column is not boolean
     */
    public boolean getBoolean(int row) {
        try {
            if (storage.vector instanceof BitVector v) {
                return v.get(row) != 0;
            }
            throw new IllegalStateException("column '" + name + "' of type " + dataType + " is not boolean");
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Tests whether a row holds {@code true}; null and false both test false.
     *
     * @param row the row index
     * @return true if the slot is a valid true
     */
    public boolean isTrue(int row) {
        return !isNull(row) && getBoolean(row);
    }

    /**
     * Returns the number of null values.
     *
     * @return the null count
     */
    public int nullCount() {
        try {
            return storage.vector.getNullCount();
        } finally {
            Reference.reachabilityFence(this);
        }
    }

    /**
     * Returns the values as an unmodifiable list.
     *
     * @return the values
     */
    public List<Object> values() {
        return Collections.unmodifiableList(toList());
    }

    /**
     * Returns this column under a different name, sharing the vector.
     *
     * @param newName the new name
     * @return the renamed column
     */
    public Column rename(String newName) {
        if (newName.equals(name)) {
            return this;
        }
        return new Column(newName, dataType, storage);
    }

    /**
     * Returns a contiguous row range.
     *
     * @param offset the first row
     * @param length the number of rows (clamped to the column end)
     * @return the sliced column
     */
    public Column slice(int offset, int length) {
        int size = size();
        int start = Math.max(0, Math.min(offset, size));
        int end = Math.max(start, Math.min(size, start + Math.max(0, length)));
        if (start == 0 && end == size) {
            return this;
        }
        Builder builder = builder(name, dataType, end - start);
        try {
            for (int i = start; i < end; i++) {
                builder.copy(i - start, storage.vector, i);
            }
        } finally {
            Reference.reachabilityFence(this);
        }
        return builder.build();
    }

    /**
     * Gathers rows by index. An index of -1 produces a null.
     *
     * @param indices the row indices
     * @return the gathered column
     */
    public Column take(int[] indices) {
        Builder builder = builder(name, dataType, indices.length);
        try {
            FieldVector source = storage.vector;
            for (int i = 0; i < indices.length; i++) {
                if (indices[i] >= 0) {
                    builder.copy(i, source, indices[i]);
                }
            }
        } finally {
            Reference.reachabilityFence(this);
        }
        return builder.build();
    }

    /**
     * Keeps rows where the mask is true. Null mask entries drop the row.
     *
     * @param mask a boolean column of the same length
     * @return the filtered column
     */
    public Column filter(Column mask) {
        return take(selectedRows(mask));
    }

    /**
     * Returns the row indices where a boolean mask is true.
     *
     * @param mask the mask
     * @return the selected indices, ascending
     */
    public static int[] selectedRows(Column mask) {
        int size = mask.size();
        int[] selected = new int[size];
        int count = 0;
        if (!(mask.dataType instanceof NullType)) {
            for (int i = 0; i < size; i++) {
                if (mask.isTrue(i)) {
                    selected[count++] = i;
                }
            }
        }
        return count == size ? selected : Arrays.copyOf(selected, count);
    }

    /**
     * Casts every value to the target type.
     *
     * @param target the target type
     * @param strict whether failed conversions raise
     * @return the cast column
     */
    public Column cast(DataType target, boolean strict) {
        if (target.equals(dataType)) {
            return this;
        }
        int size = size();
        Builder builder = builder(name, target, size);
        for (int i = 0; i < size; i++) {
            Object value = ValueOps.cast(get(i), target, strict);
            if (value != null) {
                builder.set(i, value);
            }
        }
        return builder.build();
    }

    /**
     * Concatenates columns, keeping the first column's name and type.
     *
     * @param columns the columns (at least one)
     * @return the concatenated column
     */
    public static Column concat(List<Column> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("cannot concatenate zero columns");
        }
        if (columns.size() == 1) {
            return columns.get(0);
        }
        Column first = columns.get(0);
        int total = 0;
        for (Column column : columns) {
            total += column.size();
        }
        Builder builder = builder(first.name, first.dataType, total);
        int position = 0;
        for (Column column : columns) {
            Column part = column.dataType.equals(first.dataType) ? column : column.cast(first.dataType, true);
            int size = part.size();
            try {
                for (int i = 0; i < size; i++) {
                    builder.copy(position + i, part.storage.vector, i);
                }
            } finally {
                Reference.reachabilityFence(part);
            }
            position += size;
        }
        return builder.build();
    }

    /**
     * Copies this column into a vector, appending nothing past its length.
     *
     * @param target a vector of this column's Arrow type
     */
    public void copyInto(FieldVector target) {
        int size = size();
        try {
            FieldVector source = storage.vector;
            for (int i = 0; i < size; i++) {
                ColumnVectors.copy(source, i, target, i);
            }
        } finally {
            Reference.reachabilityFence(this);
        }
        target.setValueCount(size);
    }

    /**
     * Returns a copy of the values.
     *
     * @return a new mutable list of the values
     */
    public List<Object> toList() {
        int size = size();
        List<Object> values = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            values.add(get(i));
        }
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Column)) return false;
        Column that = (Column) o;
        return name.equals(that.name) && dataType.equals(that.dataType) && toList().equals(that.toList());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataType, toList());
    }

    @Override
    public String toString() {
        int size = size();
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(": ").append(dataType).append(" [");
        int shown = Math.min(size, 10);
        for (int i = 0; i < shown; i++) {
            if (i > 0) sb.append(", ");
            Object value = get(i);
            sb.append(value == null ? "null" : ValueOps.format(value));
        }
        if (size > shown) {
            sb.append(", ... (").append(size).append(" rows)");
        }
        return sb.append(']').toString();
    }

    /**
     * Writes the slots of a new column of fixed length. Slots never set stay null.
     *
     * <p>String and list slots must be set in ascending row order.
     *
     * <p>Example usage:
     * <pre>
     *   Column.Builder out = Column.builder("total", LongType.get(), rows);
     *   for (int i = 0; i &lt; rows; i++) {
     *       out.setLong(i, price.getLong(i) * qty.getLong(i));
     *   }
     *   Column total = out.build();
     * </pre>
     */
    public static final class Builder {
        private final String name;
        private final DataType dataType;
        private final int length;
        private final Storage storage;
        private boolean built;

        private Builder(String name, DataType dataType, int length) {
            if (length < 0) {
                throw new IllegalArgumentException("length must not be negative, got: " + length);
            }
            Field field = ColumnVectors.field(name, dataType);
            this.name = name;
            this.dataType = dataType;
            this.length = length;
            this.storage = new Storage(ColumnVectors.allocate(field, length));
        }

        public int length() {
            return length;
        }

        /**
         * Sets a slot from a Java value.
         *
         * @param row the row index
         * @param value the value, or null
         * @return this builder
         */
        public Builder set(int row, Object value) {
            checkOpen();
            ColumnVectors.write(storage.vector, row, value);
            return this;
        }

        public Builder setNull(int row) {
            checkOpen();
            ColumnVectors.setNull(storage.vector, row);
            return this;
        }

        /**
         * Sets an int32 or int64 slot.
         *
         * @param row the row index
         * @param value the value; narrowed for int32 columns
         * @return this builder
         */
        public Builder setLong(int row, long value) {
            checkOpen();
            FieldVector vector = storage.vector;
            if (vector instanceof BigIntVector v) {
                v.setSafe(row, value);
            } else if (vector instanceof IntVector v) {
                v.setSafe(row, (int) value);
            } else {
                throw new IllegalStateException("column '" + name + "' of type " + dataType + " is not integral");
            }
            return this;
        }

        /**
         * Sets a float32 or float64 slot.
         *
         * @param row the row index
         * @param value the value; rounded for float32 columns
         * @return this builder
         */
        public Builder setDouble(int row, double value) {
            checkOpen();
            FieldVector vector = storage.vector;
            if (vector instanceof Float8Vector v) {
                v.setSafe(row, value);
            } else if (vector instanceof Float4Vector v) {
                v.setSafe(row, (float) value);
            } else {
                throw new IllegalStateException("column '" + name + "' of type " + dataType + " is not floating");
            }
            return this;
        }

        public Builder setBoolean(int row, boolean value) {
            checkOpen();
            if (!(storage.vector instanceof BitVector v)) {
                throw new IllegalStateException("column '" + name + "' of type " + dataType + " is not boolean");
            }
            v.setSafe(row, value ? 1 : 0);
            return this;
        }

        /**
         * Copies one slot of another vector of the same type.
         *
         * @param row the row index in this builder
         * @param source the source vector
         * @param sourceRow the row index in the source
         * @return this builder
         */
        Builder copy(int row, FieldVector source, int sourceRow) {
            checkOpen();
            ColumnVectors.copy(source, sourceRow, storage.vector, row);
            return this;
        }

        /**
         * Finishes the column. The builder cannot be used afterwards.
         *
         * @return the column
         */
        public Column build() {
            checkOpen();
            built = true;
            storage.vector.setValueCount(length);
            return new Column(name, dataType, storage);
        }

        private void checkOpen() {
            if (built) {
                throw new IllegalStateException("column '" + name + "' was already built");
            }
        }
    }
}
