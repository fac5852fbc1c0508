package com.lazyframe.data;

import com.lazyframe.exception.SchemaException;
import com.lazyframe.types.DataType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An ordered set of named columns sharing one row count.
 *
 * <p>Batches are the unit of exchange between operators. A batch is immutable; once a
 * producer hands a batch to its consumer it keeps no reference to it.
 *
 * <p>Example:
 * <pre>
 *   ColumnarBatch batch = ColumnarBatch.of(
 *       Column.of("id", LongType.get(), 1L, 2L),
 *       Column.of("x", StringType.get(), "a", "b"));
 * </pre>
 */
public final class ColumnarBatch {

    private final StructType schema;
    private final List<Column> columns;
    private final int rowCount;

    /**
     * Creates a batch.
     *
     * @param schema the schema (names and types must match the columns)
     * @param columns the columns
     * @param rowCount the row count (needed for batches with zero columns)
     * @throws IllegalArgumentException if columns disagree with the schema or row count
     */
    public ColumnarBatch(StructType schema, List<Column> columns, int rowCount) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.columns = List.copyOf(Objects.requireNonNull(columns, "columns must not be null"));
        this.rowCount = rowCount;
        if (schema.size() != columns.size()) {
            throw new IllegalArgumentException(String.format(
                "schema has %d fields but batch has %d columns", schema.size(), columns.size()));
        }
        for (int i = 0; i < columns.size(); i++) {
            Column column = columns.get(i);
            StructField field = schema.fieldAt(i);
            if (column.size() != rowCount) {
                throw new IllegalArgumentException(String.format(
                    "column '%s' has %d rows, expected %d", column.name(), column.size(), rowCount));
            }
            if (!column.name().equals(field.name()) || !column.dataType().equals(field.dataType())) {
                throw new IllegalArgumentException(String.format(
                    "column %s does not match schema field %s", column.name() + ": " + column.dataType(), field));
            }
        }
    }

    /**
     * Creates a batch from columns, deriving the schema.
     *
     * @param columns the columns (at least one)
     * @return the batch
     */
    public static ColumnarBatch of(Column... columns) {
        return of(Arrays.asList(columns));
    }

    /**
     * Creates a batch from columns, deriving the schema.
     *
     * @param columns the columns (at least one)
     * @return the batch
     */
    public static ColumnarBatch of(List<Column> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("use empty(schema) for a batch without columns");
        }
        List<StructField> fields = new ArrayList<>(columns.size());
        for (Column column : columns) {
            fields.add(column.field());
        }
        return new ColumnarBatch(new StructType(fields), columns, columns.get(0).size());
    }

    /**
     * Creates a zero-row batch of the given schema.
     *
     * @param schema the schema
     * @return the empty batch
     */
    public static ColumnarBatch empty(StructType schema) {
        List<Column> columns = new ArrayList<>(schema.size());
        for (StructField field : schema.fields()) {
            columns.add(Column.nulls(field.name(), field.dataType(), 0));
        }
        return new ColumnarBatch(schema, columns, 0);
    }

    /**
     * Creates a batch from row tuples.
     *
     * @param schema the schema
     * @param rows the rows, each with one value per field
     * @return the batch
     */
    public static ColumnarBatch fromRows(StructType schema, List<List<Object>> rows) {
        List<Column> columns = new ArrayList<>(schema.size());
        for (int c = 0; c < schema.size(); c++) {
            Object[] values = new Object[rows.size()];
            for (int r = 0; r < rows.size(); r++) {
                values[r] = rows.get(r).get(c);
            }
            StructField field = schema.fieldAt(c);
            columns.add(Column.of(field.name(), field.dataType(), values));
        }
        return new ColumnarBatch(schema, columns, rows.size());
    }

    public StructType schema() {
        return schema;
    }

    public List<Column> columns() {
        return columns;
    }

    public int numColumns() {
        return columns.size();
    }

    public int rowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    public Column column(int index) {
        return columns.get(index);
    }

    /**
     * Returns the column with the given name.
     *
     * @param name the column name
     * @return the column
     * @throws SchemaException if no such column exists
     */
    public Column column(String name) {
        int index = schema.fieldIndex(name);
        if (index < 0) {
            schema.field(name);
        }
        return columns.get(index);
    }

    /**
     * Returns a batch with the named columns, in order.
     *
     * @param names the column names
     * @return the projected batch
     */
    public ColumnarBatch select(List<String> names) {
        List<Column> selected = new ArrayList<>(names.size());
        for (String name : names) {
            selected.add(column(name));
        }
        return new ColumnarBatch(schema.select(names), selected, rowCount);
    }

    /**
     * Returns a batch with the given column appended, or replaced in place when a column of
     * the same name exists.
     *
     * @param column the column (must have this batch's row count)
     * @return the new batch
     */
    public ColumnarBatch withColumn(Column column) {
        List<Column> result = new ArrayList<>(columns);
        int index = schema.fieldIndex(column.name());
        if (index >= 0) {
            result.set(index, column);
        } else {
            result.add(column);
        }
        return new ColumnarBatch(schema.withField(column.field()), result, rowCount);
    }

    /**
     * Returns a batch whose columns carry new names, positionally.
     *
     * @param target the target schema (same arity and types)
     * @return the renamed batch
     */
    public ColumnarBatch withSchema(StructType target) {
        List<Column> renamed = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            StructField field = target.fieldAt(i);
            Column column = columns.get(i).rename(field.name());
            if (!column.dataType().equals(field.dataType())) {
                column = column.cast(field.dataType(), true);
            }
            renamed.add(column);
        }
        return new ColumnarBatch(target, renamed, rowCount);
    }

    /**
     * Returns a contiguous row range.
     *
     * @param offset the first row
     * @param length the maximum number of rows
     * @return the sliced batch
     */
    public ColumnarBatch slice(int offset, int length) {
        if (offset <= 0 && length >= rowCount) {
            return this;
        }
        int start = Math.max(0, Math.min(offset, rowCount));
        int end = Math.max(start, Math.min(rowCount, start + Math.max(0, length)));
        List<Column> sliced = new ArrayList<>(columns.size());
        for (Column column : columns) {
            sliced.add(column.slice(start, end - start));
        }
        return new ColumnarBatch(schema, sliced, end - start);
    }

    /**
     * Gathers rows by index. An index of -1 produces a row of nulls.
     *
     * @param indices the row indices
     * @return the gathered batch
     */
    public ColumnarBatch take(int[] indices) {
        List<Column> taken = new ArrayList<>(columns.size());
        for (Column column : columns) {
            taken.add(column.take(indices));
        }
        return new ColumnarBatch(schema, taken, indices.length);
    }

    /**
     * Keeps rows where the mask is true; null counts as false.
     *
     * @param mask a boolean column of this batch's length
     * @return the filtered batch
     */
    public ColumnarBatch filter(Column mask) {
        return take(Column.selectedRows(mask));
    }

    /**
     * Splits this batch into consecutive chunks of at most {@code size} rows.
     *
     * @param size the maximum chunk size
     * @return the chunks, in order; a single empty batch if this batch is empty
     */
    public List<ColumnarBatch> split(int size) {
        if (rowCount <= size) {
            return Collections.singletonList(this);
        }
        List<ColumnarBatch> chunks = new ArrayList<>((rowCount + size - 1) / size);
        for (int offset = 0; offset < rowCount; offset += size) {
            chunks.add(slice(offset, size));
        }
        return chunks;
    }

    /**
     * Concatenates batches vertically.
     *
     * @param schema the common schema
     * @param batches the batches, in order
     * @return the concatenated batch
     */
    public static ColumnarBatch concat(StructType schema, List<ColumnarBatch> batches) {
        if (batches.isEmpty()) {
            return empty(schema);
        }
        if (batches.size() == 1) {
            return batches.get(0);
        }
        int total = 0;
        for (ColumnarBatch batch : batches) {
            total += batch.rowCount;
        }
        List<Column> result = new ArrayList<>(schema.size());
        for (int c = 0; c < schema.size(); c++) {
            List<Column> parts = new ArrayList<>(batches.size());
            for (ColumnarBatch batch : batches) {
                parts.add(batch.columns.get(c));
            }
            StructField field = schema.fieldAt(c);
            result.add(Column.concat(parts).rename(field.name()));
        }
        return new ColumnarBatch(schema, result, total);
    }

    /**
     * Returns one row as a list of values.
     *
     * @param index the row index
     * @return the row
     */
    public List<Object> row(int index) {
        List<Object> row = new ArrayList<>(columns.size());
        for (Column column : columns) {
            row.add(column.get(index));
        }
        return row;
    }

    /**
     * Returns all rows as lists of values.
     *
     * @return the rows
     */
    public List<List<Object>> rows() {
        List<List<Object>> rows = new ArrayList<>(rowCount);
        for (int i = 0; i < rowCount; i++) {
            rows.add(row(i));
        }
        return rows;
    }

    /**
     * Returns the type of the named column.
     *
     * @param name the column name
     * @return the type
     */
    public DataType typeOf(String name) {
        return schema.field(name).dataType();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnarBatch)) return false;
        ColumnarBatch that = (ColumnarBatch) o;
        return rowCount == that.rowCount && schema.equals(that.schema) && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(schema, columns, rowCount);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("shape: (").append(rowCount).append(", ").append(columns.size()).append(")\n");
        sb.append(String.join(" | ", schema.names())).append('\n');
        int shown = Math.min(rowCount, 20);
        for (int r = 0; r < shown; r++) {
            List<String> cells = new ArrayList<>(columns.size());
            for (Column column : columns) {
                Object value = column.get(r);
                cells.add(value == null ? "null" : ValueOps.format(value));
            }
            sb.append(String.join(" | ", cells)).append('\n');
        }
        if (rowCount > shown) {
            sb.append("...\n");
        }
        return sb.toString();
    }
}
