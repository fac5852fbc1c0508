package com.lazyframe.runtime;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnVectors;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Arrow data interchange at the engine boundary.
 *
 * <p>Columns already live in Arrow vectors (see {@link ColumnVectors} for the type
 * mapping), so export copies vector to vector into a root the caller owns, and import
 * copies the caller's vectors into engine-owned columns.
 *
 * <p>Example usage:
 * <pre>
 *   try (VectorSchemaRoot root = ArrowInterchange.toArrow(batch)) {
 *       ColumnarBatch copy = ArrowInterchange.fromArrow(root);
 *   }
 * </pre>
 *
 * @see ArrowBatchIterator
 */
public final class ArrowInterchange {

    private ArrowInterchange() {
        // Utility class - prevent instantiation
    }

    // ==================== Schema ====================

    /**
     * Converts an engine schema to an Arrow schema.
     *
     * @param schema the engine schema
     * @return the Arrow schema
     */
    public static Schema toArrowSchema(StructType schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        List<Field> fields = new ArrayList<>(schema.size());
        for (StructField field : schema.fields()) {
            fields.add(ColumnVectors.field(field.name(), field.dataType()));
        }
        return new Schema(fields);
    }

    /**
     * Converts an Arrow schema to an engine schema.
     *
     * @param schema the Arrow schema
     * @return the engine schema
     * @throws com.lazyframe.exception.InvalidOperationException if a field has an unsupported type
     */
    public static StructType fromArrowSchema(Schema schema) {
        Objects.requireNonNull(schema, "schema must not be null");
        List<StructField> fields = new ArrayList<>();
        for (Field field : schema.getFields()) {
            fields.add(new StructField(field.getName(), ColumnVectors.dataType(field)));
        }
        return new StructType(fields);
    }

    // ==================== Batch conversion ====================

    /**
     * Copies a batch into a new Arrow root allocated from the column allocator.
     *
     * @param batch the batch
     * @return the root; the caller must close it
     */
    public static VectorSchemaRoot toArrow(ColumnarBatch batch) {
        return toArrow(batch, ColumnVectors.allocator());
    }

    /**
     * Copies a batch into a new Arrow root.
     *
     * @param batch the batch
     * @param bufferAllocator the allocator of the vectors
     * @return the root; the caller must close it
     */
    public static VectorSchemaRoot toArrow(ColumnarBatch batch, BufferAllocator bufferAllocator) {
        Objects.requireNonNull(batch, "batch must not be null");
        VectorSchemaRoot root = VectorSchemaRoot.create(toArrowSchema(batch.schema()), bufferAllocator);
        try {
            root.allocateNew();
            for (int c = 0; c < batch.numColumns(); c++) {
                batch.column(c).copyInto(root.getVector(c));
            }
            root.setRowCount(batch.rowCount());
            return root;
        } catch (RuntimeException e) {
            root.close();
            throw e;
        }
    }

    /**
     * Copies the rows of an Arrow root into a batch.
     *
     * @param root the Arrow root; it stays owned by the caller
     * @return the batch
     */
    public static ColumnarBatch fromArrow(VectorSchemaRoot root) {
        Objects.requireNonNull(root, "root must not be null");
        StructType schema = fromArrowSchema(root.getSchema());
        List<Column> columns = new ArrayList<>(schema.size());
        for (int c = 0; c < schema.size(); c++) {
            FieldVector vector = root.getVector(c);
            StructField field = schema.fieldAt(c);
            columns.add(Column.copyOf(field.name(), field.dataType(), vector));
        }
        return new ColumnarBatch(schema, columns, root.getRowCount());
    }

    /**
     * Returns the allocator used for Arrow memory management.
     *
     * @return the column allocator
     */
    public static BufferAllocator getAllocator() {
        return ColumnVectors.allocator();
    }
}
