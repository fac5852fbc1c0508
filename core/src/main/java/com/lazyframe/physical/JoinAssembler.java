package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.logical.Join;
import com.lazyframe.types.DataType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds join output batches from matched row indexes.
 *
 * <p>A row index of {@code -1} stands for the missing side of an outer match and produces
 * nulls. Coalesced full-join key columns take the right key where the left row is missing.
 */
public final class JoinAssembler {

    private final Join join;
    private final Map<Integer, String> coalesced = new HashMap<>();

    public JoinAssembler(Join join) {
        this.join = join;
        StructType leftSchema = join.left().schema();
        for (int index : join.coalescedKeys()) {
            String name = ((ColumnReference) join.leftKeys().get(index)).name();
            coalesced.put(leftSchema.fieldIndex(name), name);
        }
    }

    /**
     * Assembles the output rows for the given index pairs.
     *
     * @param left the left input
     * @param right the right input (unused for semi and anti joins)
     * @param leftRows left row per output row
     * @param rightRows right row per output row
     * @return the output batch
     */
    public ColumnarBatch assemble(ColumnarBatch left, ColumnarBatch right, int[] leftRows, int[] rightRows) {
        StructType schema = join.schema();
        List<Column> columns = new ArrayList<>(schema.size());
        for (int i = 0; i < left.numColumns(); i++) {
            String rightKey = coalesced.get(i);
            if (rightKey == null) {
                columns.add(left.column(i).take(leftRows));
            } else {
                columns.add(coalesce(schema.fieldAt(i), left.column(i), right.column(rightKey), leftRows, rightRows));
            }
        }
        for (Join.RightOutput output : join.rightOutputs()) {
            columns.add(right.column(output.source()).take(rightRows).rename(output.name()));
        }
        return new ColumnarBatch(schema, columns, leftRows.length);
    }

    private static Column coalesce(StructField field, Column left, Column right, int[] leftRows, int[] rightRows) {
        DataType type = field.dataType();
        Column l = left.cast(type, false);
        Column r = right.cast(type, false);
        Object[] values = new Object[leftRows.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = leftRows[i] >= 0 ? l.get(leftRows[i]) : rightRows[i] >= 0 ? r.get(rightRows[i]) : null;
        }
        return Column.fromValues(field.name(), type, values);
    }
}
