package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.logical.Explode;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.types.StructField;
import java.util.ArrayList;
import java.util.List;

/**
 * Explodes list columns into one row per element, repeating the other columns.
 */
public final class ExplodeExec extends PhysicalOperator {

    private final Explode explode;

    public ExplodeExec(Explode explode, PhysicalOperator child) {
        super(explode.schema(), child);
        this.explode = explode;
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        return Partitioned.map(ctx, input, schema(), nodeName(), this::explode);
    }

    private ColumnarBatch explode(ColumnarBatch input) {
        List<Column> lists = new ArrayList<>(explode.columns().size());
        for (String name : explode.columns()) {
            lists.add(input.column(name));
        }
        int rows = input.rowCount();
        int[] lengths = new int[rows];
        long total = 0;
        for (int row = 0; row < rows; row++) {
            int length = -1;
            for (Column list : lists) {
                int size = sizeOf(list.get(row));
                if (length >= 0 && size != length) {
                    throw new ComputeException(String.format(
                        "exploded columns have different list lengths in row %d: %d vs %d", row, length, size),
                        null, nodeName(), list.name());
                }
                length = size;
            }
            lengths[row] = Math.max(1, length);
            total += lengths[row];
        }
        if (total > Integer.MAX_VALUE) {
            throw new ComputeException("explode result of " + total + " rows is too large", null, nodeName(), null);
        }

        int[] source = new int[(int) total];
        int[] element = new int[(int) total];
        int next = 0;
        for (int row = 0; row < rows; row++) {
            for (int e = 0; e < lengths[row]; e++) {
                source[next] = row;
                element[next] = e;
                next++;
            }
        }

        List<Column> columns = new ArrayList<>(schema().size());
        for (StructField field : schema().fields()) {
            Column column = input.column(field.name());
            if (!explode.columns().contains(field.name())) {
                columns.add(column.take(source));
                continue;
            }
            Object[] values = new Object[source.length];
            for (int i = 0; i < source.length; i++) {
                Object list = column.get(source[i]);
                values[i] = list == null || ((List<?>) list).isEmpty() ? null : ((List<?>) list).get(element[i]);
            }
            columns.add(Column.fromValues(field.name(), field.dataType(), values));
        }
        return new ColumnarBatch(schema(), columns, source.length);
    }

    private static int sizeOf(Object list) {
        return list == null ? 0 : ((List<?>) list).size();
    }

    @Override
    public String toString() {
        return String.format("ExplodeExec(%s)", explode.columns());
    }
}
