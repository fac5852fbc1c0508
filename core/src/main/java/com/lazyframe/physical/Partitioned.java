package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;

/**
 * Row-range partitioning of in-memory work.
 *
 * <p>A batch is split into contiguous row ranges that are processed as independent units
 * on the worker pool. Results are concatenated in range order, so row-wise operators keep
 * their input order.
 */
final class Partitioned {

    private Partitioned() {
        // Utility class - prevent instantiation
    }

    /**
     * Splits a row count into contiguous ranges.
     *
     * @param rows the number of rows
     * @param parts the number of ranges
     * @return {@code [start, end)} pairs, in order
     */
    static List<int[]> ranges(int rows, int parts) {
        int count = Math.max(1, Math.min(parts, Math.max(rows, 1)));
        List<int[]> ranges = new ArrayList<>(count);
        int base = rows / count;
        int extra = rows % count;
        int start = 0;
        for (int i = 0; i < count; i++) {
            int end = start + base + (i < extra ? 1 : 0);
            ranges.add(new int[] {start, end});
            start = end;
        }
        return ranges;
    }

    /**
     * Applies a row-wise function to a batch, range by range.
     *
     * @param ctx the execution context
     * @param input the input
     * @param schema the output schema
     * @param operator the operator name used in error context
     * @param fn the row-wise function
     * @return the concatenated results
     */
    static ColumnarBatch map(ExecutionContext ctx, ColumnarBatch input, StructType schema, String operator,
                             UnaryOperator<ColumnarBatch> fn) {
        int parts = ctx.partitionCount(input.rowCount());
        if (parts == 1) {
            return fn.apply(input);
        }
        List<Callable<ColumnarBatch>> tasks = new ArrayList<>(parts);
        for (int[] range : ranges(input.rowCount(), parts)) {
            ColumnarBatch slice = input.slice(range[0], range[1] - range[0]);
            tasks.add(() -> fn.apply(slice));
        }
        return ColumnarBatch.concat(schema, ctx.invokeAll(tasks, operator));
    }
}
