package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Slice;
import com.lazyframe.runtime.ExecutionContext;

/**
 * Keeps a contiguous row range; a negative offset counts from the end.
 */
public final class SliceExec extends PhysicalOperator {

    private final Slice slice;

    public SliceExec(Slice slice, PhysicalOperator child) {
        super(slice.schema(), child);
        this.slice = slice;
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        long rows = input.rowCount();
        long start = slice.offset() >= 0 ? Math.min(slice.offset(), rows) : Math.max(0, rows + slice.offset());
        long end = Math.min(rows, start + Math.min(slice.length(), rows));
        return input.slice((int) start, (int) (end - start));
    }

    @Override
    public String toString() {
        return String.format("SliceExec(offset=%d, length=%d)", slice.offset(), slice.length());
    }
}
