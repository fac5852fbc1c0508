package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.WithColumns;
import com.lazyframe.runtime.ExecutionContext;
import java.util.function.UnaryOperator;

/**
 * Adds or replaces columns in parallel over row ranges. Order-preserving.
 */
public final class WithColumnsExec extends PhysicalOperator {

    private final WithColumns withColumns;
    private final UnaryOperator<ColumnarBatch> function;

    public WithColumnsExec(WithColumns withColumns, PhysicalOperator child) {
        super(withColumns.schema(), child);
        this.withColumns = withColumns;
        this.function = BatchFunctions.withColumns(withColumns.columns());
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        return Partitioned.map(ctx, input, schema(), nodeName(), function);
    }

    @Override
    public String toString() {
        return String.format("WithColumnsExec(%s)", withColumns.columns());
    }
}
