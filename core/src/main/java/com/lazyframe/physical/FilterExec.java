package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Filter;
import com.lazyframe.runtime.ExecutionContext;
import java.util.function.UnaryOperator;

/**
 * Filters rows in parallel over row ranges. Order-preserving.
 */
public final class FilterExec extends PhysicalOperator {

    private final Filter filter;
    private final UnaryOperator<ColumnarBatch> function;

    public FilterExec(Filter filter, PhysicalOperator child) {
        super(filter.schema(), child);
        this.filter = filter;
        this.function = BatchFunctions.filter(filter.condition());
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        return Partitioned.map(ctx, input, schema(), nodeName(), function);
    }

    @Override
    public String toString() {
        return String.format("FilterExec(%s)", filter.condition());
    }
}
