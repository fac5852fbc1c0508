package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Union;
import com.lazyframe.runtime.ExecutionContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Concatenates its inputs in order, widening each to the union schema.
 */
public final class UnionExec extends PhysicalOperator {

    public UnionExec(Union union, List<PhysicalOperator> inputs) {
        super(union.schema(), inputs);
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        List<ColumnarBatch> parts = new ArrayList<>(children().size());
        long rows = 0;
        for (PhysicalOperator input : children()) {
            ColumnarBatch part = input.execute(ctx).withSchema(schema());
            rows += part.rowCount();
            ctx.checkRows(rows, nodeName());
            parts.add(part);
        }
        return ColumnarBatch.concat(schema(), parts);
    }

    @Override
    public String toString() {
        return String.format("UnionExec(inputs=%d)", children().size());
    }
}
