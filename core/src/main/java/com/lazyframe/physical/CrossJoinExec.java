package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.ResourceExhaustedException;
import com.lazyframe.logical.Join;
import com.lazyframe.runtime.ExecutionContext;
import java.util.List;

/**
 * Cartesian product in left-major order.
 */
public final class CrossJoinExec extends PhysicalOperator {

    private final JoinAssembler assembler;

    public CrossJoinExec(Join join, PhysicalOperator left, PhysicalOperator right) {
        super(join.schema(), List.of(left, right));
        this.assembler = new JoinAssembler(join);
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch left = children().get(0).execute(ctx);
        ColumnarBatch right = children().get(1).execute(ctx);
        long total = (long) left.rowCount() * right.rowCount();
        ctx.checkRows(total, nodeName());
        if (total > Integer.MAX_VALUE) {
            throw new ResourceExhaustedException(total + " rows exceed the maximum batch size", null, nodeName(), null);
        }
        int rows = (int) total;
        int[] leftRows = new int[rows];
        int[] rightRows = new int[rows];
        int next = 0;
        for (int l = 0; l < left.rowCount(); l++) {
            for (int r = 0; r < right.rowCount(); r++) {
                leftRows[next] = l;
                rightRows[next] = r;
                next++;
            }
        }
        return assembler.assemble(left, right, leftRows, rightRows);
    }

    @Override
    public String toString() {
        return "CrossJoinExec";
    }
}
