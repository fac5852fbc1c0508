package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.WindowFunction;
import com.lazyframe.expression.eval.WindowEvaluator;
import com.lazyframe.logical.Window;
import com.lazyframe.runtime.ExecutionContext;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Computes window functions, evaluating groups of partitions in parallel.
 *
 * <p>All window expressions are evaluated over the input before any result column is
 * added, so they never see each other's outputs.
 */
public final class WindowExec extends PhysicalOperator {

    private final Window window;
    private final List<WindowEvaluator> evaluators;

    public WindowExec(Window window, PhysicalOperator child) {
        super(window.schema(), child);
        this.window = window;
        this.evaluators = new ArrayList<>(window.windowExpressions().size());
        for (AliasExpression expr : window.windowExpressions()) {
            evaluators.add(new WindowEvaluator((WindowFunction) expr.expression(), expr.outputName()));
        }
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        List<Column> results = new ArrayList<>(evaluators.size());
        for (WindowEvaluator evaluator : evaluators) {
            results.add(evaluate(ctx, evaluator, input));
        }
        ColumnarBatch output = input;
        for (Column column : results) {
            output = output.withColumn(column);
        }
        return output;
    }

    private Column evaluate(ExecutionContext ctx, WindowEvaluator evaluator, ColumnarBatch input) {
        WindowEvaluator.Prepared prepared = evaluator.prepare(input);
        List<int[]> partitions = prepared.partitions();
        Object[] out = new Object[input.rowCount()];
        int parts = Math.min(partitions.size(), ctx.partitionCount(input.rowCount()));
        List<Callable<Void>> tasks = new ArrayList<>();
        for (int[] range : Partitioned.ranges(partitions.size(), parts)) {
            tasks.add(() -> {
                for (int p = range[0]; p < range[1]; p++) {
                    evaluator.evaluatePartition(prepared, partitions.get(p), out);
                }
                return null;
            });
        }
        ctx.invokeAll(tasks, nodeName());
        return Column.fromValues(evaluator.outputName(), evaluator.dataType(), out);
    }

    @Override
    public String toString() {
        return String.format("WindowExec(%s)", window.windowExpressions());
    }
}
