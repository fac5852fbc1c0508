package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.RowComparator;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.SortOrder;
import com.lazyframe.expression.eval.CompiledExpression;
import com.lazyframe.expression.eval.ExpressionCompiler;
import com.lazyframe.logical.Sort;
import com.lazyframe.runtime.ExecutionContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Stable multi-key sort.
 *
 * <p>Row ranges are sorted in parallel and merged in range order, ties taking the earlier
 * range first. With a top-k hint every range keeps only its leading {@code k} rows.
 */
public final class SortExec extends PhysicalOperator {

    private final Sort sort;
    private final List<CompiledExpression> keys;
    private final boolean[] descending;
    private final boolean[] nullsLast;

    public SortExec(Sort sort, PhysicalOperator child) {
        super(sort.schema(), child);
        this.sort = sort;
        List<SortOrder> orders = sort.sortOrders();
        List<Expression> expressions = new ArrayList<>(orders.size());
        this.descending = new boolean[orders.size()];
        this.nullsLast = new boolean[orders.size()];
        for (int i = 0; i < orders.size(); i++) {
            expressions.add(orders.get(i).expression());
            descending[i] = orders.get(i).descending();
            nullsLast[i] = orders.get(i).nullsLast();
        }
        this.keys = ExpressionCompiler.compileAll(expressions);
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        int rows = input.rowCount();
        List<Column> keyColumns = new ArrayList<>(keys.size());
        for (CompiledExpression key : keys) {
            keyColumns.add(key.evaluate(input));
        }
        RowComparator comparator = new RowComparator(keyColumns, descending, nullsLast);
        int limit = sort.topK() < 0 ? rows : (int) Math.min(rows, sort.topK());

        List<Callable<int[]>> tasks = new ArrayList<>();
        for (int[] range : Partitioned.ranges(rows, ctx.partitionCount(rows))) {
            tasks.add(() -> {
                int[] order = new int[range[1] - range[0]];
                for (int i = 0; i < order.length; i++) {
                    order[i] = range[0] + i;
                }
                comparator.sort(order);
                return order.length > limit ? Arrays.copyOf(order, limit) : order;
            });
        }
        int[] order = null;
        for (int[] part : ctx.invokeAll(tasks, nodeName())) {
            order = order == null ? part : merge(order, part, comparator, limit);
        }
        return input.take(order == null ? new int[0] : order);
    }

    private static int[] merge(int[] first, int[] second, RowComparator comparator, int limit) {
        int[] out = new int[Math.min(limit, first.length + second.length)];
        int i = 0;
        int j = 0;
        for (int k = 0; k < out.length; k++) {
            if (j >= second.length || (i < first.length && comparator.compare(first[i], second[j]) <= 0)) {
                out[k] = first[i++];
            } else {
                out[k] = second[j++];
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return sort.topK() < 0
            ? String.format("SortExec(%s)", sort.sortOrders())
            : String.format("SortExec(%s, top_k=%d)", sort.sortOrders(), sort.topK());
    }
}
