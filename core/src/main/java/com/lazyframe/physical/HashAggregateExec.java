package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.runtime.ExecutionContext;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Partitioned hash aggregation.
 *
 * <p>Each row range is aggregated into its own partial state on the pool; the partial
 * states are then merged in range order. Aggregations with a non-mergeable function run as
 * a single partition.
 */
public final class HashAggregateExec extends PhysicalOperator {

    private final Aggregate aggregate;
    private final GroupedAggregation prototype;

    public HashAggregateExec(Aggregate aggregate, PhysicalOperator child) {
        super(aggregate.schema(), child);
        this.aggregate = aggregate;
        this.prototype = new GroupedAggregation(aggregate);
    }

    public Aggregate aggregate() {
        return aggregate;
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        int parts = aggregate.isMergeable() ? ctx.partitionCount(input.rowCount()) : 1;
        List<Callable<GroupedAggregation>> tasks = new ArrayList<>(parts);
        for (int[] range : Partitioned.ranges(input.rowCount(), parts)) {
            ColumnarBatch slice = parts == 1 ? input : input.slice(range[0], range[1] - range[0]);
            tasks.add(() -> {
                GroupedAggregation partial = prototype.newPartial();
                partial.accumulate(slice);
                return partial;
            });
        }
        List<GroupedAggregation> partials = ctx.invokeAll(tasks, nodeName());
        GroupedAggregation result = partials.get(0);
        for (int i = 1; i < partials.size(); i++) {
            ctx.checkCancelled(nodeName());
            result.merge(partials.get(i));
        }
        ctx.checkRows(result.groupCount(), nodeName());
        return result.finish();
    }

    @Override
    public String toString() {
        return String.format("HashAggregateExec(keys=%s, aggs=%s)",
            aggregate.groupingExpressions(), aggregate.aggregateExpressions());
    }
}
