package com.lazyframe.streaming;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.physical.GroupedAggregation;
import com.lazyframe.runtime.ExecutionContext;

/**
 * Streaming hash aggregation: folds every morsel into the group table and emits the
 * groups once the input ends. Only mergeable aggregates are planned here.
 */
public final class HashAggregateOperator implements StreamOperator {

    private static final String NAME = "HashAggregate";

    private final GroupedAggregation state;
    private final ExecutionContext ctx;
    private ColumnarBatch result;
    private boolean finishing;
    private boolean emitted;

    public HashAggregateOperator(GroupedAggregation state, ExecutionContext ctx) {
        this.state = state;
        this.ctx = ctx;
    }

    @Override
    public boolean needsInput() {
        return !finishing;
    }

    @Override
    public void addInput(ColumnarBatch batch) {
        if (finishing) {
            throw new IllegalStateException(NAME + " already finished");
        }
        state.accumulate(batch);
        ctx.checkRows(state.groupCount(), NAME);
    }

    @Override
    public ColumnarBatch getOutput() {
        if (!finishing || emitted) {
            return null;
        }
        emitted = true;
        ColumnarBatch output = result;
        result = null;
        return output.rowCount() > 0 ? output : null;
    }

    @Override
    public void finish() {
        if (!finishing) {
            finishing = true;
            result = state.finish();
            state.clear();
        }
    }

    @Override
    public boolean isFinished() {
        return finishing && emitted;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void close() {
        state.clear();
        result = null;
    }
}
