package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Upsample;
import com.lazyframe.runtime.ExecutionContext;

/**
 * Fills gaps in a time series at a fixed interval.
 */
public final class UpsampleExec extends PhysicalOperator {

    private final Upsample upsample;

    public UpsampleExec(Upsample upsample, PhysicalOperator child) {
        super(upsample.schema(), child);
        this.upsample = upsample;
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        return upsample.upsampler().upsample(input);
    }

    @Override
    public String toString() {
        return String.format("UpsampleExec(%s)", upsample.upsampler());
    }
}
