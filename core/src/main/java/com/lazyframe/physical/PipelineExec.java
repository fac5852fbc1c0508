package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.source.BatchStream;
import com.lazyframe.streaming.Pipeline;
import com.lazyframe.streaming.PipelineDriver;
import java.util.ArrayList;
import java.util.List;

/**
 * A streaming subtree, run morsel by morsel by a {@link PipelineDriver}.
 *
 * <p>The children are the in-memory build sides of the pipeline's joins; they are listed
 * for plan output and executed by the join stages themselves.
 */
public final class PipelineExec extends PhysicalOperator {

    private final Pipeline pipeline;

    public PipelineExec(Pipeline pipeline, List<PhysicalOperator> buildSides) {
        super(pipeline.schema(), buildSides);
        this.pipeline = pipeline;
    }

    public Pipeline pipeline() {
        return pipeline;
    }

    @Override
    public boolean isStreaming() {
        return true;
    }

    @Override
    public BatchStream stream(ExecutionContext ctx) {
        ctx.checkCancelled(nodeName());
        return new PipelineDriver(pipeline, ctx);
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        List<ColumnarBatch> batches = new ArrayList<>();
        long rows = 0;
        try (BatchStream stream = stream(ctx)) {
            while (stream.hasNext()) {
                ColumnarBatch batch = stream.next();
                rows += batch.rowCount();
                ctx.checkRows(rows, nodeName());
                batches.add(batch);
            }
        }
        return ColumnarBatch.concat(schema(), batches);
    }

    @Override
    public String toString() {
        return "PipelineExec" + pipeline.describe();
    }
}
