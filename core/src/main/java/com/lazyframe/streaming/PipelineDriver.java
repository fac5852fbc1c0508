package com.lazyframe.streaming;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.CancelledException;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.exception.LazyFrameException;
import com.lazyframe.exception.ResourceExhaustedException;
import com.lazyframe.physical.MorselStream;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.source.BatchStream;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one pipeline by pulling batches through its operators on demand.
 *
 * <p>Each call of {@link #next()} pulls from the last operator, which pulls from its
 * upstream only when it needs input, down to the scan. Nothing is buffered between stages
 * beyond one pending batch per operator, so production follows consumption. Stateless
 * stages directly after the scan run on the worker pool as part of the scan.
 *
 * <p>The cancellation token is checked before every pull. Operators and the scan are
 * closed when the run ends, fails, or the driver is closed early.
 */
public final class PipelineDriver implements BatchStream {

    private static final Logger logger = LoggerFactory.getLogger(PipelineDriver.class);

    private final Pipeline pipeline;
    private final ExecutionContext ctx;
    private final PipelineContext context = new PipelineContext();
    private final List<StreamOperator> operators = new ArrayList<>();
    private final List<String> fused = new ArrayList<>();
    private final MorselStream source;
    private ColumnarBatch next;
    private String active;
    private long batches;
    private long rows;
    private boolean closed;

    /**
     * Creates the operators of a pipeline for one run.
     *
     * @param pipeline the pipeline
     * @param ctx the execution context
     */
    public PipelineDriver(Pipeline pipeline, ExecutionContext ctx) {
        this.pipeline = pipeline;
        this.ctx = ctx;
        UnaryOperator<ColumnarBatch> transform = null;
        int first = 0;
        List<OperatorFactory> stages = pipeline.stages();
        while (first < stages.size() && stages.get(first).batchFunction() != null) {
            UnaryOperator<ColumnarBatch> stage = stages.get(first).batchFunction();
            UnaryOperator<ColumnarBatch> previous = transform;
            transform = previous == null ? stage : batch -> stage.apply(previous.apply(batch));
            fused.add(stages.get(first).description());
            first++;
        }
        this.source = new MorselStream(pipeline.source(), ctx, transform, "Scan");
        try {
            for (int i = first; i < stages.size(); i++) {
                active = stages.get(i).description();
                operators.add(stages.get(i).create(ctx));
            }
        } catch (RuntimeException e) {
            close();
            throw e;
        }
        active = null;
    }

    public PipelineContext context() {
        return context;
    }

    @Override
    public boolean hasNext() {
        if (next != null) {
            return true;
        }
        if (closed || context.isTerminal()) {
            return false;
        }
        if (context.status() == PipelineContext.Status.IDLE) {
            context.setRunning();
            logger.debug("{} started: fused={}, operators={}", pipeline, fused, operators.size());
        }
        try {
            next = pull(operators.size() - 1);
        } catch (CancelledException e) {
            context.setCancelled();
            close();
            throw e;
        } catch (LazyFrameException e) {
            context.setFailed(e.getMessage());
            close();
            throw active == null ? e : e.withOperator(active);
        } catch (OutOfMemoryError e) {
            context.setFailed("out of memory");
            close();
            throw new ResourceExhaustedException("out of memory", e, active, null);
        } catch (RuntimeException e) {
            context.setFailed(String.valueOf(e.getMessage()));
            close();
            throw new ComputeException(e.getMessage() == null ? e.toString() : e.getMessage(), e, active, null);
        }
        if (next == null) {
            context.setFinished();
            logger.debug("Pipeline#{} finished: {} batches, {} rows", pipeline.id(), batches, rows);
            close();
            return false;
        }
        batches++;
        rows += next.rowCount();
        return true;
    }

    @Override
    public ColumnarBatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        ColumnarBatch batch = next;
        next = null;
        return batch;
    }

    private ColumnarBatch pull(int index) {
        if (index < 0) {
            active = null;
            ctx.checkCancelled("Scan");
            return source.hasNext() ? source.next() : null;
        }
        StreamOperator operator = operators.get(index);
        while (true) {
            active = operator.name();
            ctx.checkCancelled(operator.name());
            ColumnarBatch output = operator.getOutput();
            if (output != null) {
                return output;
            }
            if (operator.isFinished()) {
                return null;
            }
            if (!operator.needsInput()) {
                throw new IllegalStateException(operator.name() + " has no output and accepts no input");
            }
            ColumnarBatch input = pull(index - 1);
            active = operator.name();
            if (input == null) {
                operator.finish();
            } else {
                operator.addInput(input);
            }
        }
    }

    /**
     * Stops the run and releases all operators and the scan. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        next = null;
        if (context.status() == PipelineContext.Status.RUNNING) {
            context.setCancelled();
            logger.debug("Pipeline#{} closed before completion", pipeline.id());
        }
        for (StreamOperator operator : operators) {
            try {
                operator.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing operator {}", operator.name(), e);
            }
        }
        source.close();
    }
}
