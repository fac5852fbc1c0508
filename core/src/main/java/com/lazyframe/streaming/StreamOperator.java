package com.lazyframe.streaming;

import com.lazyframe.data.ColumnarBatch;

/**
 * An operator of a streaming pipeline.
 *
 * <p>Operators are driven by a {@link PipelineDriver} in a pull loop:
 *
 * <ol>
 *   <li>The driver asks for output with {@link #getOutput()}
 *   <li>If there is none and {@link #needsInput()} is true, it pulls a batch from upstream
 *       and passes it to {@link #addInput}
 *   <li>When upstream is exhausted the driver calls {@link #finish()}; the operator then
 *       hands out whatever it buffered
 *   <li>Once {@link #isFinished()} is true the operator produces nothing more
 *   <li>The driver calls {@link #close()} when the pipeline stops, also on failure
 * </ol>
 *
 * <p>An operator holds at most one pending output batch, so a consumer that stops pulling
 * stops the whole pipeline. Operators are confined to the driver's thread.
 */
public interface StreamOperator extends AutoCloseable {

    /**
     * Returns true if the operator accepts a batch now.
     *
     * @return true if {@link #addInput} may be called
     */
    boolean needsInput();

    /**
     * Passes one batch of input.
     *
     * @param batch the input batch
     * @throws IllegalStateException if the operator does not need input
     */
    void addInput(ColumnarBatch batch);

    /**
     * Returns the next output batch, or null if none is ready. Null does not mean the
     * operator is finished.
     *
     * @return the output batch, or null
     */
    ColumnarBatch getOutput();

    /**
     * Signals that no more input will arrive.
     */
    void finish();

    /**
     * Returns true if the operator will produce no more output.
     *
     * @return true when finished
     */
    boolean isFinished();

    /**
     * Returns the operator name used in logs and error context.
     *
     * @return the name
     */
    String name();

    /**
     * Releases the operator's state.
     */
    @Override
    void close();
}
