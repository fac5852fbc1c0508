package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.exception.LazyFrameException;
import com.lazyframe.exception.ResourceExhaustedException;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.source.BatchStream;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Base class of the executable operator tree produced by {@link PhysicalPlanner}.
 *
 * <p>Physical operators mirror the logical nodes but carry compiled evaluators and an
 * execution strategy. In-memory operators produce their whole result in one call of
 * {@link #execute}; {@link PipelineExec} runs a streaming subtree morsel by morsel. An
 * in-memory operator never consumes a pipeline directly: the planner puts an explicit
 * {@link MaterializeExec} boundary in between.
 *
 * <p>An operator tree belongs to one execution. {@link #execute} wraps failures so the
 * caller sees the innermost failing operator, and checks the materialization budget of
 * every result.
 */
public abstract sealed class PhysicalOperator
    permits ScanExec, FilterExec, ProjectExec, WithColumnsExec, HashAggregateExec, HashJoinExec,
            CrossJoinExec, AsofJoinExec, SortExec, WindowExec, UnionExec, DistinctExec, ExplodeExec,
            UnpivotExec, SliceExec, CacheExec, UpsampleExec, PipelineExec, MaterializeExec {

    private final List<PhysicalOperator> children;
    private final StructType schema;

    protected PhysicalOperator(StructType schema, List<PhysicalOperator> children) {
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    protected PhysicalOperator(StructType schema, PhysicalOperator child) {
        this(schema, List.of(Objects.requireNonNull(child, "child must not be null")));
    }

    protected PhysicalOperator(StructType schema) {
        this(schema, List.of());
    }

    public List<PhysicalOperator> children() {
        return children;
    }

    protected PhysicalOperator child() {
        return children.get(0);
    }

    public StructType schema() {
        return schema;
    }

    /**
     * Returns the operator name used in error context and plan output.
     *
     * @return the operator name
     */
    public String nodeName() {
        return getClass().getSimpleName();
    }

    /**
     * Returns true if this operator runs in the streaming executor.
     *
     * @return false for in-memory operators
     */
    public boolean isStreaming() {
        return false;
    }

    /**
     * Computes the whole result of this operator.
     *
     * @param ctx the execution context
     * @return the result
     * @throws LazyFrameException naming the failing operator
     */
    public final ColumnarBatch execute(ExecutionContext ctx) {
        ctx.checkCancelled(nodeName());
        ColumnarBatch result;
        try {
            result = doExecute(ctx);
        } catch (LazyFrameException e) {
            throw e.withOperator(nodeName());
        } catch (OutOfMemoryError e) {
            throw new ResourceExhaustedException("out of memory", e, nodeName(), null);
        } catch (RuntimeException e) {
            throw new ComputeException(e.getMessage() == null ? e.toString() : e.getMessage(), e, nodeName(), null);
        }
        return ctx.checkBudget(result, nodeName());
    }

    protected abstract ColumnarBatch doExecute(ExecutionContext ctx);

    /**
     * Produces the result incrementally. In-memory operators compute the whole result and
     * hand it out in morsels.
     *
     * @param ctx the execution context
     * @return the result stream
     */
    public BatchStream stream(ExecutionContext ctx) {
        ColumnarBatch result = execute(ctx);
        Iterator<ColumnarBatch> chunks = result.rowCount() == 0
            ? Collections.emptyIterator()
            : result.split(ctx.config().morselSize()).iterator();
        return new BatchStream() {
            @Override
            public boolean hasNext() {
                return chunks.hasNext();
            }

            @Override
            public ColumnarBatch next() {
                if (!chunks.hasNext()) {
                    throw new NoSuchElementException();
                }
                return chunks.next();
            }

            @Override
            public void close() {
                // Nothing held beyond the materialized result
            }
        };
    }

    /**
     * Returns a one-line description of this operator (without children).
     *
     * @return the description
     */
    @Override
    public abstract String toString();
}
