package com.lazyframe.runtime;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.LazyFrameException;
import com.lazyframe.logging.QueryLogger;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.PlanPrinter;
import com.lazyframe.optimizer.QueryOptimizer;
import com.lazyframe.physical.PhysicalOperator;
import com.lazyframe.physical.PhysicalPlanner;
import com.lazyframe.source.BatchStream;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.UUID;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Optimizes, plans and executes logical plans.
 *
 * <p>Every execution gets a query id for log correlation, its own
 * {@link ExecutionContext} and the shared worker pool. The executor itself holds only the
 * configuration, so one instance may run any number of queries concurrently.
 *
 * <p>Example usage:
 * <pre>
 *   QueryExecutor executor = new QueryExecutor(EngineConfig.defaults());
 *   ColumnarBatch result = executor.collect(plan);
 *
 *   try (BatchStream batches = executor.collectStreaming(plan, token)) {
 *       while (batches.hasNext()) {
 *           process(batches.next());
 *       }
 *   }
 * </pre>
 */
public class QueryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(QueryExecutor.class);

    private final EngineConfig config;

    public QueryExecutor(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public EngineConfig config() {
        return config;
    }

    /**
     * Runs the enabled optimizer passes.
     *
     * @param plan the logical plan
     * @return the optimized plan
     */
    public LogicalPlan optimize(LogicalPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        long start = System.nanoTime();
        QueryOptimizer optimizer = QueryOptimizer.forConfig(config);
        LogicalPlan optimized = optimizer.optimize(plan);
        QueryLogger.logOptimization(PlanPrinter.render(optimized), optimizer.lastIterations(),
            (System.nanoTime() - start) / 1_000_000);
        return optimized;
    }

    /**
     * Translates an optimized plan into physical operators.
     *
     * @param optimized the optimized logical plan
     * @return the physical plan
     */
    public PhysicalOperator plan(LogicalPlan optimized) {
        PhysicalOperator physical = new PhysicalPlanner(config).plan(optimized);
        QueryLogger.logPhysicalPlan(PhysicalPlanner.explain(physical), config.streaming());
        return physical;
    }

    /**
     * Executes a plan and returns the whole result.
     *
     * @param plan the logical plan
     * @return the result
     */
    public ColumnarBatch collect(LogicalPlan plan) {
        return collect(plan, new CancellationToken());
    }

    /**
     * Executes a plan and returns the whole result.
     *
     * @param plan the logical plan
     * @param token cancels the execution when triggered from another thread
     * @return the result
     * @throws LazyFrameException if optimization, planning or execution fails
     */
    public ColumnarBatch collect(LogicalPlan plan, CancellationToken token) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(token, "token must not be null");

        String queryId = "q_" + UUID.randomUUID().toString().substring(0, 8);
        QueryLogger.startQuery(queryId);
        long queryStartTime = System.nanoTime();
        ExecutionContext ctx = ExecutionContext.create(config, token);
        try {
            PhysicalOperator physical = plan(optimize(plan));

            long execStart = System.nanoTime();
            ColumnarBatch result = physical.execute(ctx);
            QueryLogger.logExecution((System.nanoTime() - execStart) / 1_000_000, result.rowCount());

            QueryLogger.completeQuery((System.nanoTime() - queryStartTime) / 1_000_000);
            return result;
        } catch (LazyFrameException e) {
            QueryLogger.logError(e);
            throw e;
        } finally {
            ctx.release();
            QueryLogger.clearContext();
        }
    }

    /**
     * Executes a plan and returns its result as a lazily produced stream of batches. With
     * streaming enabled and a streamable plan root, rows are computed as the caller pulls;
     * otherwise the result is computed on the first pull. The caller must close the stream.
     *
     * @param plan the logical plan
     * @param token cancels the execution when triggered from another thread
     * @return the result stream
     */
    public BatchStream collectStreaming(LogicalPlan plan, CancellationToken token) {
        Objects.requireNonNull(plan, "plan must not be null");
        Objects.requireNonNull(token, "token must not be null");

        String queryId = "q_" + UUID.randomUUID().toString().substring(0, 8);
        QueryLogger.startQuery(queryId);
        ExecutionContext ctx = ExecutionContext.create(config, token);
        PhysicalOperator physical;
        try {
            physical = plan(optimize(plan));
        } catch (LazyFrameException e) {
            QueryLogger.logError(e);
            throw e;
        } finally {
            QueryLogger.clearContext();
        }
        return new QueryStream(queryId, physical, ctx);
    }

    /**
     * Executes a plan and returns the result as Arrow record batches.
     *
     * @param plan the logical plan
     * @param token cancels the execution when triggered from another thread
     * @return the Arrow batches; the caller must close the iterator
     */
    public ArrowBatchIterator collectArrow(LogicalPlan plan, CancellationToken token) {
        BatchStream results = collectStreaming(plan, token);
        return new ArrowBatchStream(results, plan.schema(), ArrowInterchange.getAllocator());
    }

    /**
     * Executes a plan and returns the result as one Arrow record batch.
     *
     * @param plan the logical plan
     * @return the result; the caller must close it
     */
    public VectorSchemaRoot collectToArrow(LogicalPlan plan) {
        return ArrowInterchange.toArrow(collect(plan));
    }

    /**
     * Renders the optimized logical plan.
     *
     * @param plan the logical plan
     * @return the rendered plan
     */
    public String explain(LogicalPlan plan) {
        return PlanPrinter.render(optimize(plan));
    }

    /**
     * Renders the physical plan, showing which parts stream.
     *
     * @param plan the logical plan
     * @return the rendered physical plan
     */
    public String explainPhysical(LogicalPlan plan) {
        return PhysicalPlanner.explain(plan(optimize(plan)));
    }

    /**
     * Result stream of one query; binds the query id to the pulling thread for each call.
     */
    private static final class QueryStream implements BatchStream {
        private final String queryId;
        private final PhysicalOperator physical;
        private final ExecutionContext ctx;
        private final long startTime = System.nanoTime();
        private BatchStream delegate;
        private long rows;
        private boolean done;

        private QueryStream(String queryId, PhysicalOperator physical, ExecutionContext ctx) {
            this.queryId = queryId;
            this.physical = physical;
            this.ctx = ctx;
        }

        @Override
        public boolean hasNext() {
            if (done) {
                return false;
            }
            QueryLogger.restoreContext(queryId);
            try {
                if (delegate == null) {
                    delegate = physical.stream(ctx);
                }
                boolean more = delegate.hasNext();
                if (!more) {
                    done = true;
                    QueryLogger.logExecution((System.nanoTime() - startTime) / 1_000_000, rows);
                    QueryLogger.completeQuery((System.nanoTime() - startTime) / 1_000_000);
                    release();
                }
                return more;
            } catch (LazyFrameException e) {
                done = true;
                QueryLogger.logError(e);
                release();
                throw e;
            } finally {
                QueryLogger.clearContext();
            }
        }

        @Override
        public ColumnarBatch next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            QueryLogger.restoreContext(queryId);
            try {
                ColumnarBatch batch = delegate.next();
                rows += batch.rowCount();
                return batch;
            } finally {
                QueryLogger.clearContext();
            }
        }

        private void release() {
            if (delegate != null) {
                delegate.close();
            }
            ctx.release();
        }

        @Override
        public void close() {
            if (!done) {
                done = true;
                logger.debug("Result stream of {} closed after {} rows", queryId, rows);
                release();
            }
        }
    }
}
