package com.lazyframe.runtime;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.ResourceExhaustedException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * State of one execution, owned by that execution only.
 *
 * <p>Carries the configuration, the cancellation token, the worker pool and the results
 * of shared {@code Cache} subplans, which are computed once per execution.
 */
public final class ExecutionContext {

    private final EngineConfig config;
    private final CancellationToken token;
    private final ExecutionPool pool;
    private final Map<Long, CompletableFuture<ColumnarBatch>> cachedResults = new ConcurrentHashMap<>();

    public ExecutionContext(EngineConfig config, CancellationToken token, ExecutionPool pool) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.token = Objects.requireNonNull(token, "token must not be null");
        this.pool = Objects.requireNonNull(pool, "pool must not be null");
    }

    /**
     * Creates a context on the shared pool.
     *
     * @param config the configuration
     * @param token the cancellation token
     * @return the context
     */
    public static ExecutionContext create(EngineConfig config, CancellationToken token) {
        return new ExecutionContext(config, token, ExecutionPool.shared());
    }

    public EngineConfig config() {
        return config;
    }

    public CancellationToken token() {
        return token;
    }

    public ExecutionPool pool() {
        return pool;
    }

    /**
     * Returns the number of partitions an operator should split its input into.
     *
     * @param rows the input row count
     * @return the partition count, at least 1
     */
    public int partitionCount(int rows) {
        if (!config.parallel() || rows < 2 * config.morselSize()) {
            return 1;
        }
        return Math.max(1, Math.min(pool.threads(), rows / config.morselSize()));
    }

    /**
     * Runs units of work on the pool, or sequentially when parallelism is disabled.
     *
     * @param tasks the units
     * @param operator the operator name used in error context
     * @param <T> the result type
     * @return the results, in task order
     */
    public <T> List<T> invokeAll(List<? extends Callable<T>> tasks, String operator) {
        return pool.invokeAll(tasks, token, operator, config.parallel());
    }

    /**
     * Checks cancellation before a unit of work starts.
     *
     * @param operator the operator about to run
     */
    public void checkCancelled(String operator) {
        token.throwIfCancelled(operator);
    }

    /**
     * Checks a materialized result against the configured row budget.
     *
     * @param batch the materialized result
     * @param operator the operator that produced it
     * @return the batch
     * @throws ResourceExhaustedException if the batch exceeds the budget
     */
    public ColumnarBatch checkBudget(ColumnarBatch batch, String operator) {
        checkRows(batch.rowCount(), operator);
        return batch;
    }

    /**
     * Checks a row count against the configured row budget.
     *
     * @param rows the number of rows about to be materialized
     * @param operator the operator materializing them
     */
    public void checkRows(long rows, String operator) {
        if (rows > config.maxMaterializedRows()) {
            throw new ResourceExhaustedException(String.format(
                "%d rows exceed the materialization limit of %d rows", rows, config.maxMaterializedRows()),
                null, operator, null);
        }
    }

    /**
     * Returns the result of a shared subplan, computing it on first request.
     *
     * <p>The first caller for an id computes the result; callers arriving while it runs wait
     * for that result, or for its failure, instead of computing it again.
     *
     * @param id the cache id
     * @param compute computes the result
     * @return the cached result
     */
    public ColumnarBatch cached(long id, Supplier<ColumnarBatch> compute) {
        CompletableFuture<ColumnarBatch> created = new CompletableFuture<>();
        CompletableFuture<ColumnarBatch> existing = cachedResults.putIfAbsent(id, created);
        if (existing != null) {
            try {
                return existing.join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
        }
        try {
            ColumnarBatch result = compute.get();
            created.complete(result);
            return result;
        } catch (RuntimeException | Error e) {
            created.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * Drops the cached subplan results.
     */
    public void release() {
        cachedResults.clear();
    }
}
