package com.lazyframe.runtime;

import com.lazyframe.exception.CancelledException;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.exception.LazyFrameException;
import com.lazyframe.exception.ResourceExhaustedException;
import com.lazyframe.logging.QueryLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fixed-size worker pool shared by both executors.
 *
 * <p>Operators fan out independent units of work (row ranges, partitions, morsel stages)
 * with {@link #invokeAll} and block only until all of them are done. Every unit checks the
 * cancellation token before it starts, so a cancelled execution schedules no new work while
 * units already running complete.
 *
 * <p>The process-wide instance is created on first use by {@link #shared()}; its size comes
 * from {@code lazyframe.threads} or the number of available cores.
 *
 * <p>Example usage:
 * <pre>
 *   List&lt;ColumnarBatch&gt; parts = ExecutionPool.shared().invokeAll(tasks, token, "Filter");
 * </pre>
 */
public final class ExecutionPool implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ExecutionPool.class);

    private static volatile ExecutionPool shared;

    private final ExecutorService executor;
    private final int threads;

    /**
     * Creates a pool with named daemon worker threads.
     *
     * @param threads the number of workers
     */
    public ExecutionPool(int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive, got: " + threads);
        }
        this.threads = threads;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "lazyframe-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        logger.info("ExecutionPool initialized: threads={}", threads);
    }

    /**
     * Returns the process-wide pool, creating it on first use.
     *
     * @return the shared pool
     */
    public static ExecutionPool shared() {
        ExecutionPool pool = shared;
        if (pool == null) {
            synchronized (ExecutionPool.class) {
                pool = shared;
                if (pool == null) {
                    pool = new ExecutionPool(EngineConfig.defaults().threads());
                    shared = pool;
                }
            }
        }
        return pool;
    }

    public int threads() {
        return threads;
    }

    /**
     * Runs independent tasks and waits for all of them.
     *
     * <p>Results are returned in task order. The first failure, in task order, is rethrown
     * after every task has finished or been skipped.
     *
     * @param tasks the units of work
     * @param token the cancellation token checked before each unit starts
     * @param operator the operator name used in error context
     * @param parallel false to run the units one after another on the calling thread
     * @param <T> the result type
     * @return the results, in task order
     * @throws CancelledException if the token was cancelled
     * @throws ResourceExhaustedException if a unit ran out of heap
     */
    public <T> List<T> invokeAll(List<? extends Callable<T>> tasks, CancellationToken token,
                                 String operator, boolean parallel) {
        if (!parallel || tasks.size() <= 1) {
            List<T> results = new ArrayList<>(tasks.size());
            for (Callable<T> task : tasks) {
                token.throwIfCancelled(operator);
                results.add(call(task, operator));
            }
            return results;
        }

        String queryId = QueryLogger.contextSnapshot();
        List<CompletableFuture<T>> futures = new ArrayList<>(tasks.size());
        for (Callable<T> task : tasks) {
            futures.add(CompletableFuture.supplyAsync(() -> {
                token.throwIfCancelled(operator);
                QueryLogger.restoreContext(queryId);
                try {
                    return call(task, operator);
                } finally {
                    QueryLogger.clearContext();
                }
            }, executor));
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            token.cancel();
            throw new CancelledException("interrupted while waiting for " + operator).withOperator(operator);
        } catch (ExecutionException e) {
            logger.debug("{} unit failed: {}", operator, e.getCause() == null ? e : e.getCause().toString());
            // Wait for the remaining units, then report the first failure in task order
        }

        List<T> results = new ArrayList<>(futures.size());
        for (CompletableFuture<T> future : futures) {
            try {
                results.add(future.join());
            } catch (CompletionException e) {
                throw unwrap(e.getCause(), operator);
            }
        }
        return results;
    }

    /**
     * Runs independent tasks in parallel and waits for all of them.
     *
     * @param tasks the units of work
     * @param token the cancellation token
     * @param operator the operator name used in error context
     * @param <T> the result type
     * @return the results, in task order
     */
    public <T> List<T> invokeAll(List<? extends Callable<T>> tasks, CancellationToken token, String operator) {
        return invokeAll(tasks, token, operator, true);
    }

    private static <T> T call(Callable<T> task, String operator) {
        try {
            return task.call();
        } catch (LazyFrameException e) {
            throw e.withOperator(operator);
        } catch (OutOfMemoryError e) {
            throw new ResourceExhaustedException("out of memory", e, operator, null);
        } catch (RuntimeException e) {
            throw new ComputeException(e.getMessage() == null ? e.toString() : e.getMessage(), e, operator, null);
        } catch (Exception e) {
            throw new ComputeException(e.toString(), e, operator, null);
        }
    }

    private static RuntimeException unwrap(Throwable cause, String operator) {
        if (cause instanceof LazyFrameException lfe) {
            return lfe.withOperator(operator);
        }
        if (cause instanceof OutOfMemoryError oom) {
            return new ResourceExhaustedException("out of memory", oom, operator, null);
        }
        return new ComputeException(String.valueOf(cause), cause, operator, null);
    }

    /**
     * Stops the workers. Units already running complete.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.info("ExecutionPool shut down");
    }

    @Override
    public String toString() {
        return "ExecutionPool(threads=" + threads + ")";
    }
}
