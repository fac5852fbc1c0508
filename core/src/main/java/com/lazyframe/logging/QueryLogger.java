package com.lazyframe.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Structured logging for query execution.
 *
 * <p>Each execution gets a query id that is placed in the SLF4J {@link MDC} under
 * {@value #QUERY_ID_KEY}, so that every log line written while the query runs on the
 * calling thread can be correlated. Worker threads receive the id through
 * {@link #contextSnapshot()} and {@link #restoreContext(String)}.
 *
 * <p>Example usage:
 * <pre>
 *   QueryLogger.startQuery(queryId);
 *   try {
 *       ...
 *       QueryLogger.completeQuery(totalMs);
 *   } catch (LazyFrameException e) {
 *       QueryLogger.logError(e);
 *       throw e;
 *   } finally {
 *       QueryLogger.clearContext();
 *   }
 * </pre>
 */
public final class QueryLogger {

    private static final Logger logger = LoggerFactory.getLogger(QueryLogger.class);

    /** MDC key of the query id */
    public static final String QUERY_ID_KEY = "queryId";

    private QueryLogger() {
        // Utility class - prevent instantiation
    }

    /**
     * Starts logging for a query and binds its id to the current thread.
     *
     * @param queryId the query id
     */
    public static void startQuery(String queryId) {
        MDC.put(QUERY_ID_KEY, queryId);
        logger.info("Query started");
    }

    /**
     * Logs the outcome of logical optimization.
     *
     * @param optimizedPlan the rendered optimized plan
     * @param passes the number of optimizer iterations
     * @param durationMs time spent optimizing
     */
    public static void logOptimization(String optimizedPlan, int passes, long durationMs) {
        logger.debug("Optimized plan in {}ms ({} iterations)", durationMs, passes);
        if (logger.isDebugEnabled()) {
            logger.debug("Optimized logical plan:\n{}", optimizedPlan);
        }
    }

    /**
     * Logs the physical plan chosen for execution.
     *
     * @param physicalPlan the rendered physical plan
     * @param streaming whether the plan contains streaming pipelines
     */
    public static void logPhysicalPlan(String physicalPlan, boolean streaming) {
        if (logger.isDebugEnabled()) {
            logger.debug("Physical plan (streaming={}):\n{}", streaming, physicalPlan);
        }
    }

    /**
     * Logs execution metrics.
     *
     * @param executionMs time spent executing
     * @param rowCount number of result rows
     */
    public static void logExecution(long executionMs, long rowCount) {
        logger.debug("Executed in {}ms, {} rows", executionMs, rowCount);
    }

    /**
     * Logs query completion.
     *
     * @param totalMs total time from start to completion
     */
    public static void completeQuery(long totalMs) {
        logger.info("Query completed in {}ms", totalMs);
    }

    /**
     * Logs a query failure.
     *
     * @param error the failure
     */
    public static void logError(Throwable error) {
        logger.error("Query failed: {}", error.getMessage(), error);
    }

    /**
     * Returns the query id bound to the current thread.
     *
     * @return the query id, or null
     */
    public static String contextSnapshot() {
        return MDC.get(QUERY_ID_KEY);
    }

    /**
     * Binds a query id captured with {@link #contextSnapshot()} to the current thread.
     *
     * @param queryId the query id (null clears it)
     */
    public static void restoreContext(String queryId) {
        if (queryId == null) {
            MDC.remove(QUERY_ID_KEY);
        } else {
            MDC.put(QUERY_ID_KEY, queryId);
        }
    }

    /**
     * Removes the query id from the current thread.
     */
    public static void clearContext() {
        MDC.remove(QUERY_ID_KEY);
    }
}
