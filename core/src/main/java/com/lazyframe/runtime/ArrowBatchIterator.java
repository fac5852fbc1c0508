package com.lazyframe.runtime;

import java.util.Iterator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;

/**
 * Iterator over query results as Arrow batches, with metadata and resource management.
 *
 * <p>Implementations must properly manage Arrow memory resources. Callers should
 * use try-with-resources to ensure cleanup:
 *
 * <pre>{@code
 * try (ArrowBatchIterator iter = frame.collectArrow(config)) {
 *     while (iter.hasNext()) {
 *         VectorSchemaRoot batch = iter.next();
 *         // Process batch - do NOT close, owned by iterator
 *     }
 * }
 * }</pre>
 *
 * <p>Note: The VectorSchemaRoot returned by next() is owned by the iterator
 * and must NOT be closed by the caller. It stays valid until the following call
 * to next() or close().
 */
public interface ArrowBatchIterator extends Iterator<VectorSchemaRoot>, AutoCloseable {

    /**
     * Get the Arrow schema for result batches.
     *
     * @return the Arrow schema
     */
    Schema getSchema();

    /**
     * Total rows returned so far across all batches.
     *
     * @return cumulative row count
     */
    long getTotalRowCount();

    /**
     * Number of batches returned so far.
     *
     * @return batch count
     */
    int getBatchCount();

    /**
     * Check if there was an error during iteration.
     *
     * <p>The error is thrown to the caller of hasNext() or next() when it happens;
     * afterwards hasNext() returns false and getError() returns it.
     *
     * @return true if iteration failed with an error
     */
    boolean hasError();

    /**
     * Get the error that caused iteration to fail.
     *
     * @return the exception, or null if hasError() returns false
     */
    Exception getError();

    /**
     * Close the iterator and release all Arrow resources.
     *
     * <p>This method is idempotent - calling it multiple times has no effect.
     */
    @Override
    void close();
}
