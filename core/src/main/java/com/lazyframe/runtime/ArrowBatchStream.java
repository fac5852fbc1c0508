package com.lazyframe.runtime;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.source.BatchStream;
import com.lazyframe.types.StructType;
import java.util.NoSuchElementException;
import java.util.Objects;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streaming Arrow batch iterator over the incremental result of a query.
 *
 * <p>Each engine batch is copied into a fresh {@link VectorSchemaRoot}; the previous root
 * is released when the next one is produced, so at most one result batch is held in Arrow
 * memory at a time.
 *
 * <p>Usage:
 * <pre>{@code
 * try (ArrowBatchStream stream = new ArrowBatchStream(results, schema, allocator)) {
 *     while (stream.hasNext()) {
 *         VectorSchemaRoot batch = stream.next();
 *         // Process batch - do NOT close, owned by stream
 *     }
 * }
 * }</pre>
 */
public class ArrowBatchStream implements ArrowBatchIterator {

    private static final Logger logger = LoggerFactory.getLogger(ArrowBatchStream.class);

    private final BatchStream results;
    private final Schema schema;
    private final BufferAllocator allocator;

    private VectorSchemaRoot current;
    private boolean closed = false;
    private long totalRowCount = 0;
    private int batchCount = 0;
    private Exception error = null;

    /**
     * Create a streaming Arrow iterator over engine batches.
     *
     * @param results the engine result stream (closed with this iterator)
     * @param schema the result schema
     * @param allocator Arrow memory allocator
     */
    public ArrowBatchStream(BatchStream results, StructType schema, BufferAllocator allocator) {
        this.results = Objects.requireNonNull(results, "results must not be null");
        this.schema = ArrowInterchange.toArrowSchema(Objects.requireNonNull(schema, "schema must not be null"));
        this.allocator = Objects.requireNonNull(allocator, "allocator must not be null");
    }

    @Override
    public Schema getSchema() {
        return schema;
    }

    @Override
    public boolean hasNext() {
        if (closed || error != null) {
            return false;
        }
        try {
            return results.hasNext();
        } catch (RuntimeException e) {
            error = e;
            throw e;
        }
    }

    @Override
    public VectorSchemaRoot next() {
        if (closed) {
            throw new IllegalStateException("Stream is closed");
        }
        if (!hasNext()) {
            throw new NoSuchElementException("No more batches");
        }
        try {
            ColumnarBatch batch = results.next();
            releaseCurrent();
            current = ArrowInterchange.toArrow(batch, allocator);
            totalRowCount += batch.rowCount();
            batchCount++;

            if (logger.isDebugEnabled()) {
                logger.debug("Batch {}: {} rows (total: {})", batchCount, batch.rowCount(), totalRowCount);
            }
            return current;  // DO NOT close - owned by this stream
        } catch (RuntimeException e) {
            error = e;
            throw e;
        }
    }

    @Override
    public long getTotalRowCount() {
        return totalRowCount;
    }

    @Override
    public int getBatchCount() {
        return batchCount;
    }

    @Override
    public boolean hasError() {
        return error != null;
    }

    @Override
    public Exception getError() {
        return error;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        releaseCurrent();
        try {
            results.close();
        } catch (RuntimeException e) {
            logger.warn("Error closing result stream", e);
        }
        logger.debug("ArrowBatchStream closed after {} batches, {} rows", batchCount, totalRowCount);
    }

    private void releaseCurrent() {
        if (current != null) {
            current.close();
            current = null;
        }
    }
}
