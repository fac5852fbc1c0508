package com.lazyframe.source;

import com.lazyframe.data.ColumnarBatch;
import java.util.Iterator;

/**
 * A lazily pulled, ordered sequence of batches produced by a {@link DataSource}.
 *
 * <p>Batches are produced on demand, one per {@link #next()} call, so a consumer that
 * stops pulling stops production. Callers must close the stream, also when they stop
 * early:
 *
 * <pre>{@code
 * try (BatchStream stream = source.open(request)) {
 *     while (stream.hasNext()) {
 *         ColumnarBatch batch = stream.next();
 *     }
 * }
 * }</pre>
 */
public interface BatchStream extends Iterator<ColumnarBatch>, AutoCloseable {

    /**
     * Releases the resources of this stream. Idempotent.
     */
    @Override
    void close();
}
