package com.lazyframe.source;

import com.lazyframe.types.StructType;
import java.util.OptionalLong;

/**
 * The scan collaborator: produces an ordered sequence of columnar batches conforming to
 * a schema.
 *
 * <p>Implementations must be safe to open more than once, since a plan may scan the same
 * source in several places, and every opened stream must be independent.
 */
public interface DataSource {

    /**
     * Returns a short name used in plan output and logs.
     *
     * @return the source name
     */
    String name();

    /**
     * Returns the schema of every batch the source produces when no projection is pushed.
     *
     * @return the schema
     */
    StructType schema();

    /**
     * Returns the row count if it is known without reading the data. Used to pick the
     * build side of hash joins.
     *
     * @return the estimated row count, or empty if unknown
     */
    default OptionalLong estimatedRowCount() {
        return OptionalLong.empty();
    }

    /**
     * Opens a lazily pulled stream of batches.
     *
     * @param request pushed-down hints
     * @return the stream
     */
    BatchStream open(ScanRequest request);
}
