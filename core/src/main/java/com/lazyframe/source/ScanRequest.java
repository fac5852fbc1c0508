package com.lazyframe.source;

import com.lazyframe.expression.Expression;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Hints passed to a {@link DataSource} when a scan is opened.
 *
 * <p>All hints are optional optimizations. A source may ignore any of them: the engine
 * re-applies the predicate, the projection and the row limit to whatever the source
 * returns.
 *
 * @param projection the columns needed, or null for all columns; includes the columns
 *                   the predicate reads
 * @param predicate a resolved row predicate, or null
 * @param rowLimit the number of rows needed after the predicate, or -1 for no limit
 * @param batchSize the preferred number of rows per batch
 */
public record ScanRequest(List<String> projection, Expression predicate, long rowLimit, int batchSize) {

    public ScanRequest {
        projection = projection == null ? null : List.copyOf(projection);
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got: " + batchSize);
        }
    }

    /**
     * Returns a request for all rows and columns.
     *
     * @param batchSize the preferred batch size
     * @return the request
     */
    public static ScanRequest all(int batchSize) {
        return new ScanRequest(null, null, -1, batchSize);
    }

    public Optional<List<String>> projectionHint() {
        return Optional.ofNullable(projection);
    }

    public Optional<Expression> predicateHint() {
        return Optional.ofNullable(predicate);
    }

    public OptionalLong rowLimitHint() {
        return rowLimit < 0 ? OptionalLong.empty() : OptionalLong.of(rowLimit);
    }
}
