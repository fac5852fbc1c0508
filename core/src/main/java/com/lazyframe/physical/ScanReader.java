package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.eval.CompiledExpression;
import com.lazyframe.expression.eval.ExpressionCompiler;
import com.lazyframe.logical.Scan;
import com.lazyframe.source.BatchStream;
import com.lazyframe.source.ScanRequest;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Opens a scan and re-applies its pushed-down operations to whatever the source returns.
 *
 * <p>The source receives the predicate, the needed columns and the row limit as hints. Each
 * returned batch is filtered by the predicate again and projected to the scan's schema;
 * the caller cuts the stream at {@link #rowLimit()}.
 */
public final class ScanReader {

    private final Scan scan;
    private final ScanRequest request;
    private final CompiledExpression predicate;
    private final StructType schema;

    /**
     * Creates a reader.
     *
     * @param scan the scan node
     * @param batchSize the preferred number of rows per batch
     */
    public ScanReader(Scan scan, int batchSize) {
        this.scan = Objects.requireNonNull(scan, "scan must not be null");
        this.schema = scan.schema();
        this.predicate = scan.predicate() == null ? null : ExpressionCompiler.compile(scan.predicate());
        this.request = new ScanRequest(requestedColumns(scan), scan.predicate(), scan.rowLimit(), batchSize);
    }

    private static List<String> requestedColumns(Scan scan) {
        if (scan.projection() == null) {
            return null;
        }
        Set<String> needed = scan.predicate() == null
            ? Set.of() : ExpressionUtils.referencedColumns(scan.predicate());
        List<String> columns = new ArrayList<>();
        for (String name : scan.source().schema().names()) {
            if (scan.projection().contains(name) || needed.contains(name)) {
                columns.add(name);
            }
        }
        return columns;
    }

    public ScanRequest request() {
        return request;
    }

    /**
     * Returns the maximum number of rows the scan produces.
     *
     * @return the limit, or -1 for none
     */
    public long rowLimit() {
        return scan.rowLimit();
    }

    public StructType schema() {
        return schema;
    }

    public String sourceName() {
        return scan.source().name();
    }

    /**
     * Opens the source.
     *
     * @return the raw batch stream
     */
    public BatchStream open() {
        return scan.source().open(request);
    }

    /**
     * Applies the predicate and the projection to a batch returned by the source.
     *
     * @param raw the source batch
     * @return the batch in the scan's schema
     */
    public ColumnarBatch apply(ColumnarBatch raw) {
        ColumnarBatch batch = raw;
        if (predicate != null && batch.rowCount() > 0) {
            Column mask = predicate.evaluate(batch);
            batch = batch.filter(mask);
        }
        return batch.select(schema.names());
    }
}
