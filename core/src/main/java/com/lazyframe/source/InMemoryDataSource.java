package com.lazyframe.source;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.expression.eval.CompiledExpression;
import com.lazyframe.expression.eval.ExpressionCompiler;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * A data source over batches held in memory.
 *
 * <p>Honors every scan hint: batches are re-chunked to the requested batch size, filtered,
 * projected and cut at the row limit.
 */
public final class InMemoryDataSource implements DataSource {

    private final String name;
    private final StructType schema;
    private final List<ColumnarBatch> batches;
    private final long rowCount;

    /**
     * Creates an in-memory source.
     *
     * @param name the source name
     * @param schema the schema of all batches
     * @param batches the data, in order
     */
    public InMemoryDataSource(String name, StructType schema, List<ColumnarBatch> batches) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.schema = Objects.requireNonNull(schema, "schema must not be null");
        this.batches = List.copyOf(Objects.requireNonNull(batches, "batches must not be null"));
        long rows = 0;
        for (ColumnarBatch batch : this.batches) {
            if (!batch.schema().equals(schema)) {
                throw new IllegalArgumentException(
                    "batch schema " + batch.schema() + " does not match source schema " + schema);
            }
            rows += batch.rowCount();
        }
        this.rowCount = rows;
    }

    /**
     * Creates an in-memory source over one batch.
     *
     * @param name the source name
     * @param batch the data
     * @return the source
     */
    public static InMemoryDataSource of(String name, ColumnarBatch batch) {
        return new InMemoryDataSource(name, batch.schema(), List.of(batch));
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public StructType schema() {
        return schema;
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return OptionalLong.of(rowCount);
    }

    @Override
    public BatchStream open(ScanRequest request) {
        CompiledExpression predicate = request.predicate() == null
            ? null : ExpressionCompiler.compile(request.predicate());
        Iterator<ColumnarBatch> chunks = chunks(request.batchSize()).iterator();
        return new BatchStream() {
            private long remaining = request.rowLimit() < 0 ? Long.MAX_VALUE : request.rowLimit();
            private ColumnarBatch pending;

            @Override
            public boolean hasNext() {
                while (pending == null && remaining > 0 && chunks.hasNext()) {
                    ColumnarBatch batch = chunks.next();
                    if (predicate != null) {
                        Column mask = predicate.evaluate(batch);
                        batch = batch.filter(mask);
                    }
                    if (request.projection() != null) {
                        batch = batch.select(request.projection());
                    }
                    if (batch.rowCount() > remaining) {
                        batch = batch.slice(0, (int) remaining);
                    }
                    remaining -= batch.rowCount();
                    pending = batch;
                }
                return pending != null;
            }

            @Override
            public ColumnarBatch next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                ColumnarBatch batch = pending;
                pending = null;
                return batch;
            }

            @Override
            public void close() {
                pending = null;
            }
        };
    }

    private List<ColumnarBatch> chunks(int batchSize) {
        List<ColumnarBatch> chunks = new ArrayList<>();
        for (ColumnarBatch batch : batches) {
            if (batch.rowCount() > 0) {
                chunks.addAll(batch.split(batchSize));
            }
        }
        return chunks;
    }

    @Override
    public String toString() {
        return "InMemoryDataSource(" + name + ", rows=" + rowCount + ")";
    }
}
