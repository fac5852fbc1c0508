package com.lazyframe.source;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.runtime.ArrowInterchange;
import com.lazyframe.types.StructType;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalLong;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * A data source over Arrow record batches.
 *
 * <p>Each root is converted to engine batches only when the stream reaches it. The source
 * honors the batch size hint and ignores the predicate, projection and row limit hints,
 * which the engine applies itself. The roots stay owned by the caller and must remain open
 * while queries over this source run.
 */
public final class ArrowDataSource implements DataSource {

    private final String name;
    private final StructType schema;
    private final List<VectorSchemaRoot> roots;

    /**
     * Creates a source over Arrow record batches sharing one schema.
     *
     * @param name the source name
     * @param roots the record batches, in order (at least one)
     */
    public ArrowDataSource(String name, List<VectorSchemaRoot> roots) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.roots = List.copyOf(Objects.requireNonNull(roots, "roots must not be null"));
        if (this.roots.isEmpty()) {
            throw new IllegalArgumentException("at least one record batch is required");
        }
        this.schema = ArrowInterchange.fromArrowSchema(this.roots.get(0).getSchema());
        for (VectorSchemaRoot root : this.roots) {
            if (!ArrowInterchange.fromArrowSchema(root.getSchema()).equals(schema)) {
                throw new IllegalArgumentException("record batch schema " + root.getSchema()
                    + " does not match " + this.roots.get(0).getSchema());
            }
        }
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
        long rows = 0;
        for (VectorSchemaRoot root : roots) {
            rows += root.getRowCount();
        }
        return OptionalLong.of(rows);
    }

    @Override
    public BatchStream open(ScanRequest request) {
        Iterator<VectorSchemaRoot> pending = roots.iterator();
        return new BatchStream() {
            private final Deque<ColumnarBatch> chunks = new ArrayDeque<>();

            @Override
            public boolean hasNext() {
                while (chunks.isEmpty() && pending.hasNext()) {
                    ColumnarBatch batch = ArrowInterchange.fromArrow(pending.next());
                    if (batch.rowCount() > 0) {
                        chunks.addAll(batch.split(request.batchSize()));
                    }
                }
                return !chunks.isEmpty();
            }

            @Override
            public ColumnarBatch next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return chunks.poll();
            }

            @Override
            public void close() {
                chunks.clear();
            }
        };
    }

    @Override
    public String toString() {
        return "ArrowDataSource(" + name + ", batches=" + roots.size() + ")";
    }
}
