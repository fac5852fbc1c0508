package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.source.BatchStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pulls morsels from a scan on demand and prepares them on the worker pool.
 *
 * <p>Source batches are pulled sequentially, one fan-out window at a time (one morsel per
 * worker when parallelism is enabled, otherwise one). The morsels of a window are filtered,
 * projected and passed through an optional row-wise transform as independent units, then
 * handed out in source order. The scan's row limit is applied in order before the
 * transform; nothing is pulled once it is reached.
 */
public final class MorselStream implements BatchStream {

    private static final Logger logger = LoggerFactory.getLogger(MorselStream.class);

    private final ScanReader reader;
    private final ExecutionContext ctx;
    private final UnaryOperator<ColumnarBatch> transform;
    private final String operator;
    private final int window;
    private final Deque<ColumnarBatch> ready = new ArrayDeque<>();
    private BatchStream source;
    private long remaining;
    private boolean exhausted;
    private long morsels;

    /**
     * Creates a morsel stream.
     *
     * @param reader the scan reader
     * @param ctx the execution context
     * @param transform a row-wise transform applied to every morsel, or null
     * @param operator the operator name used in error context
     */
    public MorselStream(ScanReader reader, ExecutionContext ctx, UnaryOperator<ColumnarBatch> transform,
                        String operator) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.ctx = Objects.requireNonNull(ctx, "ctx must not be null");
        this.transform = transform;
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.window = ctx.config().parallel() ? Math.max(1, ctx.pool().threads()) : 1;
        this.remaining = reader.rowLimit() < 0 ? Long.MAX_VALUE : reader.rowLimit();
    }

    @Override
    public boolean hasNext() {
        while (ready.isEmpty() && !exhausted) {
            fill();
        }
        return !ready.isEmpty();
    }

    @Override
    public ColumnarBatch next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.poll();
    }

    private void fill() {
        ctx.checkCancelled(operator);
        if (source == null) {
            source = reader.open();
        }
        List<ColumnarBatch> raw = new ArrayList<>(window);
        while (raw.size() < window && remaining > 0 && source.hasNext()) {
            raw.add(source.next());
        }
        if (raw.isEmpty()) {
            finish();
            return;
        }

        boolean limited = remaining != Long.MAX_VALUE;
        List<Callable<ColumnarBatch>> tasks = new ArrayList<>(raw.size());
        for (ColumnarBatch batch : raw) {
            tasks.add(() -> {
                ColumnarBatch applied = reader.apply(batch);
                return limited || transform == null ? applied : transform.apply(applied);
            });
        }
        for (ColumnarBatch batch : ctx.invokeAll(tasks, operator)) {
            if (limited) {
                if (remaining <= 0) {
                    break;
                }
                if (batch.rowCount() > remaining) {
                    batch = batch.slice(0, (int) remaining);
                }
                remaining -= batch.rowCount();
                if (transform != null) {
                    batch = transform.apply(batch);
                }
            }
            morsels++;
            if (batch.rowCount() > 0) {
                ready.add(batch);
            }
        }
        if (remaining <= 0) {
            finish();
        }
    }

    private void finish() {
        if (!exhausted) {
            exhausted = true;
            logger.debug("Scan of {} exhausted after {} morsels", reader.sourceName(), morsels);
            closeSource();
        }
    }

    private void closeSource() {
        if (source != null) {
            try {
                source.close();
            } catch (RuntimeException e) {
                logger.warn("Error closing scan of {}", reader.sourceName(), e);
            }
            source = null;
        }
    }

    @Override
    public void close() {
        exhausted = true;
        ready.clear();
        closeSource();
    }
}
