package com.lazyframe.streaming;

import com.lazyframe.data.ColumnarBatch;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Stateless operator applying a row-wise function (filter, projection, with-columns) to
 * every batch. Empty results are dropped.
 */
public final class MapOperator implements StreamOperator {

    private final String name;
    private final UnaryOperator<ColumnarBatch> function;
    private ColumnarBatch pending;
    private boolean finishing;

    public MapOperator(String name, UnaryOperator<ColumnarBatch> function) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.function = Objects.requireNonNull(function, "function must not be null");
    }

    @Override
    public boolean needsInput() {
        return pending == null && !finishing;
    }

    @Override
    public void addInput(ColumnarBatch batch) {
        if (!needsInput()) {
            throw new IllegalStateException(name + " does not accept input now");
        }
        ColumnarBatch result = function.apply(batch);
        if (result.rowCount() > 0) {
            pending = result;
        }
    }

    @Override
    public ColumnarBatch getOutput() {
        ColumnarBatch output = pending;
        pending = null;
        return output;
    }

    @Override
    public void finish() {
        finishing = true;
    }

    @Override
    public boolean isFinished() {
        return finishing && pending == null;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void close() {
        pending = null;
    }
}
