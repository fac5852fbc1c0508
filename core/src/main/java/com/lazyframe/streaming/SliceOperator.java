package com.lazyframe.streaming;

import com.lazyframe.data.ColumnarBatch;

/**
 * Keeps the rows {@code [offset, offset + length)} of the stream and finishes as soon as
 * they have passed, so upstream stops producing.
 */
public final class SliceOperator implements StreamOperator {

    private static final String NAME = "Slice";

    private long toSkip;
    private long remaining;
    private ColumnarBatch pending;
    private boolean finishing;

    public SliceOperator(long offset, long length) {
        if (offset < 0) {
            throw new IllegalArgumentException("streaming slice needs a non-negative offset, got: " + offset);
        }
        this.toSkip = offset;
        this.remaining = length;
    }

    @Override
    public boolean needsInput() {
        return pending == null && !finishing && remaining > 0;
    }

    @Override
    public void addInput(ColumnarBatch batch) {
        if (!needsInput()) {
            throw new IllegalStateException(NAME + " does not accept input now");
        }
        int rows = batch.rowCount();
        int start = (int) Math.min(rows, toSkip);
        toSkip -= start;
        int length = (int) Math.min(rows - start, remaining);
        remaining -= length;
        if (length > 0) {
            pending = start == 0 && length == rows ? batch : batch.slice(start, length);
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
        return pending == null && (finishing || remaining <= 0);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void close() {
        pending = null;
    }
}
