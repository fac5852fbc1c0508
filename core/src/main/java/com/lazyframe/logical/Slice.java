package com.lazyframe.logical;

import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;

/**
 * Logical plan node that keeps a contiguous range of rows.
 *
 * <p>A non-negative offset counts from the first row; a negative offset counts from the end,
 * so {@code Slice(-n, n)} is the last {@code n} rows. The range is clamped to the input.
 */
public final class Slice extends LogicalPlan {

    private final long offset;
    private final long length;

    /**
     * Creates a slice node.
     *
     * @param child the child node
     * @param offset the first row (negative counts from the end)
     * @param length the maximum number of rows
     */
    public Slice(LogicalPlan child, long offset, long length) {
        super(child);
        if (length < 0) {
            throw new IllegalArgumentException("slice length must not be negative, got: " + length);
        }
        this.offset = offset;
        this.length = length;
    }

    public long offset() {
        return offset;
    }

    public long length() {
        return length;
    }

    /**
     * Returns true if the slice keeps leading rows only.
     *
     * @return true for a non-negative offset
     */
    public boolean isHead() {
        return offset >= 0;
    }

    /**
     * Returns the number of leading input rows the slice needs, when it keeps leading rows.
     *
     * @return offset plus length, saturated
     */
    public long rowsNeeded() {
        long sum = offset + length;
        return sum < 0 ? Long.MAX_VALUE : sum;
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Slice(newChildren.get(0), offset, length);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        OptionalLong estimate = child().estimatedRowCount();
        if (estimate.isEmpty()) {
            return OptionalLong.of(length);
        }
        long rows = estimate.getAsLong();
        long start = offset >= 0 ? Math.min(offset, rows) : Math.max(0, rows + offset);
        return OptionalLong.of(Math.max(0, Math.min(length, rows - start)));
    }

    @Override
    protected List<Object> parameters() {
        return List.of(offset, length);
    }

    @Override
    public String toString() {
        return String.format("Slice(offset=%d, length=%d)", offset, length);
    }
}
