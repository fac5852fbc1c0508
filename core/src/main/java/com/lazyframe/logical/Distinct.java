package com.lazyframe.logical;

import com.lazyframe.types.StructType;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Logical plan node that removes duplicate rows.
 *
 * <p>Rows are duplicates when they agree on the subset columns (all columns when no subset
 * is given); nulls compare equal to each other. The keep strategy decides which row of a
 * duplicate set survives. Surviving rows keep their input order.
 */
public final class Distinct extends LogicalPlan {

    /**
     * Which row of a set of duplicates is kept.
     */
    public enum Keep {
        /** The first row of each set. */
        FIRST,
        /** The last row of each set. */
        LAST,
        /** No row of a set that has duplicates. */
        NONE
    }

    private final List<String> subset;
    private final Keep keep;

    /**
     * Creates a distinct node over all columns keeping the first row.
     *
     * @param child the child node
     */
    public Distinct(LogicalPlan child) {
        this(child, null, Keep.FIRST);
    }

    /**
     * Creates a distinct node.
     *
     * @param child the child node
     * @param subset the columns that identify duplicates, or null for all columns
     * @param keep the keep strategy
     */
    public Distinct(LogicalPlan child, List<String> subset, Keep keep) {
        super(child);
        this.subset = subset == null ? null : List.copyOf(subset);
        this.keep = Objects.requireNonNull(keep, "keep must not be null");
        if (this.subset != null) {
            if (this.subset.isEmpty()) {
                throw new IllegalArgumentException("subset must not be empty");
            }
            child.schema().select(this.subset);
        }
    }

    /**
     * Returns the subset columns.
     *
     * @return the column names, or null for all columns
     */
    public List<String> subset() {
        return subset;
    }

    /**
     * Returns the columns that identify duplicates.
     *
     * @return the subset, or every child column
     */
    public List<String> keyColumns() {
        return subset != null ? subset : child().schema().names();
    }

    public Keep keep() {
        return keep;
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Distinct(newChildren.get(0), subset, keep);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return child().estimatedRowCount();
    }

    @Override
    protected List<Object> parameters() {
        return Arrays.asList(subset, keep);
    }

    @Override
    public String toString() {
        return subset == null
            ? String.format("Distinct(keep=%s)", keep.name().toLowerCase())
            : String.format("Distinct(subset=%s, keep=%s)", subset, keep.name().toLowerCase());
    }
}
