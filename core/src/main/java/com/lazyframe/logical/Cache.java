package com.lazyframe.logical;

import com.lazyframe.types.StructType;
import java.util.List;
import java.util.OptionalLong;

/**
 * Logical plan node marking a subplan whose result is computed once per execution and
 * shared by every cache node with the same id.
 *
 * <p>Cache nodes are inserted by common subplan elimination when the same subplan feeds
 * several inputs of a join or union.
 */
public final class Cache extends LogicalPlan {

    private final long id;

    public Cache(LogicalPlan child, long id) {
        super(child);
        this.id = id;
    }

    public long id() {
        return id;
    }

    @Override
    protected StructType inferSchema() {
        return child().schema();
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Cache(newChildren.get(0), id);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return child().estimatedRowCount();
    }

    @Override
    protected List<Object> parameters() {
        return List.of(id);
    }

    @Override
    public String toString() {
        return String.format("Cache(id=%d)", id);
    }
}
