package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Cache;
import com.lazyframe.runtime.ExecutionContext;

/**
 * A subplan shared by several consumers, computed once per execution.
 */
public final class CacheExec extends PhysicalOperator {

    private final long id;

    public CacheExec(Cache cache, PhysicalOperator child) {
        super(cache.schema(), child);
        this.id = cache.id();
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        return ctx.cached(id, () -> child().execute(ctx));
    }

    @Override
    public String toString() {
        return String.format("CacheExec(id=%d)", id);
    }
}
