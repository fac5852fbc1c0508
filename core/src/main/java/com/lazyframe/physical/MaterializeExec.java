package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.runtime.ExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Boundary between a streaming pipeline and an in-memory consumer: collects the whole
 * output of the pipeline, within the materialization budget, at this one point.
 */
public final class MaterializeExec extends PhysicalOperator {

    private static final Logger logger = LoggerFactory.getLogger(MaterializeExec.class);

    public MaterializeExec(PhysicalOperator child) {
        super(child.schema(), child);
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch result = child().execute(ctx);
        logger.debug("Materialized {} rows from {}", result.rowCount(), child().nodeName());
        return result;
    }

    @Override
    public String toString() {
        return "MaterializeExec";
    }
}
