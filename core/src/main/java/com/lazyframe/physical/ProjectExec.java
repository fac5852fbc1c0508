package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Project;
import com.lazyframe.runtime.ExecutionContext;
import java.util.function.UnaryOperator;

/**
 * Evaluates a projection in parallel over row ranges. Order-preserving.
 */
public final class ProjectExec extends PhysicalOperator {

    private final Project project;
    private final UnaryOperator<ColumnarBatch> function;

    public ProjectExec(Project project, PhysicalOperator child) {
        super(project.schema(), child);
        this.project = project;
        this.function = BatchFunctions.project(project.projections(), project.schema());
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        if (project.isColumnSelection()) {
            return input.select(schema().names());
        }
        return Partitioned.map(ctx, input, schema(), nodeName(), function);
    }

    @Override
    public String toString() {
        return String.format("ProjectExec(%s)", project.projections());
    }
}
