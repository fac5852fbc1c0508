package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Unpivot;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.types.StringType;
import java.util.ArrayList;
import java.util.List;

/**
 * Unpivots value columns into (variable, value) rows, one block of input rows per value
 * column.
 */
public final class UnpivotExec extends PhysicalOperator {

    private final Unpivot unpivot;

    public UnpivotExec(Unpivot unpivot, PhysicalOperator child) {
        super(unpivot.schema(), child);
        this.unpivot = unpivot;
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        int rows = input.rowCount();
        ctx.checkRows((long) rows * unpivot.on().size(), nodeName());
        List<ColumnarBatch> blocks = new ArrayList<>(unpivot.on().size());
        for (String name : unpivot.on()) {
            List<Column> columns = new ArrayList<>(schema().size());
            for (String index : unpivot.index()) {
                columns.add(input.column(index));
            }
            columns.add(Column.constant(unpivot.variableName(), StringType.get(), name, rows));
            columns.add(input.column(name).cast(unpivot.valueType(), false).rename(unpivot.valueName()));
            blocks.add(new ColumnarBatch(schema(), columns, rows));
        }
        return ColumnarBatch.concat(schema(), blocks);
    }

    @Override
    public String toString() {
        return String.format("UnpivotExec(index=%s, on=%s)", unpivot.index(), unpivot.on());
    }
}
