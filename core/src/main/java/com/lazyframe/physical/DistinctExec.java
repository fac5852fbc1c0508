package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.Grouping;
import com.lazyframe.logical.Distinct;
import com.lazyframe.runtime.ExecutionContext;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Removes duplicate rows by hashing the key columns. Surviving rows keep input order.
 */
public final class DistinctExec extends PhysicalOperator {

    private final Distinct distinct;

    public DistinctExec(Distinct distinct, PhysicalOperator child) {
        super(distinct.schema(), child);
        this.distinct = distinct;
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch input = child().execute(ctx);
        List<Column> keys = new ArrayList<>();
        for (String name : distinct.keyColumns()) {
            keys.add(input.column(name));
        }
        Grouping grouping = Grouping.of(keys, input.rowCount());
        int[] kept;
        switch (distinct.keep()) {
            case FIRST:
                kept = grouping.firstRows();
                break;
            case LAST: {
                List<int[]> groups = grouping.groups();
                kept = new int[groups.size()];
                for (int g = 0; g < kept.length; g++) {
                    int[] rows = groups.get(g);
                    kept[g] = rows[rows.length - 1];
                }
                break;
            }
            case NONE: {
                List<int[]> groups = grouping.groups();
                kept = groups.stream().filter(rows -> rows.length == 1).mapToInt(rows -> rows[0]).toArray();
                break;
            }
            default:
                throw new IllegalStateException("unknown keep strategy " + distinct.keep());
        }
        Arrays.sort(kept);
        return input.take(kept);
    }

    @Override
    public String toString() {
        return String.format("DistinctExec(subset=%s, keep=%s)",
            distinct.subset() == null ? "*" : distinct.subset(), distinct.keep().name().toLowerCase());
    }
}
