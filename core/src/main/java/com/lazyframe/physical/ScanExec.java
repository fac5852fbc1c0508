package com.lazyframe.physical;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Scan;
import com.lazyframe.runtime.ExecutionContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a whole scan into memory.
 */
public final class ScanExec extends PhysicalOperator {

    private final Scan scan;
    private final ScanReader reader;

    public ScanExec(Scan scan, int batchSize) {
        super(scan.schema());
        this.scan = scan;
        this.reader = new ScanReader(scan, batchSize);
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        List<ColumnarBatch> batches = new ArrayList<>();
        long rows = 0;
        try (MorselStream morsels = new MorselStream(reader, ctx, null, nodeName())) {
            while (morsels.hasNext()) {
                ColumnarBatch batch = morsels.next();
                rows += batch.rowCount();
                ctx.checkRows(rows, nodeName());
                batches.add(batch);
            }
        }
        return ColumnarBatch.concat(schema(), batches);
    }

    @Override
    public String toString() {
        return "ScanExec" + scan.toString().substring("Scan".length());
    }
}
