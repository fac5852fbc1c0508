package com.lazyframe.streaming;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Join;
import com.lazyframe.physical.JoinAssembler;
import com.lazyframe.physical.JoinTable;
import java.util.List;

/**
 * Streams the left input of a hash join through a table built over the materialized right
 * input. Supports inner, left, semi and anti joins; output keeps the streamed order.
 */
public final class HashJoinStreamOperator implements StreamOperator {

    private static final String NAME = "HashJoinStream";

    private final Join join;
    private final ColumnarBatch build;
    private final JoinTable table;
    private final JoinAssembler assembler;
    private ColumnarBatch pending;
    private boolean finishing;

    /**
     * Creates a streaming hash join operator.
     *
     * @param join the join
     * @param build the materialized right input
     */
    public HashJoinStreamOperator(Join join, ColumnarBatch build) {
        this.join = join;
        this.build = build;
        this.table = JoinTable.build(JoinTable.keyColumns(join, false, build), build.rowCount());
        this.assembler = new JoinAssembler(join);
    }

    @Override
    public boolean needsInput() {
        return pending == null && !finishing;
    }

    @Override
    public void addInput(ColumnarBatch batch) {
        if (!needsInput()) {
            throw new IllegalStateException(NAME + " does not accept input now");
        }
        List<Column> keys = JoinTable.keyColumns(join, true, batch);
        JoinTable.Matches matches = table.match(keys, 0, batch.rowCount(), join.joinType(), null);
        if (matches.size() > 0) {
            pending = assembler.assemble(batch, build, matches.leftRows(), matches.rightRows());
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
        return finishing && pending == null;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void close() {
        pending = null;
    }

    @Override
    public String toString() {
        return NAME + "(" + table + ")";
    }
}
