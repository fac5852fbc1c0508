package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.JoinOptions;
import com.lazyframe.logical.JoinType;
import com.lazyframe.runtime.ExecutionContext;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Equality join by hashing one side and probing it with the other.
 *
 * <p>The build side is the one configured in the join options or, by default, the smaller
 * input. Matching runs in parallel over row ranges of the streamed side against the read-only
 * table. Whichever side is built, output rows are in left order and, within one left row,
 * in right order; unmatched right rows of a full join follow in right order.
 */
public final class HashJoinExec extends PhysicalOperator {

    private static final Logger logger = LoggerFactory.getLogger(HashJoinExec.class);

    private final Join join;
    private final JoinAssembler assembler;

    public HashJoinExec(Join join, PhysicalOperator left, PhysicalOperator right) {
        super(join.schema(), List.of(left, right));
        this.join = join;
        this.assembler = new JoinAssembler(join);
    }

    public Join join() {
        return join;
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch left = children().get(0).execute(ctx);
        ColumnarBatch right = children().get(1).execute(ctx);
        List<Column> leftKeys = JoinTable.keyColumns(join, true, left);
        List<Column> rightKeys = JoinTable.keyColumns(join, false, right);

        boolean buildLeft = buildOnLeft(left.rowCount(), right.rowCount());
        logger.debug("{} {} join: left={} rows, right={} rows, build={}", nodeName(), join.joinType().joinName(),
            left.rowCount(), right.rowCount(), buildLeft ? "left" : "right");

        JoinTable.Matches matches = buildLeft
            ? matchFromRight(ctx, JoinTable.build(leftKeys, left.rowCount()), rightKeys, left.rowCount())
            : matchFromLeft(ctx, JoinTable.build(rightKeys, right.rowCount()), leftKeys, right.rowCount());
        ctx.checkRows(matches.size(), nodeName());
        return assembler.assemble(left, right, matches.leftRows(), matches.rightRows());
    }

    private boolean buildOnLeft(int leftRows, int rightRows) {
        if (join.joinType() == JoinType.FULL) {
            return false;
        }
        JoinOptions.BuildSide side = join.options().buildSide();
        if (side == JoinOptions.BuildSide.AUTO) {
            return leftRows < rightRows;
        }
        return side == JoinOptions.BuildSide.LEFT;
    }

    private JoinTable.Matches matchFromLeft(ExecutionContext ctx, JoinTable table, List<Column> leftKeys,
                                            int rightRows) {
        JoinType type = join.joinType();
        int rows = leftKeys.isEmpty() ? 0 : leftKeys.get(0).size();
        List<int[]> ranges = Partitioned.ranges(rows, ctx.partitionCount(rows));
        List<Callable<RangeMatches>> tasks = new ArrayList<>(ranges.size());
        for (int[] range : ranges) {
            tasks.add(() -> {
                BitSet matched = type == JoinType.FULL ? new BitSet(rightRows) : null;
                return new RangeMatches(table.match(leftKeys, range[0], range[1], type, matched), matched);
            });
        }
        List<RangeMatches> results = ctx.invokeAll(tasks, nodeName());
        List<JoinTable.Matches> parts = new ArrayList<>(results.size());
        BitSet matched = new BitSet(rightRows);
        for (RangeMatches range : results) {
            parts.add(range.matches);
            if (range.matched != null) {
                matched.or(range.matched);
            }
        }
        JoinTable.Matches result = JoinTable.Matches.concat(parts);
        if (type == JoinType.FULL) {
            for (int r = matched.nextClearBit(0); r < rightRows; r = matched.nextClearBit(r + 1)) {
                result.add(-1, r);
            }
        }
        return result;
    }

    private JoinTable.Matches matchFromRight(ExecutionContext ctx, JoinTable table, List<Column> rightKeys,
                                             int leftRows) {
        JoinType type = join.joinType();
        int rows = rightKeys.isEmpty() ? 0 : rightKeys.get(0).size();
        List<int[]> ranges = Partitioned.ranges(rows, ctx.partitionCount(rows));
        List<Callable<RangeMatches>> tasks = new ArrayList<>(ranges.size());
        for (int[] range : ranges) {
            tasks.add(() -> {
                // Streamed rows are right rows here, so pairs come out as (right, left)
                BitSet matched = new BitSet(leftRows);
                JoinTable.Matches pairs = table.match(rightKeys, range[0], range[1], JoinType.INNER, null);
                JoinTable.Matches swapped = new JoinTable.Matches(pairs.size());
                int[] streamRows = pairs.leftRows();
                int[] buildRows = pairs.rightRows();
                for (int i = 0; i < streamRows.length; i++) {
                    swapped.add(buildRows[i], streamRows[i]);
                    matched.set(buildRows[i]);
                }
                return new RangeMatches(swapped, matched);
            });
        }
        List<RangeMatches> results = ctx.invokeAll(tasks, nodeName());
        List<JoinTable.Matches> parts = new ArrayList<>(results.size());
        BitSet matched = new BitSet(leftRows);
        for (RangeMatches range : results) {
            parts.add(range.matches);
            matched.or(range.matched);
        }

        switch (type) {
            case INNER:
            case LEFT: {
                JoinTable.Matches result = JoinTable.Matches.concat(parts);
                if (type == JoinType.LEFT) {
                    for (int l = matched.nextClearBit(0); l < leftRows; l = matched.nextClearBit(l + 1)) {
                        result.add(l, -1);
                    }
                }
                result.sortByLeft();
                return result;
            }
            case SEMI:
            case ANTI: {
                JoinTable.Matches result = new JoinTable.Matches(leftRows);
                for (int l = 0; l < leftRows; l++) {
                    if (matched.get(l) == (type == JoinType.SEMI)) {
                        result.add(l, -1);
                    }
                }
                return result;
            }
            default:
                throw new IllegalStateException("cannot build the left side of a " + type.joinName() + " join");
        }
    }

    private static final class RangeMatches {
        private final JoinTable.Matches matches;
        private final BitSet matched;

        private RangeMatches(JoinTable.Matches matches, BitSet matched) {
            this.matches = matches;
            this.matched = matched;
        }
    }

    @Override
    public String toString() {
        return String.format("HashJoinExec(%s, left_on=%s, right_on=%s)",
            join.joinType().joinName(), join.leftKeys(), join.rightKeys());
    }
}
