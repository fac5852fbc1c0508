package com.lazyframe.expression.eval;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.Grouping;
import com.lazyframe.data.RowComparator;
import com.lazyframe.data.ValueOps;
import com.lazyframe.expression.AggregateExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.SortOrder;
import com.lazyframe.expression.WindowFunction;
import com.lazyframe.types.DataType;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Evaluates one resolved {@link WindowFunction} over a batch.
 *
 * <p>Evaluation is split so that the caller can run partitions in parallel:
 * {@link #prepare} evaluates arguments and keys once, then {@link #evaluatePartition}
 * fills the output slots of one partition. Partitions write disjoint slots of the shared
 * output array.
 */
public final class WindowEvaluator {

    /**
     * Per-batch inputs of a window evaluation.
     */
    public static final class Prepared {
        private final Column argument;
        private final List<Column> partitionKeys;
        private final RowComparator order;
        private final int rowCount;

        private Prepared(Column argument, List<Column> partitionKeys, RowComparator order, int rowCount) {
            this.argument = argument;
            this.partitionKeys = partitionKeys;
            this.order = order;
            this.rowCount = rowCount;
        }

        public int rowCount() {
            return rowCount;
        }

        /**
         * Returns the partitions in first-seen order, each with its rows in input order.
         *
         * @return row indices per partition
         */
        public List<int[]> partitions() {
            return Grouping.of(partitionKeys, rowCount).groups();
        }
    }

    private final WindowFunction function;
    private final String outputName;
    private final CompiledExpression argument;
    private final AggregateExpression.Function aggregate;
    private final DataType aggregateResultType;
    private final List<CompiledExpression> partitionBy;
    private final List<CompiledExpression> orderBy;
    private final boolean[] descending;
    private final boolean[] nullsLast;

    /**
     * Compiles a resolved window function.
     *
     * @param function the window function
     * @param outputName the name of the produced column
     */
    public WindowEvaluator(WindowFunction function, String outputName) {
        this.function = function;
        this.outputName = outputName;
        Expression arg = function.argument();
        if (function.kind() == WindowFunction.Kind.AGGREGATE) {
            AggregateExpression agg = (AggregateExpression) arg;
            this.aggregate = agg.function();
            this.aggregateResultType = agg.dataType();
            this.argument = ExpressionCompiler.compile(agg.argument());
        } else {
            this.aggregate = null;
            this.aggregateResultType = null;
            this.argument = arg == null ? null : ExpressionCompiler.compile(arg);
        }
        this.partitionBy = ExpressionCompiler.compileAll(function.partitionBy());
        List<SortOrder> orders = function.orderBy();
        this.orderBy = ExpressionCompiler.compileAll(orders);
        this.descending = new boolean[orders.size()];
        this.nullsLast = new boolean[orders.size()];
        for (int i = 0; i < orders.size(); i++) {
            descending[i] = orders.get(i).descending();
            nullsLast[i] = orders.get(i).nullsLast();
        }
    }

    public String outputName() {
        return outputName;
    }

    public DataType dataType() {
        return function.dataType();
    }

    /**
     * Evaluates arguments, partition keys and order keys over the batch.
     *
     * @param batch the input batch
     * @return the prepared inputs
     */
    public Prepared prepare(ColumnarBatch batch) {
        Column arg = argument == null ? null : argument.evaluate(batch);
        List<Column> keys = new ArrayList<>(partitionBy.size());
        for (CompiledExpression key : partitionBy) {
            keys.add(key.evaluate(batch));
        }
        RowComparator comparator = null;
        if (!orderBy.isEmpty()) {
            List<Column> orderKeys = new ArrayList<>(orderBy.size());
            for (CompiledExpression key : orderBy) {
                orderKeys.add(key.evaluate(batch));
            }
            comparator = new RowComparator(orderKeys, descending, nullsLast);
        }
        return new Prepared(arg, keys, comparator, batch.rowCount());
    }

    /**
     * Computes the window values of one partition.
     *
     * @param prepared the prepared inputs
     * @param rows the partition's rows in input order
     * @param out the output slots, indexed by row
     */
    public void evaluatePartition(Prepared prepared, int[] rows, Object[] out) {
        int[] ordered = rows.clone();
        if (prepared.order != null) {
            prepared.order.sort(ordered);
        }
        Column arg = prepared.argument;
        switch (function.kind()) {
            case ROW_NUMBER -> {
                for (int i = 0; i < ordered.length; i++) {
                    out[ordered[i]] = (long) (i + 1);
                }
            }
            case RANK, DENSE_RANK -> {
                boolean dense = function.kind() == WindowFunction.Kind.DENSE_RANK;
                long rank = 0;
                for (int i = 0; i < ordered.length; i++) {
                    if (i == 0 || prepared.order.compare(ordered[i - 1], ordered[i]) != 0) {
                        rank = dense ? rank + 1 : i + 1;
                    }
                    out[ordered[i]] = rank;
                }
            }
            case LAG, LEAD -> {
                int shift = function.kind() == WindowFunction.Kind.LAG ? -function.offset() : function.offset();
                for (int i = 0; i < ordered.length; i++) {
                    int source = i + shift;
                    out[ordered[i]] = source >= 0 && source < ordered.length ? arg.get(ordered[source]) : null;
                }
            }
            case FIRST_VALUE, LAST_VALUE -> {
                Object value = ordered.length == 0 ? null : arg.get(
                    function.kind() == WindowFunction.Kind.FIRST_VALUE ? ordered[0] : ordered[ordered.length - 1]);
                for (int row : ordered) {
                    out[row] = value;
                }
            }
            case CUM_SUM -> {
                DataType type = function.dataType();
                Object running = null;
                for (int row : ordered) {
                    Object v = arg.get(row);
                    if (v == null) {
                        out[row] = null;
                        continue;
                    }
                    running = running == null ? ValueOps.toNumeric(v, type) : ValueOps.add(running, v, type);
                    out[row] = running;
                }
            }
            case CUM_COUNT -> {
                long count = 0;
                for (int row : ordered) {
                    if (arg.get(row) != null) {
                        count++;
                    }
                    out[row] = count;
                }
            }
            case CUM_MIN, CUM_MAX -> {
                boolean max = function.kind() == WindowFunction.Kind.CUM_MAX;
                Object current = null;
                for (int row : ordered) {
                    Object v = arg.get(row);
                    if (v == null) {
                        out[row] = null;
                        continue;
                    }
                    if (current == null || (max ? ValueOps.compare(v, current) > 0 : ValueOps.compare(v, current) < 0)) {
                        current = v;
                    }
                    out[row] = current;
                }
            }
            case AGGREGATE -> {
                Supplier<Accumulator> factory = Accumulators.factory(aggregate, aggregateResultType);
                Accumulator accumulator = factory.get();
                for (int row : ordered) {
                    accumulator.update(arg.get(row));
                }
                Object value = accumulator.result();
                for (int row : ordered) {
                    out[row] = value;
                }
            }
        }
    }

    /**
     * Evaluates every partition sequentially.
     *
     * @param batch the input batch
     * @return the window column
     */
    public Column evaluate(ColumnarBatch batch) {
        Prepared prepared = prepare(batch);
        Object[] out = new Object[batch.rowCount()];
        for (int[] partition : prepared.partitions()) {
            evaluatePartition(prepared, partition, out);
        }
        return Column.fromValues(outputName, dataType(), out);
    }
}
