package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.ValueOps;
import com.lazyframe.expression.AggregateExpression;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.eval.Accumulator;
import com.lazyframe.expression.eval.Accumulators;
import com.lazyframe.expression.eval.CompiledExpression;
import com.lazyframe.expression.eval.ExpressionCompiler;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Hash aggregation state over a sequence of batches.
 *
 * <p>Groups are numbered in first-seen order. Partial states built over consecutive row
 * ranges are combined with {@link #merge} in range order, which keeps both the group order
 * and order-sensitive aggregates such as {@code first} identical to a single pass. The
 * state is confined to one thread while it is updated.
 *
 * <p>Each aggregate call is computed into a column named {@code __agg_<i>}; the output
 * expressions are then evaluated over the group keys and those columns.
 */
public final class GroupedAggregation {

    private static final String AGG_PREFIX = "__agg_";

    private final Shared shared;
    private final Map<List<Object>, Integer> groupIndex = new HashMap<>();
    private final List<Object[]> groupKeys = new ArrayList<>();
    private final List<Accumulator[]> states = new ArrayList<>();

    /**
     * Compiled parts shared by all partial states of one aggregation.
     */
    private static final class Shared {
        private final Aggregate aggregate;
        private final List<CompiledExpression> keys;
        private final List<CompiledExpression> arguments;
        private final List<Supplier<Accumulator>> factories;
        private final List<CompiledExpression> outputs;
        private final StructType intermediate;

        private Shared(Aggregate aggregate) {
            this.aggregate = aggregate;
            this.keys = ExpressionCompiler.compileAll(aggregate.groupingExpressions());
            List<AggregateExpression> calls = aggregate.aggregateCalls();
            this.arguments = new ArrayList<>(calls.size());
            this.factories = new ArrayList<>(calls.size());
            Map<AggregateExpression, Expression> replacements = new HashMap<>();
            List<StructField> fields = new ArrayList<>();
            for (Expression key : aggregate.groupingExpressions()) {
                fields.add(new StructField(key.outputName(), key.dataType()));
            }
            for (int i = 0; i < calls.size(); i++) {
                AggregateExpression call = calls.get(i);
                arguments.add(ExpressionCompiler.compile(call.argument()));
                factories.add(Accumulators.factory(call.function(), call.dataType()));
                String name = AGG_PREFIX + i;
                replacements.put(call, new ColumnReference(name, call.dataType()));
                fields.add(new StructField(name, call.dataType()));
            }
            this.intermediate = new StructType(fields);
            List<Expression> rewritten = new ArrayList<>();
            for (Expression output : aggregate.aggregateExpressions()) {
                Expression expr = ExpressionUtils.transformDown(output, e -> {
                    Expression replacement = e instanceof AggregateExpression ? replacements.get(e) : null;
                    return replacement != null ? replacement : e;
                });
                if (!expr.outputName().equals(output.outputName())) {
                    expr = new AliasExpression(expr, output.outputName());
                }
                rewritten.add(expr);
            }
            this.outputs = ExpressionCompiler.compileAll(rewritten);
        }
    }

    /**
     * Creates an empty aggregation state.
     *
     * @param aggregate the aggregation node
     */
    public GroupedAggregation(Aggregate aggregate) {
        this(new Shared(aggregate));
    }

    private GroupedAggregation(Shared shared) {
        this.shared = shared;
    }

    /**
     * Returns a new empty state sharing this state's compiled expressions.
     *
     * @return the empty partial state
     */
    public GroupedAggregation newPartial() {
        return new GroupedAggregation(shared);
    }

    public int groupCount() {
        return states.size();
    }

    /**
     * Adds the rows of a batch.
     *
     * @param batch a batch of the aggregation's input
     */
    public void accumulate(ColumnarBatch batch) {
        int rows = batch.rowCount();
        if (rows == 0) {
            return;
        }
        List<Column> keyColumns = new ArrayList<>(shared.keys.size());
        for (CompiledExpression key : shared.keys) {
            keyColumns.add(key.evaluate(batch));
        }
        List<Column> argumentColumns = new ArrayList<>(shared.arguments.size());
        for (CompiledExpression argument : shared.arguments) {
            argumentColumns.add(argument.evaluate(batch));
        }
        for (int row = 0; row < rows; row++) {
            Accumulator[] state = stateOf(keyColumns, row);
            for (int i = 0; i < state.length; i++) {
                state[i].update(argumentColumns.get(i).get(row));
            }
        }
    }

    private Accumulator[] stateOf(List<Column> keyColumns, int row) {
        List<Object> key = ValueOps.rowKey(keyColumns, row);
        Integer id = groupIndex.get(key);
        if (id != null) {
            return states.get(id);
        }
        Object[] values = new Object[keyColumns.size()];
        for (int k = 0; k < values.length; k++) {
            values[k] = keyColumns.get(k).get(row);
        }
        return addGroup(key, values, newState());
    }

    private Accumulator[] newState() {
        Accumulator[] state = new Accumulator[shared.factories.size()];
        for (int i = 0; i < state.length; i++) {
            state[i] = shared.factories.get(i).get();
        }
        return state;
    }

    private Accumulator[] addGroup(List<Object> key, Object[] values, Accumulator[] state) {
        groupIndex.put(key, states.size());
        groupKeys.add(values);
        states.add(state);
        return state;
    }

    /**
     * Folds a state built over later rows into this one.
     *
     * @param later the partial state of the following rows
     */
    public void merge(GroupedAggregation later) {
        for (int g = 0; g < later.states.size(); g++) {
            Object[] values = later.groupKeys.get(g);
            List<Object> key = new ArrayList<>(values.length);
            for (Object value : values) {
                key.add(ValueOps.normalizeKey(value));
            }
            Integer id = groupIndex.get(key);
            if (id == null) {
                addGroup(key, values, later.states.get(g));
            } else {
                Accumulator[] state = states.get(id);
                Accumulator[] other = later.states.get(g);
                for (int i = 0; i < state.length; i++) {
                    state[i].merge(other[i]);
                }
            }
        }
    }

    /**
     * Produces one row per group in first-seen order. Without grouping keys the result has
     * exactly one row, also for an empty input.
     *
     * @return the aggregation result
     */
    public ColumnarBatch finish() {
        if (states.isEmpty() && shared.keys.isEmpty()) {
            addGroup(List.of(), new Object[0], newState());
        }
        int groups = states.size();
        List<Column> columns = new ArrayList<>(shared.intermediate.size());
        for (int k = 0; k < shared.keys.size(); k++) {
            Object[] values = new Object[groups];
            for (int g = 0; g < groups; g++) {
                values[g] = groupKeys.get(g)[k];
            }
            StructField field = shared.intermediate.fieldAt(k);
            columns.add(Column.fromValues(field.name(), field.dataType(), values));
        }
        for (int i = 0; i < shared.factories.size(); i++) {
            Object[] values = new Object[groups];
            for (int g = 0; g < groups; g++) {
                values[g] = states.get(g)[i].result();
            }
            StructField field = shared.intermediate.fieldAt(shared.keys.size() + i);
            columns.add(Column.fromValues(field.name(), field.dataType(), values));
        }
        ColumnarBatch intermediate = new ColumnarBatch(shared.intermediate, columns, groups);

        List<Column> result = new ArrayList<>(shared.aggregate.schema().size());
        for (int k = 0; k < shared.keys.size(); k++) {
            result.add(columns.get(k));
        }
        for (CompiledExpression output : shared.outputs) {
            result.add(output.evaluate(intermediate));
        }
        return new ColumnarBatch(shared.aggregate.schema(), result, groups);
    }

    /**
     * Releases the group table.
     */
    public void clear() {
        groupIndex.clear();
        groupKeys.clear();
        states.clear();
    }
}
