package com.lazyframe.logical;

import com.lazyframe.expression.AggregateExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.eval.ExpressionResolver;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a group-by aggregation.
 *
 * <p>Rows are partitioned by the values of the grouping expressions; each output row holds
 * one group's key values followed by the aggregation outputs. An aggregation output is any
 * expression over aggregates and grouping keys, for example
 * {@code col("v").sum().div(col("v").count())}. Columns outside aggregates must be
 * grouping keys.
 *
 * <p>Groups are emitted in the order of their first row in the input. With no grouping
 * expressions the whole input forms a single group (and an empty input yields one row).
 */
public final class Aggregate extends LogicalPlan {

    private final List<Expression> groupingExpressions;
    private final List<Expression> aggregateExpressions;

    /**
     * Creates an aggregation node.
     *
     * @param child the child node
     * @param groupingExpressions the grouping keys
     * @param aggregateExpressions the aggregation outputs
     */
    public Aggregate(LogicalPlan child, List<Expression> groupingExpressions,
                     List<Expression> aggregateExpressions) {
        super(child);
        Objects.requireNonNull(groupingExpressions, "groupingExpressions must not be null");
        Objects.requireNonNull(aggregateExpressions, "aggregateExpressions must not be null");
        StructType input = child.schema();
        this.groupingExpressions = List.copyOf(ExpressionResolver.resolveAll(groupingExpressions, input));
        StructType keySchema = schemaOf(this.groupingExpressions, nodeName());
        List<Expression> resolved = new ArrayList<>(aggregateExpressions.size());
        for (Expression expr : aggregateExpressions) {
            resolved.add(ExpressionResolver.resolveAggregation(expr, input, keySchema));
        }
        this.aggregateExpressions = List.copyOf(resolved);
    }

    public List<Expression> groupingExpressions() {
        return groupingExpressions;
    }

    public List<Expression> aggregateExpressions() {
        return aggregateExpressions;
    }

    /**
     * Returns the distinct aggregate calls of all outputs, in order of first appearance.
     *
     * @return the aggregate calls
     */
    public List<AggregateExpression> aggregateCalls() {
        Set<AggregateExpression> calls = new LinkedHashSet<>();
        for (Expression expr : aggregateExpressions) {
            collectCalls(expr, calls);
        }
        return new ArrayList<>(calls);
    }

    private static void collectCalls(Expression expr, Set<AggregateExpression> calls) {
        if (expr instanceof AggregateExpression agg) {
            calls.add(agg);
            return;
        }
        for (Expression child : expr.children()) {
            collectCalls(child, calls);
        }
    }

    /**
     * Returns true if every aggregate can be computed from partial states merged in input
     * order, which is what the streaming executor requires.
     *
     * @return true if all aggregates are mergeable
     */
    public boolean isMergeable() {
        for (AggregateExpression call : aggregateCalls()) {
            if (!call.function().isMergeable()) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected StructType inferSchema() {
        List<StructField> fields = new ArrayList<>();
        for (Expression key : groupingExpressions) {
            fields.add(new StructField(key.outputName(), key.dataType()));
        }
        for (Expression agg : aggregateExpressions) {
            fields.add(new StructField(agg.outputName(), agg.dataType()));
        }
        List<Expression> all = new ArrayList<>(groupingExpressions);
        all.addAll(aggregateExpressions);
        // Reject duplicate output names with operator context
        schemaOf(all, nodeName());
        return new StructType(fields);
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Aggregate(newChildren.get(0), groupingExpressions, aggregateExpressions);
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> all = new ArrayList<>(groupingExpressions);
        all.addAll(aggregateExpressions);
        return all;
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        List<Expression> keys = mapAll(groupingExpressions, fn);
        List<Expression> aggs = mapAll(aggregateExpressions, fn);
        if (sameExpressions(keys, groupingExpressions) && sameExpressions(aggs, aggregateExpressions)) {
            return this;
        }
        return new Aggregate(child(), keys, aggs);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        if (groupingExpressions.isEmpty()) {
            return OptionalLong.of(1);
        }
        return child().estimatedRowCount();
    }

    /**
     * Returns the columns the aggregation reads from its child.
     *
     * @return the referenced child columns
     */
    public Set<String> referencedInputColumns() {
        Set<String> columns = new LinkedHashSet<>(ExpressionUtils.referencedColumns(groupingExpressions));
        for (AggregateExpression call : aggregateCalls()) {
            columns.addAll(ExpressionUtils.referencedColumns(call));
        }
        return columns;
    }

    @Override
    protected List<Object> parameters() {
        return List.of(groupingExpressions, aggregateExpressions);
    }

    @Override
    public String toString() {
        return String.format("Aggregate(keys=%s, aggs=%s)", groupingExpressions, aggregateExpressions);
    }
}
