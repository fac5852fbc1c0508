package com.lazyframe.logical;

import com.lazyframe.expression.Expression;
import com.lazyframe.expression.eval.ExpressionResolver;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a filter.
 *
 * <p>This node keeps the rows of its child for which a boolean predicate is true; rows
 * where it is false or null are dropped. Row order is preserved.
 *
 * <p>Examples:
 * <pre>
 *   lf.filter(col("age").gt(25))
 *   lf.filter(col("price").gt(100).and(col("category").eq("electronics")))
 * </pre>
 */
public final class Filter extends LogicalPlan {

    private final Expression condition;

    /**
     * Creates a filter node.
     *
     * @param child the child node
     * @param condition the filter condition (must evaluate to boolean)
     */
    public Filter(LogicalPlan child, Expression condition) {
        super(child);
        Objects.requireNonNull(condition, "condition must not be null");
        this.condition = ExpressionResolver.resolvePredicate(condition, child.schema());
    }

    /**
     * Returns the filter condition.
     *
     * @return the condition expression
     */
    public Expression condition() {
        return condition;
    }

    @Override
    protected StructType inferSchema() {
        // Filter doesn't change the schema
        return child().schema();
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Filter(newChildren.get(0), condition);
    }

    @Override
    public List<Expression> expressions() {
        return List.of(condition);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        Expression mapped = fn.apply(condition);
        return mapped == condition ? this : new Filter(child(), mapped);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return child().estimatedRowCount();
    }

    @Override
    protected List<Object> parameters() {
        return List.of(condition);
    }

    @Override
    public String toString() {
        return String.format("Filter(%s)", condition);
    }
}
