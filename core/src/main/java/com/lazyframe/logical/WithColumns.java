package com.lazyframe.logical;

import com.lazyframe.expression.Expression;
import com.lazyframe.expression.eval.ExpressionResolver;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;

/**
 * Logical plan node that adds or replaces columns.
 *
 * <p>All expressions are evaluated against the child's columns (not against each other).
 * A result whose name matches an existing column replaces it in place; other results are
 * appended in order.
 *
 * <p>Examples:
 * <pre>
 *   lf.withColumns(col("price").times(col("qty")).alias("total"))
 * </pre>
 */
public final class WithColumns extends LogicalPlan {

    private final List<Expression> columns;

    /**
     * Creates a with-columns node.
     *
     * @param child the child node
     * @param columns the added or replacing expressions
     */
    public WithColumns(LogicalPlan child, List<Expression> columns) {
        super(child);
        Objects.requireNonNull(columns, "columns must not be null");
        this.columns = List.copyOf(ExpressionResolver.resolveAll(columns, child.schema()));
        // Names must be unique among the new columns
        schemaOf(this.columns, nodeName());
    }

    public List<Expression> columns() {
        return columns;
    }

    @Override
    protected StructType inferSchema() {
        StructType result = child().schema();
        for (Expression expr : columns) {
            result = result.withField(new StructField(expr.outputName(), expr.dataType()));
        }
        return result;
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new WithColumns(newChildren.get(0), columns);
    }

    @Override
    public List<Expression> expressions() {
        return columns;
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        List<Expression> mapped = mapAll(columns, fn);
        return sameExpressions(mapped, columns) ? this : new WithColumns(child(), mapped);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return child().estimatedRowCount();
    }

    @Override
    protected List<Object> parameters() {
        return List.of(columns);
    }

    @Override
    public String toString() {
        return String.format("WithColumns(%s)", columns);
    }
}
