package com.lazyframe.logical;

import com.lazyframe.exception.InvalidOperationException;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.WindowFunction;
import com.lazyframe.expression.eval.ExpressionResolver;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;

/**
 * Logical plan node that computes window functions.
 *
 * <p>Each window expression is an aliased {@link WindowFunction}; its result is appended to
 * the child's columns (or replaces a column of the same name). Row order and row count are
 * preserved: every row receives the value computed over its own partition.
 *
 * <p>Window nodes are created by the query builder, which extracts window functions out of
 * {@code select} and {@code withColumns} projections.
 */
public final class Window extends LogicalPlan {

    private final List<AliasExpression> windowExpressions;

    /**
     * Creates a window node.
     *
     * @param child the child node
     * @param windowExpressions aliased window functions
     */
    public Window(LogicalPlan child, List<AliasExpression> windowExpressions) {
        super(child);
        Objects.requireNonNull(windowExpressions, "windowExpressions must not be null");
        List<AliasExpression> resolved = new ArrayList<>(windowExpressions.size());
        for (AliasExpression expr : windowExpressions) {
            if (!(expr.expression() instanceof WindowFunction)) {
                throw new InvalidOperationException("Window node expects window functions, got " + expr);
            }
            resolved.add((AliasExpression) ExpressionResolver.resolveWindow(expr, child.schema()));
        }
        this.windowExpressions = List.copyOf(resolved);
        schemaOf(new ArrayList<>(this.windowExpressions), nodeName());
    }

    public List<AliasExpression> windowExpressions() {
        return windowExpressions;
    }

    @Override
    protected StructType inferSchema() {
        StructType result = child().schema();
        for (AliasExpression expr : windowExpressions) {
            result = result.withField(new StructField(expr.outputName(), expr.dataType()));
        }
        return result;
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Window(newChildren.get(0), windowExpressions);
    }

    @Override
    public List<Expression> expressions() {
        return new ArrayList<>(windowExpressions);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        List<AliasExpression> mapped = new ArrayList<>(windowExpressions.size());
        boolean changed = false;
        for (AliasExpression expr : windowExpressions) {
            Expression next = fn.apply(expr);
            changed |= next != expr;
            mapped.add(next instanceof AliasExpression a ? a : new AliasExpression(next, expr.alias()));
        }
        return changed ? new Window(child(), mapped) : this;
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return child().estimatedRowCount();
    }

    @Override
    protected List<Object> parameters() {
        return List.of(windowExpressions);
    }

    @Override
    public String toString() {
        return String.format("Window(%s)", windowExpressions);
    }
}
