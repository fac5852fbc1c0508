package com.lazyframe.logical;

import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.eval.ExpressionResolver;
import com.lazyframe.types.StructType;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;

/**
 * Logical plan node representing a projection (select).
 *
 * <p>Every output column is an expression evaluated row-wise over the child; output names
 * must be unique. Row order and row count are preserved.
 *
 * <p>Examples:
 * <pre>
 *   lf.select(col("name"), col("age").plus(1).alias("next_age"))
 * </pre>
 */
public final class Project extends LogicalPlan {

    private final List<Expression> projections;

    /**
     * Creates a projection node.
     *
     * @param child the child node
     * @param projections the output expressions
     */
    public Project(LogicalPlan child, List<Expression> projections) {
        super(child);
        Objects.requireNonNull(projections, "projections must not be null");
        this.projections = List.copyOf(ExpressionResolver.resolveAll(projections, child.schema()));
    }

    /**
     * Creates a projection that keeps the named columns of its child.
     *
     * @param child the child node
     * @param columns the column names
     * @return the projection
     */
    public static Project columns(LogicalPlan child, List<String> columns) {
        StructType schema = child.schema();
        return new Project(child, columns.stream()
            .map(name -> (Expression) new ColumnReference(
                name, schema.field(name).dataType()))
            .toList());
    }

    public List<Expression> projections() {
        return projections;
    }

    /**
     * Returns true if every output is a bare reference to a child column with the same name.
     *
     * @return true for a pure column selection
     */
    public boolean isColumnSelection() {
        for (Expression expr : projections) {
            if (!(expr instanceof ColumnReference)) {
                return false;
            }
        }
        return true;
    }

    @Override
    protected StructType inferSchema() {
        return schemaOf(projections, nodeName());
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        return new Project(newChildren.get(0), projections);
    }

    @Override
    public List<Expression> expressions() {
        return projections;
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        List<Expression> mapped = mapAll(projections, fn);
        return sameExpressions(mapped, projections) ? this : new Project(child(), mapped);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        return child().estimatedRowCount();
    }

    @Override
    protected List<Object> parameters() {
        return List.of(projections);
    }

    @Override
    public String toString() {
        return String.format("Project(%s)", projections);
    }
}
