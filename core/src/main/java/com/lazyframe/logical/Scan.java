package com.lazyframe.logical;

import com.lazyframe.expression.Expression;
import com.lazyframe.expression.eval.ExpressionResolver;
import com.lazyframe.source.DataSource;
import com.lazyframe.types.StructType;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.function.UnaryOperator;

/**
 * Logical plan node that reads a {@link DataSource}.
 *
 * <p>Besides the source, a scan carries the pushed-down operations the optimizer moved into
 * it, applied in this order: the predicate (over all source columns), the projection, then
 * the row limit. The executor applies all three itself; the source receives them only as
 * hints.
 */
public final class Scan extends LogicalPlan {

    private final DataSource source;
    private final List<String> projection;
    private final Expression predicate;
    private final long rowLimit;

    /**
     * Creates a scan of every row and column.
     *
     * @param source the data source
     */
    public Scan(DataSource source) {
        this(source, null, null, -1);
    }

    /**
     * Creates a scan with pushed-down operations.
     *
     * @param source the data source
     * @param projection the columns to keep, or null for all
     * @param predicate a row predicate over the source columns, or null
     * @param rowLimit the maximum number of rows, or -1 for no limit
     */
    public Scan(DataSource source, List<String> projection, Expression predicate, long rowLimit) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.projection = projection == null ? null : List.copyOf(projection);
        this.predicate = predicate == null ? null
            : ExpressionResolver.resolvePredicate(predicate, source.schema());
        this.rowLimit = rowLimit < 0 ? -1 : rowLimit;
        if (this.projection != null) {
            source.schema().select(this.projection);
        }
    }

    public DataSource source() {
        return source;
    }

    /**
     * Returns the projected columns.
     *
     * @return the column names, or null when every column is read
     */
    public List<String> projection() {
        return projection;
    }

    public Expression predicate() {
        return predicate;
    }

    public long rowLimit() {
        return rowLimit;
    }

    public Scan withProjection(List<String> columns) {
        return new Scan(source, columns, predicate, rowLimit);
    }

    public Scan withPredicate(Expression newPredicate) {
        return new Scan(source, projection, newPredicate, rowLimit);
    }

    public Scan withRowLimit(long limit) {
        return new Scan(source, projection, predicate, limit);
    }

    @Override
    protected StructType inferSchema() {
        return projection == null ? source.schema() : source.schema().select(projection);
    }

    @Override
    public LogicalPlan withChildren(List<LogicalPlan> newChildren) {
        if (!newChildren.isEmpty()) {
            throw new IllegalArgumentException("Scan takes no children");
        }
        return this;
    }

    @Override
    public List<Expression> expressions() {
        return predicate == null ? List.of() : List.of(predicate);
    }

    @Override
    public LogicalPlan mapExpressions(UnaryOperator<Expression> fn) {
        if (predicate == null) {
            return this;
        }
        Expression mapped = fn.apply(predicate);
        return mapped == predicate ? this : withPredicate(mapped);
    }

    @Override
    public OptionalLong estimatedRowCount() {
        OptionalLong estimate = source.estimatedRowCount();
        if (rowLimit < 0) {
            return estimate;
        }
        return OptionalLong.of(estimate.isPresent() ? Math.min(estimate.getAsLong(), rowLimit) : rowLimit);
    }

    @Override
    protected List<Object> parameters() {
        return Arrays.asList(new SourceIdentity(source), projection, predicate, rowLimit);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Scan(").append(source.name());
        if (projection != null) {
            sb.append(", projection=").append(projection);
        }
        if (predicate != null) {
            sb.append(", predicate=").append(predicate);
        }
        if (rowLimit >= 0) {
            sb.append(", limit=").append(rowLimit);
        }
        return sb.append(')').toString();
    }

    /**
     * Compares data sources by identity.
     */
    private record SourceIdentity(DataSource source) {
        @Override
        public boolean equals(Object obj) {
            return obj instanceof SourceIdentity other && other.source == source;
        }

        @Override
        public int hashCode() {
            return System.identityHashCode(source);
        }
    }
}
