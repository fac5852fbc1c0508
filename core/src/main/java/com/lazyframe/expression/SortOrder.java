package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * A sort key: an expression with a direction and a null placement.
 *
 * <p>Nulls sort first unless {@code nullsLast} is set, independent of the direction.
 */
public final class SortOrder implements Expression {

    private final Expression expression;
    private final boolean descending;
    private final boolean nullsLast;

    public SortOrder(Expression expression, boolean descending, boolean nullsLast) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.descending = descending;
        this.nullsLast = nullsLast;
    }

    public Expression expression() {
        return expression;
    }

    public boolean descending() {
        return descending;
    }

    public boolean nullsLast() {
        return nullsLast;
    }

    /**
     * Returns a copy that places nulls after all other values.
     *
     * @return the sort order
     */
    public SortOrder withNullsLast() {
        return new SortOrder(expression, descending, true);
    }

    @Override
    public DataType dataType() {
        return expression.dataType();
    }

    @Override
    public List<Expression> children() {
        return List.of(expression);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new SortOrder(children.get(0), descending, nullsLast);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SortOrder)) return false;
        SortOrder that = (SortOrder) obj;
        return descending == that.descending && nullsLast == that.nullsLast
            && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, descending, nullsLast);
    }

    @Override
    public String toString() {
        return expression + (descending ? " DESC" : " ASC") + (nullsLast ? " NULLS LAST" : "");
    }
}
