package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Names the output of an expression.
 *
 * <p>Example:
 * <pre>
 *   col("price").times(col("qty")).alias("total")
 * </pre>
 */
public final class AliasExpression implements Expression {

    private final Expression expression;
    private final String alias;

    public AliasExpression(Expression expression, String alias) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.alias = Objects.requireNonNull(alias, "alias must not be null");
        if (alias.isEmpty()) {
            throw new IllegalArgumentException("alias must not be empty");
        }
    }

    public Expression expression() {
        return expression;
    }

    public String alias() {
        return alias;
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
        return new AliasExpression(children.get(0), alias);
    }

    @Override
    public String outputName() {
        return alias;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AliasExpression)) return false;
        AliasExpression that = (AliasExpression) obj;
        return alias.equals(that.alias) && expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, alias);
    }

    @Override
    public String toString() {
        return expression + ".alias(\"" + alias + "\")";
    }
}
