package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.List;
import java.util.Objects;

/**
 * Converts its operand to a target type.
 *
 * <p>A strict cast raises a compute error for values that cannot be converted (for example
 * an unparseable string); a non-strict cast turns them into nulls.
 */
public final class CastExpression implements Expression {

    private final Expression expression;
    private final DataType targetType;
    private final boolean strict;

    public CastExpression(Expression expression, DataType targetType, boolean strict) {
        this.expression = Objects.requireNonNull(expression, "expression must not be null");
        this.targetType = Objects.requireNonNull(targetType, "targetType must not be null");
        this.strict = strict;
    }

    public Expression expression() {
        return expression;
    }

    public DataType targetType() {
        return targetType;
    }

    public boolean strict() {
        return strict;
    }

    @Override
    public DataType dataType() {
        return targetType;
    }

    @Override
    public List<Expression> children() {
        return List.of(expression);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new CastExpression(children.get(0), targetType, strict);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CastExpression)) return false;
        CastExpression that = (CastExpression) obj;
        return strict == that.strict && expression.equals(that.expression)
            && targetType.equals(that.targetType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, targetType, strict);
    }

    @Override
    public String toString() {
        return expression + (strict ? ".strict_cast(" : ".cast(") + targetType + ")";
    }
}
