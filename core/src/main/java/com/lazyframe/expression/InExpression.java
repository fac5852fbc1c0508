package com.lazyframe.expression;

import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Membership test: {@code value IN (v1, v2, ...)}.
 *
 * <p>A null value yields null. A value that matches no option yields false, or null when
 * one of the options is null.
 */
public final class InExpression implements Expression {

    private final Expression value;
    private final List<Expression> options;

    public InExpression(Expression value, List<Expression> options) {
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.options = List.copyOf(Objects.requireNonNull(options, "options must not be null"));
    }

    public Expression value() {
        return value;
    }

    public List<Expression> options() {
        return options;
    }

    @Override
    public DataType dataType() {
        return BooleanType.get();
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>(options.size() + 1);
        children.add(value);
        children.addAll(options);
        return children;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new InExpression(children.get(0), children.subList(1, children.size()));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof InExpression)) return false;
        InExpression that = (InExpression) obj;
        return value.equals(that.value) && options.equals(that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, options);
    }

    @Override
    public String toString() {
        return value + ".is_in(" + options + ")";
    }
}
