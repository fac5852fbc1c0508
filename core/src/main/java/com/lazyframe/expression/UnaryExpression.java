package com.lazyframe.expression;

import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.TypeCoercion;
import com.lazyframe.types.UnresolvedType;
import java.util.List;
import java.util.Objects;

/**
 * Expression with a single operand: logical negation, arithmetic negation and null tests.
 */
public final class UnaryExpression implements Expression {

    /**
     * Unary operators.
     */
    public enum Operator {
        NOT("not"),
        NEGATE("-"),
        IS_NULL("is_null"),
        IS_NOT_NULL("is_not_null");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * Null tests never produce null; the other operators propagate it.
         *
         * @return true if a null operand yields null
         */
        public boolean propagatesNull() {
            return this == NOT || this == NEGATE;
        }
    }

    private final Operator operator;
    private final Expression operand;

    public UnaryExpression(Operator operator, Expression operand) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.operand = Objects.requireNonNull(operand, "operand must not be null");
    }

    public Operator operator() {
        return operator;
    }

    public Expression operand() {
        return operand;
    }

    @Override
    public DataType dataType() {
        DataType type = operand.dataType();
        if (type instanceof UnresolvedType) {
            return type;
        }
        return switch (operator) {
            case IS_NULL, IS_NOT_NULL -> BooleanType.get();
            case NOT -> type instanceof BooleanType || type instanceof NullType
                ? BooleanType.get() : UnresolvedType.get();
            case NEGATE -> TypeCoercion.isNumeric(type) || type instanceof NullType
                ? type : UnresolvedType.get();
        };
    }

    @Override
    public List<Expression> children() {
        return List.of(operand);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new UnaryExpression(operator, children.get(0));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof UnaryExpression)) return false;
        UnaryExpression that = (UnaryExpression) obj;
        return operator == that.operator && operand.equals(that.operand);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operand);
    }

    @Override
    public String toString() {
        return operator == Operator.NEGATE
            ? "-(" + operand + ")"
            : operand + "." + operator.symbol() + "()";
    }
}
