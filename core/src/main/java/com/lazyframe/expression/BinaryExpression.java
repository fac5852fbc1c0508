package com.lazyframe.expression;

import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.TypeCoercion;
import com.lazyframe.types.UnresolvedType;
import java.util.List;
import java.util.Objects;

/**
 * Expression representing a binary operation (operation with two operands).
 *
 * <p>Binary expressions include:
 * <ul>
 *   <li>Arithmetic: a + b, a - b, a * b, a / b, a // b, a % b</li>
 *   <li>Comparison: a &gt; b, a &gt;= b, a &lt; b, a &lt;= b, a == b, a != b</li>
 *   <li>Logical: a AND b, a OR b (three-valued)</li>
 *   <li>String: a + b on two strings concatenates</li>
 * </ul>
 *
 * <p>A null operand makes the result null, except for AND and OR: {@code false AND null}
 * is false and {@code true OR null} is true.
 */
public final class BinaryExpression implements Expression {

    /**
     * Binary operators.
     */
    public enum Operator {
        // Arithmetic operators
        ADD("+", "addition"),
        SUBTRACT("-", "subtraction"),
        MULTIPLY("*", "multiplication"),
        DIVIDE("/", "division"),
        FLOOR_DIVIDE("//", "floor division"),
        MODULO("%", "modulo"),

        // Comparison operators
        EQUAL("==", "equal"),
        NOT_EQUAL("!=", "not equal"),
        LESS_THAN("<", "less than"),
        LESS_THAN_OR_EQUAL("<=", "less than or equal"),
        GREATER_THAN(">", "greater than"),
        GREATER_THAN_OR_EQUAL(">=", "greater than or equal"),

        // Logical operators
        AND("&", "logical AND"),
        OR("|", "logical OR");

        private final String symbol;
        private final String description;

        Operator(String symbol, String description) {
            this.symbol = symbol;
            this.description = description;
        }

        public String symbol() {
            return symbol;
        }

        public String description() {
            return description;
        }

        public boolean isArithmetic() {
            return this == ADD || this == SUBTRACT || this == MULTIPLY ||
                   this == DIVIDE || this == FLOOR_DIVIDE || this == MODULO;
        }

        public boolean isComparison() {
            return this == EQUAL || this == NOT_EQUAL || this == LESS_THAN ||
                   this == LESS_THAN_OR_EQUAL || this == GREATER_THAN ||
                   this == GREATER_THAN_OR_EQUAL;
        }

        public boolean isLogical() {
            return this == AND || this == OR;
        }

        /**
         * Returns whether swapping the operands preserves the result.
         *
         * @return true for commutative operators
         */
        public boolean isCommutative() {
            return this == MULTIPLY || this == EQUAL || this == NOT_EQUAL
                || this == AND || this == OR;
        }
    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    /**
     * Creates a binary expression.
     *
     * @param left the left operand
     * @param operator the operator
     * @param right the right operand
     */
    public BinaryExpression(Expression left, Operator operator, Expression right) {
        this.left = Objects.requireNonNull(left, "left must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.right = Objects.requireNonNull(right, "right must not be null");
    }

    public Expression left() {
        return left;
    }

    public Operator operator() {
        return operator;
    }

    public Expression right() {
        return right;
    }

    @Override
    public DataType dataType() {
        return resultType(operator, left.dataType(), right.dataType());
    }

    /**
     * Computes the result type of an operator over two operand types.
     *
     * @param operator the operator
     * @param left the left operand type
     * @param right the right operand type
     * @return the result type, or {@link UnresolvedType} if the operator does not apply
     */
    public static DataType resultType(Operator operator, DataType left, DataType right) {
        if (left instanceof UnresolvedType || right instanceof UnresolvedType) {
            return UnresolvedType.get();
        }
        if (operator.isComparison()) {
            return TypeCoercion.commonSupertype(left, right).isPresent()
                ? BooleanType.get() : UnresolvedType.get();
        }
        if (operator.isLogical()) {
            boolean ok = (left instanceof BooleanType || left instanceof NullType)
                && (right instanceof BooleanType || right instanceof NullType);
            return ok ? BooleanType.get() : UnresolvedType.get();
        }
        if (operator == Operator.ADD && (left instanceof StringType || right instanceof StringType)) {
            boolean ok = (left instanceof StringType || left instanceof NullType)
                && (right instanceof StringType || right instanceof NullType);
            return ok ? StringType.get() : UnresolvedType.get();
        }
        DataType l = left instanceof NullType ? right : left;
        DataType r = right instanceof NullType ? left : right;
        if (l instanceof NullType && r instanceof NullType) {
            return operator == Operator.DIVIDE ? DoubleType.get() : NullType.get();
        }
        if (!TypeCoercion.isNumeric(l) || !TypeCoercion.isNumeric(r)) {
            return UnresolvedType.get();
        }
        DataType promoted = TypeCoercion.promoteNumeric(l, r);
        if (operator == Operator.DIVIDE && TypeCoercion.isIntegral(promoted)) {
            return DoubleType.get();
        }
        return promoted;
    }

    /**
     * Returns the type both operands are brought to before the operator applies.
     *
     * @return the operand type, or {@link UnresolvedType} if there is none
     */
    public DataType operandType() {
        DataType l = left.dataType();
        DataType r = right.dataType();
        if (operator.isLogical()) {
            return BooleanType.get();
        }
        DataType result = dataType();
        if (operator.isArithmetic()) {
            return result;
        }
        return TypeCoercion.commonSupertype(l, r).orElse(UnresolvedType.get());
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new BinaryExpression(children.get(0), operator, children.get(1));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof BinaryExpression)) return false;
        BinaryExpression that = (BinaryExpression) obj;
        return operator == that.operator && left.equals(that.left) && right.equals(that.right);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, operator, right);
    }

    @Override
    public String toString() {
        return String.format("[(%s) %s (%s)]", left, operator.symbol(), right);
    }
}
