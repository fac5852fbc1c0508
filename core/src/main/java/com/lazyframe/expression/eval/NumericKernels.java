package com.lazyframe.expression.eval;

import com.lazyframe.data.Column;
import com.lazyframe.expression.BinaryExpression.Operator;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.LongType;

/**
 * Binary arithmetic and comparison over int32, int64 and float64 columns, read and
 * written as primitives.
 *
 * <p>Results are identical to the per-value operations in {@link com.lazyframe.data.ValueOps}:
 * int32 arithmetic wraps at 32 bits, integral floor division and modulo by zero give
 * null, and float comparison orders NaN last with negative zero equal to zero.
 */
final class NumericKernels {

    private NumericKernels() {
        // Utility class - prevent instantiation
    }

    /**
     * Whether an operator over operands of the given type has a primitive kernel.
     *
     * @param op the operator
     * @param operandType the common operand type
     * @param resultType the result type
     * @return true if {@link #apply} handles it
     */
    static boolean supports(Operator op, DataType operandType, DataType resultType) {
        boolean integral = operandType instanceof LongType || operandType instanceof IntegerType;
        boolean floating = operandType instanceof DoubleType;
        if (op.isLogical() || !(integral || floating)) {
            return false;
        }
        return !op.isArithmetic() || resultType.equals(operandType);
    }

    /**
     * Applies an operator row by row. A null operand gives a null result.
     *
     * @param op the operator
     * @param left the left operand, of the operand type
     * @param right the right operand, of the operand type
     * @param name the result column name
     * @param resultType the result type
     * @return the result column
     */
    static Column apply(Operator op, Column left, Column right, String name, DataType resultType) {
        int rows = left.size();
        Column.Builder out = Column.builder(name, resultType, rows);
        boolean integral = left.dataType() instanceof LongType || left.dataType() instanceof IntegerType;
        for (int i = 0; i < rows; i++) {
            if (left.isNull(i) || right.isNull(i)) {
                continue;
            }
            if (integral) {
                integral(op, left.getLong(i), right.getLong(i), out, i);
            } else {
                floating(op, left.getDouble(i), right.getDouble(i), out, i);
            }
        }
        return out.build();
    }

    private static void integral(Operator op, long a, long b, Column.Builder out, int row) {
        switch (op) {
            case ADD -> out.setLong(row, a + b);
            case SUBTRACT -> out.setLong(row, a - b);
            case MULTIPLY -> out.setLong(row, a * b);
            case FLOOR_DIVIDE -> {
                if (b != 0) {
                    out.setLong(row, Math.floorDiv(a, b));
                }
            }
            case MODULO -> {
                if (b != 0) {
                    out.setLong(row, Math.floorMod(a, b));
                }
            }
            case DIVIDE -> throw new IllegalStateException("true division has a floating result type");
            default -> out.setBoolean(row, compares(op, Long.compare(a, b)));
        }
    }

    private static void floating(Operator op, double a, double b, Column.Builder out, int row) {
        switch (op) {
            case ADD -> out.setDouble(row, a + b);
            case SUBTRACT -> out.setDouble(row, a - b);
            case MULTIPLY -> out.setDouble(row, a * b);
            case DIVIDE -> out.setDouble(row, a / b);
            case FLOOR_DIVIDE -> out.setDouble(row, Math.floor(a / b));
            case MODULO -> out.setDouble(row, a - Math.floor(a / b) * b);
            default -> out.setBoolean(row, compares(op, Double.compare(normalizeZero(a), normalizeZero(b))));
        }
    }

    private static boolean compares(Operator op, int c) {
        return switch (op) {
            case EQUAL -> c == 0;
            case NOT_EQUAL -> c != 0;
            case LESS_THAN -> c < 0;
            case LESS_THAN_OR_EQUAL -> c <= 0;
            case GREATER_THAN -> c > 0;
            case GREATER_THAN_OR_EQUAL -> c >= 0;
            default -> throw new IllegalStateException("not a comparison: " + op);
        };
    }

    private static double normalizeZero(double d) {
        return d == 0.0 ? 0.0 : d;
    }
}
