package com.lazyframe.expression;

import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.TypeCoercion;
import com.lazyframe.types.UnresolvedType;
import java.util.List;
import java.util.Objects;

/**
 * An aggregate function over the rows of a group.
 *
 * <p>Aggregates are only valid inside a group-by aggregation or a window. Nulls are
 * skipped by most aggregates; see {@link com.lazyframe.expression.eval.Accumulators} for
 * the exceptions.
 */
public final class AggregateExpression implements Expression {

    /**
     * Aggregate functions.
     */
    public enum Function {
        SUM("sum", true),
        MEAN("mean", true),
        MIN("min", true),
        MAX("max", true),
        COUNT("count", true),
        LEN("len", true),
        FIRST("first", true),
        LAST("last", true),
        N_UNIQUE("n_unique", false),
        STD("std", true),
        VAR("var", true),
        MEDIAN("median", false);

        private final String functionName;
        private final boolean mergeable;

        Function(String functionName, boolean mergeable) {
            this.functionName = functionName;
            this.mergeable = mergeable;
        }

        public String functionName() {
            return functionName;
        }

        /**
         * Whether partial states computed over disjoint morsels can be merged with bounded
         * state, which is what streaming partial aggregation needs.
         *
         * @return true if mergeable
         */
        public boolean isMergeable() {
            return mergeable;
        }

        /**
         * Whether the function needs a numeric (or boolean) input.
         *
         * @return true for numeric-only aggregates
         */
        public boolean requiresNumeric() {
            return this == SUM || this == MEAN || this == STD || this == VAR || this == MEDIAN;
        }

        public boolean requiresOrderable() {
            return this == MIN || this == MAX;
        }
    }

    private final Function function;
    private final Expression argument;

    public AggregateExpression(Function function, Expression argument) {
        this.function = Objects.requireNonNull(function, "function must not be null");
        this.argument = Objects.requireNonNull(argument, "argument must not be null");
    }

    public Function function() {
        return function;
    }

    public Expression argument() {
        return argument;
    }

    @Override
    public DataType dataType() {
        return resultType(function, argument.dataType());
    }

    /**
     * Computes the result type of an aggregate over an input type.
     *
     * @param function the aggregate function
     * @param input the input type
     * @return the result type
     */
    public static DataType resultType(Function function, DataType input) {
        if (input instanceof UnresolvedType) {
            return input;
        }
        return switch (function) {
            case COUNT, LEN, N_UNIQUE -> LongType.get();
            case MEAN, STD, VAR, MEDIAN -> DoubleType.get();
            case SUM -> TypeCoercion.isIntegral(input) || input instanceof BooleanType
                || input instanceof NullType ? LongType.get() : input;
            case MIN, MAX, FIRST, LAST -> input;
        };
    }

    @Override
    public List<Expression> children() {
        return List.of(argument);
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        return new AggregateExpression(function, children.get(0));
    }

    @Override
    public String outputName() {
        return function == Function.LEN ? "len" : argument.outputName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AggregateExpression)) return false;
        AggregateExpression that = (AggregateExpression) obj;
        return function == that.function && argument.equals(that.argument);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, argument);
    }

    @Override
    public String toString() {
        return argument + "." + function.functionName() + "()";
    }
}
