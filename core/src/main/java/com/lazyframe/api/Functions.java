package com.lazyframe.api;

import com.lazyframe.exception.InvalidOperationException;
import com.lazyframe.expression.AggregateExpression;
import com.lazyframe.expression.CaseWhenExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.FunctionCall;
import com.lazyframe.expression.Literal;
import com.lazyframe.expression.UnresolvedColumn;
import com.lazyframe.expression.WindowFunction;
import com.lazyframe.functions.FunctionRegistry;
import com.lazyframe.types.DataType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Static builders for expressions.
 *
 * <p>Intended for static import:
 * <pre>
 *   import static com.lazyframe.api.Functions.*;
 *
 *   frame.filter(col("amount").gt(100))
 *        .withColumns(when(col("amount").gt(1000)).then("large").otherwise("small").alias("size"))
 * </pre>
 */
public final class Functions {

    private Functions() {
        // Utility class - prevent instantiation
    }

    // ==================== Columns and literals ====================

    public static Expression col(String name) {
        return new UnresolvedColumn(name);
    }

    public static List<Expression> cols(String... names) {
        return Arrays.stream(names).map(Functions::col).toList();
    }

    public static Expression lit(Object value) {
        return Literal.lift(value);
    }

    public static Expression nullLit(DataType type) {
        return Literal.nullOf(type);
    }

    // ==================== Aggregates ====================

    /**
     * Counts the rows of each group, nulls included. Output column {@code len}.
     *
     * @return the aggregate
     */
    public static AggregateExpression len() {
        return new AggregateExpression(AggregateExpression.Function.LEN, Literal.of(1));
    }

    public static AggregateExpression sum(Object column) {
        return aggregate(AggregateExpression.Function.SUM, column);
    }

    public static AggregateExpression mean(Object column) {
        return aggregate(AggregateExpression.Function.MEAN, column);
    }

    public static AggregateExpression min(Object column) {
        return aggregate(AggregateExpression.Function.MIN, column);
    }

    public static AggregateExpression max(Object column) {
        return aggregate(AggregateExpression.Function.MAX, column);
    }

    public static AggregateExpression count(Object column) {
        return aggregate(AggregateExpression.Function.COUNT, column);
    }

    public static AggregateExpression first(Object column) {
        return aggregate(AggregateExpression.Function.FIRST, column);
    }

    public static AggregateExpression last(Object column) {
        return aggregate(AggregateExpression.Function.LAST, column);
    }

    public static AggregateExpression nUnique(Object column) {
        return aggregate(AggregateExpression.Function.N_UNIQUE, column);
    }

    /** Sample standard deviation (one delta degree of freedom). */
    public static AggregateExpression std(Object column) {
        return aggregate(AggregateExpression.Function.STD, column);
    }

    /** Sample variance (one delta degree of freedom). */
    public static AggregateExpression var(Object column) {
        return aggregate(AggregateExpression.Function.VAR, column);
    }

    public static AggregateExpression median(Object column) {
        return aggregate(AggregateExpression.Function.MEDIAN, column);
    }

    private static AggregateExpression aggregate(AggregateExpression.Function function, Object column) {
        return new AggregateExpression(function, Literal.liftColumn(column));
    }

    // ==================== Window functions ====================

    public static WindowFunction rowNumber() {
        return WindowFunction.of(WindowFunction.Kind.ROW_NUMBER, null, 0);
    }

    public static WindowFunction rank() {
        return WindowFunction.of(WindowFunction.Kind.RANK, null, 0);
    }

    public static WindowFunction denseRank() {
        return WindowFunction.of(WindowFunction.Kind.DENSE_RANK, null, 0);
    }

    /**
     * Value of the row {@code offset} rows before the current one in its partition.
     *
     * @param column column name or expression
     * @param offset a positive row offset
     * @return the window function, to be completed with {@code over(...)}
     */
    public static WindowFunction lag(Object column, int offset) {
        return WindowFunction.of(WindowFunction.Kind.LAG, Literal.liftColumn(column), offset);
    }

    public static WindowFunction lead(Object column, int offset) {
        return WindowFunction.of(WindowFunction.Kind.LEAD, Literal.liftColumn(column), offset);
    }

    public static WindowFunction firstValue(Object column) {
        return WindowFunction.of(WindowFunction.Kind.FIRST_VALUE, Literal.liftColumn(column), 0);
    }

    public static WindowFunction lastValue(Object column) {
        return WindowFunction.of(WindowFunction.Kind.LAST_VALUE, Literal.liftColumn(column), 0);
    }

    public static WindowFunction cumSum(Object column) {
        return WindowFunction.of(WindowFunction.Kind.CUM_SUM, Literal.liftColumn(column), 0);
    }

    public static WindowFunction cumCount(Object column) {
        return WindowFunction.of(WindowFunction.Kind.CUM_COUNT, Literal.liftColumn(column), 0);
    }

    public static WindowFunction cumMin(Object column) {
        return WindowFunction.of(WindowFunction.Kind.CUM_MIN, Literal.liftColumn(column), 0);
    }

    public static WindowFunction cumMax(Object column) {
        return WindowFunction.of(WindowFunction.Kind.CUM_MAX, Literal.liftColumn(column), 0);
    }

    // ==================== Scalar functions ====================

    /**
     * Calls a function of the {@link FunctionRegistry} by name.
     *
     * @param name the function name (case-insensitive)
     * @param args column expressions or plain values
     * @return the call
     * @throws InvalidOperationException if no function of that name is registered
     */
    public static Expression call(String name, Object... args) {
        Objects.requireNonNull(name, "name must not be null");
        if (!FunctionRegistry.isSupported(name)) {
            throw new InvalidOperationException("unknown function: " + name
                + " (known: " + FunctionRegistry.functionNames() + ")");
        }
        List<Expression> arguments = new ArrayList<>(args.length);
        for (Object arg : args) {
            arguments.add(Literal.lift(arg));
        }
        return new FunctionCall(name, arguments);
    }

    public static Expression upper(Object column) {
        return call("upper", Literal.liftColumn(column));
    }

    public static Expression lower(Object column) {
        return call("lower", Literal.liftColumn(column));
    }

    public static Expression abs(Object column) {
        return call("abs", Literal.liftColumn(column));
    }

    public static Expression round(Object column, int decimals) {
        return call("round", Literal.liftColumn(column), decimals);
    }

    public static Expression coalesce(Object... values) {
        return call("coalesce", values);
    }

    public static Expression year(Object column) {
        return call("year", Literal.liftColumn(column));
    }

    // ==================== Conditionals ====================

    /**
     * Starts a {@code when/then/otherwise} chain.
     *
     * @param condition the first condition
     * @return the pending branch
     */
    public static When when(Expression condition) {
        return new When(new ArrayList<>(), Objects.requireNonNull(condition, "condition must not be null"));
    }

    /**
     * A condition waiting for its value.
     */
    public static final class When {
        private final List<CaseWhenExpression.Branch> branches;
        private final Expression condition;

        private When(List<CaseWhenExpression.Branch> branches, Expression condition) {
            this.branches = branches;
            this.condition = condition;
        }

        public Then then(Object value) {
            List<CaseWhenExpression.Branch> next = new ArrayList<>(branches);
            next.add(new CaseWhenExpression.Branch(condition, Literal.lift(value)));
            return new Then(next);
        }
    }

    /**
     * A chain with at least one complete branch.
     */
    public static final class Then {
        private final List<CaseWhenExpression.Branch> branches;

        private Then(List<CaseWhenExpression.Branch> branches) {
            this.branches = branches;
        }

        public When when(Expression condition) {
            return new When(branches, Objects.requireNonNull(condition, "condition must not be null"));
        }

        public Expression otherwise(Object value) {
            return new CaseWhenExpression(branches, Literal.lift(value));
        }

        /**
         * Completes the chain with a null default.
         *
         * @return the conditional expression
         */
        public Expression otherwiseNull() {
            return new CaseWhenExpression(branches, Literal.of(null));
        }
    }
}
