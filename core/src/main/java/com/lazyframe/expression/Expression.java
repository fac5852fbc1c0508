package com.lazyframe.expression;

import com.lazyframe.types.DataType;
import java.util.Arrays;
import java.util.List;

/**
 * Base interface for all expressions.
 *
 * <p>Expressions represent computations that produce a column from a batch, such as:
 * <ul>
 *   <li>Literals (constants)</li>
 *   <li>Column references</li>
 *   <li>Arithmetic operations (a + b, a * b)</li>
 *   <li>Comparison operations (a &gt; b, a == b)</li>
 *   <li>Function calls (upper(name), abs(value))</li>
 *   <li>Aggregates (sum(v)) and window functions (sum(v).over(k))</li>
 * </ul>
 *
 * <p>Expressions are immutable trees with structural equality, which is what common
 * subexpression elimination and subplan comparison rely on. An expression is built
 * unresolved (column names only) and resolved against an input schema by
 * {@link com.lazyframe.expression.eval.ExpressionResolver} when it is attached to a plan;
 * {@link #dataType()} of an unresolved expression is
 * {@link com.lazyframe.types.UnresolvedType}.
 */
public sealed interface Expression
    permits UnresolvedColumn, ColumnReference, Literal, BinaryExpression, UnaryExpression,
            FunctionCall, AggregateExpression, WindowFunction, CastExpression, SortOrder,
            AliasExpression, CaseWhenExpression, InExpression {

    /**
     * Returns the data type of the value produced by this expression.
     *
     * @return the data type
     */
    DataType dataType();

    /**
     * Returns the direct child expressions, in evaluation order.
     *
     * @return the children
     */
    List<Expression> children();

    /**
     * Returns a copy of this node with new children, in the order of {@link #children()}.
     *
     * @param children the replacement children
     * @return the rebuilt expression
     */
    Expression withChildren(List<Expression> children);

    /**
     * Returns the name of the column this expression produces when it is selected.
     *
     * <p>An alias names its output; otherwise the leftmost leaf decides: a column keeps its
     * name and a literal is called {@code literal}.
     *
     * @return the output name
     */
    default String outputName() {
        List<Expression> children = children();
        return children.isEmpty() ? "literal" : children.get(0).outputName();
    }

    // ------------------------------------------------------------------------
    // Fluent construction
    // ------------------------------------------------------------------------

    default Expression eq(Object other) {
        return binary(BinaryExpression.Operator.EQUAL, other);
    }

    default Expression neq(Object other) {
        return binary(BinaryExpression.Operator.NOT_EQUAL, other);
    }

    default Expression gt(Object other) {
        return binary(BinaryExpression.Operator.GREATER_THAN, other);
    }

    default Expression gtEq(Object other) {
        return binary(BinaryExpression.Operator.GREATER_THAN_OR_EQUAL, other);
    }

    default Expression lt(Object other) {
        return binary(BinaryExpression.Operator.LESS_THAN, other);
    }

    default Expression ltEq(Object other) {
        return binary(BinaryExpression.Operator.LESS_THAN_OR_EQUAL, other);
    }

    default Expression and(Object other) {
        return binary(BinaryExpression.Operator.AND, other);
    }

    default Expression or(Object other) {
        return binary(BinaryExpression.Operator.OR, other);
    }

    default Expression plus(Object other) {
        return binary(BinaryExpression.Operator.ADD, other);
    }

    default Expression minus(Object other) {
        return binary(BinaryExpression.Operator.SUBTRACT, other);
    }

    default Expression times(Object other) {
        return binary(BinaryExpression.Operator.MULTIPLY, other);
    }

    default Expression div(Object other) {
        return binary(BinaryExpression.Operator.DIVIDE, other);
    }

    default Expression floorDiv(Object other) {
        return binary(BinaryExpression.Operator.FLOOR_DIVIDE, other);
    }

    default Expression mod(Object other) {
        return binary(BinaryExpression.Operator.MODULO, other);
    }

    default Expression not() {
        return new UnaryExpression(UnaryExpression.Operator.NOT, this);
    }

    default Expression negate() {
        return new UnaryExpression(UnaryExpression.Operator.NEGATE, this);
    }

    default Expression isNull() {
        return new UnaryExpression(UnaryExpression.Operator.IS_NULL, this);
    }

    default Expression isNotNull() {
        return new UnaryExpression(UnaryExpression.Operator.IS_NOT_NULL, this);
    }

    default Expression isIn(Object... values) {
        return new InExpression(this, Arrays.stream(values).map(Literal::lift).toList());
    }

    default Expression alias(String name) {
        return new AliasExpression(this, name);
    }

    default Expression cast(DataType type) {
        return new CastExpression(this, type, true);
    }

    default Expression cast(DataType type, boolean strict) {
        return new CastExpression(this, type, strict);
    }

    default SortOrder asc() {
        return new SortOrder(this, false, false);
    }

    default SortOrder desc() {
        return new SortOrder(this, true, false);
    }

    default AggregateExpression sum() {
        return new AggregateExpression(AggregateExpression.Function.SUM, this);
    }

    default AggregateExpression mean() {
        return new AggregateExpression(AggregateExpression.Function.MEAN, this);
    }

    default AggregateExpression min() {
        return new AggregateExpression(AggregateExpression.Function.MIN, this);
    }

    default AggregateExpression max() {
        return new AggregateExpression(AggregateExpression.Function.MAX, this);
    }

    default AggregateExpression count() {
        return new AggregateExpression(AggregateExpression.Function.COUNT, this);
    }

    default AggregateExpression first() {
        return new AggregateExpression(AggregateExpression.Function.FIRST, this);
    }

    default AggregateExpression last() {
        return new AggregateExpression(AggregateExpression.Function.LAST, this);
    }

    default AggregateExpression nUnique() {
        return new AggregateExpression(AggregateExpression.Function.N_UNIQUE, this);
    }

    /**
     * Evaluates this expression as a window over partitions of the given keys.
     *
     * <p>Applies to aggregates (broadcast over the partition) and to the
     * cumulative and ranking builders in {@link WindowFunction}.
     *
     * @param partitionBy partition keys (column names or expressions)
     * @return the window expression
     */
    default WindowFunction over(Object... partitionBy) {
        List<Expression> keys = Arrays.stream(partitionBy).map(Literal::liftColumn).toList();
        if (this instanceof WindowFunction window) {
            return window.withPartitionBy(keys);
        }
        return new WindowFunction(WindowFunction.Kind.AGGREGATE, this, 0, keys, List.of());
    }

    private Expression binary(BinaryExpression.Operator operator, Object other) {
        return new BinaryExpression(this, operator, Literal.lift(other));
    }
}
