package com.lazyframe.optimizer;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.LazyFrameException;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.CastExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.Literal;
import com.lazyframe.expression.SortOrder;
import com.lazyframe.expression.UnaryExpression;
import com.lazyframe.expression.UnresolvedColumn;
import com.lazyframe.expression.eval.ExpressionCompiler;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.ListType;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeCoercion;
import com.lazyframe.types.UnresolvedType;
import java.util.List;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simplifies expressions without changing their results.
 *
 * <p>Rewrites applied bottom-up:
 * <ul>
 *   <li>Constant folding: a pure subtree without column references is evaluated once
 *       and replaced by its value</li>
 *   <li>Boolean identities: {@code x & true -> x}, {@code x | false -> x},
 *       {@code not(not(x)) -> x}, and {@code x & false -> false}, {@code x | true -> true}
 *       when {@code x} cannot fail</li>
 *   <li>Null propagation: arithmetic and comparisons with a null literal become null</li>
 *   <li>Algebraic identities on integers: {@code x + 0}, {@code x - 0}, {@code x * 1},
 *       {@code -(-x)}</li>
 *   <li>Casts to the type the operand already has are removed</li>
 * </ul>
 *
 * <p>A filter whose predicate folds to {@code true} is removed. A constant subtree whose
 * evaluation fails (for example a strict cast of an unparseable string) is left in place
 * so that the error is raised when the query runs.
 */
public class SimplifyExpressionsRule implements OptimizationRule {

    private static final Logger logger = LoggerFactory.getLogger(SimplifyExpressionsRule.class);

    private static final ColumnarBatch SINGLE_ROW = new ColumnarBatch(StructType.EMPTY, List.of(), 1);

    private final UnaryOperator<Expression> rewrite = ExpressionRewrites.bottomUp(this::simplify);

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> {
            LogicalPlan simplified = node.mapExpressions(rewrite);
            if (simplified instanceof Filter filter && isTrue(filter.condition())) {
                return filter.child();
            }
            return simplified;
        });
    }

    private Expression simplify(Expression expr) {
        if (isFoldable(expr)) {
            Expression folded = fold(expr);
            if (folded != expr) {
                return folded;
            }
        }
        if (expr instanceof BinaryExpression bin) {
            return simplifyBinary(bin);
        }
        if (expr instanceof UnaryExpression unary) {
            return simplifyUnary(unary);
        }
        if (expr instanceof CastExpression cast && cast.expression().dataType().equals(cast.targetType())) {
            return cast.expression();
        }
        return expr;
    }

    // ==================== Constant folding ====================

    private static boolean isFoldable(Expression expr) {
        if (expr instanceof Literal || expr instanceof AliasExpression || expr instanceof SortOrder) {
            return false;
        }
        DataType type = expr.dataType();
        if (type instanceof UnresolvedType || type instanceof ListType) {
            return false;
        }
        boolean readsColumns = ExpressionUtils.anyMatch(expr,
            e -> e instanceof ColumnReference || e instanceof UnresolvedColumn);
        return !readsColumns && ExpressionUtils.isPure(expr);
    }

    private static Expression fold(Expression expr) {
        try {
            Column result = ExpressionCompiler.compile(expr).evaluate(SINGLE_ROW);
            return new Literal(result.get(0), expr.dataType());
        } catch (LazyFrameException e) {
            logger.debug("Not folding {}: {}", expr, e.getMessage());
            return expr;
        }
    }

    // ==================== Identities ====================

    private static Expression simplifyBinary(BinaryExpression bin) {
        Expression left = bin.left();
        Expression right = bin.right();
        boolean booleans = left.dataType() instanceof BooleanType && right.dataType() instanceof BooleanType;
        switch (bin.operator()) {
            case AND:
                if (!booleans) return bin;
                if (isTrue(left)) return right;
                if (isTrue(right)) return left;
                if (isFalse(left) && !ExpressionUtils.isFallible(right)) return left;
                if (isFalse(right) && !ExpressionUtils.isFallible(left)) return right;
                return bin;
            case OR:
                if (!booleans) return bin;
                if (isFalse(left)) return right;
                if (isFalse(right)) return left;
                if (isTrue(left) && !ExpressionUtils.isFallible(right)) return left;
                if (isTrue(right) && !ExpressionUtils.isFallible(left)) return right;
                return bin;
            default:
                break;
        }
        DataType resultType = bin.dataType();
        if (resultType instanceof UnresolvedType) {
            return bin;
        }
        if ((isNullLiteral(left) && !ExpressionUtils.isFallible(right))
                || (isNullLiteral(right) && !ExpressionUtils.isFallible(left))) {
            return Literal.nullOf(resultType);
        }
        if (TypeCoercion.isIntegral(resultType)) {
            switch (bin.operator()) {
                case ADD:
                    if (isIntegralConstant(right, 0) && left.dataType().equals(resultType)) return left;
                    if (isIntegralConstant(left, 0) && right.dataType().equals(resultType)) return right;
                    break;
                case SUBTRACT:
                    if (isIntegralConstant(right, 0) && left.dataType().equals(resultType)) return left;
                    break;
                case MULTIPLY:
                    if (isIntegralConstant(right, 1) && left.dataType().equals(resultType)) return left;
                    if (isIntegralConstant(left, 1) && right.dataType().equals(resultType)) return right;
                    break;
                default:
                    break;
            }
        }
        return bin;
    }

    private static Expression simplifyUnary(UnaryExpression unary) {
        Expression operand = unary.operand();
        if (operand instanceof UnaryExpression inner && inner.operator() == unary.operator()
                && (unary.operator() == UnaryExpression.Operator.NOT
                    || unary.operator() == UnaryExpression.Operator.NEGATE)) {
            return inner.operand();
        }
        if (unary.operator().propagatesNull() && isNullLiteral(operand)
                && !(unary.dataType() instanceof UnresolvedType)) {
            return Literal.nullOf(unary.dataType());
        }
        return unary;
    }

    private static boolean isTrue(Expression expr) {
        return expr instanceof Literal literal && Boolean.TRUE.equals(literal.value());
    }

    private static boolean isFalse(Expression expr) {
        return expr instanceof Literal literal && Boolean.FALSE.equals(literal.value());
    }

    private static boolean isNullLiteral(Expression expr) {
        return expr instanceof Literal literal && literal.isNullValue();
    }

    private static boolean isIntegralConstant(Expression expr, long value) {
        return expr instanceof Literal literal && literal.value() instanceof Number n
            && TypeCoercion.isIntegral(literal.dataType()) && n.longValue() == value;
    }

    @Override
    public String name() {
        return "SimplifyExpressions";
    }
}
