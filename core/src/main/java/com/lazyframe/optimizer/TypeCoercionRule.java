package com.lazyframe.optimizer;

import com.lazyframe.data.ValueOps;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.CaseWhenExpression;
import com.lazyframe.expression.CastExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.FunctionCall;
import com.lazyframe.expression.InExpression;
import com.lazyframe.expression.Literal;
import com.lazyframe.functions.ScalarFunction;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.types.DataType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.TypeCoercion;
import com.lazyframe.types.UnresolvedType;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Makes implicit type conversions explicit.
 *
 * <p>Operands of arithmetic and comparison operators, function arguments, the values of
 * {@code when/then/otherwise} and the operands of {@code is_in} are cast to the type the
 * evaluator would convert them to anyway. Literal operands are converted in place, so that
 * {@code col("i32") > 1.5} becomes {@code col("i32").cast(f64) > 1.5} and
 * {@code col("f64") == 1} becomes {@code col("f64") == 1.0}.
 *
 * <p>The inserted casts only widen or unify types, so results are unchanged; later rules
 * and the executor see one operand type per operator.
 */
public class TypeCoercionRule implements OptimizationRule {

    private static final Logger logger = LoggerFactory.getLogger(TypeCoercionRule.class);

    private final UnaryOperator<Expression> rewrite = ExpressionRewrites.bottomUp(this::coerce);

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> node.mapExpressions(rewrite));
    }

    private Expression coerce(Expression expr) {
        if (expr instanceof BinaryExpression bin) {
            return coerceBinary(bin);
        }
        if (expr instanceof FunctionCall call) {
            return coerceFunction(call);
        }
        if (expr instanceof CaseWhenExpression caseWhen) {
            return coerceCaseWhen(caseWhen);
        }
        if (expr instanceof InExpression in) {
            return coerceIn(in);
        }
        return expr;
    }

    private Expression coerceBinary(BinaryExpression bin) {
        if (bin.operator().isLogical()) {
            return bin;
        }
        DataType target = bin.operandType();
        if (target instanceof UnresolvedType || target instanceof NullType) {
            return bin;
        }
        Expression left = castTo(bin.left(), target);
        Expression right = castTo(bin.right(), target);
        if (left == bin.left() && right == bin.right()) {
            return bin;
        }
        return new BinaryExpression(left, bin.operator(), right);
    }

    private Expression coerceFunction(FunctionCall call) {
        Optional<ScalarFunction> function = call.function();
        if (function.isEmpty() || call.dataType() instanceof UnresolvedType) {
            return call;
        }
        List<DataType> targets = function.get().coerceArguments(call.argumentTypes());
        return withCoercedChildren(call, call.arguments(), targets);
    }

    private Expression coerceCaseWhen(CaseWhenExpression caseWhen) {
        DataType target = caseWhen.dataType();
        if (target instanceof UnresolvedType || target instanceof NullType) {
            return caseWhen;
        }
        List<Expression> children = caseWhen.children();
        List<DataType> targets = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            boolean isCondition = i < children.size() - 1 && i % 2 == 0;
            targets.add(isCondition ? children.get(i).dataType() : target);
        }
        return withCoercedChildren(caseWhen, children, targets);
    }

    private Expression coerceIn(InExpression in) {
        List<Expression> children = in.children();
        List<DataType> types = new ArrayList<>(children.size());
        for (Expression child : children) {
            types.add(child.dataType());
        }
        Optional<DataType> common = TypeCoercion.commonSupertype(types);
        if (common.isEmpty() || common.get() instanceof NullType) {
            return in;
        }
        List<DataType> targets = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            targets.add(common.get());
        }
        return withCoercedChildren(in, children, targets);
    }

    private Expression withCoercedChildren(Expression expr, List<Expression> children, List<DataType> targets) {
        List<Expression> coerced = new ArrayList<>(children.size());
        boolean changed = false;
        for (int i = 0; i < children.size(); i++) {
            Expression child = children.get(i);
            Expression next = castTo(child, targets.get(i));
            changed |= next != child;
            coerced.add(next);
        }
        return changed ? expr.withChildren(coerced) : expr;
    }

    /**
     * Brings an operand to the target type: literals are converted, other expressions are
     * wrapped in a strict cast.
     */
    private Expression castTo(Expression expr, DataType target) {
        DataType type = expr.dataType();
        if (type.equals(target) || target instanceof NullType || target instanceof UnresolvedType
                || !TypeCoercion.canCast(type, target)) {
            return expr;
        }
        if (expr instanceof Literal literal) {
            if (literal.isNullValue()) {
                return Literal.nullOf(target);
            }
            try {
                return new Literal(ValueOps.cast(literal.value(), target, true), target);
            } catch (ComputeException e) {
                // Keep the cast so that the failure surfaces when the query runs
                logger.debug("Literal {} does not convert to {}: {}", literal, target, e.getMessage());
            }
        }
        return new CastExpression(expr, target, true);
    }

    @Override
    public String name() {
        return "TypeCoercion";
    }
}
