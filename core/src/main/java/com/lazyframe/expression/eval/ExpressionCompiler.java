package com.lazyframe.expression.eval;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.ValueOps;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.exception.InvalidOperationException;
import com.lazyframe.expression.AggregateExpression;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.CaseWhenExpression;
import com.lazyframe.expression.CastExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.FunctionCall;
import com.lazyframe.expression.InExpression;
import com.lazyframe.expression.Literal;
import com.lazyframe.expression.SortOrder;
import com.lazyframe.expression.UnaryExpression;
import com.lazyframe.expression.UnresolvedColumn;
import com.lazyframe.expression.WindowFunction;
import com.lazyframe.functions.ScalarFunction;
import com.lazyframe.types.DataType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.TypeCoercion;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Compiles resolved row-wise expressions into {@link CompiledExpression}s.
 *
 * <p>Evaluation rules:
 * <ul>
 *   <li>Operands are brought to a common type before an operator applies, so evaluation
 *       gives the same result with or without explicit coercion casts in the tree</li>
 *   <li>A null operand makes arithmetic, comparison and negation null</li>
 *   <li>AND and OR use three-valued logic</li>
 *   <li>Branch values of {@code when/then} are evaluated only on the rows that select them</li>
 * </ul>
 *
 * <p>Aggregates and window functions are not row-wise; they are planned by the aggregation
 * and window operators, which compile only their arguments here.
 */
public final class ExpressionCompiler {

    private ExpressionCompiler() {
        // Utility class - prevent instantiation
    }

    /**
     * Compiles a resolved expression.
     *
     * @param expr the resolved expression
     * @return the compiled expression
     * @throws InvalidOperationException if the expression contains an aggregate or window
     */
    public static CompiledExpression compile(Expression expr) {
        return new CompiledExpression(expr, expr.outputName(), evaluator(expr));
    }

    /**
     * Compiles a list of resolved expressions.
     *
     * @param exprs the expressions
     * @return the compiled expressions, in order
     */
    public static List<CompiledExpression> compileAll(List<? extends Expression> exprs) {
        List<CompiledExpression> compiled = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            compiled.add(compile(expr));
        }
        return compiled;
    }

    private static CompiledExpression.Evaluator evaluator(Expression expr) {
        if (expr instanceof ColumnReference ref) {
            String name = ref.name();
            return batch -> batch.column(name);
        }
        if (expr instanceof UnresolvedColumn col) {
            throw new IllegalStateException("expression must be resolved before compilation: " + col);
        }
        if (expr instanceof Literal literal) {
            return batch -> Column.constant("literal", literal.dataType(), literal.value(), batch.rowCount());
        }
        if (expr instanceof AliasExpression alias) {
            return evaluator(alias.expression());
        }
        if (expr instanceof SortOrder sort) {
            return evaluator(sort.expression());
        }
        if (expr instanceof BinaryExpression bin) {
            return binary(bin);
        }
        if (expr instanceof UnaryExpression unary) {
            return unary(unary);
        }
        if (expr instanceof CastExpression cast) {
            return cast(cast);
        }
        if (expr instanceof FunctionCall call) {
            return function(call);
        }
        if (expr instanceof CaseWhenExpression caseWhen) {
            return caseWhen(caseWhen);
        }
        if (expr instanceof InExpression in) {
            return in(in);
        }
        if (expr instanceof AggregateExpression || expr instanceof WindowFunction) {
            throw new InvalidOperationException(
                expr + " cannot be evaluated row-wise; use it in groupBy().agg() or with over()");
        }
        throw new IllegalStateException("Unhandled expression type: " + expr.getClass().getSimpleName());
    }

    // ========================================================================
    // Operators
    // ========================================================================

    private static CompiledExpression.Evaluator binary(BinaryExpression bin) {
        CompiledExpression.Evaluator left = evaluator(bin.left());
        CompiledExpression.Evaluator right = evaluator(bin.right());
        BinaryExpression.Operator op = bin.operator();
        DataType resultType = bin.dataType();
        if (op.isLogical()) {
            boolean isAnd = op == BinaryExpression.Operator.AND;
            return batch -> {
                Column l = left.evaluate(batch);
                Column r = right.evaluate(batch);
                Column.Builder out = Column.builder(bin.outputName(), resultType, batch.rowCount());
                for (int i = 0; i < out.length(); i++) {
                    Boolean value = isAnd ? kleeneAnd(l.get(i), r.get(i)) : kleeneOr(l.get(i), r.get(i));
                    if (value != null) {
                        out.setBoolean(i, value);
                    }
                }
                return out.build();
            };
        }
        DataType operandType = bin.operandType();
        boolean primitive = NumericKernels.supports(op, operandType, resultType);
        return batch -> {
            Column l = coerce(left.evaluate(batch), operandType);
            Column r = coerce(right.evaluate(batch), operandType);
            if (primitive && l.dataType().equals(operandType) && r.dataType().equals(operandType)) {
                return NumericKernels.apply(op, l, r, bin.outputName(), resultType);
            }
            Object[] out = new Object[batch.rowCount()];
            for (int i = 0; i < out.length; i++) {
                Object a = l.get(i);
                Object b = r.get(i);
                if (a == null || b == null) {
                    continue;
                }
                out[i] = applyBinary(op, a, b, resultType);
            }
            return Column.fromValues(bin.outputName(), resultType, out);
        };
    }

    private static Object applyBinary(BinaryExpression.Operator op, Object a, Object b, DataType resultType) {
        return switch (op) {
            case ADD -> ValueOps.add(a, b, resultType);
            case SUBTRACT -> ValueOps.subtract(a, b, resultType);
            case MULTIPLY -> ValueOps.multiply(a, b, resultType);
            case DIVIDE -> ValueOps.divide(a, b, resultType);
            case FLOOR_DIVIDE -> ValueOps.floorDivide(a, b, resultType);
            case MODULO -> ValueOps.modulo(a, b, resultType);
            case EQUAL -> ValueOps.compare(a, b) == 0;
            case NOT_EQUAL -> ValueOps.compare(a, b) != 0;
            case LESS_THAN -> ValueOps.compare(a, b) < 0;
            case LESS_THAN_OR_EQUAL -> ValueOps.compare(a, b) <= 0;
            case GREATER_THAN -> ValueOps.compare(a, b) > 0;
            case GREATER_THAN_OR_EQUAL -> ValueOps.compare(a, b) >= 0;
            case AND, OR -> throw new IllegalStateException("logical operators are handled separately");
        };
    }

    static Boolean kleeneAnd(Object a, Object b) {
        if (Boolean.FALSE.equals(a) || Boolean.FALSE.equals(b)) {
            return Boolean.FALSE;
        }
        if (a == null || b == null) {
            return null;
        }
        return Boolean.TRUE;
    }

    static Boolean kleeneOr(Object a, Object b) {
        if (Boolean.TRUE.equals(a) || Boolean.TRUE.equals(b)) {
            return Boolean.TRUE;
        }
        if (a == null || b == null) {
            return null;
        }
        return Boolean.FALSE;
    }

    private static CompiledExpression.Evaluator unary(UnaryExpression unary) {
        CompiledExpression.Evaluator operand = evaluator(unary.operand());
        DataType resultType = unary.dataType();
        return batch -> {
            Column input = operand.evaluate(batch);
            Column.Builder out = Column.builder(unary.outputName(), resultType, batch.rowCount());
            for (int i = 0; i < out.length(); i++) {
                boolean missing = input.isNull(i);
                switch (unary.operator()) {
                    case IS_NULL -> out.setBoolean(i, missing);
                    case IS_NOT_NULL -> out.setBoolean(i, !missing);
                    case NOT -> {
                        if (!missing) {
                            out.setBoolean(i, !input.getBoolean(i));
                        }
                    }
                    case NEGATE -> {
                        if (!missing) {
                            out.set(i, ValueOps.negate(input.get(i)));
                        }
                    }
                }
            }
            return out.build();
        };
    }

    private static CompiledExpression.Evaluator cast(CastExpression cast) {
        CompiledExpression.Evaluator operand = evaluator(cast.expression());
        String name = cast.outputName();
        return batch -> {
            Column input = operand.evaluate(batch);
            try {
                return input.cast(cast.targetType(), cast.strict());
            } catch (ComputeException e) {
                throw new ComputeException(e.detail(), e, null, name);
            }
        };
    }

    private static CompiledExpression.Evaluator function(FunctionCall call) {
        ScalarFunction function = call.function().orElseThrow(() ->
            new InvalidOperationException("unknown function '" + call.functionName() + "'"));
        List<CompiledExpression.Evaluator> args = new ArrayList<>();
        for (Expression argument : call.arguments()) {
            args.add(evaluator(argument));
        }
        List<DataType> coerced = function.coerceArguments(call.argumentTypes());
        DataType resultType = call.dataType();
        return batch -> {
            int rows = batch.rowCount();
            List<Column> inputs = new ArrayList<>(args.size());
            for (int a = 0; a < args.size(); a++) {
                inputs.add(coerce(args.get(a).evaluate(batch), coerced.get(a)));
            }
            Object[] out = new Object[rows];
            Object[] rowArgs = new Object[inputs.size()];
            for (int i = 0; i < rows; i++) {
                for (int a = 0; a < rowArgs.length; a++) {
                    rowArgs[a] = inputs.get(a).get(i);
                }
                out[i] = function.invoke(rowArgs, resultType);
            }
            return Column.fromValues(call.outputName(), resultType, out);
        };
    }

    private static CompiledExpression.Evaluator caseWhen(CaseWhenExpression caseWhen) {
        List<CompiledExpression.Evaluator> conditions = new ArrayList<>();
        List<CompiledExpression.Evaluator> values = new ArrayList<>();
        for (CaseWhenExpression.Branch branch : caseWhen.branches()) {
            conditions.add(evaluator(branch.condition()));
            values.add(evaluator(branch.value()));
        }
        CompiledExpression.Evaluator otherwise = evaluator(caseWhen.otherwise());
        DataType resultType = caseWhen.dataType();
        return batch -> {
            Object[] out = new Object[batch.rowCount()];
            int[] remaining = new int[batch.rowCount()];
            Arrays.setAll(remaining, i -> i);
            for (int b = 0; b < conditions.size() && remaining.length > 0; b++) {
                ColumnarBatch rest = remaining.length == batch.rowCount() ? batch : batch.take(remaining);
                Column condition = conditions.get(b).evaluate(rest);
                int[] selected = Column.selectedRows(condition);
                if (selected.length > 0) {
                    Column value = coerce(values.get(b).evaluate(rest.take(selected)), resultType);
                    for (int i = 0; i < selected.length; i++) {
                        out[remaining[selected[i]]] = value.get(i);
                    }
                }
                remaining = unselected(remaining, condition);
            }
            if (remaining.length > 0) {
                Column value = coerce(otherwise.evaluate(batch.take(remaining)), resultType);
                for (int i = 0; i < remaining.length; i++) {
                    out[remaining[i]] = value.get(i);
                }
            }
            return Column.fromValues(caseWhen.outputName(), resultType, out);
        };
    }

    private static int[] unselected(int[] rows, Column condition) {
        int[] result = new int[rows.length];
        int count = 0;
        boolean typed = !(condition.dataType() instanceof NullType);
        for (int i = 0; i < rows.length; i++) {
            if (!typed || !condition.isTrue(i)) {
                result[count++] = rows[i];
            }
        }
        return count == rows.length ? result : Arrays.copyOf(result, count);
    }

    private static CompiledExpression.Evaluator in(InExpression in) {
        CompiledExpression.Evaluator value = evaluator(in.value());
        List<CompiledExpression.Evaluator> options = new ArrayList<>();
        List<DataType> types = new ArrayList<>();
        types.add(in.value().dataType());
        for (Expression option : in.options()) {
            options.add(evaluator(option));
            types.add(option.dataType());
        }
        DataType common = TypeCoercion.commonSupertype(types).orElse(in.value().dataType());
        return batch -> {
            Column v = coerce(value.evaluate(batch), common);
            List<Column> opts = new ArrayList<>(options.size());
            for (CompiledExpression.Evaluator option : options) {
                opts.add(coerce(option.evaluate(batch), common));
            }
            Object[] out = new Object[batch.rowCount()];
            for (int i = 0; i < out.length; i++) {
                Object x = v.get(i);
                if (x == null) {
                    continue;
                }
                boolean sawNull = false;
                Boolean result = Boolean.FALSE;
                for (Column opt : opts) {
                    Object o = opt.get(i);
                    if (o == null) {
                        sawNull = true;
                    } else if (ValueOps.valuesEqual(x, o)) {
                        result = Boolean.TRUE;
                        break;
                    }
                }
                out[i] = result || !sawNull ? result : null;
            }
            return Column.fromValues(in.outputName(), in.dataType(), out);
        };
    }

    private static Column coerce(Column column, DataType type) {
        if (column.dataType().equals(type) || !TypeCoercion.canCast(column.dataType(), type)) {
            return column;
        }
        return column.cast(type, true);
    }
}
