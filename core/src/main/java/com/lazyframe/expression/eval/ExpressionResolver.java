package com.lazyframe.expression.eval;

import com.lazyframe.exception.ComputeException;
import com.lazyframe.exception.InvalidOperationException;
import com.lazyframe.exception.SchemaException;
import com.lazyframe.expression.AggregateExpression;
import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.CaseWhenExpression;
import com.lazyframe.expression.CastExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.FunctionCall;
import com.lazyframe.expression.InExpression;
import com.lazyframe.expression.Literal;
import com.lazyframe.expression.UnaryExpression;
import com.lazyframe.expression.UnresolvedColumn;
import com.lazyframe.expression.WindowFunction;
import com.lazyframe.functions.FunctionRegistry;
import com.lazyframe.functions.ScalarFunction;
import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeCoercion;
import com.lazyframe.types.UnresolvedType;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves expressions against an input schema when they are attached to a plan.
 *
 * <p>Resolution replaces column names by typed {@link ColumnReference}s and validates every
 * node bottom-up, so that plan construction fails fast:
 * <ul>
 *   <li>Missing columns and operand types without a common type raise {@link SchemaException}</li>
 *   <li>Unknown functions, wrong argument counts and aggregates or windows outside the
 *       contexts that allow them raise {@link InvalidOperationException}</li>
 *   <li>Casts between types without a conversion raise {@link ComputeException}</li>
 * </ul>
 *
 * <p>Resolution is idempotent: resolving a resolved expression against the same schema
 * returns an equal expression. The optimizer re-resolves rewritten expressions against
 * the new input schema of the node that owns them.
 */
public final class ExpressionResolver {

    /**
     * Where an expression appears, which decides whether aggregates and windows are allowed.
     */
    private enum Mode {
        /** Row-wise: no aggregates, no windows. */
        ROW,
        /** Output of a group-by aggregation: aggregates allowed, bare columns must be keys. */
        AGGREGATION,
        /** Projection that may contain window functions. */
        WINDOW
    }

    private final StructType input;
    private final StructType keys;
    private final Mode mode;

    private ExpressionResolver(StructType input, StructType keys, Mode mode) {
        this.input = input;
        this.keys = keys;
        this.mode = mode;
    }

    /**
     * Resolves a row-wise expression.
     *
     * @param expr the expression
     * @param schema the input schema
     * @return the resolved expression
     */
    public static Expression resolve(Expression expr, StructType schema) {
        return new ExpressionResolver(schema, null, Mode.ROW).resolveNode(expr);
    }

    /**
     * Resolves a list of row-wise expressions.
     *
     * @param exprs the expressions
     * @param schema the input schema
     * @return the resolved expressions
     */
    public static List<Expression> resolveAll(List<? extends Expression> exprs, StructType schema) {
        List<Expression> result = new ArrayList<>(exprs.size());
        for (Expression expr : exprs) {
            result.add(resolve(expr, schema));
        }
        return result;
    }

    /**
     * Resolves a projection that may contain window functions.
     *
     * @param expr the expression
     * @param schema the input schema
     * @return the resolved expression
     */
    public static Expression resolveWindow(Expression expr, StructType schema) {
        return new ExpressionResolver(schema, null, Mode.WINDOW).resolveNode(expr);
    }

    /**
     * Resolves an aggregation output. Aggregate arguments resolve against the input schema;
     * columns outside aggregates must be grouping keys and resolve against the key schema.
     *
     * @param expr the expression
     * @param schema the input schema
     * @param keySchema the schema of the grouping keys
     * @return the resolved expression
     */
    public static Expression resolveAggregation(Expression expr, StructType schema, StructType keySchema) {
        return new ExpressionResolver(schema, keySchema, Mode.AGGREGATION).resolveNode(expr);
    }

    /**
     * Resolves a predicate and checks that it is boolean.
     *
     * @param predicate the predicate
     * @param schema the input schema
     * @return the resolved predicate
     * @throws SchemaException if the predicate is not boolean
     */
    public static Expression resolvePredicate(Expression predicate, StructType schema) {
        Expression resolved = resolve(predicate, schema);
        DataType type = resolved.dataType();
        if (!(type instanceof BooleanType) && !(type instanceof NullType)) {
            throw new SchemaException("filter predicate must be boolean, got " + type + ": " + predicate);
        }
        return resolved;
    }

    private Expression resolveNode(Expression expr) {
        if (expr instanceof UnresolvedColumn col) {
            return resolveColumn(col.name());
        }
        if (expr instanceof ColumnReference ref) {
            Expression resolved = resolveColumn(ref.name());
            return resolved.equals(ref) ? ref : resolved;
        }
        if (expr instanceof Literal) {
            return expr;
        }
        if (expr instanceof AggregateExpression agg) {
            return resolveAggregate(agg);
        }
        if (expr instanceof WindowFunction window) {
            return resolveWindowFunction(window);
        }
        Expression rebuilt = rebuild(expr, this);
        validate(rebuilt);
        return rebuilt;
    }

    private Expression resolveColumn(String name) {
        if (mode == Mode.AGGREGATION) {
            StructField key = keys.fieldByName(name);
            if (key != null) {
                return new ColumnReference(name, key.dataType());
            }
            if (input.contains(name)) {
                throw new InvalidOperationException(
                    "column '" + name + "' must be aggregated or be a group key", null, null, name);
            }
        }
        StructField field = input.field(name);
        return new ColumnReference(name, field.dataType());
    }

    private Expression resolveAggregate(AggregateExpression agg) {
        if (mode != Mode.AGGREGATION) {
            throw new InvalidOperationException(
                "aggregate " + agg + " is only valid inside groupBy().agg() or over()");
        }
        ExpressionResolver inner = new ExpressionResolver(input, null, Mode.ROW);
        AggregateExpression resolved = (AggregateExpression) rebuild(agg, inner);
        validateAggregate(resolved);
        return resolved;
    }

    private Expression resolveWindowFunction(WindowFunction window) {
        if (mode != Mode.WINDOW) {
            throw new InvalidOperationException("window function " + window
                + " is only valid in select() or withColumns()");
        }
        ExpressionResolver row = new ExpressionResolver(input, null, Mode.ROW);
        Expression argument = window.argument();
        if (window.kind() == WindowFunction.Kind.AGGREGATE) {
            if (!(argument instanceof AggregateExpression agg)) {
                throw new InvalidOperationException(
                    "over() requires an aggregate or a window function, got " + argument);
            }
            AggregateExpression resolvedAgg = (AggregateExpression) rebuild(agg, row);
            validateAggregate(resolvedAgg);
            argument = resolvedAgg;
        } else if (argument != null) {
            argument = row.resolveNode(argument);
        }
        List<Expression> children = new ArrayList<>();
        if (argument != null) {
            children.add(argument);
        }
        for (Expression key : window.partitionBy()) {
            children.add(row.resolveNode(key));
        }
        for (Expression order : window.orderBy()) {
            children.add(row.resolveNode(order));
        }
        WindowFunction resolved = (WindowFunction) window.withChildren(children);
        validateWindow(resolved);
        return resolved;
    }

    private static Expression rebuild(Expression expr, ExpressionResolver resolver) {
        List<Expression> children = expr.children();
        if (children.isEmpty()) {
            return expr;
        }
        List<Expression> resolved = new ArrayList<>(children.size());
        for (Expression child : children) {
            resolved.add(resolver.resolveNode(child));
        }
        return expr.withChildren(resolved);
    }

    // ========================================================================
    // Validation
    // ========================================================================

    private static void validate(Expression expr) {
        if (expr instanceof BinaryExpression bin) {
            if (bin.dataType() instanceof UnresolvedType) {
                throw new SchemaException(String.format("cannot apply '%s' to %s and %s: %s",
                    bin.operator().symbol(), bin.left().dataType(), bin.right().dataType(), bin));
            }
        } else if (expr instanceof UnaryExpression unary) {
            if (unary.dataType() instanceof UnresolvedType) {
                throw new SchemaException(String.format("cannot apply '%s' to %s: %s",
                    unary.operator().symbol(), unary.operand().dataType(), unary));
            }
        } else if (expr instanceof FunctionCall call) {
            ScalarFunction function = FunctionRegistry.lookup(call.functionName()).orElseThrow(() ->
                new InvalidOperationException("unknown function '" + call.functionName() + "'"));
            if (!function.acceptsArgumentCount(call.arguments().size())) {
                throw new InvalidOperationException(String.format(
                    "%s() does not accept %d arguments (expects %s)",
                    function.name(), call.arguments().size(), function));
            }
            function.returnType(call.argumentTypes());
        } else if (expr instanceof CastExpression cast) {
            DataType from = cast.expression().dataType();
            if (!TypeCoercion.canCast(from, cast.targetType())) {
                throw new ComputeException("cannot cast " + from + " to " + cast.targetType());
            }
        } else if (expr instanceof CaseWhenExpression caseWhen) {
            for (CaseWhenExpression.Branch branch : caseWhen.branches()) {
                DataType type = branch.condition().dataType();
                if (!(type instanceof BooleanType) && !(type instanceof NullType)) {
                    throw new SchemaException("when() condition must be boolean, got " + type);
                }
            }
            if (caseWhen.dataType() instanceof UnresolvedType) {
                List<DataType> types = new ArrayList<>();
                for (Expression value : caseWhen.values()) {
                    types.add(value.dataType());
                }
                throw new SchemaException("then()/otherwise() values have no common type: " + types);
            }
        } else if (expr instanceof InExpression in) {
            DataType type = in.value().dataType();
            for (Expression option : in.options()) {
                if (TypeCoercion.commonSupertype(type, option.dataType()).isEmpty()) {
                    throw new SchemaException(String.format(
                        "is_in() option %s of type %s is not comparable with %s",
                        option, option.dataType(), type));
                }
            }
        }
    }

    private static void validateAggregate(AggregateExpression agg) {
        if (agg.argument() instanceof AggregateExpression || containsNested(agg.argument())) {
            throw new InvalidOperationException("nested aggregates are not supported: " + agg);
        }
        DataType type = agg.argument().dataType();
        AggregateExpression.Function function = agg.function();
        if (function.requiresNumeric() && !TypeCoercion.isNumeric(type)
                && !(type instanceof BooleanType) && !(type instanceof NullType)) {
            throw new SchemaException(function.functionName() + "() requires a numeric column, got "
                + type, null, null, agg.argument().outputName());
        }
        if (function.requiresOrderable() && !TypeCoercion.isOrderable(type)) {
            throw new SchemaException(function.functionName() + "() requires an orderable column, got "
                + type, null, null, agg.argument().outputName());
        }
    }

    private static boolean containsNested(Expression expr) {
        for (Expression child : expr.children()) {
            if (child instanceof AggregateExpression || child instanceof WindowFunction
                    || containsNested(child)) {
                return true;
            }
        }
        return false;
    }

    private static void validateWindow(WindowFunction window) {
        WindowFunction.Kind kind = window.kind();
        if ((kind == WindowFunction.Kind.RANK || kind == WindowFunction.Kind.DENSE_RANK)
                && window.orderBy().isEmpty()) {
            throw new InvalidOperationException(kind.functionName() + "() requires orderBy()");
        }
        if (window.argument() != null && kind != WindowFunction.Kind.AGGREGATE) {
            DataType type = window.argument().dataType();
            if (kind == WindowFunction.Kind.CUM_SUM && !TypeCoercion.isNumeric(type)
                    && !(type instanceof BooleanType) && !(type instanceof NullType)) {
                throw new SchemaException("cum_sum() requires a numeric column, got " + type);
            }
            if ((kind == WindowFunction.Kind.CUM_MIN || kind == WindowFunction.Kind.CUM_MAX)
                    && !TypeCoercion.isOrderable(type)) {
                throw new SchemaException(kind.functionName() + "() requires an orderable column, got " + type);
            }
        }
    }
}
