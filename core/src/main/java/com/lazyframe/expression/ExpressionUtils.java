package com.lazyframe.expression;

import com.lazyframe.functions.ScalarFunction;
import com.lazyframe.types.DataType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.StructType;
import com.lazyframe.types.TypeCoercion;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Utility methods for inspecting and rewriting expression trees.
 */
public final class ExpressionUtils {

    private ExpressionUtils() {}

    /**
     * Returns the names of all columns the expression reads, in first-reference order.
     *
     * @param expr the expression
     * @return the column names
     */
    public static Set<String> referencedColumns(Expression expr) {
        Set<String> columns = new LinkedHashSet<>();
        collectColumns(expr, columns);
        return columns;
    }

    /**
     * Returns the names of all columns the expressions read, in first-reference order.
     *
     * @param exprs the expressions
     * @return the column names
     */
    public static Set<String> referencedColumns(Collection<? extends Expression> exprs) {
        Set<String> columns = new LinkedHashSet<>();
        for (Expression expr : exprs) {
            collectColumns(expr, columns);
        }
        return columns;
    }

    private static void collectColumns(Expression expr, Set<String> columns) {
        if (expr instanceof ColumnReference ref) {
            columns.add(ref.name());
        } else if (expr instanceof UnresolvedColumn col) {
            columns.add(col.name());
        } else {
            for (Expression child : expr.children()) {
                collectColumns(child, columns);
            }
        }
    }

    /**
     * Rewrites a tree bottom-up: children are rewritten first, then the rule is applied
     * to the rebuilt node.
     *
     * @param expr the expression
     * @param rule the rewrite, returning its argument to leave a node unchanged
     * @return the rewritten expression
     */
    public static Expression transformUp(Expression expr, Function<Expression, Expression> rule) {
        List<Expression> children = expr.children();
        Expression rebuilt = expr;
        if (!children.isEmpty()) {
            List<Expression> newChildren = new ArrayList<>(children.size());
            boolean changed = false;
            for (Expression child : children) {
                Expression newChild = transformUp(child, rule);
                changed |= newChild != child;
                newChildren.add(newChild);
            }
            if (changed) {
                rebuilt = expr.withChildren(newChildren);
            }
        }
        return rule.apply(rebuilt);
    }

    /**
     * Rewrites a tree top-down: the rule is applied to a node before its children. When
     * the rule replaces a node, the replacement is not descended into.
     *
     * @param expr the expression
     * @param rule the rewrite
     * @return the rewritten expression
     */
    public static Expression transformDown(Expression expr, Function<Expression, Expression> rule) {
        Expression replaced = rule.apply(expr);
        if (replaced != expr) {
            return replaced;
        }
        List<Expression> children = expr.children();
        if (children.isEmpty()) {
            return expr;
        }
        List<Expression> newChildren = new ArrayList<>(children.size());
        boolean changed = false;
        for (Expression child : children) {
            Expression newChild = transformDown(child, rule);
            changed |= newChild != child;
            newChildren.add(newChild);
        }
        return changed ? expr.withChildren(newChildren) : expr;
    }

    /**
     * Returns true if any node of the tree satisfies the predicate.
     *
     * @param expr the expression
     * @param predicate the test
     * @return true if a node matches
     */
    public static boolean anyMatch(Expression expr, Predicate<Expression> predicate) {
        if (predicate.test(expr)) {
            return true;
        }
        for (Expression child : expr.children()) {
            if (anyMatch(child, predicate)) {
                return true;
            }
        }
        return false;
    }

    public static boolean containsAggregate(Expression expr) {
        return anyMatch(expr, e -> e instanceof AggregateExpression);
    }

    public static boolean containsWindow(Expression expr) {
        return anyMatch(expr, e -> e instanceof WindowFunction);
    }

    /**
     * Returns true if evaluating the expression twice on the same input gives the same
     * result and its value for a row depends on that row only.
     *
     * @param expr the expression
     * @return true if pure and row-local
     */
    public static boolean isPure(Expression expr) {
        return !anyMatch(expr, e -> {
            if (e instanceof AggregateExpression || e instanceof WindowFunction) {
                return true;
            }
            if (e instanceof FunctionCall call) {
                return !call.function().map(ScalarFunction::isDeterministic).orElse(false);
            }
            return false;
        });
    }

    /**
     * Returns true if evaluation can raise an error for some input values. Moving such an
     * expression before an operator that removes rows could make a query fail that would
     * otherwise succeed.
     *
     * @param expr the expression
     * @return true if evaluation can fail
     */
    public static boolean isFallible(Expression expr) {
        return anyMatch(expr, e -> e instanceof CastExpression cast && cast.strict()
            && !isLosslessCast(cast.expression().dataType(), cast.targetType()));
    }

    /**
     * Returns true if every value of {@code from} converts to {@code to} without failure.
     *
     * @param from the source type
     * @param to the target type
     * @return true for lossless widenings
     */
    public static boolean isLosslessCast(DataType from, DataType to) {
        if (from.equals(to)) {
            return true;
        }
        Optional<DataType> common = TypeCoercion.commonSupertype(from, to);
        if (common.isPresent() && common.get().equals(to)) {
            return true;
        }
        return to instanceof StringType && !(from instanceof StructType);
    }

    /**
     * Splits a predicate into its top-level AND conjuncts.
     *
     * @param predicate the predicate
     * @return the conjuncts, in order
     */
    public static List<Expression> splitConjuncts(Expression predicate) {
        List<Expression> result = new ArrayList<>();
        splitConjuncts(predicate, result);
        return result;
    }

    private static void splitConjuncts(Expression predicate, List<Expression> result) {
        if (predicate instanceof BinaryExpression bin && bin.operator() == BinaryExpression.Operator.AND) {
            splitConjuncts(bin.left(), result);
            splitConjuncts(bin.right(), result);
        } else {
            result.add(predicate);
        }
    }

    /**
     * Joins predicates with AND.
     *
     * @param conjuncts the predicates (at least one)
     * @return the combined predicate
     */
    public static Expression combineConjuncts(List<Expression> conjuncts) {
        if (conjuncts.isEmpty()) {
            throw new IllegalArgumentException("at least one conjunct is required");
        }
        Expression result = conjuncts.get(0);
        for (int i = 1; i < conjuncts.size(); i++) {
            result = new BinaryExpression(result, BinaryExpression.Operator.AND, conjuncts.get(i));
        }
        return result;
    }

    /**
     * Removes a top-level alias.
     *
     * @param expr the expression
     * @return the aliased expression, or the argument if it has no alias
     */
    public static Expression unalias(Expression expr) {
        return expr instanceof AliasExpression alias ? alias.expression() : expr;
    }

    /**
     * Returns the source column if the expression is a bare or aliased column reference.
     *
     * @param expr the expression
     * @return the referenced column name, or empty
     */
    public static Optional<String> asColumnName(Expression expr) {
        Expression inner = unalias(expr);
        if (inner instanceof ColumnReference ref) {
            return Optional.of(ref.name());
        }
        if (inner instanceof UnresolvedColumn col) {
            return Optional.of(col.name());
        }
        return Optional.empty();
    }

    /**
     * Replaces column references by the mapped expressions.
     *
     * @param expr the expression
     * @param replacements column name to replacement
     * @return the rewritten expression
     */
    public static Expression replaceColumns(Expression expr, Map<String, Expression> replacements) {
        return transformDown(expr, e -> {
            String name = e instanceof ColumnReference ref ? ref.name()
                : e instanceof UnresolvedColumn col ? col.name() : null;
            if (name != null && replacements.containsKey(name)) {
                return replacements.get(name);
            }
            return e;
        });
    }

    /**
     * Counts the nodes of a tree.
     *
     * @param expr the expression
     * @return the node count
     */
    public static int size(Expression expr) {
        int count = 1;
        for (Expression child : expr.children()) {
            count += size(child);
        }
        return count;
    }
}
