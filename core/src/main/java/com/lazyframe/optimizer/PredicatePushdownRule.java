package com.lazyframe.optimizer;

import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.CastExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.UnresolvedColumn;
import com.lazyframe.expression.WindowFunction;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Distinct;
import com.lazyframe.logical.Explode;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.JoinType;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Project;
import com.lazyframe.logical.Scan;
import com.lazyframe.logical.Sort;
import com.lazyframe.logical.Union;
import com.lazyframe.logical.Unpivot;
import com.lazyframe.logical.Window;
import com.lazyframe.logical.WithColumns;
import com.lazyframe.types.StructField;
import com.lazyframe.types.StructType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moves filter conjuncts as close to the data sources as their semantics allow.
 *
 * <p>Each filter is split into AND conjuncts that are pushed independently:
 * <ul>
 *   <li>Through projections and column definitions, by substituting the definitions of the
 *       referenced columns</li>
 *   <li>Through sorts without a top-k, unions (into every input), explodes and unpivots
 *       when only untouched columns are referenced</li>
 *   <li>Through aggregations and distinct when only grouping keys are referenced</li>
 *   <li>Through windows when only partition columns of every window are referenced</li>
 *   <li>Into the side of a join that cannot produce null-extended rows for it</li>
 *   <li>Into the scan predicate when the scan has no row limit</li>
 * </ul>
 *
 * <p>Conjuncts that are not pure or whose evaluation can fail are never moved; slices,
 * caches, upsampling and full joins are barriers.
 */
public class PredicatePushdownRule implements OptimizationRule {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return push(plan, List.of());
    }

    private LogicalPlan push(LogicalPlan plan, List<Expression> pending) {
        if (plan instanceof Filter filter) {
            return pushFilter(filter, pending);
        }
        if (plan instanceof Scan scan) {
            return pushIntoScan(scan, pending);
        }
        if (plan instanceof Project project) {
            return pushThroughDefinitions(project, definitions(project.projections()), pending);
        }
        if (plan instanceof WithColumns withColumns) {
            return pushThroughDefinitions(withColumns, definitions(withColumns.columns()), pending);
        }
        if (plan instanceof Sort sort && sort.topK() < 0) {
            return sort.withChildren(List.of(push(sort.child(), pending)));
        }
        if (plan instanceof Aggregate aggregate) {
            return pushThroughDefinitions(aggregate, definitions(aggregate.groupingExpressions()), pending);
        }
        if (plan instanceof Window window) {
            return pushThroughWindow(window, pending);
        }
        if (plan instanceof Join join) {
            return pushIntoJoin(join, pending);
        }
        if (plan instanceof Union union) {
            return pushIntoUnion(union, pending);
        }
        if (plan instanceof Distinct distinct) {
            return pushIfColumnsIn(distinct, new HashSet<>(distinct.keyColumns()), pending);
        }
        if (plan instanceof Explode explode) {
            Set<String> untouched = new HashSet<>(explode.schema().names());
            explode.columns().forEach(untouched::remove);
            return pushIfColumnsIn(explode, untouched, pending);
        }
        if (plan instanceof Unpivot unpivot) {
            return pushIfColumnsIn(unpivot, new HashSet<>(unpivot.index()), pending);
        }
        return barrier(plan, pending);
    }

    // ==================== Node handlers ====================

    private LogicalPlan pushFilter(Filter filter, List<Expression> pending) {
        List<Expression> movable = new ArrayList<>(pending);
        List<Expression> fixed = new ArrayList<>();
        for (Expression conjunct : ExpressionUtils.splitConjuncts(filter.condition())) {
            if (isMovable(conjunct)) {
                movable.add(conjunct);
            } else {
                fixed.add(conjunct);
            }
        }
        LogicalPlan child = push(filter.child(), movable);
        return wrap(child, fixed);
    }

    private LogicalPlan pushIntoScan(Scan scan, List<Expression> pending) {
        if (pending.isEmpty() || scan.rowLimit() >= 0) {
            return wrap(scan, pending);
        }
        List<Expression> conjuncts = new ArrayList<>();
        if (scan.predicate() != null) {
            conjuncts.addAll(ExpressionUtils.splitConjuncts(scan.predicate()));
        }
        for (Expression conjunct : pending) {
            if (!conjuncts.contains(conjunct)) {
                conjuncts.add(conjunct);
            }
        }
        return scan.withPredicate(ExpressionUtils.combineConjuncts(conjuncts));
    }

    /**
     * Pushes conjuncts below a node that defines (some of) its output columns from
     * expressions over its input. Columns without a definition pass through unchanged,
     * unless the node is an aggregation, where only grouping keys can be referenced.
     */
    private LogicalPlan pushThroughDefinitions(LogicalPlan node, Map<String, Expression> definitions,
                                               List<Expression> pending) {
        boolean onlyDefined = node instanceof Aggregate || node instanceof Project;
        List<Expression> pushed = new ArrayList<>();
        List<Expression> kept = new ArrayList<>();
        for (Expression conjunct : pending) {
            Set<String> columns = ExpressionUtils.referencedColumns(conjunct);
            // A constant predicate decides whether a global aggregation emits its row
            boolean substitutable = !(node instanceof Aggregate) || !columns.isEmpty();
            Map<String, Expression> replacements = new HashMap<>();
            for (String column : substitutable ? columns : Set.<String>of()) {
                Expression definition = definitions.get(column);
                if (definition == null) {
                    if (onlyDefined) {
                        substitutable = false;
                        break;
                    }
                    continue;
                }
                if (!isMovable(definition)) {
                    substitutable = false;
                    break;
                }
                replacements.put(column, definition);
            }
            if (substitutable) {
                pushed.add(ExpressionUtils.replaceColumns(conjunct, replacements));
            } else {
                kept.add(conjunct);
            }
        }
        LogicalPlan child = push(node.child(), pushed);
        return wrap(rebuild(node, List.of(child)), kept);
    }

    private LogicalPlan pushThroughWindow(Window window, List<Expression> pending) {
        Set<String> partitionColumns = null;
        for (AliasExpression expr : window.windowExpressions()) {
            WindowFunction function = (WindowFunction) expr.expression();
            Set<String> columns = new HashSet<>();
            for (Expression key : function.partitionBy()) {
                ExpressionUtils.asColumnName(key).ifPresent(columns::add);
            }
            if (partitionColumns == null) {
                partitionColumns = columns;
            } else {
                partitionColumns.retainAll(columns);
            }
        }
        if (partitionColumns == null) {
            partitionColumns = new HashSet<>();
        }
        for (AliasExpression expr : window.windowExpressions()) {
            partitionColumns.remove(expr.alias());
        }
        return pushIfColumnsIn(window, partitionColumns, pending);
    }

    private LogicalPlan pushIntoJoin(Join join, List<Expression> pending) {
        JoinType type = join.joinType();
        if (type == JoinType.FULL) {
            return barrier(join, pending);
        }
        Set<String> leftColumns = new HashSet<>(join.left().schema().names());
        Map<String, String> rightSources = new HashMap<>();
        for (Join.RightOutput output : join.rightOutputs()) {
            rightSources.put(output.name(), output.source());
        }
        boolean rightPushable = type == JoinType.INNER || type == JoinType.CROSS;

        List<Expression> toLeft = new ArrayList<>();
        List<Expression> toRight = new ArrayList<>();
        List<Expression> kept = new ArrayList<>();
        for (Expression conjunct : pending) {
            Set<String> columns = ExpressionUtils.referencedColumns(conjunct);
            if (leftColumns.containsAll(columns)) {
                toLeft.add(conjunct);
            } else if (rightPushable && rightSources.keySet().containsAll(columns)) {
                Map<String, Expression> renames = new HashMap<>();
                for (String column : columns) {
                    renames.put(column, new UnresolvedColumn(rightSources.get(column)));
                }
                toRight.add(ExpressionUtils.replaceColumns(conjunct, renames));
            } else {
                kept.add(conjunct);
            }
        }
        LogicalPlan left = push(join.left(), toLeft);
        LogicalPlan right = push(join.right(), toRight);
        return wrap(rebuild(join, List.of(left, right)), kept);
    }

    private LogicalPlan pushIntoUnion(Union union, List<Expression> pending) {
        StructType unionSchema = union.schema();
        List<LogicalPlan> inputs = new ArrayList<>(union.inputs().size());
        for (LogicalPlan input : union.inputs()) {
            Map<String, Expression> widened = new HashMap<>();
            for (StructField field : input.schema().fields()) {
                StructField target = unionSchema.field(field.name());
                if (!field.dataType().equals(target.dataType())) {
                    widened.put(field.name(),
                        new CastExpression(new UnresolvedColumn(field.name()), target.dataType(), true));
                }
            }
            List<Expression> conjuncts = new ArrayList<>(pending.size());
            for (Expression conjunct : pending) {
                conjuncts.add(widened.isEmpty() ? conjunct : ExpressionUtils.replaceColumns(conjunct, widened));
            }
            inputs.add(push(input, conjuncts));
        }
        return rebuild(union, inputs);
    }

    private LogicalPlan pushIfColumnsIn(LogicalPlan node, Set<String> allowed, List<Expression> pending) {
        List<Expression> pushed = new ArrayList<>();
        List<Expression> kept = new ArrayList<>();
        for (Expression conjunct : pending) {
            if (allowed.containsAll(ExpressionUtils.referencedColumns(conjunct))) {
                pushed.add(conjunct);
            } else {
                kept.add(conjunct);
            }
        }
        LogicalPlan child = push(node.child(), pushed);
        return wrap(rebuild(node, List.of(child)), kept);
    }

    private LogicalPlan barrier(LogicalPlan plan, List<Expression> pending) {
        List<LogicalPlan> children = new ArrayList<>(plan.children().size());
        for (LogicalPlan child : plan.children()) {
            children.add(push(child, List.of()));
        }
        return wrap(rebuild(plan, children), pending);
    }

    // ==================== Helpers ====================

    private static boolean isMovable(Expression expr) {
        return ExpressionUtils.isPure(expr) && !ExpressionUtils.isFallible(expr);
    }

    private static Map<String, Expression> definitions(List<Expression> exprs) {
        Map<String, Expression> definitions = new HashMap<>();
        for (Expression expr : exprs) {
            definitions.put(expr.outputName(), ExpressionUtils.unalias(expr));
        }
        return definitions;
    }

    private static LogicalPlan rebuild(LogicalPlan plan, List<LogicalPlan> children) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) != plan.children().get(i)) {
                return plan.withChildren(children);
            }
        }
        return plan;
    }

    private static LogicalPlan wrap(LogicalPlan plan, List<Expression> conjuncts) {
        if (conjuncts.isEmpty()) {
            return plan;
        }
        return new Filter(plan, ExpressionUtils.combineConjuncts(conjuncts));
    }

    @Override
    public String name() {
        return "PredicatePushdown";
    }
}
