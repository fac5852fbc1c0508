package com.lazyframe.optimizer;

import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Cache;
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
import com.lazyframe.logical.Upsample;
import com.lazyframe.logical.Window;
import com.lazyframe.logical.WithColumns;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes columns that no ancestor reads.
 *
 * <p>The rule walks the plan top-down with the set of columns each node must produce.
 * Scans read only required columns, and projections, column definitions, window columns
 * and aggregates whose output is never read are dropped. The root keeps its full schema,
 * including column order.
 *
 * <p>Every node keeps at least one column, so row counts survive pruning.
 */
public class ProjectionPushdownRule implements OptimizationRule {

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return prune(plan, new LinkedHashSet<>(plan.schema().names()));
    }

    private LogicalPlan prune(LogicalPlan plan, Set<String> required) {
        if (plan instanceof Scan scan) {
            return pruneScan(scan, required);
        }
        if (plan instanceof Filter filter) {
            return pruneChild(filter, union(required, ExpressionUtils.referencedColumns(filter.condition())));
        }
        if (plan instanceof Sort sort) {
            return pruneChild(sort, union(required, ExpressionUtils.referencedColumns(sort.expressions())));
        }
        if (plan instanceof Project project) {
            return pruneProject(project, required);
        }
        if (plan instanceof WithColumns withColumns) {
            return pruneWithColumns(withColumns, required);
        }
        if (plan instanceof Window window) {
            return pruneWindow(window, required);
        }
        if (plan instanceof Aggregate aggregate) {
            return pruneAggregate(aggregate, required);
        }
        if (plan instanceof Join join) {
            return pruneJoin(join, required);
        }
        if (plan instanceof Union union) {
            return pruneUnion(union, required);
        }
        if (plan instanceof Distinct distinct) {
            Set<String> needed = distinct.subset() == null
                ? new LinkedHashSet<>(distinct.child().schema().names())
                : union(required, distinct.subset());
            return pruneChild(distinct, needed);
        }
        if (plan instanceof Explode explode) {
            return pruneChild(explode, union(required, explode.columns()));
        }
        if (plan instanceof Unpivot unpivot) {
            return pruneUnpivot(unpivot, required);
        }
        if (plan instanceof Upsample upsample) {
            Set<String> needed = union(required, upsample.upsampler().by());
            needed.add(upsample.upsampler().timeColumn());
            return pruneChild(upsample, needed);
        }
        if (plan instanceof Cache cache) {
            // Cached subplans are shared; every consumer sees the full schema
            return pruneChild(cache, new LinkedHashSet<>(cache.child().schema().names()));
        }
        // Slice
        return pruneChild(plan, required);
    }

    // ==================== Node handlers ====================

    private LogicalPlan pruneScan(Scan scan, Set<String> required) {
        List<String> current = scan.schema().names();
        List<String> kept = new ArrayList<>();
        for (String name : current) {
            if (required.contains(name)) {
                kept.add(name);
            }
        }
        if (kept.isEmpty()) {
            kept.add(current.get(0));
        }
        if (kept.size() == current.size()) {
            return scan;
        }
        return scan.withProjection(kept);
    }

    private LogicalPlan pruneProject(Project project, Set<String> required) {
        List<Expression> kept = new ArrayList<>();
        for (Expression expr : project.projections()) {
            if (required.contains(expr.outputName())) {
                kept.add(expr);
            }
        }
        if (kept.isEmpty()) {
            kept.add(project.projections().get(0));
        }
        LogicalPlan child = prune(project.child(), ExpressionUtils.referencedColumns(kept));
        if (kept.size() == project.projections().size()) {
            return rebuild(project, List.of(child));
        }
        return new Project(child, kept);
    }

    private LogicalPlan pruneWithColumns(WithColumns withColumns, Set<String> required) {
        List<Expression> kept = new ArrayList<>();
        for (Expression expr : withColumns.columns()) {
            if (required.contains(expr.outputName())) {
                kept.add(expr);
            }
        }
        // Replaced columns stay in the child so that they keep their position
        LogicalPlan child = prune(withColumns.child(), union(required, ExpressionUtils.referencedColumns(kept)));
        if (kept.isEmpty()) {
            return child;
        }
        if (kept.size() == withColumns.columns().size()) {
            return rebuild(withColumns, List.of(child));
        }
        return new WithColumns(child, kept);
    }

    private LogicalPlan pruneWindow(Window window, Set<String> required) {
        List<AliasExpression> kept = new ArrayList<>();
        for (AliasExpression expr : window.windowExpressions()) {
            if (required.contains(expr.alias())) {
                kept.add(expr);
            }
        }
        LogicalPlan child = prune(window.child(), union(required, ExpressionUtils.referencedColumns(kept)));
        if (kept.isEmpty()) {
            return child;
        }
        if (kept.size() == window.windowExpressions().size()) {
            return rebuild(window, List.of(child));
        }
        return new Window(child, kept);
    }

    private LogicalPlan pruneAggregate(Aggregate aggregate, Set<String> required) {
        List<Expression> kept = new ArrayList<>();
        for (Expression expr : aggregate.aggregateExpressions()) {
            if (required.contains(expr.outputName())) {
                kept.add(expr);
            }
        }
        if (kept.isEmpty() && aggregate.groupingExpressions().isEmpty()
                && !aggregate.aggregateExpressions().isEmpty()) {
            kept.add(aggregate.aggregateExpressions().get(0));
        }
        Set<String> needed = new LinkedHashSet<>(ExpressionUtils.referencedColumns(aggregate.groupingExpressions()));
        needed.addAll(ExpressionUtils.referencedColumns(kept));
        LogicalPlan child = prune(aggregate.child(), needed);
        if (kept.size() == aggregate.aggregateExpressions().size()) {
            return rebuild(aggregate, List.of(child));
        }
        return new Aggregate(child, aggregate.groupingExpressions(), kept);
    }

    private LogicalPlan pruneJoin(Join join, Set<String> required) {
        Set<String> leftNames = new HashSet<>(join.left().schema().names());
        Set<String> leftNeeded = new LinkedHashSet<>();
        for (String name : join.left().schema().names()) {
            if (required.contains(name)) {
                leftNeeded.add(name);
            }
        }
        leftNeeded.addAll(ExpressionUtils.referencedColumns(join.leftKeys()));
        leftNeeded.addAll(join.options().leftBy());

        Set<String> rightNeeded = new LinkedHashSet<>(ExpressionUtils.referencedColumns(join.rightKeys()));
        rightNeeded.addAll(join.options().rightBy());
        if (join.joinType().outputsRight()) {
            for (Join.RightOutput output : join.rightOutputs()) {
                if (!required.contains(output.name())) {
                    continue;
                }
                rightNeeded.add(output.source());
                // The suffix is only applied while the left column exists
                if (!output.name().equals(output.source()) && leftNames.contains(output.source())) {
                    leftNeeded.add(output.source());
                }
            }
        }
        if (join.joinType() == JoinType.SEMI || join.joinType() == JoinType.ANTI) {
            rightNeeded.retainAll(ExpressionUtils.referencedColumns(join.rightKeys()));
        }
        LogicalPlan left = prune(join.left(), leftNeeded);
        LogicalPlan right = prune(join.right(), rightNeeded);
        return rebuild(join, List.of(left, right));
    }

    private LogicalPlan pruneUnion(Union union, Set<String> required) {
        List<String> target = new ArrayList<>();
        for (String name : union.schema().names()) {
            if (required.contains(name)) {
                target.add(name);
            }
        }
        if (target.isEmpty()) {
            target.add(union.schema().names().get(0));
        }
        List<LogicalPlan> inputs = new ArrayList<>(union.inputs().size());
        for (LogicalPlan input : union.inputs()) {
            LogicalPlan pruned = prune(input, new LinkedHashSet<>(target));
            if (!pruned.schema().names().equals(target)) {
                pruned = Project.columns(pruned, target);
            }
            inputs.add(pruned);
        }
        return rebuild(union, inputs);
    }

    private LogicalPlan pruneUnpivot(Unpivot unpivot, Set<String> required) {
        List<String> index = new ArrayList<>();
        for (String name : unpivot.index()) {
            if (required.contains(name)) {
                index.add(name);
            }
        }
        Set<String> needed = new LinkedHashSet<>(index);
        needed.addAll(unpivot.on());
        LogicalPlan child = prune(unpivot.child(), needed);
        if (index.size() == unpivot.index().size()) {
            return rebuild(unpivot, List.of(child));
        }
        return new Unpivot(child, index, unpivot.on(), unpivot.variableName(), unpivot.valueName());
    }

    private LogicalPlan pruneChild(LogicalPlan plan, Set<String> needed) {
        return rebuild(plan, List.of(prune(plan.child(), needed)));
    }

    // ==================== Helpers ====================

    private static Set<String> union(Set<String> a, Collection<String> b) {
        Set<String> result = new LinkedHashSet<>(a);
        result.addAll(b);
        return result;
    }

    private static LogicalPlan rebuild(LogicalPlan plan, List<LogicalPlan> children) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) != plan.children().get(i)) {
                return plan.withChildren(children);
            }
        }
        return plan;
    }

    @Override
    public String name() {
        return "ProjectionPushdown";
    }
}
