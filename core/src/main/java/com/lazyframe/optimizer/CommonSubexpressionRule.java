package com.lazyframe.optimizer;

import com.lazyframe.expression.AggregateExpression;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.Literal;
import com.lazyframe.expression.SortOrder;
import com.lazyframe.expression.UnresolvedColumn;
import com.lazyframe.expression.WindowFunction;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Cache;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Project;
import com.lazyframe.logical.WithColumns;
import com.lazyframe.types.StructType;
import com.lazyframe.types.UnresolvedType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes repeated work once.
 *
 * <p><b>Common subexpressions:</b> a pure subexpression that appears more than once among
 * the outputs of a projection, a column definition node or the aggregate arguments of an
 * aggregation is computed once into a temporary {@code __cse_N} column below the node,
 * and the occurrences read that column. Temporaries never reach the node's output.
 *
 * <p><b>Common subplans:</b> a subplan that appears more than once in the plan (for
 * example both inputs of a self-join) is wrapped in {@link Cache} nodes with a shared id,
 * so that it executes once per query.
 */
public class CommonSubexpressionRule implements OptimizationRule {

    private static final Logger logger = LoggerFactory.getLogger(CommonSubexpressionRule.class);

    /** Prefix of the temporary columns holding shared subexpressions */
    public static final String TEMP_PREFIX = "__cse_";

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        LogicalPlan rewritten = plan.transformUp(this::eliminateExpressions);
        return eliminateSubplans(rewritten);
    }

    // ==================== Subexpressions ====================

    private LogicalPlan eliminateExpressions(LogicalPlan node) {
        if (node instanceof Project project) {
            Extraction extraction = extract(project.projections(), project.child().schema(), false);
            if (extraction == null) {
                return node;
            }
            LogicalPlan child = new WithColumns(project.child(), extraction.definitions);
            return new Project(child, extraction.rewritten);
        }
        if (node instanceof WithColumns withColumns) {
            Extraction extraction = extract(withColumns.columns(), withColumns.child().schema(), false);
            if (extraction == null) {
                return node;
            }
            LogicalPlan child = new WithColumns(withColumns.child(), extraction.definitions);
            LogicalPlan outer = new WithColumns(child, extraction.rewritten);
            return Project.columns(outer, withColumns.schema().names());
        }
        if (node instanceof Aggregate aggregate) {
            Extraction extraction = extract(aggregate.aggregateExpressions(), aggregate.child().schema(), true);
            if (extraction == null) {
                return node;
            }
            LogicalPlan child = new WithColumns(aggregate.child(), extraction.definitions);
            return new Aggregate(child, aggregate.groupingExpressions(), extraction.rewritten);
        }
        return node;
    }

    private static final class Extraction {
        final List<Expression> definitions = new ArrayList<>();
        List<Expression> rewritten;
    }

    /**
     * Replaces repeated subexpressions by temporary columns, largest first.
     *
     * @param exprs the node's expressions
     * @param input the node's input schema
     * @param insideAggregates whether only aggregate arguments are searched
     * @return the extraction, or null if nothing repeats
     */
    private Extraction extract(List<Expression> exprs, StructType input, boolean insideAggregates) {
        Extraction extraction = new Extraction();
        List<Expression> current = exprs;
        int next = 0;
        while (true) {
            Optional<Expression> candidate = largestRepeated(current, insideAggregates);
            if (candidate.isEmpty()) {
                break;
            }
            Expression shared = candidate.get();
            String name = TEMP_PREFIX + next++;
            while (input.contains(name)) {
                name = TEMP_PREFIX + next++;
            }
            extraction.definitions.add(new AliasExpression(shared, name));
            ColumnReference ref = new ColumnReference(name, shared.dataType());
            UnaryOperator<Expression> substitute = e -> ExpressionUtils.transformDown(e,
                sub -> sub.equals(shared) ? ref : sub);
            // Outside aggregate arguments, aggregation outputs may only read grouping keys
            UnaryOperator<Expression> replace = ExpressionRewrites.preservingNames(!insideAggregates
                ? substitute
                : e -> ExpressionUtils.transformDown(e, sub -> sub instanceof AggregateExpression agg
                    ? agg.withChildren(List.of(substitute.apply(agg.argument())))
                    : sub));
            List<Expression> replaced = new ArrayList<>(current.size());
            for (Expression expr : current) {
                replaced.add(replace.apply(expr));
            }
            current = replaced;
            logger.debug("Sharing {} as {}", shared, name);
        }
        if (extraction.definitions.isEmpty()) {
            return null;
        }
        extraction.rewritten = current;
        return extraction;
    }

    private static Optional<Expression> largestRepeated(List<Expression> exprs, boolean insideAggregates) {
        Map<Expression, Integer> counts = new LinkedHashMap<>();
        for (Expression expr : exprs) {
            count(ExpressionUtils.unalias(expr), insideAggregates, counts);
        }
        Expression best = null;
        int bestSize = 0;
        for (Map.Entry<Expression, Integer> entry : counts.entrySet()) {
            if (entry.getValue() < 2) {
                continue;
            }
            int size = ExpressionUtils.size(entry.getKey());
            if (size > bestSize) {
                best = entry.getKey();
                bestSize = size;
            }
        }
        return Optional.ofNullable(best);
    }

    private static void count(Expression expr, boolean collecting, Map<Expression, Integer> counts) {
        if (expr instanceof WindowFunction) {
            return;
        }
        if (expr instanceof AggregateExpression agg) {
            if (collecting) {
                count(agg.argument(), false, counts);
            }
            return;
        }
        if (!collecting && isShareable(expr)) {
            counts.merge(expr, 1, Integer::sum);
        }
        for (Expression child : expr.children()) {
            count(child, collecting, counts);
        }
    }

    private static boolean isShareable(Expression expr) {
        if (expr instanceof Literal || expr instanceof ColumnReference || expr instanceof UnresolvedColumn
                || expr instanceof AliasExpression || expr instanceof SortOrder) {
            return false;
        }
        return !(expr.dataType() instanceof UnresolvedType)
            && ExpressionUtils.isPure(expr) && !ExpressionUtils.isFallible(expr);
    }

    // ==================== Subplans ====================

    private LogicalPlan eliminateSubplans(LogicalPlan plan) {
        long nextId = maxCacheId(plan) + 1;
        LogicalPlan current = plan;
        while (true) {
            Map<LogicalPlan, Integer> counts = new LinkedHashMap<>();
            countSubplans(current, counts);
            LogicalPlan best = null;
            for (Map.Entry<LogicalPlan, Integer> entry : counts.entrySet()) {
                LogicalPlan candidate = entry.getKey();
                if (entry.getValue() >= 2 && candidate.size() >= 2
                        && (best == null || candidate.size() > best.size())) {
                    best = candidate;
                }
            }
            if (best == null) {
                return current;
            }
            long id = nextId++;
            logger.debug("Caching shared subplan {} as cache {}", best.nodeName(), id);
            current = wrapOccurrences(current, best, id);
        }
    }

    private static void countSubplans(LogicalPlan plan, Map<LogicalPlan, Integer> counts) {
        if (plan instanceof Cache) {
            return;
        }
        counts.merge(plan, 1, Integer::sum);
        for (LogicalPlan child : plan.children()) {
            countSubplans(child, counts);
        }
    }

    private static LogicalPlan wrapOccurrences(LogicalPlan plan, LogicalPlan target, long id) {
        if (plan instanceof Cache) {
            return plan;
        }
        if (plan.equals(target)) {
            return new Cache(plan, id);
        }
        List<LogicalPlan> children = new ArrayList<>(plan.children().size());
        boolean changed = false;
        for (LogicalPlan child : plan.children()) {
            LogicalPlan next = wrapOccurrences(child, target, id);
            changed |= next != child;
            children.add(next);
        }
        return changed ? plan.withChildren(children) : plan;
    }

    private static long maxCacheId(LogicalPlan plan) {
        long max = -1;
        if (plan instanceof Cache cache) {
            max = cache.id();
        }
        for (LogicalPlan child : plan.children()) {
            max = Math.max(max, maxCacheId(child));
        }
        return max;
    }

    @Override
    public String name() {
        return "CommonSubexpressionElimination";
    }
}
