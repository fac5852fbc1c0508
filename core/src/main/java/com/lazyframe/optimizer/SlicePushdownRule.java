package com.lazyframe.optimizer;

import com.lazyframe.logical.Explode;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.JoinType;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Project;
import com.lazyframe.logical.Scan;
import com.lazyframe.logical.Slice;
import com.lazyframe.logical.Sort;
import com.lazyframe.logical.Union;
import com.lazyframe.logical.WithColumns;
import java.util.ArrayList;
import java.util.List;

/**
 * Propagates the number of leading rows a slice needs towards the sources.
 *
 * <p>The slice itself stays in place; its inputs learn an upper bound on the rows they
 * must produce:
 * <ul>
 *   <li>A scan gets a row limit</li>
 *   <li>A sort becomes a top-k sort</li>
 *   <li>Row-wise operators (projections, column definitions) pass the bound on</li>
 *   <li>Unions pass the bound to every input</li>
 *   <li>Left, as-of and cross joins pass it to the left input, since every left row
 *       produces at least one output row in left order (cross joins with an empty right
 *       side produce nothing at all)</li>
 *   <li>Explode passes it on, since every input row produces at least one row</li>
 * </ul>
 *
 * <p>Slices from the end (negative offsets) do not bound their input.
 */
public class SlicePushdownRule implements OptimizationRule {

    private static final long UNBOUNDED = -1;

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return bound(plan, UNBOUNDED);
    }

    private LogicalPlan bound(LogicalPlan plan, long limit) {
        if (plan instanceof Slice slice) {
            long needed = UNBOUNDED;
            if (slice.isHead()) {
                long length = limit < 0 ? slice.length() : Math.min(slice.length(), limit);
                needed = saturatedAdd(slice.offset(), length);
            }
            return rebuild(slice, List.of(bound(slice.child(), needed)));
        }
        if (limit < 0) {
            return boundChildren(plan, UNBOUNDED);
        }
        if (plan instanceof Scan scan) {
            if (scan.rowLimit() >= 0 && scan.rowLimit() <= limit) {
                return scan;
            }
            return scan.withRowLimit(limit);
        }
        if (plan instanceof Sort sort) {
            LogicalPlan child = bound(sort.child(), UNBOUNDED);
            Sort rebuilt = (Sort) rebuild(sort, List.of(child));
            if (rebuilt.topK() >= 0 && rebuilt.topK() <= limit) {
                return rebuilt;
            }
            return rebuilt.withTopK(limit);
        }
        if (plan instanceof Project || plan instanceof WithColumns || plan instanceof Explode
                || plan instanceof Union) {
            return boundChildren(plan, limit);
        }
        if (plan instanceof Join join) {
            JoinType type = join.joinType();
            if (type == JoinType.LEFT || type == JoinType.ASOF || type == JoinType.CROSS) {
                LogicalPlan left = bound(join.left(), limit);
                LogicalPlan right = bound(join.right(), UNBOUNDED);
                return rebuild(join, List.of(left, right));
            }
        }
        return boundChildren(plan, UNBOUNDED);
    }

    private LogicalPlan boundChildren(LogicalPlan plan, long limit) {
        List<LogicalPlan> children = new ArrayList<>(plan.children().size());
        for (LogicalPlan child : plan.children()) {
            children.add(bound(child, limit));
        }
        return rebuild(plan, children);
    }

    private static long saturatedAdd(long a, long b) {
        long sum = a + b;
        return sum < 0 ? Long.MAX_VALUE : sum;
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
        return "SlicePushdown";
    }
}
