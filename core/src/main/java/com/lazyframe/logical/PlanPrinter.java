package com.lazyframe.logical;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Renders plan trees as indented text, one node per line.
 *
 * <pre>
 * Project([col("a")])
 * +- Filter([(col("a")) &gt; (1)])
 *    +- Scan(people)
 * </pre>
 */
public final class PlanPrinter {

    private PlanPrinter() {
        // Utility class - prevent instantiation
    }

    /**
     * Renders a logical plan.
     *
     * @param plan the plan
     * @return the rendered tree
     */
    public static String render(LogicalPlan plan) {
        return render(plan, LogicalPlan::children, LogicalPlan::toString);
    }

    /**
     * Renders any tree of nodes.
     *
     * @param root the root node
     * @param children returns a node's children
     * @param label returns a node's one-line description
     * @param <T> the node type
     * @return the rendered tree
     */
    public static <T> String render(T root, Function<T, List<? extends T>> children, Function<T, String> label) {
        StringBuilder sb = new StringBuilder();
        append(sb, root, children, label, "", "", new IdentityHashMap<>());
        return sb.toString();
    }

    private static <T> void append(StringBuilder sb, T node, Function<T, List<? extends T>> children,
                                   Function<T, String> label, String prefix, String childPrefix,
                                   Map<T, Boolean> seen) {
        sb.append(prefix).append(label.apply(node));
        boolean repeated = seen.put(node, Boolean.TRUE) != null;
        List<? extends T> kids = children.apply(node);
        if (repeated && !kids.isEmpty()) {
            sb.append(" [shared]\n");
            return;
        }
        sb.append('\n');
        for (T child : kids) {
            append(sb, child, children, label, childPrefix + "+- ", childPrefix + "   ", seen);
        }
    }
}
