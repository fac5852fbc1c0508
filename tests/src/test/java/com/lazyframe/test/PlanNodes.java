package com.lazyframe.test;

import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.PlanPrinter;
import java.util.ArrayList;
import java.util.List;

/**
 * Searches logical plans by node type.
 */
public final class PlanNodes {

    private PlanNodes() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns every node of a type, in pre-order.
     */
    public static <T extends LogicalPlan> List<T> find(LogicalPlan plan, Class<T> type) {
        List<T> found = new ArrayList<>();
        collect(plan, type, found);
        return found;
    }

    public static <T extends LogicalPlan> T only(LogicalPlan plan, Class<T> type) {
        List<T> found = find(plan, type);
        if (found.size() != 1) {
            throw new AssertionError("expected one " + type.getSimpleName() + " but found " + found.size()
                + " in\n" + PlanPrinter.render(plan));
        }
        return found.get(0);
    }

    private static <T extends LogicalPlan> void collect(LogicalPlan plan, Class<T> type, List<T> found) {
        if (type.isInstance(plan)) {
            found.add(type.cast(plan));
        }
        for (LogicalPlan child : plan.children()) {
            collect(child, type, found);
        }
    }
}
