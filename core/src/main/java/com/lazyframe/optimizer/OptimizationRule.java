package com.lazyframe.optimizer;

import com.lazyframe.logical.LogicalPlan;

/**
 * Interface for query optimization rules.
 *
 * <p>Optimization rules transform a logical plan into an equivalent plan
 * that should execute more efficiently. Rules are applied in order, and the
 * sequence is repeated until no more changes occur or a maximum iteration
 * limit is reached.
 *
 * <p>Rules must preserve query semantics - the optimized plan must
 * produce the same rows, columns and values as the original plan, in the same
 * order wherever the original order is defined. A rule that cannot prove a
 * rewrite safe must skip it.
 */
public interface OptimizationRule {

    /**
     * Applies this optimization rule to a logical plan.
     *
     * <p>The rule should return a transformed plan if optimizations are
     * applicable, or the original plan if no optimizations apply.
     *
     * <p>Rules should be idempotent - applying the same rule multiple
     * times should not cause further changes after the first application.
     *
     * @param plan the input plan
     * @return the optimized plan (or original if no optimization applied)
     */
    LogicalPlan apply(LogicalPlan plan);

    /**
     * Returns the name of this optimization rule.
     *
     * <p>Used for logging and debugging.
     *
     * @return the rule name
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
