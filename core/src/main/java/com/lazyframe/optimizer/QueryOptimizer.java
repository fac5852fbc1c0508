package com.lazyframe.optimizer;

import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.PlanPrinter;
import com.lazyframe.runtime.EngineConfig;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Query optimizer that applies optimization rules to logical plans.
 *
 * <p>The optimizer applies its rules in order, and repeats the sequence until
 * no more changes occur or a maximum iteration limit is reached. This allows
 * rules to enable each other (e.g., predicate pushdown enabling projection
 * pushdown into a scan).
 *
 * <p>Example usage:
 * <pre>
 *   QueryOptimizer optimizer = QueryOptimizer.forConfig(EngineConfig.defaults());
 *   LogicalPlan optimized = optimizer.optimize(plan);
 * </pre>
 *
 * <p>The full rule sequence, each rule enabled by its own configuration toggle:
 * <ol>
 *   <li>Type coercion - make implicit casts explicit</li>
 *   <li>Expression simplification - constant folding, boolean and algebraic identities</li>
 *   <li>Predicate pushdown - move filters towards scans</li>
 *   <li>Projection pushdown - read and carry only the columns that are needed</li>
 *   <li>Slice pushdown - propagate row limits into scans and sorts</li>
 *   <li>Common subexpression elimination - compute repeated expressions and subplans once</li>
 *   <li>Join reordering - rewrite degenerate joins and choose hash join build sides</li>
 * </ol>
 */
public class QueryOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(QueryOptimizer.class);

    /** Default iteration limit */
    public static final int DEFAULT_MAX_ITERATIONS = 5;

    private final List<OptimizationRule> rules;
    private final int maxIterations;
    private int lastIterations;

    /**
     * Creates a query optimizer with every rule enabled.
     */
    public QueryOptimizer() {
        this(createRules(EngineConfig.defaults()), DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Creates a query optimizer with custom rules and max iterations.
     *
     * @param rules the optimization rules to apply
     * @param maxIterations the maximum number of iterations
     */
    public QueryOptimizer(List<OptimizationRule> rules, int maxIterations) {
        this.rules = new ArrayList<>(rules);
        this.maxIterations = maxIterations;
    }

    /**
     * Creates a query optimizer with the rules a configuration enables.
     *
     * @param config the engine configuration
     * @return the optimizer
     */
    public static QueryOptimizer forConfig(EngineConfig config) {
        return new QueryOptimizer(createRules(config), DEFAULT_MAX_ITERATIONS);
    }

    /**
     * Optimizes a logical plan by applying optimization rules.
     *
     * <p>Rules are applied iteratively until no changes occur or max
     * iterations is reached. Each iteration applies all rules in order.
     *
     * @param plan the input plan
     * @return the optimized plan
     */
    public LogicalPlan optimize(LogicalPlan plan) {
        if (plan == null) {
            return null;
        }

        long start = System.nanoTime();
        LogicalPlan currentPlan = plan;
        int iteration = 0;

        while (iteration < maxIterations) {
            iteration++;
            LogicalPlan previousPlan = currentPlan;

            // Apply each rule in sequence
            for (OptimizationRule rule : rules) {
                LogicalPlan before = currentPlan;
                currentPlan = rule.apply(currentPlan);
                if (logger.isDebugEnabled() && !currentPlan.equals(before)) {
                    logger.debug("{} rewrote the plan (iteration {}):\n{}",
                        rule.name(), iteration, PlanPrinter.render(currentPlan));
                }
            }

            // Check if plan changed
            if (currentPlan == previousPlan || currentPlan.equals(previousPlan)) {
                // No changes in this iteration, optimization complete
                break;
            }
        }

        lastIterations = iteration;
        logger.debug("Optimization finished after {} iterations in {}ms",
            iteration, (System.nanoTime() - start) / 1_000_000);
        return currentPlan;
    }

    /**
     * Creates the rules enabled by a configuration, in application order.
     *
     * @param config the engine configuration
     * @return the rules
     */
    public static List<OptimizationRule> createRules(EngineConfig config) {
        List<OptimizationRule> rules = new ArrayList<>();
        if (config.typeCoercion()) {
            rules.add(new TypeCoercionRule());
        }
        if (config.simplifyExpressions()) {
            rules.add(new SimplifyExpressionsRule());
        }
        if (config.predicatePushdown()) {
            rules.add(new PredicatePushdownRule());
        }
        if (config.projectionPushdown()) {
            rules.add(new ProjectionPushdownRule());
        }
        if (config.slicePushdown()) {
            rules.add(new SlicePushdownRule());
        }
        if (config.cse()) {
            rules.add(new CommonSubexpressionRule());
        }
        if (config.joinReordering()) {
            rules.add(new JoinReorderingRule());
        }
        return rules;
    }

    /**
     * Returns the list of optimization rules.
     *
     * @return the rules
     */
    public List<OptimizationRule> rules() {
        return new ArrayList<>(rules);
    }

    /**
     * Returns the maximum number of iterations.
     *
     * @return the max iterations
     */
    public int maxIterations() {
        return maxIterations;
    }

    /**
     * Returns the number of iterations the last {@link #optimize} call ran.
     *
     * @return the iteration count
     */
    public int lastIterations() {
        return lastIterations;
    }
}
