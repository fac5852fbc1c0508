package com.lazyframe.optimizer;

import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.SortOrder;
import java.util.function.UnaryOperator;

/**
 * Helpers shared by rules that rewrite the expressions of plan nodes.
 */
final class ExpressionRewrites {

    private ExpressionRewrites() {
        // Utility class - prevent instantiation
    }

    /**
     * Wraps a node-level rewrite so that each rewritten top-level expression keeps the
     * output name of the original. Sort keys keep their sort direction instead.
     *
     * @param rewrite the rewrite of one top-level expression
     * @return the name-preserving rewrite
     */
    static UnaryOperator<Expression> preservingNames(UnaryOperator<Expression> rewrite) {
        return expr -> {
            Expression rewritten = rewrite.apply(expr);
            if (rewritten == expr || rewritten instanceof SortOrder
                    || rewritten.outputName().equals(expr.outputName())) {
                return rewritten;
            }
            return new AliasExpression(ExpressionUtils.unalias(rewritten), expr.outputName());
        };
    }

    /**
     * Applies a bottom-up expression rewrite to every top-level expression, preserving
     * output names.
     *
     * @param rule the per-node rewrite
     * @return the top-level rewrite
     */
    static UnaryOperator<Expression> bottomUp(UnaryOperator<Expression> rule) {
        return preservingNames(expr -> ExpressionUtils.transformUp(expr, rule));
    }
}
