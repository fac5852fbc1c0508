package com.lazyframe.optimizer;

import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.ExpressionUtils;
import com.lazyframe.expression.UnaryExpression;
import com.lazyframe.expression.UnresolvedColumn;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.JoinOptions;
import com.lazyframe.logical.JoinType;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.types.TypeCoercion;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites joins into cheaper equivalent forms.
 *
 * <ul>
 *   <li>A cross join filtered by an equality between a left and a right expression
 *       becomes an inner equi-join, and an inner join absorbs such equalities as
 *       additional keys</li>
 *   <li>A left join below a filter that rejects rows whose right columns are null
 *       becomes an inner join</li>
 *   <li>Hash joins without an explicit build side build from the input with the smaller
 *       estimated row count</li>
 * </ul>
 *
 * <p>Output columns and row order are unchanged; a rewrite that would change the output
 * schema (for example by dropping a duplicate key column) is skipped.
 */
public class JoinReorderingRule implements OptimizationRule {

    private static final Logger logger = LoggerFactory.getLogger(JoinReorderingRule.class);

    @Override
    public LogicalPlan apply(LogicalPlan plan) {
        return plan.transformUp(node -> {
            LogicalPlan rewritten = node;
            if (rewritten instanceof Filter filter && filter.child() instanceof Join join) {
                rewritten = rewriteFilteredJoin(filter, join);
            }
            if (rewritten instanceof Join join) {
                rewritten = chooseBuildSide(join);
            }
            return rewritten;
        });
    }

    private LogicalPlan rewriteFilteredJoin(Filter filter, Join join) {
        List<Expression> conjuncts = ExpressionUtils.splitConjuncts(filter.condition());
        Join current = join;
        if (current.joinType() == JoinType.LEFT && rejectsNullRight(conjuncts, current)) {
            logger.debug("Converting left join to inner join below null-rejecting filter");
            current = current.withJoinType(JoinType.INNER);
        }
        if (current.joinType() != JoinType.CROSS && current.joinType() != JoinType.INNER) {
            return current == join ? filter : new Filter(current, filter.condition());
        }

        Set<String> leftColumns = new HashSet<>(current.left().schema().names());
        Map<String, String> rightSources = new HashMap<>();
        for (Join.RightOutput output : current.rightOutputs()) {
            rightSources.put(output.name(), output.source());
        }
        List<Expression> remaining = new ArrayList<>();
        for (Expression conjunct : conjuncts) {
            Join absorbed = absorbEquality(current, conjunct, leftColumns, rightSources);
            if (absorbed == null) {
                remaining.add(conjunct);
            } else {
                current = absorbed;
            }
        }
        if (current == join) {
            return filter;
        }
        return remaining.isEmpty() ? current : new Filter(current, ExpressionUtils.combineConjuncts(remaining));
    }

    /**
     * Turns {@code left_expr == right_expr} into a join key pair.
     *
     * @return the join with the extra key, or null if the conjunct does not qualify
     */
    private static Join absorbEquality(Join join, Expression conjunct, Set<String> leftColumns,
                                       Map<String, String> rightSources) {
        if (!(conjunct instanceof BinaryExpression bin) || bin.operator() != BinaryExpression.Operator.EQUAL
                || !ExpressionUtils.isPure(conjunct) || ExpressionUtils.isFallible(conjunct)) {
            return null;
        }
        Expression leftKey;
        Expression rightKey;
        if (onlyReads(bin.left(), leftColumns) && onlyReads(bin.right(), rightSources.keySet())) {
            leftKey = bin.left();
            rightKey = bin.right();
        } else if (onlyReads(bin.right(), leftColumns) && onlyReads(bin.left(), rightSources.keySet())) {
            leftKey = bin.right();
            rightKey = bin.left();
        } else {
            return null;
        }
        if (TypeCoercion.commonSupertype(leftKey.dataType(), rightKey.dataType()).isEmpty()) {
            return null;
        }
        Map<String, Expression> renames = new HashMap<>();
        for (String column : ExpressionUtils.referencedColumns(rightKey)) {
            renames.put(column, new UnresolvedColumn(rightSources.get(column)));
        }
        List<Expression> leftKeys = new ArrayList<>(join.leftKeys());
        List<Expression> rightKeys = new ArrayList<>(join.rightKeys());
        leftKeys.add(leftKey);
        rightKeys.add(ExpressionUtils.replaceColumns(rightKey, renames));
        Join candidate = new Join(join.left(), join.right(), JoinType.INNER, leftKeys, rightKeys, join.options());
        if (!candidate.schema().equals(join.schema())) {
            return null;
        }
        return candidate;
    }

    private static boolean onlyReads(Expression expr, Set<String> columns) {
        Set<String> referenced = ExpressionUtils.referencedColumns(expr);
        return !referenced.isEmpty() && columns.containsAll(referenced);
    }

    /**
     * Returns true if some conjunct is null (or false) whenever the right side of the join
     * did not match: a comparison or a not-null test on a right column.
     */
    private static boolean rejectsNullRight(List<Expression> conjuncts, Join join) {
        Set<String> rightColumns = new HashSet<>();
        for (Join.RightOutput output : join.rightOutputs()) {
            rightColumns.add(output.name());
        }
        for (Expression conjunct : conjuncts) {
            if (conjunct instanceof BinaryExpression bin && bin.operator().isComparison()
                    && (isColumnIn(bin.left(), rightColumns) || isColumnIn(bin.right(), rightColumns))) {
                return true;
            }
            if (conjunct instanceof UnaryExpression unary
                    && unary.operator() == UnaryExpression.Operator.IS_NOT_NULL
                    && isColumnIn(unary.operand(), rightColumns)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isColumnIn(Expression expr, Set<String> columns) {
        return expr instanceof ColumnReference ref && columns.contains(ref.name());
    }

    private static LogicalPlan chooseBuildSide(Join join) {
        JoinType type = join.joinType();
        if (type == JoinType.CROSS || type == JoinType.ASOF
                || join.options().buildSide() != JoinOptions.BuildSide.AUTO) {
            return join;
        }
        OptionalLong left = join.left().estimatedRowCount();
        OptionalLong right = join.right().estimatedRowCount();
        if (left.isEmpty() || right.isEmpty()) {
            return join;
        }
        JoinOptions.BuildSide side = left.getAsLong() < right.getAsLong()
            ? JoinOptions.BuildSide.LEFT : JoinOptions.BuildSide.RIGHT;
        return join.withOptions(join.options().withBuildSide(side));
    }

    @Override
    public String name() {
        return "JoinReordering";
    }
}
