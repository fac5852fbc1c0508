package com.lazyframe.optimizer;

import static com.lazyframe.api.Functions.coalesce;
import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.when;
import static org.assertj.core.api.Assertions.assertThat;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.CastExpression;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.Literal;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Project;
import com.lazyframe.test.BatchAssertions;
import com.lazyframe.test.PlanNodes;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.LongType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TypeCoercionRule}.
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@DisplayName("TypeCoercionRule")
public class TypeCoercionRuleTest extends TestBase {

    private final TypeCoercionRule rule = new TypeCoercionRule();

    private static LazyFrame orders() {
        return LazyFrame.fromBatch("orders", TestData.orders(40));
    }

    private BinaryExpression coercedCondition(LazyFrame frame) {
        LogicalPlan plan = rule.apply(frame.logicalPlan());
        return (BinaryExpression) PlanNodes.only(plan, Filter.class).condition();
    }

    private Expression coercedProjection(Expression expr) {
        LogicalPlan plan = rule.apply(orders().select(expr.alias("out")).logicalPlan());
        return ((AliasExpression) PlanNodes.only(plan, Project.class).projections().get(0)).expression();
    }

    @Test
    @DisplayName("An integer column compared with a float is cast")
    void testColumnWidened() {
        BinaryExpression condition = coercedCondition(orders().filter(col("qty").gt(1.5)));

        assertThat(condition.left()).isInstanceOf(CastExpression.class);
        assertThat(((CastExpression) condition.left()).targetType()).isEqualTo(DoubleType.get());
        assertThat(condition.right()).isInstanceOf(Literal.class);
    }

    @Test
    @DisplayName("Literals are converted in place")
    void testLiteralConverted() {
        BinaryExpression condition = coercedCondition(orders().filter(col("amount").eq(50)));

        assertThat(condition.right()).isInstanceOf(Literal.class);
        assertThat(((Literal) condition.right()).value()).isEqualTo(50.0);
        assertThat(condition.right().dataType()).isEqualTo(DoubleType.get());
    }

    @Test
    @DisplayName("Function arguments are cast to their common type")
    void testFunctionArguments() {
        Expression call = coercedProjection(coalesce(col("qty"), 0L));

        assertThat(call.dataType()).isEqualTo(LongType.get());
        assertThat(call.children().get(0)).isInstanceOf(CastExpression.class);
        assertThat(call.children().get(1)).isInstanceOf(Literal.class);
    }

    @Test
    @DisplayName("Conditional branches are unified")
    void testConditionalBranches() {
        Expression conditional = coercedProjection(when(col("qty").gt(10)).then(col("qty")).otherwise(0.5));

        assertThat(conditional.dataType()).isEqualTo(DoubleType.get());
        // Children are condition, value, default
        assertThat(conditional.children().get(1)).isInstanceOf(CastExpression.class);
        assertThat(conditional.children().get(0)).isInstanceOf(BinaryExpression.class);
    }

    @Test
    @DisplayName("Coercion does not change results")
    void testResultsUnchanged() {
        LazyFrame frame = orders()
            .filter(col("qty").gt(12.5).or(col("amount").ltEq(30)))
            .select("id", col("qty").plus(col("amount")).alias("mixed"));

        BatchAssertions.assertSameResult(
            frame.withConfig(TestData.inMemory()).collect(),
            frame.withConfig(TestData.unoptimized()).collect());
    }
}
