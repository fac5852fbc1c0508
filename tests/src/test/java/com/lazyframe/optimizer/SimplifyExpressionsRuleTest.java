package com.lazyframe.optimizer;

import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.lit;
import static com.lazyframe.api.Functions.nullLit;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.expression.AliasExpression;
import com.lazyframe.expression.BinaryExpression;
import com.lazyframe.expression.CastExpression;
import com.lazyframe.expression.ColumnReference;
import com.lazyframe.expression.Expression;
import com.lazyframe.expression.Literal;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Project;
import com.lazyframe.test.PlanNodes;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.LongType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SimplifyExpressionsRule}.
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@DisplayName("SimplifyExpressionsRule")
public class SimplifyExpressionsRuleTest extends TestBase {

    private final SimplifyExpressionsRule rule = new SimplifyExpressionsRule();

    private static LazyFrame orders() {
        return LazyFrame.fromBatch("orders", TestData.orders(20));
    }

    private Expression simplifiedProjection(Expression expr) {
        LogicalPlan plan = rule.apply(orders().select(expr.alias("out")).logicalPlan());
        Expression projection = PlanNodes.only(plan, Project.class).projections().get(0);
        return ((AliasExpression) projection).expression();
    }

    @Test
    @DisplayName("Constant subtrees are folded")
    void testConstantFolding() {
        LogicalPlan plan = rule.apply(orders().filter(col("qty").gt(lit(2).plus(3))).logicalPlan());

        BinaryExpression condition = (BinaryExpression) PlanNodes.only(plan, Filter.class).condition();
        assertThat(condition.right()).isInstanceOf(Literal.class);
        assertThat(((Literal) condition.right()).value()).isEqualTo(5);
    }

    @Test
    @DisplayName("A filter that is always true is removed")
    void testTrueFilterRemoved() {
        LogicalPlan plan = rule.apply(orders().filter(lit(true).or(col("qty").gt(1))).logicalPlan());

        assertThat(PlanNodes.find(plan, Filter.class)).isEmpty();
    }

    @Test
    @DisplayName("Boolean identities drop constant operands")
    void testBooleanIdentity() {
        LogicalPlan withTrue = rule.apply(orders().filter(col("qty").gt(1).and(lit(true))).logicalPlan());
        LogicalPlan plain = orders().filter(col("qty").gt(1)).logicalPlan();

        assertThat(PlanNodes.only(withTrue, Filter.class).condition())
            .isEqualTo(PlanNodes.only(plain, Filter.class).condition());
    }

    @Test
    @DisplayName("Integer identities and double negation are removed")
    void testAlgebraicIdentities() {
        assertThat(simplifiedProjection(col("qty").plus(0))).isInstanceOf(ColumnReference.class);
        assertThat(simplifiedProjection(col("qty").times(1))).isInstanceOf(ColumnReference.class);
        assertThat(simplifiedProjection(col("qty").negate().negate())).isInstanceOf(ColumnReference.class);
        // Not an identity for floating point values
        assertThat(simplifiedProjection(col("amount").plus(0.0))).isInstanceOf(BinaryExpression.class);
    }

    @Test
    @DisplayName("Arithmetic with a null literal becomes null")
    void testNullPropagation() {
        Expression simplified = simplifiedProjection(col("qty").plus(nullLit(IntegerType.get())));

        assertThat(simplified).isInstanceOf(Literal.class);
        assertThat(((Literal) simplified).isNullValue()).isTrue();
        assertThat(simplified.dataType()).isEqualTo(IntegerType.get());
    }

    @Test
    @DisplayName("A redundant cast is removed")
    void testRedundantCast() {
        assertThat(simplifiedProjection(col("id").cast(LongType.get()))).isInstanceOf(ColumnReference.class);
    }

    @Test
    @DisplayName("A constant that fails to evaluate is kept and fails at run time")
    void testFailingConstantKept() {
        LazyFrame frame = orders().select(lit("abc").cast(LongType.get()).alias("bad"));

        LogicalPlan plan = rule.apply(frame.logicalPlan());

        Expression projection = ((AliasExpression) PlanNodes.only(plan, Project.class).projections().get(0))
            .expression();
        assertThat(projection).isInstanceOf(CastExpression.class);
        assertThatThrownBy(frame::collect).isInstanceOf(ComputeException.class);
    }
}
