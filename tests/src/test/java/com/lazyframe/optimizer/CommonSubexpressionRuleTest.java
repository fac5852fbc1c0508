package com.lazyframe.optimizer;

import static com.lazyframe.api.Functions.call;
import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.sum;
import static org.assertj.core.api.Assertions.assertThat;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.expression.Expression;
import com.lazyframe.logical.Cache;
import com.lazyframe.logical.JoinType;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.WithColumns;
import com.lazyframe.test.BatchAssertions;
import com.lazyframe.test.PlanNodes;
import com.lazyframe.test.RecordingDataSource;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link CommonSubexpressionRule}.
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@DisplayName("CommonSubexpressionRule")
public class CommonSubexpressionRuleTest extends TestBase {

    private final CommonSubexpressionRule rule = new CommonSubexpressionRule();

    private static LazyFrame orders() {
        return LazyFrame.fromBatch("orders", TestData.orders(60));
    }

    @Test
    @DisplayName("A repeated expression is computed once into a temporary column")
    void testSharedExpression() {
        Expression revenue = col("amount").times(col("qty"));
        LazyFrame frame = orders().select(
            "id",
            revenue.plus(1.0).alias("revenue_plus"),
            revenue.times(2.0).alias("revenue_twice"));

        LogicalPlan rewritten = rule.apply(frame.logicalPlan());
        logData("Rewritten", rewritten);

        WithColumns shared = PlanNodes.only(rewritten, WithColumns.class);
        assertThat(shared.columns()).hasSize(1);
        assertThat(shared.columns().get(0).outputName()).startsWith(CommonSubexpressionRule.TEMP_PREFIX);
        assertThat(rewritten.schema()).isEqualTo(frame.logicalPlan().schema());

        BatchAssertions.assertSameResult(frame.collect(), frame.withConfig(TestData.unoptimized()).collect());
    }

    @Test
    @DisplayName("Repeated aggregate arguments are computed once")
    void testSharedAggregateArgument() {
        Expression revenue = col("amount").times(col("qty"));
        LazyFrame frame = orders().groupBy("region").agg(
            sum(revenue).alias("revenue"),
            revenue.max().alias("largest"));

        LogicalPlan rewritten = rule.apply(frame.logicalPlan());

        assertThat(PlanNodes.only(rewritten, WithColumns.class).columns()).hasSize(1);
        assertThat(frame.explain()).contains(CommonSubexpressionRule.TEMP_PREFIX);
        assertThat(frame.collect().schema().names()).containsExactly("region", "revenue", "largest");
    }

    @Test
    @DisplayName("Nondeterministic expressions are never shared")
    void testRandomNotShared() {
        Expression noise = call("random").times(10.0);
        LogicalPlan plan = orders().select(noise.alias("a"), noise.alias("b")).logicalPlan();

        LogicalPlan rewritten = rule.apply(plan);

        assertThat(PlanNodes.find(rewritten, WithColumns.class)).isEmpty();
    }

    @Test
    @DisplayName("A self-join reads its shared input once")
    void testSharedSubplan() {
        RecordingDataSource source = new RecordingDataSource("orders", TestData.orders(60));
        LazyFrame totals = LazyFrame.scan(source).withConfig(TestData.inMemory())
            .groupBy("region")
            .agg(sum("qty").alias("total"));
        LazyFrame joined = totals.join(totals, "region", JoinType.INNER);

        LogicalPlan optimized = rule.apply(joined.logicalPlan());
        List<Cache> caches = PlanNodes.find(optimized, Cache.class);
        assertThat(caches).hasSize(2);
        assertThat(caches.get(0).id()).isEqualTo(caches.get(1).id());

        ColumnarBatch result = joined.collect();

        assertThat(source.requests()).hasSize(1);
        assertThat(result.schema().names()).containsExactly("region", "total", "total_right");
        // The null region never matches itself
        assertThat(result.rowCount()).isEqualTo(4);
        for (List<Object> row : result.rows()) {
            assertThat(row.get(1)).isEqualTo(row.get(2));
        }
    }

    @Test
    @DisplayName("A bare scan is not worth caching")
    void testScanNotCached() {
        LazyFrame orders = orders();
        LogicalPlan plan = orders.join(orders, "id", JoinType.INNER).logicalPlan();

        assertThat(PlanNodes.find(rule.apply(plan), Cache.class)).isEmpty();
    }
}
