package com.lazyframe.optimizer;

import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.len;
import static com.lazyframe.api.Functions.sum;
import static com.lazyframe.test.BatchAssertions.row;
import static org.assertj.core.api.Assertions.assertThat;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.JoinType;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Scan;
import com.lazyframe.logical.WithColumns;
import com.lazyframe.test.PlanNodes;
import com.lazyframe.test.RecordingDataSource;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ProjectionPushdownRule}.
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@DisplayName("ProjectionPushdownRule")
public class ProjectionPushdownRuleTest extends TestBase {

    private final ProjectionPushdownRule rule = new ProjectionPushdownRule();

    private static LazyFrame orders() {
        return LazyFrame.fromBatch("orders", TestData.orders(30));
    }

    @Test
    @DisplayName("Scans read only the columns an ancestor needs")
    void testScanProjection() {
        LogicalPlan plan = orders().filter(col("region").eq("north")).select("amount").logicalPlan();

        LogicalPlan pruned = rule.apply(plan);

        assertThat(PlanNodes.only(pruned, Scan.class).projection()).containsExactly("region", "amount");
        assertThat(pruned.schema()).isEqualTo(plan.schema());
    }

    @Test
    @DisplayName("Unread column definitions are dropped")
    void testDropsUnusedDefinitions() {
        LogicalPlan plan = orders()
            .withColumns(col("amount").times(col("qty")).alias("total"))
            .select("id")
            .logicalPlan();

        LogicalPlan pruned = rule.apply(plan);
        logData("Pruned", pruned);

        assertThat(PlanNodes.find(pruned, WithColumns.class)).isEmpty();
        assertThat(PlanNodes.only(pruned, Scan.class).projection()).containsExactly("id");
    }

    @Test
    @DisplayName("The root keeps its full schema and column order")
    void testRootSchemaPreserved() {
        LogicalPlan plan = orders()
            .withColumns(col("qty").plus(1).alias("qty_plus"))
            .select("qty_plus", "note", "id")
            .logicalPlan();

        LogicalPlan pruned = rule.apply(plan);

        assertThat(pruned.schema().names()).containsExactly("qty_plus", "note", "id");
        assertThat(PlanNodes.only(pruned, Scan.class).projection()).containsExactly("id", "qty", "note");
    }

    @Test
    @DisplayName("Joins read keys and the requested columns of each side")
    void testJoinSides() {
        LazyFrame regions = LazyFrame.fromBatch("regions", TestData.regions());
        LogicalPlan plan = orders()
            .join(regions, "region", JoinType.LEFT)
            .select("id", "manager")
            .logicalPlan();

        LogicalPlan pruned = rule.apply(plan);

        List<Scan> scans = PlanNodes.find(pruned, Scan.class);
        assertThat(scans).hasSize(2);
        assertThat(scans.get(0).projection()).containsExactly("id", "region");
        // Every column of the lookup table is needed
        assertThat(scans.get(1).projection()).isNull();
    }

    @Test
    @DisplayName("Counting rows keeps one column so the row count survives")
    void testRowCountSurvives() {
        RecordingDataSource source = new RecordingDataSource("orders", TestData.orders(30));
        LazyFrame frame = LazyFrame.scan(source).withConfig(TestData.inMemory()).agg(len());

        LogicalPlan pruned = rule.apply(frame.logicalPlan());
        assertThat(PlanNodes.only(pruned, Scan.class).projection()).hasSize(1);

        ColumnarBatch result = frame.collect();
        assertThat(result.rows()).containsExactly(row(30L));
        assertThat(source.lastRequest().projectionHint()).hasValueSatisfying(
            columns -> assertThat(columns).hasSize(1));
    }

    @Test
    @DisplayName("Unread aggregates are dropped and their inputs are not read")
    void testDropsUnusedAggregates() {
        LogicalPlan plan = orders()
            .groupBy("region")
            .agg(sum("qty").alias("qty_sum"), sum("amount").alias("amount_sum"))
            .select("region", "qty_sum")
            .logicalPlan();

        LogicalPlan pruned = rule.apply(plan);

        assertThat(PlanNodes.only(pruned, Scan.class).projection()).containsExactly("region", "qty");
    }
}
