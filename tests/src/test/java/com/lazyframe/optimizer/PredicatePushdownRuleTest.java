package com.lazyframe.optimizer;

import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.sum;
import static org.assertj.core.api.Assertions.assertThat;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.Aggregate;
import com.lazyframe.logical.Filter;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.JoinType;
import com.lazyframe.logical.LogicalPlan;
import com.lazyframe.logical.Scan;
import com.lazyframe.logical.Slice;
import com.lazyframe.test.BatchAssertions;
import com.lazyframe.test.PlanNodes;
import com.lazyframe.test.RecordingDataSource;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import com.lazyframe.types.LongType;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link PredicatePushdownRule}.
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@DisplayName("PredicatePushdownRule")
public class PredicatePushdownRuleTest extends TestBase {

    private final PredicatePushdownRule rule = new PredicatePushdownRule();

    private static LazyFrame orders() {
        return LazyFrame.fromBatch("orders", TestData.orders(50));
    }

    @Test
    @DisplayName("Filter above a projection becomes the scan predicate")
    void testThroughProjectionIntoScan() {
        LogicalPlan plan = orders().select("id", "qty").filter(col("qty").gt(10)).logicalPlan();

        LogicalPlan pushed = rule.apply(plan);
        logData("Pushed", pushed);

        assertThat(PlanNodes.find(pushed, Filter.class)).isEmpty();
        assertThat(PlanNodes.only(pushed, Scan.class).predicate()).isNotNull();
        assertThat(pushed.schema()).isEqualTo(plan.schema());
    }

    @Test
    @DisplayName("Computed columns are substituted by their definitions")
    void testSubstitutesDefinitions() {
        LogicalPlan plan = orders()
            .withColumns(col("qty").times(2).alias("double_qty"))
            .filter(col("double_qty").gt(40))
            .logicalPlan();

        LogicalPlan pushed = rule.apply(plan);

        Scan scan = PlanNodes.only(pushed, Scan.class);
        assertThat(scan.predicate()).isNotNull();
        assertThat(scan.predicate().toString()).contains("qty").doesNotContain("double_qty");
    }

    @Test
    @DisplayName("Inner join conjuncts go to the side owning their columns")
    void testSplitAcrossInnerJoin() {
        LazyFrame regions = LazyFrame.fromBatch("regions", TestData.regions());
        LogicalPlan plan = orders()
            .join(regions, "region", JoinType.INNER)
            .filter(col("qty").gt(10).and(col("manager").neq("bo")))
            .logicalPlan();

        LogicalPlan pushed = rule.apply(plan);
        logData("Pushed", pushed);

        assertThat(PlanNodes.find(pushed, Filter.class)).isEmpty();
        for (Scan scan : PlanNodes.find(pushed, Scan.class)) {
            assertThat(scan.predicate()).as(scan.source().name()).isNotNull();
        }
    }

    @Test
    @DisplayName("Right-side conjuncts stay above a left join")
    void testRightSideOfLeftJoinIsBarrier() {
        LazyFrame regions = LazyFrame.fromBatch("regions", TestData.regions());
        LogicalPlan plan = orders()
            .join(regions, "region", JoinType.LEFT)
            .filter(col("manager").isNull())
            .logicalPlan();

        LogicalPlan pushed = rule.apply(plan);

        Filter filter = PlanNodes.only(pushed, Filter.class);
        assertThat(filter.child()).isInstanceOf(Join.class);
        for (Scan scan : PlanNodes.find(pushed, Scan.class)) {
            assertThat(scan.predicate()).isNull();
        }
    }

    @Test
    @DisplayName("Slices are barriers")
    void testSliceIsBarrier() {
        LogicalPlan plan = orders().head(10).filter(col("qty").gt(10)).logicalPlan();

        LogicalPlan pushed = rule.apply(plan);

        assertThat(PlanNodes.only(pushed, Filter.class).child()).isInstanceOf(Slice.class);
        assertThat(PlanNodes.only(pushed, Scan.class).predicate()).isNull();
    }

    @Test
    @DisplayName("Only grouping key conjuncts pass an aggregation")
    void testThroughAggregation() {
        LogicalPlan plan = orders()
            .groupBy("region")
            .agg(sum("qty").alias("total"))
            .filter(col("region").eq("north").and(col("total").gt(100L)))
            .logicalPlan();

        LogicalPlan pushed = rule.apply(plan);
        logData("Pushed", pushed);

        Filter kept = PlanNodes.only(pushed, Filter.class);
        assertThat(kept.child()).isInstanceOf(Aggregate.class);
        assertThat(kept.condition().toString()).contains("total").doesNotContain("north");
        assertThat(PlanNodes.only(pushed, Scan.class).predicate().toString()).contains("north");
    }

    @Test
    @DisplayName("Conjuncts that can fail are never moved")
    void testFallibleConjunctStays() {
        LogicalPlan plan = orders()
            .select("id", "note")
            .filter(col("note").cast(LongType.get()).gt(1L))
            .logicalPlan();

        LogicalPlan pushed = rule.apply(plan);

        assertThat(PlanNodes.find(pushed, Filter.class)).hasSize(1);
        assertThat(PlanNodes.only(pushed, Scan.class).predicate()).isNull();
    }

    @Test
    @DisplayName("Union pushes into every input")
    void testIntoUnionInputs() {
        LogicalPlan plan = orders().union(orders()).filter(col("id").lt(5L)).logicalPlan();

        LogicalPlan pushed = rule.apply(plan);

        List<Scan> scans = PlanNodes.find(pushed, Scan.class);
        assertThat(scans).hasSize(2);
        assertThat(scans).allSatisfy(scan -> assertThat(scan.predicate()).isNotNull());
    }

    @Test
    @DisplayName("The source sees the predicate hint and the engine still applies it")
    void testSourceReceivesHint() {
        RecordingDataSource source = new RecordingDataSource("orders", TestData.orders(50));
        LazyFrame frame = LazyFrame.scan(source).withConfig(TestData.inMemory())
            .filter(col("region").eq("north"))
            .select("id");

        ColumnarBatch result = frame.collect();

        assertThat(source.lastRequest().predicateHint()).isPresent();
        // Every fifth row is "north" and the source ignores the hint
        assertThat(result.rowCount()).isEqualTo(10);
        BatchAssertions.assertSameRows(result,
            LazyFrame.fromBatch("orders", TestData.orders(50)).withConfig(TestData.unoptimized())
                .filter(col("region").eq("north")).select("id").collect());
    }
}
