package com.lazyframe.optimizer;

import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.len;
import static com.lazyframe.test.BatchAssertions.assertSameResult;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.logical.JoinType;
import com.lazyframe.runtime.EngineConfig;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import com.lazyframe.types.DoubleType;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Every optimizer pass, and every executor setting, must leave query results unchanged.
 *
 * <p>Each query runs once without any optimization, sequentially and in memory; that result
 * is compared with runs under every other configuration.
 */
@TestCategories.Tier1
@TestCategories.Optimizer
@TestCategories.Integration
@DisplayName("Optimizer Equivalence Tests")
public class OptimizerEquivalenceTest extends TestBase {

    private static final LazyFrame ORDERS = LazyFrame.fromBatch("orders", TestData.orders(200));
    private static final LazyFrame REGIONS = LazyFrame.fromBatch("regions", TestData.regions());

    private static final EngineConfig BASELINE = EngineConfig.builder()
        .noOptimization().streaming(false).parallel(false).build();

    private static Map<String, Supplier<LazyFrame>> queries() {
        Map<String, Supplier<LazyFrame>> queries = new LinkedHashMap<>();
        queries.put("filter-project", () -> ORDERS
            .filter(col("amount").gt(20.0).and(col("region").isNotNull()))
            .withColumns(col("qty").times(2).alias("q2"))
            .select("id", "region", "q2"));
        queries.put("left-join-filter", () -> ORDERS
            .join(REGIONS, "region", JoinType.LEFT)
            .filter(col("manager").neq("bo"))
            .select("id", "manager", "qty"));
        queries.put("left-join-null-filter", () -> ORDERS
            .join(REGIONS, "region", JoinType.LEFT)
            .filter(col("manager").isNull())
            .select("id", "region"));
        queries.put("group-by", () -> ORDERS
            .groupBy("region")
            .agg(col("qty").sum().alias("total"), col("amount").max().alias("top"), len())
            .sort("region"));
        queries.put("top-k", () -> ORDERS.sort(col("amount").desc(), col("id").asc()).head(7));
        queries.put("repeated-expression", () -> ORDERS.select(
            col("qty").plus(1).times(2).alias("a"),
            col("qty").plus(1).times(3).alias("b"),
            col("qty").plus(1).times(2).plus(col("id")).alias("c")));
        queries.put("self-join", () -> {
            LazyFrame totals = ORDERS.groupBy("region").agg(col("qty").sum().alias("total"));
            return totals.join(totals, "region", JoinType.INNER);
        });
        queries.put("union-filter", () -> ORDERS.union(ORDERS)
            .filter(col("qty").lt(10))
            .select("id", "qty"));
        queries.put("window-filter", () -> ORDERS
            .withColumns(col("qty").sum().over("region").alias("region_qty"))
            .filter(col("region").eq("north"))
            .select("id", "region_qty"));
        queries.put("cross-join-equality", () -> ORDERS.select("id", "region").head(20)
            .crossJoin(REGIONS)
            .filter(col("region").eq(col("region_right")).and(col("id").gt(3L))));
        queries.put("constant-folding", () -> ORDERS
            .filter(col("qty").gt(col("qty").minus(col("qty")).plus(20)).or(false))
            .select(col("id").plus(0L).alias("id"), col("amount").cast(DoubleType.get())));
        queries.put("slice-through-projection", () -> ORDERS
            .filter(col("note").eq("n1"))
            .withColumns(col("id").times(10L).alias("big"))
            .slice(3, 5));
        return queries;
    }

    private static Map<String, EngineConfig> configs() {
        Map<String, EngineConfig> configs = new LinkedHashMap<>();
        configs.put("all-passes", EngineConfig.builder().streaming(false).build());
        configs.put("no-type-coercion", EngineConfig.builder().streaming(false).typeCoercion(false).build());
        configs.put("no-simplify", EngineConfig.builder().streaming(false).simplifyExpressions(false).build());
        configs.put("no-predicate-pushdown", EngineConfig.builder().streaming(false).predicatePushdown(false).build());
        configs.put("no-projection-pushdown", EngineConfig.builder().streaming(false).projectionPushdown(false).build());
        configs.put("no-slice-pushdown", EngineConfig.builder().streaming(false).slicePushdown(false).build());
        configs.put("no-cse", EngineConfig.builder().streaming(false).cse(false).build());
        configs.put("no-join-reordering", EngineConfig.builder().streaming(false).joinReordering(false).build());
        configs.put("streaming", EngineConfig.builder().streaming(true).morselSize(16).build());
        configs.put("parallel-partitions", EngineConfig.builder().streaming(false).parallel(true).morselSize(8).build());
        configs.put("streaming-unoptimized", EngineConfig.builder().noOptimization().streaming(true).morselSize(7).build());
        return configs;
    }

    static Stream<Arguments> cases() {
        List<Arguments> cases = new ArrayList<>();
        for (String query : queries().keySet()) {
            for (Map.Entry<String, EngineConfig> config : configs().entrySet()) {
                cases.add(Arguments.of(query, config.getKey(), config.getValue()));
            }
        }
        return cases.stream();
    }

    @ParameterizedTest(name = "{0} under {1}")
    @MethodSource("cases")
    @DisplayName("Results match the unoptimized sequential run")
    void testEquivalence(String query, String configName, EngineConfig config) {
        LazyFrame frame = queries().get(query).get();

        ColumnarBatch expected = frame.withConfig(BASELINE).collect();
        ColumnarBatch actual = frame.withConfig(config).collect();
        logData("Rows", actual.rowCount());

        assertSameResult(actual, expected);
    }
}
