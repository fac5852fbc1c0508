package com.lazyframe.streaming;

import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.len;
import static com.lazyframe.api.Functions.sum;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.CancelledException;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.logical.JoinType;
import com.lazyframe.physical.PhysicalOperator;
import com.lazyframe.physical.PipelineExec;
import com.lazyframe.runtime.CancellationToken;
import com.lazyframe.runtime.EngineConfig;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.runtime.QueryExecutor;
import com.lazyframe.test.BatchAssertions;
import com.lazyframe.test.RecordingDataSource;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import com.lazyframe.types.LongType;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests for {@link PipelineDriver} and streaming execution.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("PipelineDriver")
public class PipelineDriverTest extends TestBase {

    private static EngineConfig streaming(int morselSize) {
        return EngineConfig.builder().streaming(true).morselSize(morselSize).build();
    }

    private static PipelineDriver driver(LazyFrame frame, CancellationToken token) {
        QueryExecutor executor = new QueryExecutor(frame.config());
        PhysicalOperator root = executor.plan(executor.optimize(frame.logicalPlan()));
        assertThat(root).isInstanceOf(PipelineExec.class);
        return new PipelineDriver(((PipelineExec) root).pipeline(), ExecutionContext.create(frame.config(), token));
    }

    private static List<ColumnarBatch> drain(PipelineDriver driver) {
        List<ColumnarBatch> batches = new ArrayList<>();
        while (driver.hasNext()) {
            batches.add(driver.next());
        }
        return batches;
    }

    @Test
    @DisplayName("A run moves from idle through running to finished")
    void testLifecycle() {
        LazyFrame frame = LazyFrame.fromBatch("orders", TestData.orders(100)).withConfig(streaming(16))
            .filter(col("qty").isNotNull());
        PipelineDriver driver = driver(frame, new CancellationToken());

        assertThat(driver.context().status()).isEqualTo(PipelineContext.Status.IDLE);
        assertThat(driver.hasNext()).isTrue();
        assertThat(driver.context().status()).isEqualTo(PipelineContext.Status.RUNNING);

        List<ColumnarBatch> batches = drain(driver);

        assertThat(driver.context().status()).isEqualTo(PipelineContext.Status.FINISHED);
        assertThat(batches).allSatisfy(batch -> assertThat(batch.rowCount()).isLessThanOrEqualTo(16));
        // Rows 0, 11, 22, ... have no quantity
        assertThat(batches.stream().mapToInt(ColumnarBatch::rowCount).sum()).isEqualTo(90);
    }

    @Test
    @DisplayName("Closing before completion cancels the run and closes the source")
    void testCloseBeforeCompletion() {
        RecordingDataSource source = new RecordingDataSource("orders", TestData.orders(100));
        PipelineDriver driver = driver(LazyFrame.scan(source).withConfig(streaming(10)), new CancellationToken());

        driver.next();
        driver.close();
        driver.close();

        assertThat(driver.context().status()).isEqualTo(PipelineContext.Status.CANCELLED);
        assertThat(driver.hasNext()).isFalse();
        assertThat(source.openStreams()).isZero();
    }

    @Test
    @DisplayName("A cancelled token ends the run as cancelled")
    void testCancelled() {
        CancellationToken token = new CancellationToken();
        RecordingDataSource source = new RecordingDataSource("orders", TestData.orders(100));
        PipelineDriver driver = driver(LazyFrame.scan(source).withConfig(streaming(10)).select("id"), token);

        driver.next();
        token.cancel();

        assertThatThrownBy(driver::hasNext).isInstanceOf(CancelledException.class);
        assertThat(driver.context().status()).isEqualTo(PipelineContext.Status.CANCELLED);
        assertThat(source.openStreams()).isZero();
    }

    @Test
    @DisplayName("An evaluation failure ends the run as failed")
    void testFailed() {
        LazyFrame frame = LazyFrame.fromBatch("orders", TestData.orders(30)).withConfig(streaming(8))
            .select(col("note").cast(LongType.get()).alias("parsed"));
        PipelineDriver driver = driver(frame, new CancellationToken());

        assertThatThrownBy(driver::hasNext).isInstanceOf(ComputeException.class);
        assertThat(driver.context().status()).isEqualTo(PipelineContext.Status.FAILED);
        assertThat(driver.context().failureMessage()).isNotBlank();
    }

    @Test
    @DisplayName("A streaming aggregation emits one batch of groups")
    void testAggregationPipeline() {
        LazyFrame frame = LazyFrame.fromBatch("orders", TestData.orders(100)).withConfig(streaming(7))
            .groupBy("region")
            .agg(len(), sum("qty").alias("qty_sum"));

        List<ColumnarBatch> batches = drain(driver(frame, new CancellationToken()));
        ColumnarBatch inMemory = frame.withConfig(TestData.inMemory()).collect();

        assertThat(batches).hasSize(1);
        BatchAssertions.assertSameResult(batches.get(0), inMemory);
    }

    // ==================== Streaming equals in-memory ====================

    static Stream<Arguments> pipelines() {
        LazyFrame orders = LazyFrame.fromBatch("orders", TestData.orders(150));
        LazyFrame regions = LazyFrame.fromBatch("regions", TestData.regions());
        return Stream.of(
            Arguments.of("filter-project", orders
                .filter(col("amount").gt(20.0).and(col("region").neq("east")))
                .select("id", col("amount").times(col("qty")).alias("revenue"))),
            Arguments.of("inner-stream", orders.join(regions, "region", JoinType.INNER).select("id", "manager")),
            Arguments.of("left-stream", orders.join(regions, "region", JoinType.LEFT)),
            Arguments.of("semi-stream", orders.join(regions, "region", JoinType.SEMI)),
            Arguments.of("anti-stream", orders.join(regions, "region", JoinType.ANTI)),
            Arguments.of("aggregate", orders.groupBy("region", "note")
                .agg(len(), col("qty").min().alias("low"), col("qty").max().alias("high"), col("id").first())),
            Arguments.of("head", orders.filter(col("qty").gt(10)).head(13)),
            Arguments.of("offset-head", orders.slice(20, 9)),
            Arguments.of("stream-join-then-aggregate", orders.join(regions, "region", JoinType.INNER)
                .groupBy("manager").agg(sum("qty").alias("qty_sum"))));
    }

    static Stream<Arguments> cases() {
        List<Arguments> cases = new ArrayList<>();
        for (Arguments pipeline : pipelines().toList()) {
            for (int morselSize : new int[] {1, 5, 16, 1000}) {
                cases.add(Arguments.of(pipeline.get()[0], pipeline.get()[1], morselSize));
            }
        }
        return cases.stream();
    }

    @ParameterizedTest(name = "{0} with morsels of {2}")
    @MethodSource("cases")
    @DisplayName("Streaming gives the in-memory result")
    void testStreamingMatchesInMemory(String name, LazyFrame frame, int morselSize) {
        ColumnarBatch expected = frame.withConfig(TestData.inMemory()).collect();
        ColumnarBatch actual = frame.withConfig(streaming(morselSize)).collect();

        logData(name, actual.rowCount());
        BatchAssertions.assertSameResult(actual, expected);
    }
}
