package com.lazyframe.runtime;

import static com.lazyframe.api.Functions.col;
import static com.lazyframe.api.Functions.len;
import static com.lazyframe.api.Functions.sum;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.api.LazyFrame;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.CancelledException;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.exception.ErrorKind;
import com.lazyframe.exception.LazyFrameException;
import com.lazyframe.exception.ResourceExhaustedException;
import com.lazyframe.source.BatchStream;
import com.lazyframe.test.RecordingDataSource;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.test.TestData;
import com.lazyframe.types.LongType;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for query execution: cancellation, resource budgets, error context and the
 * worker pool.
 */
@TestCategories.Tier1
@TestCategories.Integration
@DisplayName("Query execution")
public class QueryExecutionTest extends TestBase {

    private static EngineConfig streaming(int morselSize) {
        return EngineConfig.builder().streaming(true).morselSize(morselSize).build();
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("A cancelled token stops an in-memory query before it starts")
        void testCancelledBeforeStart() {
            CancellationToken token = new CancellationToken();
            token.cancel();
            LazyFrame frame = LazyFrame.fromBatch("orders", TestData.orders(30)).withConfig(TestData.inMemory());

            assertThatThrownBy(() -> frame.collect(token))
                .isInstanceOf(CancelledException.class)
                .satisfies(e -> assertThat(((LazyFrameException) e).kind()).isEqualTo(ErrorKind.CANCELLED));
        }

        @Test
        @DisplayName("Cancelling a running stream stops it and releases the source")
        void testCancelWhileStreaming() {
            RecordingDataSource source = new RecordingDataSource("orders", TestData.orders(200));
            CancellationToken token = new CancellationToken();
            LazyFrame frame = LazyFrame.scan(source).withConfig(streaming(16))
                .select("id", col("qty").plus(1).alias("next_qty"));

            BatchStream stream = frame.collectStreaming(token);
            assertThat(stream.hasNext()).isTrue();
            stream.next();
            int served = source.batchesServed();

            logStep("Cancelling after " + served + " batches");
            token.cancel();

            assertThatThrownBy(stream::hasNext).isInstanceOf(CancelledException.class);
            assertThat(source.batchesServed()).isEqualTo(served);
            assertThat(source.openStreams()).isZero();
            stream.close();
        }

        @Test
        @DisplayName("Closing a stream early releases the source")
        void testCloseEarly() {
            RecordingDataSource source = new RecordingDataSource("orders", TestData.orders(200));
            LazyFrame frame = LazyFrame.scan(source).withConfig(streaming(16)).filter(col("qty").gt(3));

            try (BatchStream stream = frame.collectStreaming(new CancellationToken())) {
                assertThat(stream.hasNext()).isTrue();
                stream.next();
            }

            assertThat(source.openStreams()).isZero();
            assertThat(source.batchesServed()).isLessThan(200 / 16);
        }

        @Test
        @DisplayName("A streamed head reads only the first morsels")
        void testHeadStopsEarly() {
            RecordingDataSource source = new RecordingDataSource("orders", TestData.orders(200));
            LazyFrame frame = LazyFrame.scan(source).withConfig(streaming(16)).select("id").head(5);

            ColumnarBatch result = frame.collect();

            assertThat(result.rowCount()).isEqualTo(5);
            assertThat(source.batchesServed()).isLessThan(200 / 16);
            assertThat(source.openStreams()).isZero();
        }
    }

    @Nested
    @DisplayName("Resource budget")
    class BudgetTests {

        @Test
        @DisplayName("Materializing more rows than the budget fails")
        void testInMemoryBudget() {
            EngineConfig config = TestData.inMemory().toBuilder().maxMaterializedRows(50).build();
            LazyFrame frame = LazyFrame.fromBatch("orders", TestData.orders(200)).withConfig(config);

            assertThatThrownBy(frame::collect)
                .isInstanceOf(ResourceExhaustedException.class)
                .hasMessageContaining("50");
        }

        @Test
        @DisplayName("Streaming aggregation handles inputs larger than the budget")
        void testStreamingWithinBudget() {
            EngineConfig config = streaming(16).toBuilder().maxMaterializedRows(50).build();
            LazyFrame frame = LazyFrame.fromBatch("orders", TestData.orders(200)).withConfig(config)
                .groupBy("region")
                .agg(len(), sum("qty").alias("qty_sum"));

            ColumnarBatch result = frame.collect();

            assertThat(result.rowCount()).isEqualTo(5);
            long rows = 0;
            for (Object count : result.column("len").toList()) {
                rows += (Long) count;
            }
            assertThat(rows).isEqualTo(200);
        }

        @Test
        @DisplayName("A sort still materializes its input under streaming")
        void testStreamingSortBudget() {
            EngineConfig config = streaming(16).toBuilder().maxMaterializedRows(50).build();
            LazyFrame frame = LazyFrame.fromBatch("orders", TestData.orders(200)).withConfig(config).sort("amount");

            assertThatThrownBy(frame::collect).isInstanceOf(ResourceExhaustedException.class);
        }
    }

    @Nested
    @DisplayName("Error context")
    class ErrorTests {

        @Test
        @DisplayName("Evaluation errors name the failing operator")
        void testOperatorNamed() {
            LazyFrame frame = LazyFrame.fromBatch("orders", TestData.orders(20)).withConfig(TestData.inMemory())
                .withColumns(col("note").cast(LongType.get()).alias("parsed"));

            assertThatThrownBy(frame::collect)
                .isInstanceOf(ComputeException.class)
                .satisfies(e -> {
                    LazyFrameException error = (LazyFrameException) e;
                    assertThat(error.operator()).isPresent();
                    assertThat(error.getUserMessage()).startsWith("Computation failed");
                });
        }

        @Test
        @DisplayName("A failing query leaves the engine usable")
        void testSubsequentQueriesRun() {
            LazyFrame base = LazyFrame.fromBatch("orders", TestData.orders(20));

            assertThatThrownBy(() -> base.select(col("note").cast(LongType.get()).alias("x")).collect())
                .isInstanceOf(ComputeException.class);
            assertThat(base.select("id").collect().rowCount()).isEqualTo(20);
        }
    }

    @Nested
    @DisplayName("ExecutionPool")
    class PoolTests {

        @Test
        @DisplayName("Results come back in task order")
        void testTaskOrder() {
            try (ExecutionPool pool = new ExecutionPool(4)) {
                List<Callable<Integer>> tasks = new ArrayList<>();
                for (int i = 0; i < 20; i++) {
                    int value = i;
                    tasks.add(() -> value * value);
                }

                List<Integer> results = pool.invokeAll(tasks, new CancellationToken(), "Test");

                assertThat(results).hasSize(20);
                for (int i = 0; i < 20; i++) {
                    assertThat(results.get(i)).isEqualTo(i * i);
                }
            }
        }

        @Test
        @DisplayName("The first failure in task order is reported")
        void testFirstFailureReported() {
            try (ExecutionPool pool = new ExecutionPool(2)) {
                List<Callable<Integer>> tasks = List.of(
                    () -> 1,
                    () -> {
                        throw new IllegalStateException("second failed");
                    },
                    () -> {
                        throw new IllegalStateException("third failed");
                    });

                assertThatThrownBy(() -> pool.invokeAll(tasks, new CancellationToken(), "Test"))
                    .isInstanceOf(ComputeException.class)
                    .hasMessageContaining("second failed");
            }
        }

        @Test
        @DisplayName("No unit starts after cancellation")
        void testCancelledPool() {
            AtomicInteger started = new AtomicInteger();
            CancellationToken token = new CancellationToken();
            token.cancel();
            try (ExecutionPool pool = new ExecutionPool(2)) {
                List<Callable<Integer>> tasks = List.of(started::incrementAndGet, started::incrementAndGet);

                assertThatThrownBy(() -> pool.invokeAll(tasks, token, "Test", false))
                    .isInstanceOf(CancelledException.class);
                assertThatThrownBy(() -> pool.invokeAll(tasks, token, "Test", true))
                    .isInstanceOf(CancelledException.class);
            }
            assertThat(started).hasValue(0);
        }
    }
}
