package com.lazyframe.runtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.test.TestBase;
import com.lazyframe.test.TestCategories;
import com.lazyframe.types.LongType;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ExecutionContext}.
 */
@TestCategories.Tier1
@TestCategories.Unit
@DisplayName("ExecutionContext")
public class ExecutionContextTest extends TestBase {

    private final ExecutionContext ctx = ExecutionContext.create(
        EngineConfig.builder().threads(2).build(), new CancellationToken());

    @Test
    @DisplayName("Concurrent consumers of a shared subplan compute it once")
    void testConcurrentConsumersComputeOnce() throws Exception {
        AtomicInteger scans = new AtomicInteger();
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Supplier<ColumnarBatch> scan = () -> {
            scans.incrementAndGet();
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ColumnarBatch.of(Column.of("id", LongType.get(), 1L, 2L));
        };

        ExecutorService consumers = Executors.newFixedThreadPool(2);
        try {
            Future<ColumnarBatch> first = consumers.submit(() -> ctx.cached(7L, scan));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            Future<ColumnarBatch> second = consumers.submit(() -> ctx.cached(7L, scan));
            Thread.sleep(100);
            release.countDown();

            ColumnarBatch a = first.get(5, TimeUnit.SECONDS);
            ColumnarBatch b = second.get(5, TimeUnit.SECONDS);

            assertThat(scans).hasValue(1);
            assertThat(b).isSameAs(a);
        } finally {
            consumers.shutdownNow();
        }
    }

    @Test
    @DisplayName("Later consumers reuse the result without recomputing")
    void testSequentialConsumersReuse() {
        AtomicInteger scans = new AtomicInteger();
        Supplier<ColumnarBatch> scan = () -> {
            scans.incrementAndGet();
            return ColumnarBatch.of(Column.of("id", LongType.get(), 1L));
        };

        ColumnarBatch a = ctx.cached(1L, scan);
        ColumnarBatch b = ctx.cached(1L, scan);
        ctx.cached(2L, scan);

        assertThat(b).isSameAs(a);
        assertThat(scans).hasValue(2);
    }

    @Test
    @DisplayName("A failed computation fails every consumer with the same error")
    void testFailureReachesWaitingConsumers() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger scans = new AtomicInteger();
        Supplier<ColumnarBatch> failing = () -> {
            scans.incrementAndGet();
            started.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            throw new ComputeException("source unavailable");
        };

        ExecutorService consumers = Executors.newFixedThreadPool(2);
        try {
            Future<ColumnarBatch> first = consumers.submit(() -> ctx.cached(3L, failing));
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            Future<ColumnarBatch> second = consumers.submit(() -> ctx.cached(3L, failing));
            Thread.sleep(100);
            release.countDown();

            assertThatThrownBy(() -> first.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(ComputeException.class);
            assertThatThrownBy(() -> second.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasMessageContaining("source unavailable");
            assertThat(scans).hasValue(1);
        } finally {
            consumers.shutdownNow();
        }
    }
}
