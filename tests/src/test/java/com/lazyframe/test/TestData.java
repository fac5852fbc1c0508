package com.lazyframe.test;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.runtime.EngineConfig;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.IntegerType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.StringType;
import com.lazyframe.types.TimestampType;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared fixtures.
 */
public final class TestData {

    private TestData() {
        // Utility class - prevent instantiation
    }

    /** {@code A(id, x) = [(1, "a"), (2, "b")]}. */
    public static ColumnarBatch joinLeft() {
        return ColumnarBatch.of(
            Column.of("id", LongType.get(), 1L, 2L),
            Column.of("x", StringType.get(), "a", "b"));
    }

    /** {@code B(id, y) = [(1, 10), (3, 30)]}. */
    public static ColumnarBatch joinRight() {
        return ColumnarBatch.of(
            Column.of("id", LongType.get(), 1L, 3L),
            Column.of("y", LongType.get(), 10L, 30L));
    }

    /** {@code [(k=1, v=2), (k=1, v=4), (k=2, v=5)]}. */
    public static ColumnarBatch groups() {
        return ColumnarBatch.of(
            Column.of("k", LongType.get(), 1L, 1L, 2L),
            Column.of("v", LongType.get(), 2L, 4L, 5L));
    }

    /**
     * Orders table with a deterministic mix of regions, amounts and nulls.
     *
     * @param rows the row count
     * @return the batch with columns id, region, amount, qty, note
     */
    public static ColumnarBatch orders(int rows) {
        String[] regions = {"north", "south", "east", "west", null};
        List<Object> ids = new ArrayList<>(rows);
        List<Object> region = new ArrayList<>(rows);
        List<Object> amount = new ArrayList<>(rows);
        List<Object> qty = new ArrayList<>(rows);
        List<Object> note = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            ids.add((long) i);
            region.add(regions[i % regions.length]);
            amount.add(i % 7 == 0 ? null : (double) ((i * 37) % 1000) / 10.0);
            qty.add(i % 11 == 0 ? null : (i * 13) % 50);
            note.add("n" + (i % 3));
        }
        return ColumnarBatch.of(
            Column.of("id", LongType.get(), ids),
            Column.of("region", StringType.get(), region),
            Column.of("amount", DoubleType.get(), amount),
            Column.of("qty", IntegerType.get(), qty),
            Column.of("note", StringType.get(), note));
    }

    /**
     * Regions lookup table matching {@link #orders(int)}.
     */
    public static ColumnarBatch regions() {
        return ColumnarBatch.of(
            Column.of("region", StringType.get(), "north", "south", "east", "central"),
            Column.of("manager", StringType.get(), "ann", "bo", "cy", "dee"));
    }

    public static LocalDateTime ts(int day, int hour) {
        return LocalDateTime.of(2024, 1, day, hour, 0);
    }

    public static Column timestamps(String name, LocalDateTime... values) {
        return Column.of(name, TimestampType.get(), (Object[]) values);
    }

    // ==================== Configurations ====================

    public static EngineConfig inMemory() {
        return EngineConfig.builder().streaming(false).build();
    }

    public static EngineConfig streaming() {
        return EngineConfig.builder().streaming(true).morselSize(16).build();
    }

    public static EngineConfig unoptimized() {
        return EngineConfig.builder().noOptimization().streaming(false).build();
    }

    public static EngineConfig sequential() {
        return EngineConfig.builder().parallel(false).streaming(false).build();
    }
}
