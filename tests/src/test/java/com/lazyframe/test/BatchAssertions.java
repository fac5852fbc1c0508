package com.lazyframe.test;

import static org.assertj.core.api.Assertions.assertThat;

import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.ValueOps;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Result comparisons shared by the executor tests.
 */
public final class BatchAssertions {

    private BatchAssertions() {
        // Utility class - prevent instantiation
    }

    /**
     * Builds one expected row; unlike {@code List.of} it accepts nulls.
     */
    public static List<Object> row(Object... values) {
        return Arrays.asList(values);
    }

    /**
     * Returns the rows of a batch in a canonical order, for order-insensitive comparison.
     */
    public static List<List<Object>> sortedRows(ColumnarBatch batch) {
        List<List<Object>> rows = new ArrayList<>(batch.rows());
        rows.sort(BatchAssertions::compareRows);
        return rows;
    }

    /**
     * Asserts that two results have the same column names and the same rows in the same
     * order.
     */
    public static void assertSameResult(ColumnarBatch actual, ColumnarBatch expected) {
        assertThat(actual.schema().names()).isEqualTo(expected.schema().names());
        assertThat(actual.rows()).isEqualTo(expected.rows());
    }

    /**
     * Asserts that two results have the same column names and the same rows in any order.
     */
    public static void assertSameRows(ColumnarBatch actual, ColumnarBatch expected) {
        assertThat(actual.schema().names()).isEqualTo(expected.schema().names());
        assertThat(sortedRows(actual)).isEqualTo(sortedRows(expected));
    }

    private static int compareRows(List<Object> a, List<Object> b) {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            Object x = a.get(i);
            Object y = b.get(i);
            if (x == null || y == null) {
                if (x != y) {
                    return x == null ? -1 : 1;
                }
                continue;
            }
            int c = x instanceof List || y instanceof List
                ? x.toString().compareTo(y.toString())
                : ValueOps.compare(x, y);
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    }
}
