package com.lazyframe.data;

import java.util.List;
import java.util.Objects;

/**
 * Compares rows by a list of key columns, each with its own direction and null placement.
 *
 * <p>Nulls sort first by default regardless of direction, NaN sorts greater than every
 * other number, and rows with equal keys compare equal, so a stable sort keeps their
 * input order.
 */
public final class RowComparator {

    private final List<Column> keys;
    private final boolean[] descending;
    private final boolean[] nullsLast;

    public RowComparator(List<Column> keys, boolean[] descending, boolean[] nullsLast) {
        this.keys = Objects.requireNonNull(keys, "keys must not be null");
        this.descending = descending.clone();
        this.nullsLast = nullsLast.clone();
        if (descending.length != keys.size() || nullsLast.length != keys.size()) {
            throw new IllegalArgumentException("one direction and null placement per key is required");
        }
    }

    /**
     * Compares two rows of the key columns.
     *
     * @param left the first row index
     * @param right the second row index
     * @return negative, zero or positive
     */
    public int compare(int left, int right) {
        for (int k = 0; k < keys.size(); k++) {
            Column key = keys.get(k);
            Object a = key.get(left);
            Object b = key.get(right);
            int c;
            if (a == null || b == null) {
                c = ValueOps.compareNullable(a, b, nullsLast[k]);
            } else {
                c = ValueOps.compare(a, b);
                if (descending[k]) {
                    c = -c;
                }
            }
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    /**
     * Sorts row indices in place with a stable merge sort.
     *
     * @param rows the row indices
     */
    public void sort(int[] rows) {
        if (rows.length < 2) {
            return;
        }
        int[] buffer = new int[rows.length];
        mergeSort(rows, buffer, 0, rows.length);
    }

    private void mergeSort(int[] rows, int[] buffer, int from, int to) {
        if (to - from < 16) {
            insertionSort(rows, from, to);
            return;
        }
        int mid = (from + to) >>> 1;
        mergeSort(rows, buffer, from, mid);
        mergeSort(rows, buffer, mid, to);
        if (compare(rows[mid - 1], rows[mid]) <= 0) {
            return;
        }
        System.arraycopy(rows, from, buffer, from, to - from);
        int i = from;
        int j = mid;
        int out = from;
        while (i < mid && j < to) {
            rows[out++] = compare(buffer[j], buffer[i]) < 0 ? buffer[j++] : buffer[i++];
        }
        while (i < mid) {
            rows[out++] = buffer[i++];
        }
        while (j < to) {
            rows[out++] = buffer[j++];
        }
    }

    private void insertionSort(int[] rows, int from, int to) {
        for (int i = from + 1; i < to; i++) {
            int row = rows[i];
            int j = i - 1;
            while (j >= from && compare(rows[j], row) > 0) {
                rows[j + 1] = rows[j];
                j--;
            }
            rows[j + 1] = row;
        }
    }
}
