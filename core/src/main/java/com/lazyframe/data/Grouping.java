package com.lazyframe.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Assignment of rows to groups of equal key values, numbered in first-seen order.
 *
 * <p>Null keys form their own group. With no key columns every row belongs to group 0.
 */
public final class Grouping {

    private final int[] groupIds;
    private final int[] firstRows;
    private final int groupCount;

    private Grouping(int[] groupIds, int[] firstRows, int groupCount) {
        this.groupIds = groupIds;
        this.firstRows = firstRows;
        this.groupCount = groupCount;
    }

    /**
     * Groups the rows of the key columns.
     *
     * @param keys the key columns
     * @param rowCount the number of rows
     * @return the grouping
     */
    public static Grouping of(List<Column> keys, int rowCount) {
        int[] ids = new int[rowCount];
        if (keys.isEmpty()) {
            return new Grouping(ids, rowCount == 0 ? new int[0] : new int[] {0}, rowCount == 0 ? 0 : 1);
        }
        Map<List<Object>, Integer> index = new HashMap<>();
        int[] first = new int[Math.min(rowCount, 16)];
        int count = 0;
        for (int row = 0; row < rowCount; row++) {
            List<Object> key = ValueOps.rowKey(keys, row);
            Integer id = index.get(key);
            if (id == null) {
                id = count++;
                index.put(key, id);
                if (id == first.length) {
                    first = Arrays.copyOf(first, Math.max(1, first.length * 2));
                }
                first[id] = row;
            }
            ids[row] = id;
        }
        return new Grouping(ids, Arrays.copyOf(first, count), count);
    }

    public int groupCount() {
        return groupCount;
    }

    /**
     * Returns the group of a row.
     *
     * @param row the row index
     * @return the group id
     */
    public int groupOf(int row) {
        return groupIds[row];
    }

    /**
     * Returns the first row of each group, in group order.
     *
     * @return the first row indices
     */
    public int[] firstRows() {
        return firstRows.clone();
    }

    /**
     * Returns the rows of every group, each in input order.
     *
     * @return row indices per group
     */
    public List<int[]> groups() {
        int[] sizes = new int[groupCount];
        for (int id : groupIds) {
            sizes[id]++;
        }
        List<int[]> groups = new ArrayList<>(groupCount);
        for (int size : sizes) {
            groups.add(new int[size]);
        }
        int[] fill = new int[groupCount];
        for (int row = 0; row < groupIds.length; row++) {
            int id = groupIds[row];
            groups.get(id)[fill[id]++] = row;
        }
        return groups;
    }
}
