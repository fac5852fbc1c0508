package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.ValueOps;
import com.lazyframe.expression.eval.CompiledExpression;
import com.lazyframe.expression.eval.ExpressionCompiler;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.JoinType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hash table over the key columns of a join's build side.
 *
 * <p>Keys are cast to the join's comparison type and normalized before hashing; a key with
 * a null component is never inserted and never matches. Rows with equal keys are kept in
 * build order. The table is read-only once built, so any number of threads may read it.
 */
public final class JoinTable {

    private final Map<List<Object>, int[]> rows;
    private final int buildRows;

    private JoinTable(Map<List<Object>, int[]> rows, int buildRows) {
        this.rows = rows;
        this.buildRows = buildRows;
    }

    /**
     * Builds a table over the given key columns.
     *
     * @param keys the build-side key columns, already cast to the comparison types
     * @param rowCount the build-side row count
     * @return the table
     */
    public static JoinTable build(List<Column> keys, int rowCount) {
        Map<List<Object>, IndexList> lists = new HashMap<>();
        for (int row = 0; row < rowCount; row++) {
            List<Object> key = keyOf(keys, row);
            if (key != null) {
                lists.computeIfAbsent(key, k -> new IndexList()).add(row);
            }
        }
        Map<List<Object>, int[]> rows = new HashMap<>(lists.size() * 2);
        lists.forEach((key, list) -> rows.put(key, list.toArray()));
        return new JoinTable(rows, rowCount);
    }

    /**
     * Evaluates one side's key expressions and casts them to the join's comparison types.
     *
     * @param join the join
     * @param left true for the left keys
     * @param batch the input of that side
     * @return the key columns
     */
    public static List<Column> keyColumns(Join join, boolean left, ColumnarBatch batch) {
        List<CompiledExpression> compiled = ExpressionCompiler.compileAll(left ? join.leftKeys() : join.rightKeys());
        List<Column> columns = new ArrayList<>(compiled.size());
        for (int i = 0; i < compiled.size(); i++) {
            columns.add(compiled.get(i).evaluate(batch).cast(join.keyType(i), false));
        }
        return columns;
    }

    /**
     * Returns the normalized key of a row, or null if any component is null.
     *
     * @param keys the key columns
     * @param row the row
     * @return the key, or null
     */
    public static List<Object> keyOf(List<Column> keys, int row) {
        List<Object> key = new ArrayList<>(keys.size());
        for (Column column : keys) {
            Object value = column.get(row);
            if (value == null) {
                return null;
            }
            key.add(ValueOps.normalizeKey(value));
        }
        return key;
    }

    /**
     * Returns the build rows with the given key, in build order.
     *
     * @param key a normalized key (may be null)
     * @return the matching rows, or null if there are none
     */
    public int[] lookup(List<Object> key) {
        return key == null ? null : rows.get(key);
    }

    public int buildRows() {
        return buildRows;
    }

    public int distinctKeys() {
        return rows.size();
    }

    /**
     * Matches a range of rows against this table.
     *
     * <p>Inner joins emit one pair per match. Left and full joins emit {@code -1} as the
     * build row of an unmatched streamed row and, for full joins, record matched build rows in
     * {@code matched}. Semi and anti joins emit the kept streamed rows with build row
     * {@code -1}.
     *
     * @param streamKeys the key columns of the streamed side
     * @param start first streamed row
     * @param end end of the range (exclusive)
     * @param joinType the join kind
     * @param matched receives matched build rows (full joins only, may be null otherwise)
     * @return the pairs, in streamed order
     */
    public Matches match(List<Column> streamKeys, int start, int end, JoinType joinType, BitSet matched) {
        Matches out = new Matches(end - start);
        for (int row = start; row < end; row++) {
            int[] hits = lookup(keyOf(streamKeys, row));
            switch (joinType) {
                case INNER:
                    if (hits != null) {
                        for (int hit : hits) {
                            out.add(row, hit);
                        }
                    }
                    break;
                case LEFT:
                case FULL:
                    if (hits == null) {
                        out.add(row, -1);
                    } else {
                        for (int hit : hits) {
                            out.add(row, hit);
                            if (matched != null) {
                                matched.set(hit);
                            }
                        }
                    }
                    break;
                case SEMI:
                    if (hits != null) {
                        out.add(row, -1);
                    }
                    break;
                case ANTI:
                    if (hits == null) {
                        out.add(row, -1);
                    }
                    break;
                default:
                    throw new IllegalArgumentException("hash join does not support " + joinType.joinName());
            }
        }
        return out;
    }

    @Override
    public String toString() {
        return "JoinTable(rows=" + buildRows + ", keys=" + rows.size() + ")";
    }

    // ========================================================================
    // Row index buffers
    // ========================================================================

    /**
     * Growable list of row indexes.
     */
    static final class IndexList {
        private int[] values = new int[4];
        private int size;

        void add(int value) {
            if (size == values.length) {
                values = Arrays.copyOf(values, size * 2);
            }
            values[size++] = value;
        }

        int size() {
            return size;
        }

        int[] toArray() {
            return Arrays.copyOf(values, size);
        }
    }

    /**
     * Pairs of (left row, right row) produced by a match; {@code -1} marks a missing side.
     */
    public static final class Matches {
        private int[] left;
        private int[] right;
        private int size;

        public Matches(int capacity) {
            int initial = Math.max(4, capacity);
            this.left = new int[initial];
            this.right = new int[initial];
        }

        public void add(int leftRow, int rightRow) {
            if (size == left.length) {
                left = Arrays.copyOf(left, size * 2);
                right = Arrays.copyOf(right, size * 2);
            }
            left[size] = leftRow;
            right[size] = rightRow;
            size++;
        }

        public int size() {
            return size;
        }

        public int[] leftRows() {
            return Arrays.copyOf(left, size);
        }

        public int[] rightRows() {
            return Arrays.copyOf(right, size);
        }

        /**
         * Concatenates partial results in order.
         *
         * @param parts the partial results
         * @return the combined pairs
         */
        public static Matches concat(List<Matches> parts) {
            int total = 0;
            for (Matches part : parts) {
                total += part.size;
            }
            Matches out = new Matches(total);
            for (Matches part : parts) {
                System.arraycopy(part.left, 0, out.left, out.size, part.size);
                System.arraycopy(part.right, 0, out.right, out.size, part.size);
                out.size += part.size;
            }
            return out;
        }

        /**
         * Sorts the pairs by left row, then right row, with {@code -1} right rows last.
         */
        public void sortByLeft() {
            long[] packed = new long[size];
            for (int i = 0; i < size; i++) {
                packed[i] = ((long) left[i] << 32) | (right[i] & 0xFFFFFFFFL);
            }
            Arrays.sort(packed);
            for (int i = 0; i < size; i++) {
                left[i] = (int) (packed[i] >>> 32);
                right[i] = (int) packed[i];
            }
        }
    }
}
