package com.lazyframe.physical;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.ValueOps;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.logical.Join;
import com.lazyframe.logical.JoinOptions;
import com.lazyframe.runtime.ExecutionContext;
import com.lazyframe.temporal.Duration;
import com.lazyframe.types.DataType;
import com.lazyframe.types.TypeCoercion;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * As-of join: each left row is matched with the nearest right row by key, in the
 * configured direction and within the optional tolerance.
 *
 * <p>Both inputs must be sorted ascending on the join key (within each group of the
 * {@code by} columns when given); null keys are skipped by the check and never match.
 * Every left row appears once in the output, in input order.
 */
public final class AsofJoinExec extends PhysicalOperator {

    private final Join join;
    private final JoinAssembler assembler;

    public AsofJoinExec(Join join, PhysicalOperator left, PhysicalOperator right) {
        super(join.schema(), List.of(left, right));
        this.join = join;
        this.assembler = new JoinAssembler(join);
    }

    @Override
    protected ColumnarBatch doExecute(ExecutionContext ctx) {
        ColumnarBatch left = children().get(0).execute(ctx);
        ColumnarBatch right = children().get(1).execute(ctx);
        JoinOptions options = join.options();
        Column leftKey = JoinTable.keyColumns(join, true, left).get(0);
        Column rightKey = JoinTable.keyColumns(join, false, right).get(0);
        List<Column> leftBy = new ArrayList<>();
        List<Column> rightBy = new ArrayList<>();
        for (int i = 0; i < options.leftBy().size(); i++) {
            Column l = left.column(options.leftBy().get(i));
            Column r = right.column(options.rightBy().get(i));
            DataType type = TypeCoercion.commonSupertype(l.dataType(), r.dataType()).orElseThrow();
            leftBy.add(l.cast(type, false));
            rightBy.add(r.cast(type, false));
        }
        checkSorted(leftKey, leftBy, "left");
        checkSorted(rightKey, rightBy, "right");

        Map<List<Object>, JoinTable.IndexList> groups = new HashMap<>();
        for (int row = 0; row < right.rowCount(); row++) {
            List<Object> group = JoinTable.keyOf(rightBy, row);
            if (group != null && rightKey.get(row) != null) {
                groups.computeIfAbsent(group, g -> new JoinTable.IndexList()).add(row);
            }
        }
        Map<List<Object>, int[]> candidates = new HashMap<>(groups.size() * 2);
        groups.forEach((group, rows) -> candidates.put(group, rows.toArray()));

        int rows = left.rowCount();
        List<Callable<int[]>> tasks = new ArrayList<>();
        for (int[] range : Partitioned.ranges(rows, ctx.partitionCount(rows))) {
            tasks.add(() -> {
                int[] matched = new int[range[1] - range[0]];
                for (int row = range[0]; row < range[1]; row++) {
                    Object key = leftKey.get(row);
                    int[] group = key == null ? null : candidates.get(JoinTable.keyOf(leftBy, row));
                    matched[row - range[0]] = group == null ? -1 : match(key, group, rightKey);
                }
                return matched;
            });
        }
        int[] leftRows = new int[rows];
        int[] rightRows = new int[rows];
        int next = 0;
        for (int[] part : ctx.invokeAll(tasks, nodeName())) {
            for (int match : part) {
                leftRows[next] = next;
                rightRows[next] = match;
                next++;
            }
        }
        return assembler.assemble(left, right, leftRows, rightRows);
    }

    private void checkSorted(Column key, List<Column> by, String side) {
        Map<List<Object>, Object> last = new HashMap<>();
        for (int row = 0; row < key.size(); row++) {
            Object value = key.get(row);
            if (value == null) {
                continue;
            }
            Object previous = last.put(ValueOps.rowKey(by, row), value);
            if (previous != null && ValueOps.compare(previous, value) > 0) {
                throw new ComputeException(String.format(
                    "asof join requires the %s key to be sorted ascending%s (%s follows %s)",
                    side, by.isEmpty() ? "" : " within each 'by' group",
                    ValueOps.format(value), ValueOps.format(previous)), null, nodeName(), key.name());
            }
        }
    }

    private int match(Object key, int[] group, Column rightKey) {
        Object tolerance = join.options().tolerance();
        switch (join.options().asofStrategy()) {
            case BACKWARD: {
                int i = upperBound(group, rightKey, key) - 1;
                return i >= 0 && withinBehind(key, rightKey.get(group[i]), tolerance) ? group[i] : -1;
            }
            case FORWARD: {
                int i = lowerBound(group, rightKey, key);
                return i < group.length && withinAhead(key, rightKey.get(group[i]), tolerance) ? group[i] : -1;
            }
            case NEAREST: {
                int b = upperBound(group, rightKey, key) - 1;
                int f = lowerBound(group, rightKey, key);
                if (b >= 0 && f < group.length) {
                    if (behindIsCloser(key, rightKey.get(group[b]), rightKey.get(group[f]))) {
                        f = group.length;
                    } else {
                        b = -1;
                    }
                }
                if (b >= 0) {
                    return withinBehind(key, rightKey.get(group[b]), tolerance) ? group[b] : -1;
                }
                if (f < group.length) {
                    return withinAhead(key, rightKey.get(group[f]), tolerance) ? group[f] : -1;
                }
                return -1;
            }
            default:
                throw new IllegalStateException("unknown asof strategy " + join.options().asofStrategy());
        }
    }

    /** First position whose key is greater than or equal to the search key. */
    private static int lowerBound(int[] group, Column keys, Object key) {
        int lo = 0;
        int hi = group.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (ValueOps.compare(keys.get(group[mid]), key) < 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /** First position whose key is greater than the search key. */
    private static int upperBound(int[] group, Column keys, Object key) {
        int lo = 0;
        int hi = group.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (ValueOps.compare(keys.get(group[mid]), key) <= 0) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    private static boolean withinBehind(Object key, Object candidate, Object tolerance) {
        if (tolerance == null) {
            return true;
        }
        if (tolerance instanceof Duration d) {
            return !timestamp(candidate).isBefore(d.subtractFrom(timestamp(key)));
        }
        return withinTolerance(candidate, key, (Number) tolerance);
    }

    private static boolean withinAhead(Object key, Object candidate, Object tolerance) {
        if (tolerance == null) {
            return true;
        }
        if (tolerance instanceof Duration d) {
            return !timestamp(candidate).isAfter(d.addTo(timestamp(key)));
        }
        return withinTolerance(key, candidate, (Number) tolerance);
    }

    /** Whether {@code upper - lower} is at most the tolerance, given {@code lower <= upper}. */
    private static boolean withinTolerance(Object lower, Object upper, Number tolerance) {
        if (isIntegral(lower) && isIntegral(upper) && isIntegral(tolerance)) {
            long limit = tolerance.longValue();
            return limit >= 0 && Long.compareUnsigned(gap(lower, upper), limit) <= 0;
        }
        return ValueOps.toDouble(upper) - ValueOps.toDouble(lower) <= tolerance.doubleValue();
    }

    private static boolean behindIsCloser(Object key, Object behind, Object ahead) {
        if (key instanceof Number) {
            if (isIntegral(key) && isIntegral(behind) && isIntegral(ahead)) {
                return Long.compareUnsigned(gap(behind, key), gap(key, ahead)) <= 0;
            }
            double k = ValueOps.toDouble(key);
            return k - ValueOps.toDouble(behind) <= ValueOps.toDouble(ahead) - k;
        }
        long k = ValueOps.epochMicros(timestamp(key));
        long before = ValueOps.epochMicros(timestamp(behind));
        long after = ValueOps.epochMicros(timestamp(ahead));
        return Long.compareUnsigned(k - before, after - k) <= 0;
    }

    /**
     * Distance between two ordered integral values. It can exceed {@link Long#MAX_VALUE},
     * so the result is read as unsigned.
     */
    private static long gap(Object lower, Object upper) {
        return ValueOps.toLong(upper) - ValueOps.toLong(lower);
    }

    private static boolean isIntegral(Object value) {
        return value instanceof Long || value instanceof Integer;
    }

    private static LocalDateTime timestamp(Object value) {
        return value instanceof LocalDate d ? d.atStartOfDay() : (LocalDateTime) value;
    }

    @Override
    public String toString() {
        JoinOptions options = join.options();
        return String.format("AsofJoinExec(left_on=%s, right_on=%s, strategy=%s%s)", join.leftKeys(),
            join.rightKeys(), options.asofStrategy().name().toLowerCase(),
            options.tolerance() == null ? "" : ", tolerance=" + options.tolerance());
    }
}
