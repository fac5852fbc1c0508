package com.lazyframe.temporal;

import com.lazyframe.data.Column;
import com.lazyframe.data.ColumnarBatch;
import com.lazyframe.data.Grouping;
import com.lazyframe.exception.ComputeException;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DateType;
import com.lazyframe.types.TimestampType;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Upsamples a table at a regular frequency.
 *
 * <p>For each group of the {@code by} columns (first-seen order), the rows are left-joined
 * onto the time range that starts at the group's first timestamp shifted by {@code offset},
 * steps by {@code every} and ends at the group's last timestamp, both ends included.
 * Generated rows hold nulls except for the time column and the {@code by} columns, which
 * are forward filled within the group.
 *
 * <p>Date columns are processed as timestamps at midnight and converted back.
 */
public final class Upsampler {

    private final String timeColumn;
    private final List<String> by;
    private final Duration every;
    private final Duration offset;

    /**
     * Creates an upsampler.
     *
     * @param timeColumn the sorted date or timestamp column
     * @param by the group columns (may be empty)
     * @param every the step of the generated range (must be positive)
     * @param offset the shift applied to each group's start
     */
    public Upsampler(String timeColumn, List<String> by, Duration every, Duration offset) {
        this.timeColumn = Objects.requireNonNull(timeColumn, "timeColumn must not be null");
        this.by = List.copyOf(Objects.requireNonNull(by, "by must not be null"));
        this.every = Objects.requireNonNull(every, "every must not be null");
        this.offset = Objects.requireNonNull(offset, "offset must not be null");
        if (!every.isPositive()) {
            throw new IllegalArgumentException("every must be a positive duration, got " + every);
        }
    }

    /**
     * Upsamples a materialized table.
     *
     * @param input the input table
     * @return the upsampled table, with the input's schema
     * @throws ComputeException if the time column is not temporal, not sorted, or all null
     */
    public ColumnarBatch upsample(ColumnarBatch input) {
        Column time = input.column(timeColumn);
        DataType type = time.dataType();
        if (!(type instanceof DateType) && !(type instanceof TimestampType)) {
            throw new ComputeException("upsample not allowed for index column of dtype " + type,
                null, "Upsample", timeColumn);
        }
        boolean isDate = type instanceof DateType;
        LocalDateTime[] timestamps = new LocalDateTime[time.size()];
        for (int i = 0; i < timestamps.length; i++) {
            Object value = time.get(i);
            if (value != null) {
                timestamps[i] = isDate ? ((LocalDate) value).atStartOfDay() : (LocalDateTime) value;
            }
        }
        ensureSorted(timestamps);

        List<int[]> groups;
        if (by.isEmpty()) {
            int[] all = new int[input.rowCount()];
            for (int i = 0; i < all.length; i++) {
                all[i] = i;
            }
            groups = List.of(all);
        } else {
            List<Column> keys = new ArrayList<>(by.size());
            for (String name : by) {
                keys.add(input.column(name));
            }
            groups = Grouping.of(keys, input.rowCount()).groups();
        }

        List<Integer> sourceRows = new ArrayList<>();
        List<LocalDateTime> outputTimes = new ArrayList<>();
        List<Integer> groupStarts = new ArrayList<>();
        for (int[] group : groups) {
            groupStarts.add(sourceRows.size());
            upsampleGroup(group, timestamps, sourceRows, outputTimes);
        }

        int[] indices = new int[sourceRows.size()];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = sourceRows.get(i);
        }
        ColumnarBatch result = input.take(indices);

        Object[] timeValues = new Object[outputTimes.size()];
        for (int i = 0; i < timeValues.length; i++) {
            LocalDateTime t = outputTimes.get(i);
            timeValues[i] = isDate ? t.toLocalDate() : t;
        }
        result = result.withColumn(Column.fromValues(timeColumn, type, timeValues));

        for (String name : by) {
            result = result.withColumn(forwardFill(result.column(name), groupStarts));
        }
        return result;
    }

    private void upsampleGroup(int[] rows, LocalDateTime[] timestamps,
                               List<Integer> sourceRows, List<LocalDateTime> outputTimes) {
        LocalDateTime first = null;
        LocalDateTime last = null;
        Map<LocalDateTime, List<Integer>> rowsByTime = new HashMap<>();
        for (int row : rows) {
            LocalDateTime t = timestamps[row];
            if (t == null) {
                continue;
            }
            if (first == null) {
                first = t;
            }
            last = t;
            rowsByTime.computeIfAbsent(t, k -> new ArrayList<>()).add(row);
        }
        if (first == null) {
            throw new ComputeException("cannot determine upsample boundaries: all elements are null",
                null, "Upsample", timeColumn);
        }

        LocalDateTime t = offset.addTo(first);
        while (!t.isAfter(last)) {
            List<Integer> matches = rowsByTime.get(t);
            if (matches == null) {
                sourceRows.add(-1);
                outputTimes.add(t);
            } else {
                for (Integer match : matches) {
                    sourceRows.add(match);
                    outputTimes.add(t);
                }
            }
            LocalDateTime next = every.addTo(t);
            if (!next.isAfter(t)) {
                throw new ComputeException("upsample interval " + every + " does not advance past " + t,
                    null, "Upsample", timeColumn);
            }
            t = next;
        }
    }

    private void ensureSorted(LocalDateTime[] timestamps) {
        LocalDateTime previous = null;
        for (LocalDateTime t : timestamps) {
            if (t == null) {
                continue;
            }
            if (previous != null && t.isBefore(previous)) {
                throw new ComputeException("argument in operation 'upsample' is not sorted, "
                    + "please sort the column '" + timeColumn + "' first", null, "Upsample", timeColumn);
            }
            previous = t;
        }
    }

    private static Column forwardFill(Column column, List<Integer> groupStarts) {
        Object[] values = column.toList().toArray();
        int groupIndex = 0;
        Object last = null;
        for (int i = 0; i < values.length; i++) {
            while (groupIndex < groupStarts.size() && groupStarts.get(groupIndex) == i) {
                last = null;
                groupIndex++;
            }
            if (values[i] == null) {
                values[i] = last;
            } else {
                last = values[i];
            }
        }
        return Column.fromValues(column.name(), column.dataType(), values);
    }

    public String timeColumn() {
        return timeColumn;
    }

    public List<String> by() {
        return by;
    }

    public Duration every() {
        return every;
    }

    public Duration offset() {
        return offset;
    }

    @Override
    public String toString() {
        return String.format("upsample(%s, every=%s, offset=%s, by=%s)", timeColumn, every, offset, by);
    }
}
