package com.lazyframe.api;

import com.lazyframe.expression.Expression;
import com.lazyframe.expression.Literal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A frame grouped by keys, waiting for its aggregations.
 *
 * <p>Groups appear in the output in the order their first row appears in the input.
 */
public final class GroupBy {

    private final LazyFrame frame;
    private final List<Expression> keys;

    GroupBy(LazyFrame frame, List<Expression> keys) {
        this.frame = Objects.requireNonNull(frame, "frame must not be null");
        this.keys = List.copyOf(Objects.requireNonNull(keys, "keys must not be null"));
    }

    public List<Expression> keys() {
        return keys;
    }

    /**
     * Computes aggregations per group. Each output may combine aggregates and grouping keys,
     * e.g. {@code col("v").sum().div(col("v").count())}.
     *
     * @param aggs the aggregation outputs
     * @return the frame with one row per group
     */
    public LazyFrame agg(Expression... aggs) {
        return agg(Arrays.asList(aggs));
    }

    public LazyFrame agg(List<? extends Expression> aggs) {
        return frame.aggregate(keys, new ArrayList<>(aggs));
    }

    /**
     * Counts the rows of each group into a {@code len} column.
     *
     * @return the frame
     */
    public LazyFrame len() {
        return agg(Functions.len());
    }

    public LazyFrame sum(String... columns) {
        return agg(each(columns, Expression::sum));
    }

    public LazyFrame mean(String... columns) {
        return agg(each(columns, Expression::mean));
    }

    private static List<Expression> each(String[] columns, Function<Expression, Expression> aggregate) {
        List<Expression> aggs = new ArrayList<>(columns.length);
        for (String column : columns) {
            aggs.add(aggregate.apply(Literal.liftColumn(column)));
        }
        return aggs;
    }

    @Override
    public String toString() {
        return "GroupBy(keys=" + keys + ")";
    }
}
