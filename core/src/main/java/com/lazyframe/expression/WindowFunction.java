package com.lazyframe.expression;

import com.lazyframe.types.BooleanType;
import com.lazyframe.types.DataType;
import com.lazyframe.types.LongType;
import com.lazyframe.types.NullType;
import com.lazyframe.types.TypeCoercion;
import com.lazyframe.types.UnresolvedType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * A function evaluated over partitions of rows, producing one value per input row.
 *
 * <p>Supported functions:
 * <ul>
 *   <li>Ranking: row_number, rank, dense_rank</li>
 *   <li>Offset: lag, lead, first_value, last_value</li>
 *   <li>Cumulative: cum_sum, cum_count, cum_min, cum_max</li>
 *   <li>Any aggregate, broadcast to every row of its partition</li>
 * </ul>
 *
 * <p>Rows are ordered within a partition by {@link #orderBy()}, or keep their input order
 * when no order is given. Examples:
 * <pre>
 *   col("v").sum().over("k")
 *   rowNumber().over("k").orderBy(col("t").asc())
 *   lag(col("v"), 1).over("k").orderBy(col("t").asc())
 * </pre>
 */
public final class WindowFunction implements Expression {

    /**
     * Window function kinds.
     */
    public enum Kind {
        ROW_NUMBER(false),
        RANK(false),
        DENSE_RANK(false),
        LAG(true),
        LEAD(true),
        FIRST_VALUE(true),
        LAST_VALUE(true),
        CUM_SUM(true),
        CUM_COUNT(true),
        CUM_MIN(true),
        CUM_MAX(true),
        AGGREGATE(true);

        private final boolean takesArgument;

        Kind(boolean takesArgument) {
            this.takesArgument = takesArgument;
        }

        public boolean takesArgument() {
            return takesArgument;
        }

        public String functionName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final Kind kind;
    private final Expression argument;
    private final int offset;
    private final List<Expression> partitionBy;
    private final List<SortOrder> orderBy;

    /**
     * Creates a window function.
     *
     * @param kind the function kind
     * @param argument the argument (null for ranking functions)
     * @param offset the row offset for lag and lead
     * @param partitionBy the partition keys
     * @param orderBy the ordering within each partition
     */
    public WindowFunction(Kind kind, Expression argument, int offset,
                          List<Expression> partitionBy, List<SortOrder> orderBy) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        if (kind.takesArgument()) {
            Objects.requireNonNull(argument, kind.functionName() + " requires an argument");
        } else if (argument != null) {
            throw new IllegalArgumentException(kind.functionName() + " takes no argument");
        }
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative, got: " + offset);
        }
        this.argument = argument;
        this.offset = offset;
        this.partitionBy = List.copyOf(Objects.requireNonNull(partitionBy, "partitionBy must not be null"));
        this.orderBy = List.copyOf(Objects.requireNonNull(orderBy, "orderBy must not be null"));
    }

    /**
     * Creates an unpartitioned window function; partition with {@link #over(Object...)}.
     *
     * @param kind the function kind
     * @param argument the argument (null for ranking functions)
     * @param offset the lag/lead offset
     * @return the window function
     */
    public static WindowFunction of(Kind kind, Expression argument, int offset) {
        return new WindowFunction(kind, argument, offset, List.of(), List.of());
    }

    public Kind kind() {
        return kind;
    }

    /**
     * @return the argument, or null for ranking functions
     */
    public Expression argument() {
        return argument;
    }

    public int offset() {
        return offset;
    }

    public List<Expression> partitionBy() {
        return partitionBy;
    }

    public List<SortOrder> orderBy() {
        return orderBy;
    }

    public WindowFunction withPartitionBy(List<Expression> keys) {
        return new WindowFunction(kind, argument, offset, keys, orderBy);
    }

    /**
     * Returns a copy ordered by the given sort keys within each partition.
     *
     * @param keys sort orders, or plain expressions for ascending order
     * @return the ordered window function
     */
    public WindowFunction orderBy(Object... keys) {
        List<SortOrder> orders = new ArrayList<>(keys.length);
        for (Object key : Arrays.asList(keys)) {
            Expression expression = Literal.liftColumn(key);
            orders.add(expression instanceof SortOrder sort ? sort : expression.asc());
        }
        return new WindowFunction(kind, argument, offset, partitionBy, orders);
    }

    @Override
    public DataType dataType() {
        if (argument == null) {
            return LongType.get();
        }
        DataType type = argument.dataType();
        if (type instanceof UnresolvedType) {
            return type;
        }
        return switch (kind) {
            case ROW_NUMBER, RANK, DENSE_RANK, CUM_COUNT -> LongType.get();
            case CUM_SUM -> TypeCoercion.isIntegral(type) || type instanceof BooleanType
                || type instanceof NullType ? LongType.get() : type;
            case LAG, LEAD, FIRST_VALUE, LAST_VALUE, CUM_MIN, CUM_MAX, AGGREGATE -> type;
        };
    }

    @Override
    public List<Expression> children() {
        List<Expression> children = new ArrayList<>(1 + partitionBy.size() + orderBy.size());
        if (argument != null) {
            children.add(argument);
        }
        children.addAll(partitionBy);
        children.addAll(orderBy);
        return children;
    }

    @Override
    public Expression withChildren(List<Expression> children) {
        int position = 0;
        Expression newArgument = null;
        if (argument != null) {
            newArgument = children.get(position++);
        }
        List<Expression> keys = new ArrayList<>(children.subList(position, position + partitionBy.size()));
        position += partitionBy.size();
        List<SortOrder> orders = new ArrayList<>(orderBy.size());
        for (Expression child : children.subList(position, children.size())) {
            orders.add((SortOrder) child);
        }
        return new WindowFunction(kind, newArgument, offset, keys, orders);
    }

    @Override
    public String outputName() {
        return argument == null ? kind.functionName() : argument.outputName();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WindowFunction)) return false;
        WindowFunction that = (WindowFunction) obj;
        return kind == that.kind && offset == that.offset
            && Objects.equals(argument, that.argument)
            && partitionBy.equals(that.partitionBy)
            && orderBy.equals(that.orderBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, argument, offset, partitionBy, orderBy);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (kind == Kind.AGGREGATE) {
            sb.append(argument);
        } else {
            sb.append(kind.functionName()).append('(');
            if (argument != null) {
                sb.append(argument);
                if (kind == Kind.LAG || kind == Kind.LEAD) {
                    sb.append(", ").append(offset);
                }
            }
            sb.append(')');
        }
        sb.append(".over(").append(partitionBy).append(')');
        if (!orderBy.isEmpty()) {
            sb.append(".orderBy(").append(orderBy).append(')');
        }
        return sb.toString();
    }
}
