package com.lazyframe.expression.eval;

import com.lazyframe.data.ValueOps;
import com.lazyframe.expression.AggregateExpression;
import com.lazyframe.types.DataType;
import com.lazyframe.types.DoubleType;
import com.lazyframe.types.FloatType;
import com.lazyframe.types.LongType;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Accumulator implementations for every {@link AggregateExpression.Function}.
 *
 * <p>Null inputs are skipped except by {@code len}, which counts rows, by {@code first} and
 * {@code last}, which keep the boundary value as it is, and by {@code n_unique}, which counts
 * null as one distinct value. Over an empty or all-null group {@code sum} is zero, the
 * counting aggregates are zero and every other aggregate is null. {@code std} and
 * {@code var} use one delta degree of freedom.
 */
public final class Accumulators {

    private Accumulators() {
        // Utility class - prevent instantiation
    }

    /**
     * Returns a factory of fresh accumulators for an aggregate.
     *
     * @param function the aggregate function
     * @param resultType the aggregate's result type
     * @return the accumulator factory
     */
    public static Supplier<Accumulator> factory(AggregateExpression.Function function, DataType resultType) {
        return switch (function) {
            case SUM -> () -> new Sum(resultType);
            case MEAN -> Mean::new;
            case MIN -> () -> new Extreme(false);
            case MAX -> () -> new Extreme(true);
            case COUNT -> () -> new Count(false);
            case LEN -> () -> new Count(true);
            case FIRST -> () -> new Boundary(true);
            case LAST -> () -> new Boundary(false);
            case N_UNIQUE -> NUnique::new;
            case STD -> () -> new Variance(true);
            case VAR -> () -> new Variance(false);
            case MEDIAN -> Median::new;
        };
    }

    static final class Sum implements Accumulator {
        private final DataType resultType;
        private long longSum;
        private double doubleSum;

        Sum(DataType resultType) {
            this.resultType = resultType;
        }

        @Override
        public void update(Object value) {
            if (value == null) {
                return;
            }
            if (resultType instanceof LongType) {
                longSum += ValueOps.toLong(value);
            } else {
                doubleSum += ValueOps.toDouble(value);
            }
        }

        @Override
        public void merge(Accumulator other) {
            Sum that = (Sum) other;
            longSum += that.longSum;
            doubleSum += that.doubleSum;
        }

        @Override
        public Object result() {
            if (resultType instanceof LongType) {
                return longSum;
            }
            if (resultType instanceof FloatType) {
                return (float) doubleSum;
            }
            if (resultType instanceof DoubleType) {
                return doubleSum;
            }
            return ValueOps.toNumeric(doubleSum, resultType);
        }
    }

    static final class Mean implements Accumulator {
        private double sum;
        private long count;

        @Override
        public void update(Object value) {
            if (value != null) {
                sum += ValueOps.toDouble(value);
                count++;
            }
        }

        @Override
        public void merge(Accumulator other) {
            Mean that = (Mean) other;
            sum += that.sum;
            count += that.count;
        }

        @Override
        public Object result() {
            return count == 0 ? null : sum / count;
        }
    }

    static final class Extreme implements Accumulator {
        private final boolean max;
        private Object current;

        Extreme(boolean max) {
            this.max = max;
        }

        @Override
        public void update(Object value) {
            if (value == null) {
                return;
            }
            if (current == null) {
                current = value;
                return;
            }
            int c = ValueOps.compare(value, current);
            if (max ? c > 0 : c < 0) {
                current = value;
            }
        }

        @Override
        public void merge(Accumulator other) {
            update(((Extreme) other).current);
        }

        @Override
        public Object result() {
            return current;
        }
    }

    static final class Count implements Accumulator {
        private final boolean countNulls;
        private long count;

        Count(boolean countNulls) {
            this.countNulls = countNulls;
        }

        @Override
        public void update(Object value) {
            if (countNulls || value != null) {
                count++;
            }
        }

        @Override
        public void merge(Accumulator other) {
            count += ((Count) other).count;
        }

        @Override
        public Object result() {
            return count;
        }
    }

    static final class Boundary implements Accumulator {
        private final boolean first;
        private boolean seen;
        private Object value;

        Boundary(boolean first) {
            this.first = first;
        }

        @Override
        public void update(Object v) {
            if (!first || !seen) {
                value = v;
                seen = true;
            }
        }

        @Override
        public void merge(Accumulator other) {
            Boundary that = (Boundary) other;
            if (that.seen && (!first || !seen)) {
                value = that.value;
                seen = true;
            }
        }

        @Override
        public Object result() {
            return value;
        }
    }

    static final class NUnique implements Accumulator {
        private final Set<Object> values = new HashSet<>();

        @Override
        public void update(Object value) {
            values.add(ValueOps.normalizeKey(value));
        }

        @Override
        public void merge(Accumulator other) {
            values.addAll(((NUnique) other).values);
        }

        @Override
        public Object result() {
            return (long) values.size();
        }
    }

    /**
     * Welford's online algorithm; partial states merge with Chan's parallel formula.
     */
    static final class Variance implements Accumulator {
        private final boolean std;
        private long count;
        private double mean;
        private double m2;

        Variance(boolean std) {
            this.std = std;
        }

        @Override
        public void update(Object value) {
            if (value == null) {
                return;
            }
            double x = ValueOps.toDouble(value);
            count++;
            double delta = x - mean;
            mean += delta / count;
            m2 += delta * (x - mean);
        }

        @Override
        public void merge(Accumulator other) {
            Variance that = (Variance) other;
            if (that.count == 0) {
                return;
            }
            if (count == 0) {
                count = that.count;
                mean = that.mean;
                m2 = that.m2;
                return;
            }
            long total = count + that.count;
            double delta = that.mean - mean;
            mean += delta * that.count / total;
            m2 += that.m2 + delta * delta * ((double) count * that.count / total);
            count = total;
        }

        @Override
        public Object result() {
            if (count < 2) {
                return null;
            }
            double variance = m2 / (count - 1);
            return std ? Math.sqrt(variance) : variance;
        }
    }

    static final class Median implements Accumulator {
        private double[] values = new double[8];
        private int size;

        @Override
        public void update(Object value) {
            if (value == null) {
                return;
            }
            if (size == values.length) {
                values = Arrays.copyOf(values, size * 2);
            }
            values[size++] = ValueOps.toDouble(value);
        }

        @Override
        public void merge(Accumulator other) {
            Median that = (Median) other;
            for (int i = 0; i < that.size; i++) {
                update(that.values[i]);
            }
        }

        @Override
        public Object result() {
            if (size == 0) {
                return null;
            }
            double[] sorted = Arrays.copyOf(values, size);
            Arrays.sort(sorted);
            int mid = size / 2;
            return size % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
        }
    }
}
