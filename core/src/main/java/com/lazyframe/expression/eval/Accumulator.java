package com.lazyframe.expression.eval;

/**
 * Mutable state of one aggregate over one group.
 *
 * <p>Accumulators are confined to one thread while they are updated. Partial states built
 * over disjoint row sets are combined with {@link #merge}, always in input order, so
 * order-sensitive aggregates such as {@code first} and {@code last} stay deterministic.
 */
public interface Accumulator {

    /**
     * Adds one input value.
     *
     * @param value the value (may be null)
     */
    void update(Object value);

    /**
     * Folds the state of an accumulator built over later rows into this one.
     *
     * @param other an accumulator of the same aggregate
     */
    void merge(Accumulator other);

    /**
     * Returns the aggregate value.
     *
     * @return the result (may be null)
     */
    Object result();
}
