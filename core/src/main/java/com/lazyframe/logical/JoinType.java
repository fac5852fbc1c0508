package com.lazyframe.logical;

/**
 * Join kinds supported by {@link Join}.
 */
public enum JoinType {
    /** Rows with matching keys on both sides. */
    INNER("inner"),
    /** Every left row, with nulls for the right side when nothing matches. */
    LEFT("left"),
    /** Every row of both sides; keys of the same name are coalesced. */
    FULL("full"),
    /** Cartesian product. */
    CROSS("cross"),
    /** Left rows that have at least one match; right columns are not returned. */
    SEMI("semi"),
    /** Left rows without any match; right columns are not returned. */
    ANTI("anti"),
    /** Each left row matched to the nearest right row by an ordered key. */
    ASOF("asof");

    private final String joinName;

    JoinType(String joinName) {
        this.joinName = joinName;
    }

    public String joinName() {
        return joinName;
    }

    /**
     * Returns true if the join outputs right columns.
     *
     * @return false for semi and anti joins
     */
    public boolean outputsRight() {
        return this != SEMI && this != ANTI;
    }

    /**
     * Returns true if right columns can be null in rows that exist only because of the
     * left side.
     *
     * @return true for outer-on-left joins
     */
    public boolean nullsRight() {
        return this == LEFT || this == FULL || this == ASOF;
    }

    /**
     * Returns true if left columns can be null in rows that exist only because of the
     * right side.
     *
     * @return true for full joins
     */
    public boolean nullsLeft() {
        return this == FULL;
    }
}
