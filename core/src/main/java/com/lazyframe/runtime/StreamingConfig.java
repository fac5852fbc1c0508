package com.lazyframe.runtime;

/**
 * Configuration constants for morsel-driven streaming.
 */
public final class StreamingConfig {

    private StreamingConfig() {} // Utility class

    /** Default morsel size in rows */
    public static final int DEFAULT_MORSEL_SIZE = 8192;

    /** Maximum morsel size to bound memory per in-flight morsel */
    public static final int MAX_MORSEL_SIZE = 65536;

    /** Minimum morsel size to prevent too many small morsels */
    public static final int MIN_MORSEL_SIZE = 1;

    /**
     * Validate and normalize morsel size to be within allowed bounds.
     *
     * @param requested the requested morsel size
     * @return normalized morsel size within [MIN_MORSEL_SIZE, MAX_MORSEL_SIZE]
     */
    public static int normalizeMorselSize(int requested) {
        if (requested <= 0) return DEFAULT_MORSEL_SIZE;
        if (requested < MIN_MORSEL_SIZE) return MIN_MORSEL_SIZE;
        if (requested > MAX_MORSEL_SIZE) return MAX_MORSEL_SIZE;
        return requested;
    }
}
