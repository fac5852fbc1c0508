package com.lazyframe.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Execution-time configuration of the engine.
 *
 * <p>Every toggle only affects performance: disabling an optimizer pass, streaming or
 * parallelism never changes a query's result. Defaults come from system properties, read
 * when {@link #builder()} is called:
 * <ul>
 *   <li>{@code lazyframe.streaming} - use the streaming executor where possible (default false)</li>
 *   <li>{@code lazyframe.parallel} - run partitions on the worker pool (default true)</li>
 *   <li>{@code lazyframe.morselSize} - rows per streaming morsel (default 8192)</li>
 *   <li>{@code lazyframe.threads} - worker pool size (default: available cores)</li>
 *   <li>{@code lazyframe.maxMaterializedRows} - row budget of any materialized result
 *       (default unlimited)</li>
 * </ul>
 *
 * <p>Example usage:
 * <pre>
 *   EngineConfig config = EngineConfig.builder()
 *       .streaming(true)
 *       .predicatePushdown(false)
 *       .build();
 * </pre>
 */
public final class EngineConfig {

    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String PROP_STREAMING = "lazyframe.streaming";
    public static final String PROP_PARALLEL = "lazyframe.parallel";
    public static final String PROP_MORSEL_SIZE = "lazyframe.morselSize";
    public static final String PROP_THREADS = "lazyframe.threads";
    public static final String PROP_MAX_MATERIALIZED_ROWS = "lazyframe.maxMaterializedRows";

    private final boolean streaming;
    private final boolean parallel;
    private final boolean typeCoercion;
    private final boolean simplifyExpressions;
    private final boolean predicatePushdown;
    private final boolean projectionPushdown;
    private final boolean slicePushdown;
    private final boolean cse;
    private final boolean joinReordering;
    private final int morselSize;
    private final int threads;
    private final long maxMaterializedRows;

    private EngineConfig(Builder builder) {
        this.streaming = builder.streaming;
        this.parallel = builder.parallel;
        this.typeCoercion = builder.typeCoercion;
        this.simplifyExpressions = builder.simplifyExpressions;
        this.predicatePushdown = builder.predicatePushdown;
        this.projectionPushdown = builder.projectionPushdown;
        this.slicePushdown = builder.slicePushdown;
        this.cse = builder.cse;
        this.joinReordering = builder.joinReordering;
        this.morselSize = StreamingConfig.normalizeMorselSize(builder.morselSize);
        this.threads = builder.threads;
        this.maxMaterializedRows = builder.maxMaterializedRows;
    }

    /**
     * Returns the configuration with every default.
     *
     * @return the default configuration
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    /**
     * Returns a builder initialized from system properties.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder initialized with this configuration's values.
     *
     * @return a new builder
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.streaming = streaming;
        b.parallel = parallel;
        b.typeCoercion = typeCoercion;
        b.simplifyExpressions = simplifyExpressions;
        b.predicatePushdown = predicatePushdown;
        b.projectionPushdown = projectionPushdown;
        b.slicePushdown = slicePushdown;
        b.cse = cse;
        b.joinReordering = joinReordering;
        b.morselSize = morselSize;
        b.threads = threads;
        b.maxMaterializedRows = maxMaterializedRows;
        return b;
    }

    public boolean streaming() {
        return streaming;
    }

    public boolean parallel() {
        return parallel;
    }

    public boolean typeCoercion() {
        return typeCoercion;
    }

    public boolean simplifyExpressions() {
        return simplifyExpressions;
    }

    public boolean predicatePushdown() {
        return predicatePushdown;
    }

    public boolean projectionPushdown() {
        return projectionPushdown;
    }

    public boolean slicePushdown() {
        return slicePushdown;
    }

    public boolean cse() {
        return cse;
    }

    public boolean joinReordering() {
        return joinReordering;
    }

    public int morselSize() {
        return morselSize;
    }

    /**
     * Returns the worker pool size.
     *
     * @return the thread count
     */
    public int threads() {
        return threads;
    }

    /**
     * Returns the largest number of rows any single materialized result may hold.
     *
     * @return the row budget, or {@link Long#MAX_VALUE} when unlimited
     */
    public long maxMaterializedRows() {
        return maxMaterializedRows;
    }

    @Override
    public String toString() {
        return String.format("EngineConfig(streaming=%s, parallel=%s, type_coercion=%s, simplify=%s, "
                + "predicate_pushdown=%s, projection_pushdown=%s, slice_pushdown=%s, cse=%s, "
                + "join_reordering=%s, morsel_size=%d, threads=%d, max_materialized_rows=%d)",
            streaming, parallel, typeCoercion, simplifyExpressions, predicatePushdown,
            projectionPushdown, slicePushdown, cse, joinReordering, morselSize, threads,
            maxMaterializedRows);
    }

    /**
     * Builder of {@link EngineConfig}.
     */
    public static final class Builder {
        private boolean streaming = booleanProperty(PROP_STREAMING, false);
        private boolean parallel = booleanProperty(PROP_PARALLEL, true);
        private boolean typeCoercion = true;
        private boolean simplifyExpressions = true;
        private boolean predicatePushdown = true;
        private boolean projectionPushdown = true;
        private boolean slicePushdown = true;
        private boolean cse = true;
        private boolean joinReordering = true;
        private int morselSize = (int) longProperty(PROP_MORSEL_SIZE, StreamingConfig.DEFAULT_MORSEL_SIZE);
        private int threads = (int) longProperty(PROP_THREADS, HardwareProfile.detect().recommendedThreadCount());
        private long maxMaterializedRows = longProperty(PROP_MAX_MATERIALIZED_ROWS, Long.MAX_VALUE);

        private Builder() {
        }

        public Builder streaming(boolean enabled) {
            this.streaming = enabled;
            return this;
        }

        public Builder parallel(boolean enabled) {
            this.parallel = enabled;
            return this;
        }

        public Builder typeCoercion(boolean enabled) {
            this.typeCoercion = enabled;
            return this;
        }

        public Builder simplifyExpressions(boolean enabled) {
            this.simplifyExpressions = enabled;
            return this;
        }

        public Builder predicatePushdown(boolean enabled) {
            this.predicatePushdown = enabled;
            return this;
        }

        public Builder projectionPushdown(boolean enabled) {
            this.projectionPushdown = enabled;
            return this;
        }

        public Builder slicePushdown(boolean enabled) {
            this.slicePushdown = enabled;
            return this;
        }

        public Builder cse(boolean enabled) {
            this.cse = enabled;
            return this;
        }

        public Builder joinReordering(boolean enabled) {
            this.joinReordering = enabled;
            return this;
        }

        /**
         * Disables every optimizer pass.
         *
         * @return this builder
         */
        public Builder noOptimization() {
            this.typeCoercion = false;
            this.simplifyExpressions = false;
            this.predicatePushdown = false;
            this.projectionPushdown = false;
            this.slicePushdown = false;
            this.cse = false;
            this.joinReordering = false;
            return this;
        }

        public Builder morselSize(int rows) {
            this.morselSize = rows;
            return this;
        }

        public Builder threads(int count) {
            if (count <= 0) {
                throw new IllegalArgumentException("threads must be positive, got: " + count);
            }
            this.threads = count;
            return this;
        }

        public Builder maxMaterializedRows(long rows) {
            if (rows <= 0) {
                throw new IllegalArgumentException("maxMaterializedRows must be positive, got: " + rows);
            }
            this.maxMaterializedRows = rows;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }

    // ========== Configuration Helpers ==========

    private static boolean booleanProperty(String name, boolean defaultValue) {
        String value = System.getProperty(name);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    private static long longProperty(String name, long defaultValue) {
        String value = System.getProperty(name);
        if (value != null) {
            try {
                long parsed = Long.parseLong(value.trim());
                if (parsed > 0) {
                    return parsed;
                }
            } catch (NumberFormatException e) {
                logger.warn("Ignoring invalid value '{}' for system property {}", value, name);
            }
        }
        return defaultValue;
    }
}
