package com.lazyframe.exception;

/**
 * Classification of every error the engine raises.
 *
 * <p>The kind tells a caller at which stage a query failed and whether retrying with
 * different input or configuration can help.
 */
public enum ErrorKind {

    /** Missing or duplicate column, or a type mismatch no coercion can resolve. */
    SCHEMA("SchemaError"),

    /** An operator was given parameters it cannot accept. */
    INVALID_OPERATION("InvalidOperation"),

    /** A runtime evaluation failure (failed cast, unsorted as-of keys, ...). */
    COMPUTE("ComputeError"),

    /** The execution ran out of its memory or materialization budget. */
    RESOURCE_EXHAUSTED("ResourceExhausted"),

    /** The execution was stopped through its cancellation token. */
    CANCELLED("Cancelled");

    private final String label;

    ErrorKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
