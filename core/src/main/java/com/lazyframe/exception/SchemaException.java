package com.lazyframe.exception;

/**
 * Raised when a column is missing or duplicated, or when two types cannot be coerced
 * to a common type.
 *
 * <p>Schema errors are detected while the plan is built or optimized, before any data
 * is read.
 */
public class SchemaException extends LazyFrameException {

    public SchemaException(String message) {
        super(message, null, null, null);
    }

    public SchemaException(String message, Throwable cause) {
        super(message, cause, null, null);
    }

    public SchemaException(String message, Throwable cause, String operator, String column) {
        super(message, cause, operator, column);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.SCHEMA;
    }

    @Override
    public LazyFrameException withOperator(String operatorName) {
        if (operator().isPresent()) {
            return this;
        }
        return new SchemaException(detail(), getCause(), operatorName, column().orElse(null));
    }
}
