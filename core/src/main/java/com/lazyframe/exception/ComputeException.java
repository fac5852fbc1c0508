package com.lazyframe.exception;

/**
 * Raised when evaluation fails at runtime, for example a strict cast that cannot parse
 * its input or an as-of join over unsorted keys. Aborts the whole query.
 */
public class ComputeException extends LazyFrameException {

    public ComputeException(String message) {
        super(message, null, null, null);
    }

    public ComputeException(String message, Throwable cause) {
        super(message, cause, null, null);
    }

    public ComputeException(String message, Throwable cause, String operator, String column) {
        super(message, cause, operator, column);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.COMPUTE;
    }

    @Override
    public LazyFrameException withOperator(String operatorName) {
        if (operator().isPresent()) {
            return this;
        }
        return new ComputeException(detail(), getCause(), operatorName, column().orElse(null));
    }
}
