package com.lazyframe.exception;

/**
 * Raised when an execution exceeds its materialization budget or the JVM runs out of
 * heap. Fails the execution as a whole, never a single operator.
 */
public class ResourceExhaustedException extends LazyFrameException {

    public ResourceExhaustedException(String message) {
        super(message, null, null, null);
    }

    public ResourceExhaustedException(String message, Throwable cause) {
        super(message, cause, null, null);
    }

    public ResourceExhaustedException(String message, Throwable cause, String operator, String column) {
        super(message, cause, operator, column);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.RESOURCE_EXHAUSTED;
    }

    @Override
    public LazyFrameException withOperator(String operatorName) {
        if (operator().isPresent()) {
            return this;
        }
        return new ResourceExhaustedException(detail(), getCause(), operatorName, column().orElse(null));
    }
}
