package com.lazyframe.exception;

/**
 * Raised when an operator is given parameters it does not accept, for example an
 * aggregate expression outside of a group-by or join keys of unequal count.
 */
public class InvalidOperationException extends LazyFrameException {

    public InvalidOperationException(String message) {
        super(message, null, null, null);
    }

    public InvalidOperationException(String message, Throwable cause) {
        super(message, cause, null, null);
    }

    public InvalidOperationException(String message, Throwable cause, String operator, String column) {
        super(message, cause, operator, column);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INVALID_OPERATION;
    }

    @Override
    public LazyFrameException withOperator(String operatorName) {
        if (operator().isPresent()) {
            return this;
        }
        return new InvalidOperationException(detail(), getCause(), operatorName, column().orElse(null));
    }
}
