package com.lazyframe.exception;

/**
 * Raised when an execution is stopped through its
 * {@link com.lazyframe.runtime.CancellationToken}.
 */
public class CancelledException extends LazyFrameException {

    public CancelledException(String message) {
        super(message, null, null, null);
    }

    private CancelledException(String message, String operator) {
        super(message, null, operator, null);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CANCELLED;
    }

    @Override
    public LazyFrameException withOperator(String operatorName) {
        if (operator().isPresent()) {
            return this;
        }
        return new CancelledException(detail(), operatorName);
    }
}
