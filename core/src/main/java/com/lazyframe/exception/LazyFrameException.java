package com.lazyframe.exception;

import java.util.Optional;

/**
 * Base class of all errors raised by the engine.
 *
 * <p>Every error carries its {@link ErrorKind} and, where known, the physical operator
 * and the column that were being processed when it happened. Executors attach the
 * operator context on the way up through {@link #withOperator(String)}, so the caller
 * sees the innermost failing operator.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       ColumnarBatch result = frame.collect();
 *   } catch (LazyFrameException e) {
 *       System.err.println(e.getUserMessage());
 *       e.operator().ifPresent(op -&gt; System.err.println("Failed in: " + op));
 *   }
 * </pre>
 */
public abstract class LazyFrameException extends RuntimeException {

    private final String detail;
    private final String operator;
    private final String column;

    protected LazyFrameException(String detail, Throwable cause, String operator, String column) {
        super(format(detail, operator, column), cause);
        this.detail = detail;
        this.operator = operator;
        this.column = column;
    }

    /**
     * Returns the error classification.
     *
     * @return the error kind
     */
    public abstract ErrorKind kind();

    /**
     * Returns a copy of this error annotated with the operator that was running.
     *
     * <p>If this error already names an operator it is returned unchanged.
     *
     * @param operatorName the operator name
     * @return the annotated error
     */
    public abstract LazyFrameException withOperator(String operatorName);

    /**
     * Returns the message without kind and context decoration.
     *
     * @return the bare detail message
     */
    public String detail() {
        return detail;
    }

    /**
     * Returns the operator in which the error occurred.
     *
     * @return the operator name, or empty if unknown
     */
    public Optional<String> operator() {
        return Optional.ofNullable(operator);
    }

    /**
     * Returns the column being processed when the error occurred.
     *
     * @return the column name, or empty if unknown
     */
    public Optional<String> column() {
        return Optional.ofNullable(column);
    }

    /**
     * Returns a user-facing message with a hint on how to proceed.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        return switch (kind()) {
            case SCHEMA -> "Schema error: " + detail
                + ". Check column names and types against the input schema.";
            case INVALID_OPERATION -> "Invalid operation: " + detail;
            case COMPUTE -> "Computation failed: " + detail
                + operator().map(op -> " (in " + op + ")").orElse("");
            case RESOURCE_EXHAUSTED -> "Query requires more memory than available: " + detail
                + ". Try adding filters, enabling streaming, or raising the materialization limit.";
            case CANCELLED -> "Query was cancelled.";
        };
    }

    private static String format(String detail, String operator, String column) {
        StringBuilder sb = new StringBuilder(detail == null ? "" : detail);
        if (operator != null || column != null) {
            sb.append(" [");
            if (operator != null) {
                sb.append("operator=").append(operator);
            }
            if (column != null) {
                if (operator != null) {
                    sb.append(", ");
                }
                sb.append("column=").append(column);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
