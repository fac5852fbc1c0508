package com.lazyframe.streaming;

/**
 * Runtime state of one pipeline run.
 *
 * <p>A run moves from {@code IDLE} to {@code RUNNING} when the first batch is requested and
 * ends in exactly one of {@code FINISHED}, {@code CANCELLED} or {@code FAILED}.
 */
public final class PipelineContext {

    /**
     * Pipeline execution status.
     */
    public enum Status {
        IDLE,
        RUNNING,
        FINISHED,
        CANCELLED,
        FAILED
    }

    private volatile Status status = Status.IDLE;
    private volatile String failureMessage;

    public Status status() {
        return status;
    }

    public boolean isTerminal() {
        Status s = status;
        return s == Status.FINISHED || s == Status.CANCELLED || s == Status.FAILED;
    }

    void setRunning() {
        if (status == Status.IDLE) {
            status = Status.RUNNING;
        }
    }

    void setFinished() {
        if (!isTerminal()) {
            status = Status.FINISHED;
        }
    }

    void setCancelled() {
        if (!isTerminal()) {
            status = Status.CANCELLED;
        }
    }

    void setFailed(String message) {
        if (!isTerminal()) {
            status = Status.FAILED;
            failureMessage = message;
        }
    }

    public String failureMessage() {
        return failureMessage;
    }

    @Override
    public String toString() {
        return failureMessage == null ? status.name() : status.name() + ": " + failureMessage;
    }
}
