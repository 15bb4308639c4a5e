package com.schema.migration.graph;

/**
 * Raised when a connection cannot be obtained from a {@link GraphConnectionPool}.
 * All reasons except {@link Reason#CLOSED} are worth retrying.
 */
public class PoolException extends RuntimeException {

    public enum Reason { TIMEOUT, CLOSED, CANCELLED, CREATE_FAILED }

    private final Reason reason;

    public PoolException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public PoolException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public boolean isRetryable() {
        return reason != Reason.CLOSED;
    }
}
