package com.schema.migration.graph;

/**
 * Thrown when a {@link CancellationToken} was cancelled before an operation started.
 */
public class OperationCancelledException extends RuntimeException {

    public OperationCancelledException(String message) {
        super(message);
    }
}
