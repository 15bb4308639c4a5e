package com.schema.migration.graph;

/**
 * Runtime exception raised when the underlying store rejects an operation
 * or the connection to it fails.
 */
public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
