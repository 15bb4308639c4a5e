package com.schema.migration.graph;

/**
 * Connection pool interface for managing multiple {@link GraphConnection} instances.
 * Provides borrow/release semantics for safe concurrent access to the store.
 */
public interface GraphConnectionPool extends AutoCloseable {

    /**
     * Borrows a connection from the pool. Blocks until a connection is available,
     * the configured wait timeout expires, or the token is cancelled.
     *
     * @param token cancellation signal of the caller
     * @return a healthy graph connection
     * @throws PoolException if the pool is closed, the wait times out or the caller cancels
     */
    GraphConnection borrow(CancellationToken token);

    /**
     * Borrows a connection without a cancellation signal.
     */
    default GraphConnection borrow() {
        return borrow(CancellationToken.none());
    }

    /**
     * Returns a connection to the pool.
     *
     * @param connection the connection to release
     */
    void release(GraphConnection connection);

    /**
     * Returns current pool statistics.
     */
    PoolStats getStats();

    boolean isClosed();

    /**
     * Closes the pool and all idle connections. Borrowed connections are closed on release.
     */
    @Override
    void close();
}
