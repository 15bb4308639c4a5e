package com.schema.migration.graph;

/**
 * Creates new store connections. Used by {@link SimpleGraphConnectionPool}
 * to pre-warm and grow the pool.
 */
@FunctionalInterface
public interface GraphConnectionFactory {

    /**
     * Opens a new connection.
     *
     * @return an open connection
     * @throws GraphStoreException if the connection cannot be established
     */
    GraphConnection create();
}
