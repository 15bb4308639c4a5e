package com.schema.migration.graph;

import java.util.List;

/**
 * Opaque connection to a transactional graph store.
 * Implementations wrap the low-level driver; this library only consumes them.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Opens a transaction on the named database.
     *
     * @param database the database name
     * @param type     the transaction type
     * @return an open transaction
     */
    GraphTransaction transaction(String database, TransactionType type);

    /**
     * Opens a transaction, observing the caller's cancellation signal before doing so.
     * Pool-backed connections also honor the token while waiting for a connection.
     */
    default GraphTransaction transaction(String database, TransactionType type, CancellationToken token) {
        token.throwIfCancelled("open " + type + " transaction");
        return transaction(database, type);
    }

    /**
     * Returns the schema definition text of the named database.
     *
     * @param database the database name
     * @return the TypeQL {@code define} text, empty when no schema exists
     */
    String schema(String database);

    default String schema(String database, CancellationToken token) {
        token.throwIfCancelled("fetch schema");
        return schema(database);
    }

    void createDatabase(String name);

    void deleteDatabase(String name);

    boolean containsDatabase(String name);

    List<String> databases();

    // Token variants of the admin calls; pool-backed connections stop waiting when cancelled.

    default void createDatabase(String name, CancellationToken token) {
        token.throwIfCancelled("create database");
        createDatabase(name);
    }

    default void deleteDatabase(String name, CancellationToken token) {
        token.throwIfCancelled("delete database");
        deleteDatabase(name);
    }

    default boolean containsDatabase(String name, CancellationToken token) {
        token.throwIfCancelled("check database");
        return containsDatabase(name);
    }

    default List<String> databases(CancellationToken token) {
        token.throwIfCancelled("list databases");
        return databases();
    }

    /**
     * Checks if the connection is alive.
     *
     * @return true if connected
     */
    boolean isOpen();

    @Override
    void close();
}
