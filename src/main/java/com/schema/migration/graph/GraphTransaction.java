package com.schema.migration.graph;

import java.util.List;

/**
 * A transaction opened on a {@link GraphConnection}.
 */
public interface GraphTransaction extends AutoCloseable {

    /**
     * Executes a TypeQL statement and returns its rows.
     *
     * @param statement the statement text
     * @return decoded result rows, empty for statements that return nothing
     * @throws GraphStoreException if the store rejects the statement
     */
    List<QueryRow> query(String statement);

    /**
     * Commits the transaction.
     */
    void commit();

    /**
     * Discards all changes made in the transaction.
     */
    void rollback();

    /**
     * Releases the transaction. Calling it more than once has no effect.
     */
    @Override
    void close();

    boolean isOpen();

    TransactionType type();
}
