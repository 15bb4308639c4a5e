package com.schema.migration.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Scoped transaction returned by {@link Database#begin(CancellationToken, TransactionType)}.
 * Closing it without a commit discards all changes.
 */
public class TransactionContext implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TransactionContext.class);

    private final String database;
    private final GraphTransaction tx;
    private boolean completed;

    TransactionContext(String database, GraphTransaction tx) {
        this.database = database;
        this.tx = tx;
    }

    public List<QueryRow> query(String statement) {
        if (completed) {
            throw new IllegalStateException("Transaction on '" + database + "' is already completed");
        }
        return tx.query(statement);
    }

    public void commit() {
        completed = true;
        tx.commit();
    }

    public void rollback() {
        completed = true;
        tx.rollback();
    }

    public TransactionType type() {
        return tx.type();
    }

    public GraphTransaction transaction() {
        return tx;
    }

    @Override
    public void close() {
        if (!completed) {
            log.debug("Closing uncommitted {} transaction on '{}'", tx.type(), database);
            completed = true;
        }
        tx.close();
    }
}
