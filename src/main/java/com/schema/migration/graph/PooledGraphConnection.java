package com.schema.migration.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * A pool-aware {@link GraphConnection} that borrows a connection per transaction
 * and releases it back to the pool once the transaction commits, rolls back or closes.
 * Schema and database-admin calls borrow a connection for the duration of the call.
 *
 * <p>This is transparent to {@link Database}: it opens transactions as normal and
 * pool management happens behind the scenes.</p>
 */
public class PooledGraphConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(PooledGraphConnection.class);

    private final GraphConnectionPool pool;

    public PooledGraphConnection(GraphConnectionPool pool) {
        this.pool = pool;
    }

    public GraphConnectionPool getPool() {
        return pool;
    }

    @Override
    public GraphTransaction transaction(String database, TransactionType type) {
        return transaction(database, type, CancellationToken.none());
    }

    @Override
    public GraphTransaction transaction(String database, TransactionType type, CancellationToken token) {
        token.throwIfCancelled("open " + type + " transaction");
        GraphConnection conn = pool.borrow(token);
        try {
            return new PooledTransaction(conn.transaction(database, type), conn);
        } catch (RuntimeException e) {
            pool.release(conn);
            throw e;
        }
    }

    @Override
    public String schema(String database) {
        return schema(database, CancellationToken.none());
    }

    @Override
    public String schema(String database, CancellationToken token) {
        token.throwIfCancelled("fetch schema");
        return withConnection(token, conn -> conn.schema(database));
    }

    @Override
    public void createDatabase(String name) {
        createDatabase(name, CancellationToken.none());
    }

    @Override
    public void createDatabase(String name, CancellationToken token) {
        token.throwIfCancelled("create database");
        withConnection(token, conn -> {
            conn.createDatabase(name);
            return null;
        });
    }

    @Override
    public void deleteDatabase(String name) {
        deleteDatabase(name, CancellationToken.none());
    }

    @Override
    public void deleteDatabase(String name, CancellationToken token) {
        token.throwIfCancelled("delete database");
        withConnection(token, conn -> {
            conn.deleteDatabase(name);
            return null;
        });
    }

    @Override
    public boolean containsDatabase(String name) {
        return containsDatabase(name, CancellationToken.none());
    }

    @Override
    public boolean containsDatabase(String name, CancellationToken token) {
        token.throwIfCancelled("check database");
        return withConnection(token, conn -> conn.containsDatabase(name));
    }

    @Override
    public List<String> databases() {
        return databases(CancellationToken.none());
    }

    @Override
    public List<String> databases(CancellationToken token) {
        token.throwIfCancelled("list databases");
        return withConnection(token, GraphConnection::databases);
    }

    @Override
    public boolean isOpen() {
        return !pool.isClosed();
    }

    @Override
    public void close() {
        // Closing the pooled connection closes the pool itself
        pool.close();
    }

    private <T> T withConnection(CancellationToken token, Function<GraphConnection, T> action) {
        GraphConnection conn = pool.borrow(token);
        try {
            return action.apply(conn);
        } finally {
            pool.release(conn);
        }
    }

    /**
     * Transaction wrapper that gives the borrowed connection back exactly once, on the first
     * of commit, rollback or close.
     */
    private final class PooledTransaction implements GraphTransaction {
        private final GraphTransaction delegate;
        private final GraphConnection connection;
        private final AtomicBoolean released = new AtomicBoolean();

        private PooledTransaction(GraphTransaction delegate, GraphConnection connection) {
            this.delegate = delegate;
            this.connection = connection;
        }

        @Override
        public List<QueryRow> query(String statement) {
            return delegate.query(statement);
        }

        @Override
        public void commit() {
            try {
                delegate.commit();
            } finally {
                close();
            }
        }

        @Override
        public void rollback() {
            try {
                delegate.rollback();
            } finally {
                close();
            }
        }

        // the underlying transaction is closed before its connection goes back to the pool
        @Override
        public void close() {
            try {
                delegate.close();
            } finally {
                release();
            }
        }

        @Override
        public boolean isOpen() {
            return !released.get() && delegate.isOpen();
        }

        @Override
        public TransactionType type() {
            return delegate.type();
        }

        private void release() {
            if (released.compareAndSet(false, true)) {
                pool.release(connection);
                log.trace("Released pooled connection after {} transaction", delegate.type());
            }
        }
    }
}
