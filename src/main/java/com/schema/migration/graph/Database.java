package com.schema.migration.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Handle to one named database on a graph store. Binds a connection source
 * (a single connection or a {@link GraphConnectionPool}) to the transaction lifecycle
 * used by the migration components.
 *
 * <p>Every execute method checks the caller's {@link CancellationToken} before the
 * statement starts. Write and schema statements run in their own transaction which is
 * committed on success; any failure rolls the transaction back and closes it.</p>
 */
public class Database implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final GraphConnection connection;
    private final String name;
    private final boolean ownsConnection;

    private Database(GraphConnection connection, String name, boolean ownsConnection) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.name = Objects.requireNonNull(name, "name");
        this.ownsConnection = ownsConnection;
    }

    /**
     * Binds an existing connection. {@link #close()} leaves the connection open.
     */
    public static Database of(GraphConnection connection, String name) {
        return new Database(connection, name, false);
    }

    /**
     * Binds a connection that this handle owns and closes on {@link #close()}.
     */
    public static Database owning(GraphConnection connection, String name) {
        return new Database(connection, name, true);
    }

    /**
     * Binds a pool: each transaction borrows its own connection.
     * The pool stays open when this handle is closed.
     */
    public static Database pooled(GraphConnectionPool pool, String name) {
        return new Database(new PooledGraphConnection(pool), name, false);
    }

    public String getName() {
        return name;
    }

    public GraphConnection getConnection() {
        return connection;
    }

    /**
     * Returns the current schema definition text of this database.
     */
    public String schema(CancellationToken token) {
        token.throwIfCancelled("schema");
        return connection.schema(name, token);
    }

    public List<QueryRow> executeRead(CancellationToken token, String statement) {
        token.throwIfCancelled("read");
        try (GraphTransaction tx = connection.transaction(name, TransactionType.READ, token)) {
            return tx.query(statement);
        }
    }

    public List<QueryRow> executeWrite(CancellationToken token, String statement) {
        token.throwIfCancelled("write");
        return executeCommitted(token, TransactionType.WRITE, statement);
    }

    public void executeSchema(CancellationToken token, String statement) {
        token.throwIfCancelled("schema");
        executeCommitted(token, TransactionType.SCHEMA, statement);
    }

    /**
     * Executes a statement in the transaction type its leading keyword calls for.
     *
     * @see TransactionType#infer(String)
     */
    public List<QueryRow> execute(CancellationToken token, String statement) {
        TransactionType type = TransactionType.infer(statement);
        if (type == TransactionType.SCHEMA) {
            executeSchema(token, statement);
            return List.of();
        }
        return executeWrite(token, statement);
    }

    public TransactionContext begin(TransactionType type) {
        return begin(CancellationToken.none(), type);
    }

    /**
     * Opens a scoped transaction the caller commits or rolls back explicitly.
     * Use it in a try-with-resources block. On a pool the token also bounds the wait
     * for a free connection.
     */
    public TransactionContext begin(CancellationToken token, TransactionType type) {
        token.throwIfCancelled("begin");
        return new TransactionContext(name, connection.transaction(name, type, token));
    }

    /**
     * Creates this database if it does not exist yet.
     *
     * @return true if the database was created, false if it already existed
     */
    public boolean ensureDatabase(CancellationToken token) {
        token.throwIfCancelled("ensure database");
        if (connection.containsDatabase(name, token)) {
            return false;
        }
        connection.createDatabase(name, token);
        log.info("Created database '{}'", name);
        return true;
    }

    @Override
    public void close() {
        if (ownsConnection) {
            connection.close();
        }
    }

    private List<QueryRow> executeCommitted(CancellationToken token, TransactionType type, String statement) {
        GraphTransaction tx = connection.transaction(name, type, token);
        try {
            List<QueryRow> rows = tx.query(statement);
            tx.commit();
            return rows;
        } catch (RuntimeException e) {
            rollbackQuietly(tx, e);
            throw e;
        } finally {
            tx.close();
        }
    }

    private void rollbackQuietly(GraphTransaction tx, RuntimeException cause) {
        if (!tx.isOpen()) {
            return;
        }
        try {
            tx.rollback();
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
            log.warn("Rollback failed on database '{}': {}", name, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "Database{" + name + "}";
    }
}
