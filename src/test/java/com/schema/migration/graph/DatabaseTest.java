package com.schema.migration.graph;

import com.schema.migration.chaos.ChaosGraphConnection;
import com.schema.migration.support.InMemoryGraphStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

    private static final CancellationToken NONE = CancellationToken.none();

    private InMemoryGraphStore store;
    private ChaosGraphConnection connection;
    private Database database;

    @BeforeEach
    void setUp() {
        store = InMemoryGraphStore.withDatabase("db");
        connection = new ChaosGraphConnection(store.connect());
        database = Database.of(connection, "db");
        database.executeSchema(NONE, "define attribute email, value string; entity user, owns email @key;");
    }

    @Test
    @DisplayName("Should commit write statements")
    void commitsWrites() {
        database.executeWrite(NONE, "insert $u isa user, has email \"a@b\";");

        List<QueryRow> rows = database.executeRead(NONE,
                "match $u isa user; reduce $count = count($u);");
        assertEquals(1L, rows.get(0).get("count").asLong());
    }

    @Test
    @DisplayName("Should roll back when a statement fails")
    void rollsBackOnQueryFailure() {
        assertThrows(GraphStoreException.class,
                () -> database.executeWrite(NONE, "insert $u isa user, has email \"INVALID\";"));

        assertEquals(1, connection.rollbacks());
        assertTrue(store.instances("db", "user").isEmpty());
    }

    @Test
    @DisplayName("Should roll back when the commit fails")
    void rollsBackOnCommitFailure() {
        connection.setFailOnCommit(true);

        assertThrows(GraphStoreException.class,
                () -> database.executeWrite(NONE, "insert $u isa user, has email \"a@b\";"));

        assertEquals(1, connection.rollbacks());
        assertTrue(store.instances("db", "user").isEmpty());
    }

    @Test
    @DisplayName("Should not start a statement once cancelled")
    void cancelled() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        store.clearExecuted();

        assertThrows(OperationCancelledException.class,
                () -> database.executeWrite(token, "insert $u isa user, has email \"a@b\";"));
        assertThrows(OperationCancelledException.class, () -> database.schema(token));
        assertTrue(store.executedStatements().isEmpty());
    }

    @Test
    @DisplayName("execute should pick the transaction type from the statement")
    void executeInfersType() {
        database.execute(NONE, "define attribute age, value integer; user owns age;");
        database.execute(NONE, "insert $u isa user, has email \"a@b\", has age 42;");

        assertEquals(42L, store.value("db", "user", "email", "a@b", "age").orElseThrow());
    }

    @Test
    @DisplayName("A schema statement in a write transaction is rejected by the store")
    void schemaInWriteTransaction() {
        assertThrows(GraphStoreException.class,
                () -> database.executeWrite(NONE, "define attribute age, value integer;"));
        assertTrue(store.schemaModel("db").attribute("age").isEmpty());
    }

    @Test
    @DisplayName("Scoped transactions discard uncommitted changes")
    void scopedTransaction() {
        try (TransactionContext tx = database.begin(TransactionType.WRITE)) {
            tx.query("insert $u isa user, has email \"a@b\";");
        }
        assertTrue(store.instances("db", "user").isEmpty());

        try (TransactionContext tx = database.begin(TransactionType.WRITE)) {
            tx.query("insert $u isa user, has email \"a@b\";");
            tx.commit();
            assertThrows(IllegalStateException.class, () -> tx.query("insert $u isa user, has email \"c@d\";"));
        }
        assertEquals(1, store.instances("db", "user").size());
    }

    @Test
    @DisplayName("ensureDatabase should create a missing database once")
    void ensureDatabase() {
        Database other = Database.of(connection, "other");

        assertTrue(other.ensureDatabase(NONE));
        assertFalse(other.ensureDatabase(NONE));
        assertTrue(connection.databases().contains("other"));
    }

    @Test
    @DisplayName("Only owning handles close their connection")
    void closeOwnership() {
        InMemoryGraphStore.InMemoryConnection shared = store.connect();
        Database.of(shared, "db").close();
        assertTrue(shared.isOpen());

        Database.owning(shared, "db").close();
        assertFalse(shared.isOpen());
    }
}
