package com.schema.migration.migration.sequential;

import com.schema.migration.graph.CancellationToken;
import com.schema.migration.graph.Database;
import com.schema.migration.graph.QueryRow;
import com.schema.migration.graph.Value;
import com.schema.migration.migration.LedgerException;
import com.schema.migration.migration.LedgerSupport;
import com.schema.migration.schema.TypeQlSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Name-keyed ledger of applied sequential migrations, persisted as
 * {@code seq-migration-record} entities inside the target database.
 */
public class SequentialMigrationLedger {
    private static final Logger log = LoggerFactory.getLogger(SequentialMigrationLedger.class);

    public static final String RECORD_TYPE = "seq-migration-record";
    public static final String NAME_ATTRIBUTE = "seq-migration-name";
    public static final String APPLIED_AT_ATTRIBUTE = "seq-migration-applied-at";
    public static final String CHECKSUM_ATTRIBUTE = "seq-migration-checksum";

    static final String LEDGER_SCHEMA = """
            define
            attribute seq-migration-name, value string;
            attribute seq-migration-applied-at, value datetime;
            attribute seq-migration-checksum, value string;
            entity seq-migration-record,
                owns seq-migration-name @key,
                owns seq-migration-applied-at,
                owns seq-migration-checksum;""";

    private final Database database;
    private final Clock clock;

    public SequentialMigrationLedger(Database database) {
        this(database, Clock.systemUTC());
    }

    public SequentialMigrationLedger(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Defines the ledger types. Idempotent.
     */
    public void ensureSchema(CancellationToken token) {
        LedgerSupport.run("ensure schema", () -> database.executeSchema(token, LEDGER_SCHEMA));
    }

    /**
     * Applied migrations keyed and sorted by name. Records without a name are ignored.
     */
    public Map<String, AppliedMigration> applied(CancellationToken token) {
        String query = """
                match
                $m isa seq-migration-record;
                fetch {
                  "name": $m.seq-migration-name,
                  "applied-at": $m.seq-migration-applied-at,
                  "checksum": $m.seq-migration-checksum
                };""";
        List<QueryRow> rows = LedgerSupport.call("query applied", () -> database.executeRead(token, query));
        Map<String, AppliedMigration> applied = new TreeMap<>();
        for (QueryRow row : rows) {
            String name = LedgerSupport.text(row, "name");
            if (name == null || name.isEmpty()) {
                continue;
            }
            applied.put(name, new AppliedMigration(name, appliedAt(row), LedgerSupport.text(row, "checksum")));
        }
        return applied;
    }

    /**
     * Records a migration as applied now. An empty checksum is not stored.
     *
     * @throws LedgerException if the store rejects the insert, for instance for a name
     *                         already recorded by a concurrent run
     */
    public void record(CancellationToken token, String name, String checksum) {
        String checksumClause = checksum == null || checksum.isEmpty() ? ""
                : ",\nhas seq-migration-checksum \"" + TypeQlSyntax.escape(checksum) + "\"";
        String query = """
                insert
                $m isa seq-migration-record,
                has seq-migration-name "%s",
                has seq-migration-applied-at %s%s;""".formatted(
                TypeQlSyntax.escape(name),
                TypeQlSyntax.datetime(Instant.now(clock)),
                checksumClause);
        LedgerSupport.run("record " + name, () -> database.executeWrite(token, query));
        log.debug("Recorded migration {}", name);
    }

    /**
     * Deletes the record of a migration. Deleting an unknown name is a no-op.
     */
    public void delete(CancellationToken token, String name) {
        String query = """
                match
                $m isa seq-migration-record, has seq-migration-name "%s";
                delete $m;""".formatted(TypeQlSyntax.escape(name));
        LedgerSupport.run("delete " + name, () -> database.executeWrite(token, query));
        log.debug("Deleted migration record {}", name);
    }

    private static Instant appliedAt(QueryRow row) {
        Value value = row.get("applied-at");
        if (value.isNone()) {
            return null;
        }
        try {
            return value.asInstant();
        } catch (IllegalStateException e) {
            log.warn("Unreadable applied-at value {}: {}", value, e.getMessage());
            return null;
        }
    }
}
