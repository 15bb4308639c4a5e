package com.schema.migration.migration;

import com.schema.migration.graph.CancellationToken;
import com.schema.migration.graph.Database;
import com.schema.migration.graph.QueryRow;
import com.schema.migration.graph.Value;
import com.schema.migration.schema.TypeQlSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Hash-keyed ledger of generated schema change sets, persisted as
 * {@code migration-record} entities inside the target database.
 * A change set is identified by the SHA-256 of its statements, so an identical
 * change set is applied at most once.
 */
public class MigrationLedger {
    private static final Logger log = LoggerFactory.getLogger(MigrationLedger.class);

    public static final String RECORD_TYPE = "migration-record";
    public static final String HASH_ATTRIBUTE = "migration-hash";
    public static final String SUMMARY_ATTRIBUTE = "migration-summary";
    public static final String APPLIED_AT_ATTRIBUTE = "migration-applied-at";

    static final String LEDGER_SCHEMA = """
            define
            attribute migration-hash, value string;
            attribute migration-summary, value string;
            attribute migration-applied-at, value datetime;
            entity migration-record,
                owns migration-hash @key,
                owns migration-summary,
                owns migration-applied-at;""";

    private final Database database;
    private final Clock clock;

    public MigrationLedger(Database database) {
        this(database, Clock.systemUTC());
    }

    public MigrationLedger(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    /**
     * Defines the ledger types. Idempotent.
     */
    public void ensureSchema(CancellationToken token) {
        LedgerSupport.run("ensure schema", () -> database.executeSchema(token, LEDGER_SCHEMA));
    }

    public boolean isApplied(CancellationToken token, String hash) {
        String query = """
                match
                $m isa migration-record, has migration-hash "%s";
                reduce $count = count($m);""".formatted(TypeQlSyntax.escape(hash));
        return LedgerSupport.call("check applied",
                () -> LedgerSupport.count(database.executeRead(token, query)) > 0);
    }

    /**
     * Records a change set as applied at the current time.
     * A duplicate hash is rejected by the store and surfaces as a {@link LedgerException}.
     */
    public void record(CancellationToken token, String hash, String summary) {
        String query = """
                insert
                $m isa migration-record,
                has migration-hash "%s",
                has migration-summary "%s",
                has migration-applied-at %s;""".formatted(
                TypeQlSyntax.escape(hash),
                TypeQlSyntax.escape(summary),
                TypeQlSyntax.datetime(Instant.now(clock)));
        LedgerSupport.run("record", () -> database.executeWrite(token, query));
        log.debug("Recorded change set {}", hash);
    }

    /**
     * All recorded change sets, oldest first.
     */
    public List<MigrationRecord> applied(CancellationToken token) {
        String query = """
                match
                $m isa migration-record;
                fetch {
                  "hash": $m.migration-hash,
                  "summary": $m.migration-summary,
                  "applied-at": $m.migration-applied-at
                };""";
        List<QueryRow> rows = LedgerSupport.call("query applied", () -> database.executeRead(token, query));
        List<MigrationRecord> records = new ArrayList<>(rows.size());
        for (QueryRow row : rows) {
            Value appliedAt = row.get("applied-at");
            records.add(new MigrationRecord(
                    LedgerSupport.text(row, "hash"),
                    LedgerSupport.text(row, "summary"),
                    appliedAt.isNone() ? null : appliedAt.asInstant()));
        }
        records.sort(Comparator.comparing(MigrationRecord::appliedAt,
                Comparator.nullsFirst(Comparator.naturalOrder())));
        return records;
    }

    /**
     * SHA-256 hex digest over each statement followed by a newline.
     */
    public static String hashStatements(List<String> statements) {
        MessageDigest digest = sha256();
        for (String statement : statements) {
            digest.update(statement.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        return HexFormat.of().formatHex(digest.digest());
    }

    public static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
