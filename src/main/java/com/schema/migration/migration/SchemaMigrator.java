package com.schema.migration.migration;

import com.schema.migration.graph.CancellationToken;
import com.schema.migration.graph.Database;
import com.schema.migration.logging.LogContext;
import com.schema.migration.metrics.MetricsService;
import com.schema.migration.metrics.NoOpMetricsService;
import com.schema.migration.schema.InvalidSchemaException;
import com.schema.migration.schema.SchemaIntrospector;
import com.schema.migration.schema.SchemaModel;
import com.schema.migration.schema.SchemaModelProvider;
import com.schema.migration.schema.SchemaRenderer;
import com.schema.migration.schema.TypeQlSchemaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * One-shot schema migration: introspects the live schema, diffs it against the desired
 * schema and applies the additive statements.
 *
 * <p>{@link #migrate(CancellationToken)} tracks applied change sets in a
 * {@link MigrationLedger} so an identical change set runs at most once. Statements are
 * executed in order, each in its own schema transaction; on failure the change set is not
 * recorded and a retry runs the same statements again. Every failure, cancellation
 * included, surfaces as a {@link SchemaMigrationException} naming the failed stage.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * SchemaMigrator migrator = new SchemaMigrator(database, SchemaModelProvider.of(model));
 * SchemaDiff diff = migrator.migrate(CancellationToken.none());
 * log.info("migrated: {}", diff.summary());
 * </pre>
 */
public class SchemaMigrator {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrator.class);

    private final Database database;
    private final SchemaModelProvider provider;
    private final SchemaIntrospector introspector;
    private final MigrationLedger ledger;
    private final MetricsService metrics;

    public SchemaMigrator(Database database, SchemaModelProvider provider) {
        this(database, provider, new TypeQlSchemaParser(), NoOpMetricsService.INSTANCE);
    }

    public SchemaMigrator(Database database, SchemaModelProvider provider, SchemaIntrospector introspector) {
        this(database, provider, introspector, NoOpMetricsService.INSTANCE);
    }

    public SchemaMigrator(Database database, SchemaModelProvider provider, SchemaIntrospector introspector,
                          MetricsService metrics) {
        this.database = database;
        this.provider = provider;
        this.introspector = introspector;
        this.metrics = metrics;
        this.ledger = new MigrationLedger(database);
    }

    /**
     * Computes the diff between the desired and the live schema without applying anything.
     */
    public SchemaDiff diff(CancellationToken token) {
        return computeDiff(fetchSchema(token));
    }

    /**
     * Fetches the live schema and applies the diff, tracked in the hash ledger.
     *
     * @return the diff that was computed; empty when the schema is up to date
     * @throws SchemaMigrationException if any step fails; the exception carries the diff
     */
    public SchemaDiff migrate(CancellationToken token) {
        return migrateFromSchema(token, fetchSchema(token));
    }

    /**
     * Same as {@link #migrate(CancellationToken)} with a caller-supplied current schema text.
     */
    public SchemaDiff migrateFromSchema(CancellationToken token, String currentSchema) {
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forRun("migrate", database.getName())) {
            try {
                ledger.ensureSchema(token);
            } catch (RuntimeException e) {
                throw failed(SchemaMigrationException.Stage.ENSURE_LEDGER, null, null, e);
            }

            SchemaDiff diff = computeDiff(currentSchema);
            if (diff.isEmpty()) {
                log.info("Schema of '{}' is up to date", database.getName());
                return diff;
            }
            warnRemovals(diff);

            List<String> statements = diff.generateMigration();
            if (statements.isEmpty()) {
                return diff;
            }
            String hash = MigrationLedger.hashStatements(statements);

            boolean applied;
            try {
                applied = ledger.isApplied(token, hash);
            } catch (RuntimeException e) {
                throw failed(SchemaMigrationException.Stage.CHECK_LEDGER, diff, null, e);
            }
            if (applied) {
                log.info("Change set {} already applied, skipping", hash);
                return diff;
            }

            executeAll(token, diff, statements);

            try {
                ledger.record(token, hash, diff.summary());
            } catch (RuntimeException e) {
                throw failed(SchemaMigrationException.Stage.RECORD, diff, null, e);
            }
            metrics.incrementMigrationApplied();
            log.info("Applied {} statement(s) to '{}': {}", statements.size(), database.getName(), diff.summary());
            return diff;
        } finally {
            metrics.recordMigrationDuration("schema", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Applies the diff without consulting or writing the ledger.
     */
    public SchemaDiff migrateUntracked(CancellationToken token) {
        try (LogContext ignored = LogContext.forRun("migrate", database.getName())) {
            SchemaDiff diff = computeDiff(fetchSchema(token));
            if (diff.isEmpty()) {
                return diff;
            }
            warnRemovals(diff);
            executeAll(token, diff, diff.generateMigration());
            return diff;
        }
    }

    /**
     * Applies the complete desired schema as a single {@code define} statement.
     * Intended for a freshly created, empty database.
     */
    public void migrateFromEmpty(CancellationToken token) {
        String schema = SchemaRenderer.render(provider.desiredSchema());
        if (schema.isEmpty()) {
            return;
        }
        try (LogContext ignored = LogContext.forRun("migrate", database.getName())) {
            try {
                database.executeSchema(token, schema);
            } catch (RuntimeException e) {
                throw failed(SchemaMigrationException.Stage.EXECUTE, null, schema, e);
            }
            log.info("Defined full schema on '{}'", database.getName());
        }
    }

    private String fetchSchema(CancellationToken token) {
        try {
            return database.schema(token);
        } catch (RuntimeException e) {
            throw failed(SchemaMigrationException.Stage.FETCH_SCHEMA, null, null, e);
        }
    }

    private SchemaDiff computeDiff(String currentSchema) {
        SchemaModel current;
        try {
            current = introspector.introspect(currentSchema);
        } catch (InvalidSchemaException e) {
            throw failed(SchemaMigrationException.Stage.PARSE_SCHEMA, null, null, e);
        }
        return SchemaDiffer.diff(provider.desiredSchema(), current.without(LedgerSupport.LEDGER_LABELS));
    }

    private void executeAll(CancellationToken token, SchemaDiff diff, List<String> statements) {
        for (String statement : statements) {
            try {
                log.debug("Executing: {}", statement);
                database.executeSchema(token, statement);
            } catch (RuntimeException e) {
                throw failed(SchemaMigrationException.Stage.EXECUTE, diff, statement, e);
            }
        }
    }

    private void warnRemovals(SchemaDiff diff) {
        for (String change : diff.breakingChanges()) {
            log.warn("Not applied: {}", change);
        }
    }

    private SchemaMigrationException failed(SchemaMigrationException.Stage stage, SchemaDiff diff,
                                            String statement, RuntimeException cause) {
        metrics.incrementMigrationFailed();
        SchemaMigrationException failure = new SchemaMigrationException(stage, diff, statement, cause);
        log.error(failure.getMessage());
        return failure;
    }
}
