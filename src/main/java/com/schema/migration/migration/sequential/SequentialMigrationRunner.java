package com.schema.migration.migration.sequential;

import com.schema.migration.graph.CancellationToken;
import com.schema.migration.graph.Database;
import com.schema.migration.lock.DistributedLock;
import com.schema.migration.lock.LockAcquisitionException;
import com.schema.migration.logging.LogContext;
import com.schema.migration.metrics.MetricsService;
import com.schema.migration.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs caller-authored {@link SequentialMigration}s against a database, tracking them in a
 * {@link SequentialMigrationLedger}.
 *
 * <p>Migrations are applied in name order. A run validates the list, loads the ledger,
 * verifies the checksums of applied migrations, then applies the pending ones one at a
 * time, recording each right after its up step succeeds. The first failure stops the run;
 * earlier migrations stay applied and are listed in the thrown
 * {@link MigrationExecutionException}.</p>
 *
 * <p>The runner is not synchronized. Concurrent runs against one database must be
 * serialized by the caller, or through the {@link DistributedLock} in {@link RunOptions}.</p>
 *
 * <p>Usage:</p>
 * <pre>
 * List&lt;SequentialMigration&gt; migrations = List.of(
 *     SequentialMigration.ofStatements("20240101_users",
 *         List.of("define attribute email, value string; entity user, owns email @key;"),
 *         List.of("undefine user; email;")));
 * SequentialMigrationRunner runner = new SequentialMigrationRunner(database);
 * List&lt;String&gt; applied = runner.run(CancellationToken.none(), migrations);
 * </pre>
 */
public class SequentialMigrationRunner {
    private static final Logger log = LoggerFactory.getLogger(SequentialMigrationRunner.class);

    static final String UNSORTED_WARNING = "migrations are not in sorted order; they will be sorted automatically";

    private static final Comparator<SequentialMigration> BY_NAME = Comparator.comparing(SequentialMigration::getName);

    private final Database database;
    private final SequentialMigrationLedger ledger;
    private final MetricsService metrics;

    public SequentialMigrationRunner(Database database) {
        this(database, NoOpMetricsService.INSTANCE);
    }

    public SequentialMigrationRunner(Database database, MetricsService metrics) {
        this(database, new SequentialMigrationLedger(database), metrics);
    }

    public SequentialMigrationRunner(Database database, SequentialMigrationLedger ledger, MetricsService metrics) {
        this.database = database;
        this.ledger = ledger;
        this.metrics = metrics;
    }

    /**
     * Checks a migration list for structural problems without touching the database.
     * Empty and duplicate names and missing up steps are errors; an unsorted list is a warning.
     */
    public static List<ValidationIssue> validate(List<SequentialMigration> migrations) {
        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < migrations.size(); i++) {
            SequentialMigration migration = migrations.get(i);
            if (migration == null) {
                issues.add(ValidationIssue.error("[index " + i + "]", "migration is null"));
                continue;
            }
            String name = migration.getName();
            if (name == null || name.isEmpty()) {
                issues.add(ValidationIssue.error("[index " + i + "]", "migration name is empty"));
                continue;
            }
            if (!seen.add(name)) {
                issues.add(ValidationIssue.error(name, "duplicate migration name"));
            }
            if (migration.getUp() == null) {
                issues.add(ValidationIssue.error(name, "up action is missing"));
            }
        }
        if (!isSorted(migrations)) {
            issues.add(ValidationIssue.warning(null, UNSORTED_WARNING));
        }
        return issues;
    }

    public List<String> run(CancellationToken token, List<SequentialMigration> migrations) {
        return run(token, migrations, RunOptions.defaults());
    }

    /**
     * Applies the pending migrations.
     *
     * @return names applied by this run in order, or in dry-run mode the names that would be
     * @throws MigrationValidationException if the list has validation errors
     * @throws ChecksumMismatchException    if an applied migration's statements changed
     * @throws MigrationExecutionException  if a migration fails; earlier ones stay applied
     * @throws LockAcquisitionException     if the configured lock cannot be acquired
     */
    public List<String> run(CancellationToken token, List<SequentialMigration> migrations, RunOptions options) {
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forRun("run", database.getName())) {
            requireValid(migrations, options.getListener());
            return withLock(options, () -> {
                List<SequentialMigration> pending = pending(token, migrations, options);
                if (options.isDryRun()) {
                    return dryRun(pending, "pending", options.getListener());
                }
                return apply(token, pending, options.getListener());
            });
        } finally {
            metrics.recordMigrationDuration("sequential", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    public List<String> stamp(CancellationToken token, List<SequentialMigration> migrations) {
        return stamp(token, migrations, RunOptions.defaults());
    }

    /**
     * Records the pending migrations as applied without running their up steps, for schemas
     * applied out-of-band. Selection, validation and checksum verification match
     * {@link #run(CancellationToken, List, RunOptions)}.
     *
     * @return names stamped by this call, or in dry-run mode the names that would be
     */
    public List<String> stamp(CancellationToken token, List<SequentialMigration> migrations, RunOptions options) {
        if (migrations.isEmpty()) {
            return List.of();
        }
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forRun("stamp", database.getName())) {
            requireValid(migrations, options.getListener());
            return withLock(options, () -> {
                List<SequentialMigration> pending = pending(token, migrations, options);
                if (options.isDryRun()) {
                    return dryRun(pending, "stamp", options.getListener());
                }
                List<String> stamped = new ArrayList<>();
                for (SequentialMigration migration : pending) {
                    try (LogContext ctx = LogContext.forMigration(migration.getName())) {
                        try {
                            token.throwIfCancelled("stamp " + migration.getName());
                            ledger.record(token, migration.getName(), migration.checksum());
                        } catch (RuntimeException e) {
                            throw failed(migration.getName(), MigrationExecutionException.Phase.RECORD,
                                    stamped, e, options.getListener());
                        }
                        stamped.add(migration.getName());
                        metrics.incrementMigrationStamped();
                        log.info("Stamped migration {}", migration.getName());
                        notify(options.getListener(), MigrationEvent.Type.STAMPED, migration.getName(),
                                "stamped: " + migration.getName());
                    }
                }
                return stamped;
            });
        } finally {
            metrics.recordMigrationDuration("stamp", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Status of every given migration, sorted by name.
     */
    public List<MigrationStatus> status(CancellationToken token, List<SequentialMigration> migrations) {
        try (LogContext ignored = LogContext.forRun("status", database.getName())) {
            Map<String, AppliedMigration> applied = loadApplied(token);
            List<SequentialMigration> sorted = sorted(migrations);
            List<MigrationStatus> statuses = new ArrayList<>(sorted.size());
            for (SequentialMigration migration : sorted) {
                AppliedMigration record = applied.get(migration.getName());
                statuses.add(record == null
                        ? new MigrationStatus(migration.getName(), false, null)
                        : new MigrationStatus(migration.getName(), true, record.appliedAt()));
            }
            return statuses;
        }
    }

    /**
     * Names of the given migrations that are not applied yet, in name order.
     */
    public List<String> pendingNames(CancellationToken token, List<SequentialMigration> migrations) {
        List<String> names = new ArrayList<>();
        for (MigrationStatus status : status(token, migrations)) {
            if (!status.applied()) {
                names.add(status.name());
            }
        }
        return names;
    }

    public List<String> rollback(CancellationToken token, List<SequentialMigration> migrations, int steps) {
        return rollback(token, migrations, steps, RunOptions.defaults());
    }

    /**
     * Rolls back the {@code steps} applied migrations with the greatest names, newest first:
     * runs each down step and deletes its ledger record. Only the listener and lock of
     * {@code options} apply.
     *
     * @return names rolled back, in rollback order; empty when {@code steps <= 0}
     * @throws MigrationExecutionException if an applied migration is missing from the list,
     *                                     has no down step, or fails
     */
    public List<String> rollback(CancellationToken token, List<SequentialMigration> migrations, int steps,
                                 RunOptions options) {
        if (steps <= 0) {
            return List.of();
        }
        long start = System.nanoTime();
        try (LogContext ignored = LogContext.forRun("rollback", database.getName())) {
            return withLock(options, () -> {
                Map<String, AppliedMigration> applied = loadApplied(token);
                Map<String, SequentialMigration> byName = new HashMap<>();
                for (SequentialMigration migration : migrations) {
                    byName.put(migration.getName(), migration);
                }
                List<String> newestFirst = new ArrayList<>(applied.keySet());
                newestFirst.sort(Comparator.reverseOrder());

                MigrationListener listener = options.getListener();
                List<String> rolledBack = new ArrayList<>();
                for (String name : newestFirst.subList(0, Math.min(steps, newestFirst.size()))) {
                    try (LogContext ctx = LogContext.forMigration(name)) {
                        rollbackOne(token, name, byName.get(name), rolledBack, listener);
                    }
                    rolledBack.add(name);
                    metrics.incrementMigrationRolledBack();
                    log.info("Rolled back migration {}", name);
                    notify(listener, MigrationEvent.Type.ROLLED_BACK, name, "rolled back: " + name);
                }
                return rolledBack;
            });
        } finally {
            metrics.recordMigrationDuration("rollback", Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Applied migrations as recorded in the ledger, keyed by name.
     */
    public Map<String, AppliedMigration> applied(CancellationToken token) {
        return loadApplied(token);
    }

    private void rollbackOne(CancellationToken token, String name, SequentialMigration migration,
                             List<String> rolledBack, MigrationListener listener) {
        if (migration == null) {
            throw failed(name, MigrationExecutionException.Phase.DOWN, rolledBack,
                    "Migration '" + name + "' not found in provided migrations", listener);
        }
        Optional<MigrationAction> down = migration.getDown();
        if (down.isEmpty()) {
            throw failed(name, MigrationExecutionException.Phase.DOWN, rolledBack,
                    "Migration '" + name + "' has no down action", listener);
        }
        notify(listener, MigrationEvent.Type.ROLLING_BACK, name, "rolling back: " + name);
        try {
            token.throwIfCancelled("roll back " + name);
            down.get().apply(token, database);
        } catch (RuntimeException e) {
            throw failed(name, MigrationExecutionException.Phase.DOWN, rolledBack, e, listener);
        }
        try {
            ledger.delete(token, name);
        } catch (RuntimeException e) {
            throw failed(name, MigrationExecutionException.Phase.DELETE, rolledBack, e, listener);
        }
    }

    private List<String> apply(CancellationToken token, List<SequentialMigration> pending, MigrationListener listener) {
        List<String> applied = new ArrayList<>();
        for (SequentialMigration migration : pending) {
            String name = migration.getName();
            try (LogContext ctx = LogContext.forMigration(name)) {
                notify(listener, MigrationEvent.Type.APPLYING, name, "applying: " + name);
                try {
                    token.throwIfCancelled("apply " + name);
                    migration.getUp().apply(token, database);
                } catch (RuntimeException e) {
                    throw failed(name, MigrationExecutionException.Phase.UP, applied, e, listener);
                }
                try {
                    ledger.record(token, name, migration.checksum());
                } catch (RuntimeException e) {
                    throw failed(name, MigrationExecutionException.Phase.RECORD, applied, e, listener);
                }
                applied.add(name);
                metrics.incrementMigrationApplied();
                log.info("Applied migration {}", name);
                notify(listener, MigrationEvent.Type.APPLIED, name, "applied: " + name);
            }
        }
        if (applied.isEmpty()) {
            log.info("No pending migrations for '{}'", database.getName());
        }
        return applied;
    }

    private List<SequentialMigration> pending(CancellationToken token, List<SequentialMigration> migrations,
                                              RunOptions options) {
        List<SequentialMigration> sorted = sorted(migrations);
        Map<String, AppliedMigration> applied = loadApplied(token);
        verifyChecksums(sorted, applied);

        String target = options.getTarget().orElse(null);
        List<SequentialMigration> pending = new ArrayList<>();
        for (SequentialMigration migration : sorted) {
            if (target != null && migration.getName().compareTo(target) > 0) {
                break;
            }
            if (!applied.containsKey(migration.getName())) {
                pending.add(migration);
            }
        }
        log.debug("{} pending of {} migration(s)", pending.size(), sorted.size());
        return pending;
    }

    private static void verifyChecksums(List<SequentialMigration> sorted, Map<String, AppliedMigration> applied) {
        for (SequentialMigration migration : sorted) {
            AppliedMigration record = applied.get(migration.getName());
            if (record == null || record.checksum().isEmpty()) {
                continue;
            }
            String current = migration.checksum();
            if (!current.isEmpty() && !current.equals(record.checksum())) {
                throw new ChecksumMismatchException(migration.getName(), record.checksum(), current);
            }
        }
    }

    private List<String> dryRun(List<SequentialMigration> pending, String verb, MigrationListener listener) {
        List<String> names = new ArrayList<>(pending.size());
        for (SequentialMigration migration : pending) {
            names.add(migration.getName());
            String line = "[dry-run] " + verb + ": " + migration.getName();
            log.info(line);
            notify(listener, MigrationEvent.Type.PENDING, migration.getName(), line);
            migration.getStatements().ifPresent(statements -> {
                for (String statement : statements.up()) {
                    String statementLine = "[dry-run]   " + statement;
                    log.info(statementLine);
                    notify(listener, MigrationEvent.Type.STATEMENT, migration.getName(), statementLine);
                }
            });
        }
        return names;
    }

    private Map<String, AppliedMigration> loadApplied(CancellationToken token) {
        ledger.ensureSchema(token);
        return ledger.applied(token);
    }

    private void requireValid(List<SequentialMigration> migrations, MigrationListener listener) {
        List<ValidationIssue> issues = validate(migrations);
        boolean hasErrors = false;
        for (ValidationIssue issue : issues) {
            if (issue.isError()) {
                hasErrors = true;
            } else {
                log.warn("Validation warning: {}", issue);
                notify(listener, MigrationEvent.Type.VALIDATION_WARNING, issue.migration(), issue.message());
            }
        }
        if (hasErrors) {
            MigrationValidationException e = new MigrationValidationException(issues);
            log.error(e.getMessage());
            throw e;
        }
    }

    private <T> T withLock(RunOptions options, Supplier<T> action) {
        Optional<DistributedLock> lock = options.getLock();
        if (lock.isEmpty()) {
            return action.get();
        }
        String key = lockKey();
        if (!lock.get().tryLock(key)) {
            throw new LockAcquisitionException(key, "Migration lock '" + key + "' is held by another run");
        }
        try {
            return action.get();
        } finally {
            lock.get().unlock(key);
        }
    }

    String lockKey() {
        return "schema-migration:" + database.getName();
    }

    private MigrationExecutionException failed(String name, MigrationExecutionException.Phase phase,
                                               List<String> completed, RuntimeException cause,
                                               MigrationListener listener) {
        return report(new MigrationExecutionException(name, phase, completed, cause), listener);
    }

    private MigrationExecutionException failed(String name, MigrationExecutionException.Phase phase,
                                               List<String> completed, String message,
                                               MigrationListener listener) {
        return report(new MigrationExecutionException(name, phase, completed, message, null), listener);
    }

    private MigrationExecutionException report(MigrationExecutionException failure, MigrationListener listener) {
        metrics.incrementMigrationFailed();
        log.error(failure.getMessage(), failure.getCause());
        notify(listener, MigrationEvent.Type.FAILED, failure.getMigration(), failure.getMessage());
        return failure;
    }

    private static void notify(MigrationListener listener, MigrationEvent.Type type, String migration,
                               String message) {
        try {
            listener.onEvent(new MigrationEvent(type, migration, message));
        } catch (RuntimeException e) {
            log.warn("Migration listener failed on {} event: {}", type, e.getMessage());
        }
    }

    private static List<SequentialMigration> sorted(List<SequentialMigration> migrations) {
        List<SequentialMigration> sorted = new ArrayList<>(migrations);
        sorted.sort(BY_NAME);
        return Collections.unmodifiableList(sorted);
    }

    private static boolean isSorted(List<SequentialMigration> migrations) {
        String previous = null;
        for (SequentialMigration migration : migrations) {
            if (migration == null || migration.getName() == null) {
                continue;
            }
            if (previous != null && previous.compareTo(migration.getName()) > 0) {
                return false;
            }
            previous = migration.getName();
        }
        return true;
    }
}
