package com.schema.migration.migration.sequential;

import com.schema.migration.migration.MigrationException;

import java.util.List;

/**
 * A run or rollback stopped at a migration. Migrations completed before the failure
 * stay applied (or rolled back); {@link #getCompleted()} lists them in order.
 */
public class MigrationExecutionException extends MigrationException {

    /**
     * Step that failed.
     */
    public enum Phase { UP, DOWN, RECORD, DELETE }

    private final String migration;
    private final Phase phase;
    private final List<String> completed;

    public MigrationExecutionException(String migration, Phase phase, List<String> completed, Throwable cause) {
        this(migration, phase, completed,
                "Migration '" + migration + "' failed during " + phase + ": "
                        + (cause == null ? "unknown error" : cause.getMessage()),
                cause);
    }

    public MigrationExecutionException(String migration, Phase phase, List<String> completed,
                                       String message, Throwable cause) {
        super(message, cause);
        this.migration = migration;
        this.phase = phase;
        this.completed = List.copyOf(completed);
    }

    public String getMigration() {
        return migration;
    }

    public Phase getPhase() {
        return phase;
    }

    /**
     * Names applied, stamped or rolled back before the failure.
     */
    public List<String> getCompleted() {
        return completed;
    }
}
