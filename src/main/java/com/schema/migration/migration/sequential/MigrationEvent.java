package com.schema.migration.migration.sequential;

/**
 * Progress notification emitted by {@link SequentialMigrationRunner}.
 *
 * @param type      what happened
 * @param migration affected migration, null for run-wide events
 * @param message   human-readable description
 */
public record MigrationEvent(Type type, String migration, String message) {

    public enum Type {
        VALIDATION_WARNING,
        /** dry-run: the migration would be applied or stamped */
        PENDING,
        /** dry-run: one up statement of a pending migration */
        STATEMENT,
        APPLYING,
        APPLIED,
        STAMPED,
        ROLLING_BACK,
        ROLLED_BACK,
        FAILED
    }

    @Override
    public String toString() {
        return message;
    }
}
