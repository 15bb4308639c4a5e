package com.schema.migration.migration.sequential;

/**
 * A structural problem in a migration list.
 *
 * @param migration name of the affected migration, null for list-wide issues
 * @param message   description
 * @param severity  {@link Severity#ERROR} blocks the run, {@link Severity#WARNING} does not
 */
public record ValidationIssue(String migration, String message, Severity severity) {

    public enum Severity { ERROR, WARNING }

    public static ValidationIssue error(String migration, String message) {
        return new ValidationIssue(migration, message, Severity.ERROR);
    }

    public static ValidationIssue warning(String migration, String message) {
        return new ValidationIssue(migration, message, Severity.WARNING);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return (migration == null ? "(global)" : migration) + ": " + message;
    }
}
