package com.schema.migration.migration;

import java.util.Locale;

/**
 * One-shot schema migration failed. Carries the computed diff (null when the failure
 * happened before the diff existed) and, for execution failures, the failing statement.
 * Nothing is recorded in the ledger, so a retry attempts the same statements again.
 */
public class SchemaMigrationException extends MigrationException {

    public enum Stage { FETCH_SCHEMA, PARSE_SCHEMA, ENSURE_LEDGER, CHECK_LEDGER, EXECUTE, RECORD }

    private final transient SchemaDiff diff;
    private final Stage stage;
    private final String statement;

    public SchemaMigrationException(Stage stage, SchemaDiff diff, String statement, Throwable cause) {
        super(buildMessage(stage, statement, cause), cause);
        this.stage = stage;
        this.diff = diff;
        this.statement = statement;
    }

    private static String buildMessage(Stage stage, String statement, Throwable cause) {
        String detail = cause == null ? "" : ": " + cause.getMessage();
        if (statement != null) {
            return "migrate: execute \"" + statement + "\"" + detail;
        }
        return "migrate: " + stage.name().toLowerCase(Locale.ROOT).replace('_', ' ') + detail;
    }

    public Stage getStage() {
        return stage;
    }

    public SchemaDiff getDiff() {
        return diff;
    }

    public String getStatement() {
        return statement;
    }
}
