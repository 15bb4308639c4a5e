package com.schema.migration.migration;

/**
 * A migration ledger could not be read or written.
 */
public class LedgerException extends MigrationException {

    private final String operation;

    public LedgerException(String operation, String message, Throwable cause) {
        super("Migration ledger " + operation + " failed: " + message, cause);
        this.operation = operation;
    }

    /**
     * The ledger operation that failed, e.g. {@code record} or {@code ensure schema}.
     */
    public String getOperation() {
        return operation;
    }
}
