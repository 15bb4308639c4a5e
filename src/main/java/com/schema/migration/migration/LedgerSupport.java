package com.schema.migration.migration;

import com.schema.migration.graph.OperationCancelledException;
import com.schema.migration.graph.QueryRow;
import com.schema.migration.graph.Value;

import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Helpers shared by the ledgers stored inside the target database.
 */
public final class LedgerSupport {

    /**
     * Types and attributes owned by the hash and sequential ledgers and the migration lock. They live in the
     * target database but never belong to a desired schema.
     */
    public static final Set<String> LEDGER_LABELS = Set.of(
            "migration-record", "migration-hash", "migration-summary", "migration-applied-at",
            "seq-migration-record", "seq-migration-name", "seq-migration-applied-at", "seq-migration-checksum",
            "migration-lock", "migration-lock-key", "migration-lock-owner", "migration-lock-expires-at");

    private LedgerSupport() {
    }

    /**
     * Runs a ledger operation, wrapping store failures in a {@link LedgerException}.
     * Cancellation is propagated unchanged.
     */
    public static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (OperationCancelledException | LedgerException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new LedgerException(operation, e.getMessage(), e);
        }
    }

    public static void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Reads the result of a {@code reduce $count = count(...)} query.
     */
    public static long count(List<QueryRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        QueryRow row = rows.get(0);
        Value value = row.get("count");
        if (value.isNone() && !row.columns().isEmpty()) {
            value = row.asMap().values().iterator().next();
        }
        return value.isNone() ? 0 : value.asLong();
    }

    /**
     * Returns the text of a column, or null when the row has no value for it.
     */
    public static String text(QueryRow row, String column) {
        Value value = row.get(column);
        return value.isNone() ? null : value.asText();
    }
}
