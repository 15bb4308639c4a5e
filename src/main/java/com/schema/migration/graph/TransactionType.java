package com.schema.migration.graph;

import java.util.Locale;

/**
 * Kind of transaction opened against the store.
 */
public enum TransactionType {
    READ,
    WRITE,
    SCHEMA;

    /**
     * Infers the transaction type a single statement needs.
     * Statements starting with {@code define}, {@code undefine} or {@code redefine}
     * run in a schema transaction, everything else in a write transaction.
     *
     * @param statement the TypeQL statement
     * @return {@link #SCHEMA} or {@link #WRITE}
     */
    public static TransactionType infer(String statement) {
        if (statement == null) {
            return WRITE;
        }
        String trimmed = statement.strip().toLowerCase(Locale.ROOT);
        if (trimmed.startsWith("define") || trimmed.startsWith("undefine") || trimmed.startsWith("redefine")) {
            return SCHEMA;
        }
        return WRITE;
    }
}
