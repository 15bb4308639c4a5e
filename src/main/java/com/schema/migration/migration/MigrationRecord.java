package com.schema.migration.migration;

import java.time.Instant;

/**
 * A generated change set recorded in the hash ledger.
 *
 * @param hash      SHA-256 of the generated statements
 * @param summary   diff summary at the time the change set was applied
 * @param appliedAt when the change set was recorded
 */
public record MigrationRecord(String hash, String summary, Instant appliedAt) {
}
