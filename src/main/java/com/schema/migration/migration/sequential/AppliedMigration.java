package com.schema.migration.migration.sequential;

import java.time.Instant;

/**
 * Ledger record of an applied sequential migration.
 *
 * @param name      migration name
 * @param appliedAt when it was applied or stamped, null if the record has no timestamp
 * @param checksum  recorded checksum, empty when none was recorded
 */
public record AppliedMigration(String name, Instant appliedAt, String checksum) {

    public AppliedMigration {
        checksum = checksum == null ? "" : checksum;
    }
}
