package com.schema.migration.migration.sequential;

import java.time.Instant;
import java.util.Optional;

/**
 * Status of one known migration.
 *
 * @param name      migration name
 * @param applied   whether the ledger has a record for it
 * @param appliedAt recorded timestamp, null when not applied
 */
public record MigrationStatus(String name, boolean applied, Instant appliedAt) {

    public Optional<Instant> appliedAtOptional() {
        return Optional.ofNullable(appliedAt);
    }
}
