package com.schema.migration.migration.sequential;

import com.schema.migration.graph.CancellationToken;
import com.schema.migration.graph.Database;

/**
 * The up or down step of a {@link SequentialMigration}.
 */
@FunctionalInterface
public interface MigrationAction {

    /**
     * Applies the step. Any exception fails the migration.
     */
    void apply(CancellationToken token, Database database);
}
