package com.schema.migration.migration.sequential;

/**
 * Receives {@link MigrationEvent}s on the thread running the migrations.
 * A listener that throws does not affect the run.
 */
@FunctionalInterface
public interface MigrationListener {

    MigrationListener NONE = event -> { };

    void onEvent(MigrationEvent event);
}
