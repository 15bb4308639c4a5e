package com.schema.migration.migration.sequential;

import com.schema.migration.migration.MigrationException;

/**
 * The statements of an already applied migration no longer hash to the recorded checksum.
 * The run is aborted before anything new is applied.
 */
public class ChecksumMismatchException extends MigrationException {

    private final String migration;
    private final String recordedChecksum;
    private final String currentChecksum;

    public ChecksumMismatchException(String migration, String recordedChecksum, String currentChecksum) {
        super("Migration '" + migration + "': checksum mismatch (recorded " + recordedChecksum
                + ", current " + currentChecksum + "); an applied migration was modified");
        this.migration = migration;
        this.recordedChecksum = recordedChecksum;
        this.currentChecksum = currentChecksum;
    }

    public String getMigration() {
        return migration;
    }

    public String getRecordedChecksum() {
        return recordedChecksum;
    }

    public String getCurrentChecksum() {
        return currentChecksum;
    }
}
