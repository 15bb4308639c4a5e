package com.schema.migration.lock;

/**
 * Thrown when the migration lock for a key cannot be acquired, either because another
 * run holds it past the configured timeout or retries, or because the lock store failed.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String key;

    public LockAcquisitionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public LockAcquisitionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    /**
     * The lock key, e.g. {@code schema-migration:orders}.
     */
    public String getKey() {
        return key;
    }
}
