package com.schema.migration.lock;

/**
 * Lock used to serialize migration runs that share a ledger.
 *
 * <p>The runner itself does not synchronize concurrent runs: two processes may both read
 * the applied set before either records. Supplying a lock through the run options closes
 * that window.</p>
 */
public interface DistributedLock {

    /**
     * Attempts to acquire a lock on the given key.
     *
     * @param key the lock key (the runner uses {@code schema-migration:<database>})
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if lock acquisition fails after retries
     */
    boolean tryLock(String key);

    /**
     * Releases a lock on the given key. Releasing a lock not held by the caller has no effect.
     *
     * @param key the lock key
     */
    void unlock(String key);
}
