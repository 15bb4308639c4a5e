package com.schema.migration.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process lock keyed by database. Serializes runners sharing one JVM; use
 * {@link DatabaseDistributedLock} when several processes migrate the same database.
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public boolean tryLock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock(true));
        boolean acquired;
        try {
            acquired = lock.tryLock(config.timeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key, "Interrupted while waiting for migration lock '" + key + "'", e);
        }
        if (!acquired) {
            throw new LockAcquisitionException(key, "Migration lock '" + key + "' is held by another run; gave up after "
                    + config.timeoutMs() + "ms");
        }
        log.debug("Migration lock acquired: {} (hold count {})", key, lock.getHoldCount());
        return true;
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            log.debug("Ignoring unlock of '{}': not held by this thread", key);
            return;
        }
        lock.unlock();
        log.debug("Migration lock released: {}", key);
    }

    // hold count of the calling thread, 0 when it does not hold the key
    int holdCount(String key) {
        ReentrantLock lock = locks.get(key);
        return lock == null ? 0 : lock.getHoldCount();
    }

    /**
     * Whether any thread currently holds the lock for the key.
     */
    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
