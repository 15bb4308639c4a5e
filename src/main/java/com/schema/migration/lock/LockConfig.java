package com.schema.migration.lock;

import java.time.Duration;

/**
 * Configuration for lock implementations.
 *
 * @param timeoutMs      maximum time to wait for an in-process lock
 * @param maxRetries     retry attempts of the database lock while another owner holds it
 * @param retryDelayMs   delay between retry attempts in milliseconds
 * @param lockTtlSeconds lifetime of a database lock record before other owners may reclaim it
 */
public record LockConfig(long timeoutMs, int maxRetries, long retryDelayMs, int lockTtlSeconds) {

    public LockConfig {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be > 0");
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (retryDelayMs <= 0) {
            throw new IllegalArgumentException("retryDelayMs must be > 0");
        }
        if (lockTtlSeconds <= 0) {
            throw new IllegalArgumentException("lockTtlSeconds must be > 0");
        }
    }

    public Duration timeout() {
        return Duration.ofMillis(timeoutMs);
    }

    /**
     * How long a database lock record stays valid after it is written.
     */
    public Duration ttl() {
        return Duration.ofSeconds(lockTtlSeconds);
    }

    /**
     * Same settings with a different record lifetime, for runs expected to outlast the default.
     */
    public LockConfig withTtl(Duration ttl) {
        return new LockConfig(timeoutMs, maxRetries, retryDelayMs, Math.toIntExact(ttl.toSeconds()));
    }

    /**
     * 30s timeout, 10 retries, 1s delay, 10 minute TTL. Migration runs can be long,
     * so the TTL is generous.
     */
    public static LockConfig defaults() {
        return new LockConfig(30_000, 10, 1_000, 600);
    }
}
