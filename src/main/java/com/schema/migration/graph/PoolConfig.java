package com.schema.migration.graph;

import java.time.Duration;

/**
 * Configuration for {@link SimpleGraphConnectionPool}.
 *
 * <p>A {@code maxSize} of zero means the pool is unbounded, a zero {@code idleTimeout}
 * disables idle eviction and a zero {@code waitTimeout} makes acquisition wait
 * until a connection is available or the caller cancels.</p>
 */
public class PoolConfig {

    private final int minSize;
    private final int maxSize;
    private final Duration idleTimeout;
    private final Duration waitTimeout;
    private final Duration evictionInterval;
    private final boolean testOnBorrow;

    private PoolConfig(Builder builder) {
        this.minSize = builder.minSize;
        this.maxSize = builder.maxSize;
        this.idleTimeout = builder.idleTimeout;
        this.waitTimeout = builder.waitTimeout;
        this.evictionInterval = builder.evictionInterval != null
                ? builder.evictionInterval
                : builder.idleTimeout.dividedBy(2);
        this.testOnBorrow = builder.testOnBorrow;
    }

    public int getMinSize() { return minSize; }
    public int getMaxSize() { return maxSize; }
    public Duration getIdleTimeout() { return idleTimeout; }
    public Duration getWaitTimeout() { return waitTimeout; }
    public Duration getEvictionInterval() { return evictionInterval; }
    public boolean isTestOnBorrow() { return testOnBorrow; }

    public boolean isBounded() {
        return maxSize > 0;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configuration: min 2, max 10, 5 minute idle timeout, 10 second wait timeout.
     */
    public static PoolConfig defaults() {
        return builder().build();
    }

    public static class Builder {
        private int minSize = 2;
        private int maxSize = 10;
        private Duration idleTimeout = Duration.ofMinutes(5);
        private Duration waitTimeout = Duration.ofSeconds(10);
        private Duration evictionInterval;
        private boolean testOnBorrow = true;

        public Builder minSize(int minSize) {
            if (minSize < 0) throw new IllegalArgumentException("minSize must be >= 0");
            this.minSize = minSize;
            return this;
        }

        public Builder maxSize(int maxSize) {
            if (maxSize < 0) throw new IllegalArgumentException("maxSize must be >= 0");
            this.maxSize = maxSize;
            return this;
        }

        public Builder idleTimeout(Duration idleTimeout) {
            if (idleTimeout == null || idleTimeout.isNegative()) {
                throw new IllegalArgumentException("idleTimeout must be >= 0");
            }
            this.idleTimeout = idleTimeout;
            return this;
        }

        public Builder waitTimeout(Duration waitTimeout) {
            if (waitTimeout == null || waitTimeout.isNegative()) {
                throw new IllegalArgumentException("waitTimeout must be >= 0");
            }
            this.waitTimeout = waitTimeout;
            return this;
        }

        public Builder evictionInterval(Duration evictionInterval) {
            if (evictionInterval == null || evictionInterval.isNegative() || evictionInterval.isZero()) {
                throw new IllegalArgumentException("evictionInterval must be > 0");
            }
            this.evictionInterval = evictionInterval;
            return this;
        }

        public Builder testOnBorrow(boolean testOnBorrow) {
            this.testOnBorrow = testOnBorrow;
            return this;
        }

        public PoolConfig build() {
            if (maxSize > 0 && minSize > maxSize) {
                throw new IllegalArgumentException(
                        "minSize (" + minSize + ") cannot exceed maxSize (" + maxSize + ")");
            }
            return new PoolConfig(this);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "minSize=" + minSize +
                ", maxSize=" + maxSize +
                ", idleTimeout=" + idleTimeout +
                ", waitTimeout=" + waitTimeout +
                ", evictionInterval=" + evictionInterval +
                ", testOnBorrow=" + testOnBorrow +
                '}';
    }
}
