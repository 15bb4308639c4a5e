package com.schema.migration.metrics;

import com.schema.migration.graph.GraphConnectionPool;

import java.time.Duration;

/**
 * Interface for recording pool and migration metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, ensuring the library works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    void recordPoolAcquire(Duration waited, boolean success);

    void incrementPoolTimeout();

    void incrementConnectionCreated();

    void incrementConnectionEvicted();

    void incrementConnectionDiscarded();

    /**
     * Exposes the live statistics of a pool as gauges.
     */
    void bindPool(String poolName, GraphConnectionPool pool);

    void recordMigrationDuration(String kind, Duration duration);

    void incrementMigrationApplied();

    void incrementMigrationStamped();

    void incrementMigrationRolledBack();

    void incrementMigrationFailed();
}
