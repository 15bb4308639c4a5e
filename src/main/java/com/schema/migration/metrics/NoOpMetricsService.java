package com.schema.migration.metrics;

import com.schema.migration.graph.GraphConnectionPool;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 * All methods are empty, ensuring the library works without any metrics dependencies.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordPoolAcquire(Duration waited, boolean success) {
    }

    @Override
    public void incrementPoolTimeout() {
    }

    @Override
    public void incrementConnectionCreated() {
    }

    @Override
    public void incrementConnectionEvicted() {
    }

    @Override
    public void incrementConnectionDiscarded() {
    }

    @Override
    public void bindPool(String poolName, GraphConnectionPool pool) {
    }

    @Override
    public void recordMigrationDuration(String kind, Duration duration) {
    }

    @Override
    public void incrementMigrationApplied() {
    }

    @Override
    public void incrementMigrationStamped() {
    }

    @Override
    public void incrementMigrationRolledBack() {
    }

    @Override
    public void incrementMigrationFailed() {
    }
}
