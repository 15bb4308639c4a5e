package com.schema.migration.health;

import com.schema.migration.graph.GraphConnectionPool;
import com.schema.migration.graph.PoolStats;

/**
 * Health check for the graph connection pool.
 * DEGRADED when 80% of the connections are in use, DOWN when the pool is closed or
 * exhausted with callers waiting.
 */
public class ConnectionPoolHealthCheck implements HealthCheck {

    private static final double DEGRADED_THRESHOLD = 0.80;

    private final GraphConnectionPool pool;
    private final int maxSize;

    /**
     * @param maxSize the pool's configured maximum, 0 for unbounded pools
     */
    public ConnectionPoolHealthCheck(GraphConnectionPool pool, int maxSize) {
        this.pool = pool;
        this.maxSize = maxSize;
    }

    @Override
    public String getName() {
        return "connectionPool";
    }

    @Override
    public HealthStatus check() {
        if (pool.isClosed()) {
            return HealthStatus.down("Connection pool is closed");
        }
        try {
            PoolStats stats = pool.getStats();
            int capacity = maxSize > 0 ? maxSize : stats.total();
            double usage = capacity > 0 ? (double) stats.inUse() / capacity : 0.0;

            HealthStatus base;
            if (stats.waiting() > 0 && maxSize > 0 && stats.inUse() >= maxSize) {
                base = HealthStatus.down("Connection pool exhausted: " + stats.waiting() + " caller(s) waiting");
            } else if (maxSize > 0 && usage >= DEGRADED_THRESHOLD) {
                base = HealthStatus.degraded("Connection pool usage high: " +
                        String.format("%.0f%%", usage * 100));
            } else {
                base = HealthStatus.up();
            }

            return base
                    .withDetail("available", stats.available())
                    .withDetail("inUse", stats.inUse())
                    .withDetail("total", stats.total())
                    .withDetail("waiting", stats.waiting())
                    .withDetail("totalBorrowed", stats.totalBorrowed())
                    .withDetail("totalTimeouts", stats.totalTimeouts());
        } catch (RuntimeException e) {
            return HealthStatus.down("Connection pool check failed: " + e.getMessage());
        }
    }
}
