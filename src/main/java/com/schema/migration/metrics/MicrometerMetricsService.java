package com.schema.migration.metrics;

import com.schema.migration.graph.GraphConnectionPool;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code graph.pool.acquire} - Timer (tag: outcome)</li>
 *   <li>{@code graph.pool.timeouts} - Counter</li>
 *   <li>{@code graph.pool.connections.created} - Counter</li>
 *   <li>{@code graph.pool.connections.evicted} - Counter</li>
 *   <li>{@code graph.pool.connections.discarded} - Counter</li>
 *   <li>{@code graph.pool.available}, {@code .in.use}, {@code .total}, {@code .waiting} - Gauges (tag: pool)</li>
 *   <li>{@code schema.migration.duration} - Timer (tag: kind)</li>
 *   <li>{@code schema.migration.applied}, {@code .stamped}, {@code .rolled.back}, {@code .failed} - Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Counter poolTimeoutCounter;
    private final Counter createdCounter;
    private final Counter evictedCounter;
    private final Counter discardedCounter;
    private final Counter appliedCounter;
    private final Counter stampedCounter;
    private final Counter rolledBackCounter;
    private final Counter failedCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.poolTimeoutCounter = Counter.builder("graph.pool.timeouts")
                .description("Number of acquisitions that timed out waiting for a connection")
                .register(registry);
        this.createdCounter = Counter.builder("graph.pool.connections.created")
                .description("Number of connections opened by the pool")
                .register(registry);
        this.evictedCounter = Counter.builder("graph.pool.connections.evicted")
                .description("Number of idle connections closed by the evictor")
                .register(registry);
        this.discardedCounter = Counter.builder("graph.pool.connections.discarded")
                .description("Number of unhealthy connections discarded")
                .register(registry);
        this.appliedCounter = Counter.builder("schema.migration.applied")
                .description("Number of migrations applied")
                .register(registry);
        this.stampedCounter = Counter.builder("schema.migration.stamped")
                .description("Number of migrations stamped without execution")
                .register(registry);
        this.rolledBackCounter = Counter.builder("schema.migration.rolled.back")
                .description("Number of migrations rolled back")
                .register(registry);
        this.failedCounter = Counter.builder("schema.migration.failed")
                .description("Number of migrations that failed")
                .register(registry);
    }

    @Override
    public void recordPoolAcquire(Duration waited, boolean success) {
        String outcome = success ? "success" : "failure";
        Timer timer = timerCache.computeIfAbsent("acquire:" + outcome, k ->
                Timer.builder("graph.pool.acquire")
                        .description("Time spent acquiring a pooled connection")
                        .tag("outcome", outcome)
                        .register(registry));
        timer.record(waited);
    }

    @Override
    public void incrementPoolTimeout() {
        poolTimeoutCounter.increment();
    }

    @Override
    public void incrementConnectionCreated() {
        createdCounter.increment();
    }

    @Override
    public void incrementConnectionEvicted() {
        evictedCounter.increment();
    }

    @Override
    public void incrementConnectionDiscarded() {
        discardedCounter.increment();
    }

    @Override
    public void bindPool(String poolName, GraphConnectionPool pool) {
        Gauge.builder("graph.pool.available", pool, p -> p.getStats().available())
                .tag("pool", poolName)
                .register(registry);
        Gauge.builder("graph.pool.in.use", pool, p -> p.getStats().inUse())
                .tag("pool", poolName)
                .register(registry);
        Gauge.builder("graph.pool.total", pool, p -> p.getStats().total())
                .tag("pool", poolName)
                .register(registry);
        Gauge.builder("graph.pool.waiting", pool, p -> p.getStats().waiting())
                .tag("pool", poolName)
                .register(registry);
    }

    @Override
    public void recordMigrationDuration(String kind, Duration duration) {
        Timer timer = timerCache.computeIfAbsent("migration:" + kind, k ->
                Timer.builder("schema.migration.duration")
                        .description("Duration of migration operations")
                        .tag("kind", kind)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementMigrationApplied() {
        appliedCounter.increment();
    }

    @Override
    public void incrementMigrationStamped() {
        stampedCounter.increment();
    }

    @Override
    public void incrementMigrationRolledBack() {
        rolledBackCounter.increment();
    }

    @Override
    public void incrementMigrationFailed() {
        failedCounter.increment();
    }
}
