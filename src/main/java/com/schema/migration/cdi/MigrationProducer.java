package com.schema.migration.cdi;

import com.schema.migration.graph.Database;
import com.schema.migration.graph.GraphConnectionFactory;
import com.schema.migration.graph.GraphConnectionPool;
import com.schema.migration.graph.PoolConfig;
import com.schema.migration.graph.SimpleGraphConnectionPool;
import com.schema.migration.health.ConnectionPoolHealthCheck;
import com.schema.migration.health.DatabaseHealthCheck;
import com.schema.migration.health.HealthCheckRegistry;
import com.schema.migration.metrics.MetricsService;
import com.schema.migration.metrics.MicrometerMetricsService;
import com.schema.migration.metrics.NoOpMetricsService;
import com.schema.migration.migration.sequential.SequentialMigrationRunner;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * CDI producer that wires the migration library from MicroProfile Config properties.
 *
 * <p>The application supplies the store driver as a {@link GraphConnectionFactory} bean;
 * this producer builds the {@link Database} handle (pooled unless disabled), a
 * {@link SequentialMigrationRunner} and a {@link HealthCheckRegistry}. Metrics go to the
 * container's {@link MeterRegistry} when one is available. The library types have no
 * no-arg constructors, so they are produced as unproxied singletons.</p>
 *
 * <h2>Configuration</h2>
 * <pre>
 * schema-migration:
 *   database: orders
 *   pool:
 *     enabled: true
 *     min-size: 2
 *     max-size: 10
 *     idle-timeout-seconds: 300
 *     wait-timeout-millis: 10000
 *     test-on-borrow: true
 * </pre>
 */
@ApplicationScoped
public class MigrationProducer {

    private static final Logger log = LoggerFactory.getLogger(MigrationProducer.class);

    // ── Database ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "schema-migration.database")
    String databaseName;

    // ── Connection Pool ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "schema-migration.pool.enabled", defaultValue = "true")
    boolean poolEnabled;

    @Inject
    @ConfigProperty(name = "schema-migration.pool.min-size", defaultValue = "2")
    int poolMinSize;

    @Inject
    @ConfigProperty(name = "schema-migration.pool.max-size", defaultValue = "10")
    int poolMaxSize;

    @Inject
    @ConfigProperty(name = "schema-migration.pool.idle-timeout-seconds", defaultValue = "300")
    long poolIdleTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "schema-migration.pool.wait-timeout-millis", defaultValue = "10000")
    long poolWaitTimeoutMillis;

    @Inject
    @ConfigProperty(name = "schema-migration.pool.test-on-borrow", defaultValue = "true")
    boolean poolTestOnBorrow;

    @Inject
    GraphConnectionFactory connectionFactory;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    private GraphConnectionPool pool;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Recording migration metrics with Micrometer");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return NoOpMetricsService.INSTANCE;
    }

    @Produces
    @Singleton
    public Database database(MetricsService metrics) {
        if (!poolEnabled) {
            log.info("Producing Database '{}' on a single connection", databaseName);
            return Database.owning(connectionFactory.create(), databaseName);
        }
        PoolConfig config = poolConfig();
        log.info("Producing Database '{}' with pool {}", databaseName, config);
        pool = new SimpleGraphConnectionPool(config, connectionFactory, metrics);
        metrics.bindPool(databaseName, pool);
        return Database.pooled(pool, databaseName);
    }

    public void closeDatabase(@Disposes Database database) {
        log.info("Closing Database '{}'", database.getName());
        database.close();
        if (pool != null) {
            pool.close();
            pool = null;
        }
    }

    @Produces
    @Singleton
    public SequentialMigrationRunner sequentialMigrationRunner(Database database, MetricsService metrics) {
        return new SequentialMigrationRunner(database, metrics);
    }

    @Produces
    @Singleton
    public HealthCheckRegistry healthCheckRegistry(Database database) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(new DatabaseHealthCheck(database));
        if (pool != null) {
            registry.register(new ConnectionPoolHealthCheck(pool, poolMaxSize));
        }
        return registry;
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    PoolConfig poolConfig() {
        return PoolConfig.builder()
                .minSize(poolMinSize)
                .maxSize(poolMaxSize)
                .idleTimeout(Duration.ofSeconds(poolIdleTimeoutSeconds))
                .waitTimeout(Duration.ofMillis(poolWaitTimeoutMillis))
                .testOnBorrow(poolTestOnBorrow)
                .build();
    }
}
