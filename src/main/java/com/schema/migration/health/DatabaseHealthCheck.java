package com.schema.migration.health;

import com.schema.migration.graph.Database;

/**
 * Checks that the store is reachable and the database exists, and reports the latency.
 */
public class DatabaseHealthCheck implements HealthCheck {

    private final Database database;

    public DatabaseHealthCheck(Database database) {
        this.database = database;
    }

    @Override
    public String getName() {
        return "database";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            boolean exists = database.getConnection().containsDatabase(database.getName());
            long latencyMs = System.currentTimeMillis() - startMs;

            HealthStatus base = exists
                    ? HealthStatus.up()
                    : HealthStatus.down("Database '" + database.getName() + "' does not exist");
            return base
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("database", database.getName());
        } catch (RuntimeException e) {
            return HealthStatus.failed("Store connection failed", e);
        }
    }
}
