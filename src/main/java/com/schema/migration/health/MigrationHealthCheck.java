package com.schema.migration.health;

import com.schema.migration.graph.CancellationToken;
import com.schema.migration.migration.sequential.SequentialMigration;
import com.schema.migration.migration.sequential.SequentialMigrationRunner;

import java.util.List;

/**
 * Reports DOWN while any of the application's migrations is not applied, so a
 * readiness probe holds traffic until the schema has caught up.
 */
public class MigrationHealthCheck implements HealthCheck {

    private final SequentialMigrationRunner runner;
    private final List<SequentialMigration> migrations;

    public MigrationHealthCheck(SequentialMigrationRunner runner, List<SequentialMigration> migrations) {
        this.runner = runner;
        this.migrations = List.copyOf(migrations);
    }

    @Override
    public String getName() {
        return "migrations";
    }

    @Override
    public HealthStatus check() {
        try {
            List<String> pending = runner.pendingNames(CancellationToken.none(), migrations);
            HealthStatus base = pending.isEmpty()
                    ? HealthStatus.up()
                    : HealthStatus.down(pending.size() + " migration(s) pending");
            return base
                    .withDetail("known", migrations.size())
                    .withDetail("pending", pending);
        } catch (RuntimeException e) {
            return HealthStatus.failed("Migration status check failed", e);
        }
    }
}
