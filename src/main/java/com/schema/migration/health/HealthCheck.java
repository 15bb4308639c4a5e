package com.schema.migration.health;

/**
 * One component check registered with {@link HealthCheckRegistry}.
 */
public interface HealthCheck {

    /**
     * Key of this check in the aggregate details, e.g. {@code database}.
     */
    String getName();

    /**
     * Checks the component. Implementations report failures as a DOWN status.
     */
    HealthStatus check();

    /**
     * Runs {@link #check()}, turning an escaped exception into a DOWN status.
     */
    default HealthStatus checkSafely() {
        try {
            return check();
        } catch (RuntimeException e) {
            return HealthStatus.failed("Health check failed", e);
        }
    }
}
