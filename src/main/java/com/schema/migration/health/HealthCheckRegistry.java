package com.schema.migration.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of health checks combined into one aggregate status: the worst individual
 * status wins, and every check's result is listed in the details under its name.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    /**
     * Runs all registered health checks and returns an aggregate status.
     */
    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        Map<String, Object> checkResults = new LinkedHashMap<>();
        HealthStatus.Status worstStatus = HealthStatus.Status.UP;
        String worstMessage = "OK";

        for (HealthCheck check : checks) {
            HealthStatus result = check.checkSafely();
            if (!result.isUp()) {
                log.warn("Health check {} is {}: {}", check.getName(), result.status(), result.message());
            }
            checkResults.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()
            ));

            if (result.status().isWorseThan(worstStatus)) {
                worstStatus = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }

        return new HealthStatus(worstStatus, worstMessage, checkResults);
    }

    public int size() {
        return checks.size();
    }
}
