package com.schema.migration.health;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of one component (store, pool, migrations) or the aggregate of all of them.
 *
 * @param status  overall state
 * @param message human-readable reason, {@code "OK"} when up
 * @param details diagnostic values such as latency or pending migration names
 */
public record HealthStatus(Status status, String message, Map<String, Object> details) {

    /**
     * Ordered from best to worst.
     */
    public enum Status {
        UP, DEGRADED, DOWN;

        public boolean isWorseThan(Status other) {
            return compareTo(other) > 0;
        }
    }

    public HealthStatus {
        details = details != null ? Collections.unmodifiableMap(new LinkedHashMap<>(details)) : Map.of();
    }

    public static HealthStatus up() {
        return new HealthStatus(Status.UP, "OK", Map.of());
    }

    public static HealthStatus up(String message) {
        return new HealthStatus(Status.UP, message, Map.of());
    }

    public static HealthStatus down(String reason) {
        return new HealthStatus(Status.DOWN, reason, Map.of());
    }

    public static HealthStatus degraded(String reason) {
        return new HealthStatus(Status.DEGRADED, reason, Map.of());
    }

    /**
     * DOWN status for a check that failed with an exception; the exception type is kept as
     * the {@code error} detail.
     */
    public static HealthStatus failed(String reason, Exception e) {
        return down(reason + ": " + e.getMessage()).withDetail("error", e.getClass().getSimpleName());
    }

    public HealthStatus withDetail(String key, Object value) {
        Map<String, Object> newDetails = new LinkedHashMap<>(this.details);
        newDetails.put(key, value);
        return new HealthStatus(this.status, this.message, newDetails);
    }

    public boolean isUp() {
        return status == Status.UP;
    }

    public boolean isDown() {
        return status == Status.DOWN;
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
