package com.schema.migration.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them again on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forRun("run", database.getName())) {
 *     log.info("migration.applied name={}", name);
 * } // MDC entries are cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String RUN_ID = "runId";
    public static final String OPERATION = "operation";
    public static final String DATABASE = "database";
    public static final String MIGRATION = "migration";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a runner or migrator operation
     * ({@code migrate}, {@code run}, {@code stamp}, {@code rollback}, {@code status}).
     */
    public static LogContext forRun(String operation, String database) {
        LogContext ctx = new LogContext();
        ctx.put(RUN_ID, generateRunId());
        ctx.put(OPERATION, operation);
        ctx.put(DATABASE, database);
        return ctx;
    }

    /**
     * Tags log lines with the migration currently executing.
     * Closing it removes only the migration key.
     */
    public static LogContext forMigration(String name) {
        LogContext ctx = new LogContext();
        ctx.put(MIGRATION, name);
        return ctx;
    }

    /**
     * Generates a unique run ID.
     */
    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
