package com.schema.migration.lock;

import com.schema.migration.graph.CancellationToken;
import com.schema.migration.graph.Database;
import com.schema.migration.graph.QueryRow;
import com.schema.migration.graph.Value;
import com.schema.migration.schema.TypeQlSyntax;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Advisory lock stored as a {@code migration-lock} record in the migrated database,
 * for runners in different processes.
 *
 * <p>The lock key is an {@code @key} attribute, so the store rejects a second insert for
 * a held key. A record whose expiry has passed is reclaimed by the next owner, which
 * bounds how long a crashed process can block migrations.</p>
 *
 * <p>All threads of one instance share a single owner id, so the record alone cannot tell
 * them apart. Acquisition first takes an in-process reentrant lock for the key, bounded by
 * {@link LockConfig#timeout()}: a second thread waits for the first to unlock, and a thread
 * that already holds the key re-enters without touching the store. The record is deleted
 * when the outermost hold is released.</p>
 */
public class DatabaseDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(DatabaseDistributedLock.class);

    public static final String LOCK_TYPE = "migration-lock";
    public static final String KEY_ATTRIBUTE = "migration-lock-key";
    public static final String OWNER_ATTRIBUTE = "migration-lock-owner";
    public static final String EXPIRES_AT_ATTRIBUTE = "migration-lock-expires-at";

    static final String LOCK_SCHEMA = """
            define
            attribute migration-lock-key, value string;
            attribute migration-lock-owner, value string;
            attribute migration-lock-expires-at, value datetime;
            entity migration-lock,
                owns migration-lock-key @key,
                owns migration-lock-owner,
                owns migration-lock-expires-at;""";

    private final Database database;
    private final LockConfig config;
    private final Clock clock;
    private final String ownerId;
    private final LocalDistributedLock local;
    private volatile boolean schemaReady;

    public DatabaseDistributedLock(Database database) {
        this(database, LockConfig.defaults());
    }

    public DatabaseDistributedLock(Database database, LockConfig config) {
        this(database, config, Clock.systemUTC());
    }

    public DatabaseDistributedLock(Database database, LockConfig config, Clock clock) {
        this.database = database;
        this.config = config;
        this.clock = clock;
        this.ownerId = generateOwnerId();
        this.local = new LocalDistributedLock(config);
    }

    @Override
    public boolean tryLock(String key) {
        local.tryLock(key);
        if (local.holdCount(key) > 1) {
            log.debug("Migration lock re-entered: {}", key);
            return true;
        }
        try {
            acquireRecord(key);
            return true;
        } catch (RuntimeException e) {
            local.unlock(key);
            throw e;
        }
    }

    @Override
    public void unlock(String key) {
        int holds = local.holdCount(key);
        if (holds == 0) {
            log.debug("Ignoring unlock of '{}': not held by this thread", key);
            return;
        }
        try {
            if (holds == 1) {
                deleteLock(key, ownerId);
                log.debug("Migration lock released: {}", key);
            }
        } catch (RuntimeException e) {
            // the record expires on its own
            log.warn("Failed to release migration lock {}: {}", key, e.getMessage());
        } finally {
            local.unlock(key);
        }
    }

    public String getOwnerId() {
        return ownerId;
    }

    private void acquireRecord(String key) {
        ensureSchema(key);
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            if (attemptLock(key)) {
                log.debug("Migration lock acquired: {} (attempt {})", key, attempt + 1);
                return;
            }

            if (attempt < config.maxRetries()) {
                try {
                    Thread.sleep(config.retryDelayMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LockAcquisitionException(key, "Interrupted while acquiring migration lock '" + key + "'", e);
                }
            }
        }

        throw new LockAcquisitionException(key,
                "Failed to acquire migration lock '" + key + "' after " + (config.maxRetries() + 1) + " attempts");
    }

    private boolean attemptLock(String key) {
        Instant now = Instant.now(clock);
        try {
            List<QueryRow> holders = database.executeRead(CancellationToken.none(), """
                    match
                    $l isa migration-lock, has migration-lock-key "%s";
                    fetch {
                      "owner": $l.migration-lock-owner,
                      "expires-at": $l.migration-lock-expires-at
                    };""".formatted(TypeQlSyntax.escape(key)));
            if (!holders.isEmpty()) {
                QueryRow holder = holders.get(0);
                String owner = holder.get("owner").isNone() ? null : holder.get("owner").asText();
                Value expiresAt = holder.get("expires-at");
                if (ownerId.equals(owner)) {
                    return true;
                }
                if (!expiresAt.isNone() && expiresAt.asInstant().isAfter(now)) {
                    return false;
                }
                log.info("Reclaiming expired migration lock {} held by {}", key, owner);
                deleteLock(key, owner);
            }
            database.executeWrite(CancellationToken.none(), """
                    insert
                    $l isa migration-lock,
                    has migration-lock-key "%s",
                    has migration-lock-owner "%s",
                    has migration-lock-expires-at %s;""".formatted(
                    TypeQlSyntax.escape(key),
                    TypeQlSyntax.escape(ownerId),
                    TypeQlSyntax.datetime(now.plus(config.ttl()))));
            return true;
        } catch (RuntimeException e) {
            log.debug("Migration lock attempt failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    private void deleteLock(String key, String owner) {
        String ownerClause = owner == null ? ""
                : ", has migration-lock-owner \"" + TypeQlSyntax.escape(owner) + "\"";
        database.executeWrite(CancellationToken.none(), """
                match
                $l isa migration-lock, has migration-lock-key "%s"%s;
                delete $l;""".formatted(TypeQlSyntax.escape(key), ownerClause));
    }

    private void ensureSchema(String key) {
        if (schemaReady) {
            return;
        }
        try {
            database.executeSchema(CancellationToken.none(), LOCK_SCHEMA);
            schemaReady = true;
        } catch (RuntimeException e) {
            throw new LockAcquisitionException(key, "Cannot define migration lock schema: " + e.getMessage(), e);
        }
    }

    private static String generateOwnerId() {
        return ProcessHandle.current().pid() + "-" + UUID.randomUUID();
    }
}
