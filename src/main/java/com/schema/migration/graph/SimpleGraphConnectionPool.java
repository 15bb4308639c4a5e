package com.schema.migration.graph;

import com.schema.migration.metrics.MetricsService;
import com.schema.migration.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded, thread-safe connection pool.
 *
 * <p>All pool state (idle set, open count, waiter queue) is guarded by a single
 * {@link ReentrantLock}. When no idle connection exists and the pool is at
 * {@code maxSize}, callers queue as FIFO waiters; a released connection is handed
 * directly to the longest-waiting caller instead of going back to the idle set.
 * Connection I/O (open, health check, close) always happens outside the lock.</p>
 *
 * <p>A background evictor closes idle connections unused for longer than
 * {@code idleTimeout}, never shrinking the pool below {@code minSize}.</p>
 */
public class SimpleGraphConnectionPool implements GraphConnectionPool {
    private static final Logger log = LoggerFactory.getLogger(SimpleGraphConnectionPool.class);

    private final PoolConfig config;
    private final GraphConnectionFactory factory;
    private final MetricsService metrics;

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<IdleConnection> idle = new ArrayDeque<>();
    private final Deque<Waiter> waiters = new ArrayDeque<>();
    private final Set<GraphConnection> borrowed = Collections.newSetFromMap(new IdentityHashMap<>());
    private final ScheduledExecutorService evictor;

    // guarded by lock
    private int total;
    private boolean closed;
    private long totalCreated;
    private long totalBorrowed;
    private long totalTimeouts;
    private long totalEvicted;

    public SimpleGraphConnectionPool(PoolConfig config, GraphConnectionFactory factory) {
        this(config, factory, NoOpMetricsService.INSTANCE);
    }

    /**
     * Creates the pool and pre-creates {@code minSize} connections.
     *
     * @throws PoolException if any pre-warm connection cannot be created; connections
     *                       opened so far are closed and no pool is returned
     */
    public SimpleGraphConnectionPool(PoolConfig config, GraphConnectionFactory factory, MetricsService metrics) {
        this.config = config;
        this.factory = factory;
        this.metrics = metrics;

        List<GraphConnection> warm = new ArrayList<>(config.getMinSize());
        for (int i = 0; i < config.getMinSize(); i++) {
            try {
                warm.add(factory.create());
            } catch (RuntimeException e) {
                warm.forEach(this::closeQuietly);
                throw new PoolException(PoolException.Reason.CREATE_FAILED,
                        "Failed to create initial connection " + (i + 1) + "/" + config.getMinSize(), e);
            }
        }
        long now = System.nanoTime();
        for (GraphConnection conn : warm) {
            idle.addLast(new IdleConnection(conn, now));
            metrics.incrementConnectionCreated();
        }
        total = warm.size();
        totalCreated = warm.size();

        if (config.getIdleTimeout().isZero()) {
            this.evictor = null;
        } else {
            this.evictor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "graph-pool-evictor");
                t.setDaemon(true);
                return t;
            });
            long interval = Math.max(1, config.getEvictionInterval().toMillis());
            evictor.scheduleWithFixedDelay(this::evictIdle, interval, interval, TimeUnit.MILLISECONDS);
        }

        log.info("Connection pool initialized: {}", config);
    }

    @Override
    public GraphConnection borrow(CancellationToken token) {
        long start = System.nanoTime();
        long deadline = config.getWaitTimeout().isZero() ? 0 : start + config.getWaitTimeout().toNanos();
        try {
            GraphConnection conn = doBorrow(token, deadline);
            metrics.recordPoolAcquire(Duration.ofNanos(System.nanoTime() - start), true);
            return conn;
        } catch (PoolException e) {
            metrics.recordPoolAcquire(Duration.ofNanos(System.nanoTime() - start), false);
            throw e;
        }
    }

    private GraphConnection doBorrow(CancellationToken token, long deadline) {
        if (token.isCancelled()) {
            throw new PoolException(PoolException.Reason.CANCELLED, "Borrow cancelled before acquiring a connection");
        }
        while (true) {
            GraphConnection candidate = null;
            boolean reserved = false;
            Waiter waiter = null;

            lock.lock();
            try {
                if (closed) {
                    throw new PoolException(PoolException.Reason.CLOSED, "Pool is closed");
                }
                IdleConnection ic = idle.pollLast();
                if (ic != null) {
                    candidate = ic.connection();
                } else if (!config.isBounded() || total < config.getMaxSize()) {
                    total++;
                    reserved = true;
                } else {
                    waiter = new Waiter(lock.newCondition());
                    waiters.addLast(waiter);
                }
            } finally {
                lock.unlock();
            }

            if (waiter != null) {
                Handoff handoff = awaitHandoff(waiter, token, deadline);
                if (handoff.connection() == null) {
                    reserved = true;
                } else {
                    candidate = handoff.connection();
                }
            }

            if (candidate != null) {
                if (!config.isTestOnBorrow() || candidate.isOpen()) {
                    return checkOut(candidate);
                }
                log.debug("Connection failed validation on borrow, discarding");
                discard(candidate);
                continue;
            }

            if (reserved) {
                return checkOut(openReserved());
            }
        }
    }

    /**
     * Blocks until the waiter receives a connection or a free slot, or fails.
     */
    private Handoff awaitHandoff(Waiter waiter, CancellationToken token, long deadline) {
        CancellationToken.Registration registration = token.onCancel(() -> {
            lock.lock();
            try {
                waiter.cancelled = true;
                waiter.condition.signal();
            } finally {
                lock.unlock();
            }
        });
        try {
            lock.lock();
            try {
                while (!waiter.isResolved()) {
                    if (deadline == 0) {
                        waiter.condition.await();
                    } else {
                        long remaining = deadline - System.nanoTime();
                        if (remaining <= 0) {
                            break;
                        }
                        waiter.condition.awaitNanos(remaining);
                    }
                }
                if (waiter.connection != null || waiter.slotGranted) {
                    return new Handoff(waiter.connection);
                }
                waiters.remove(waiter);
                if (waiter.poolClosed) {
                    throw new PoolException(PoolException.Reason.CLOSED, "Pool closed while waiting for a connection");
                }
                if (waiter.cancelled) {
                    throw new PoolException(PoolException.Reason.CANCELLED, "Borrow cancelled while waiting for a connection");
                }
                totalTimeouts++;
                metrics.incrementPoolTimeout();
                throw new PoolException(PoolException.Reason.TIMEOUT,
                        "Timeout waiting for connection (waitTimeout=" + config.getWaitTimeout().toMillis() + "ms)");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                waiters.remove(waiter);
                if (waiter.connection != null) {
                    returnLocked(waiter.connection);
                } else if (waiter.slotGranted) {
                    releaseSlotLocked();
                }
                throw new PoolException(PoolException.Reason.CANCELLED, "Interrupted while waiting for connection", e);
            } finally {
                lock.unlock();
            }
        } finally {
            registration.close();
        }
    }

    private GraphConnection openReserved() {
        GraphConnection conn;
        try {
            conn = factory.create();
        } catch (RuntimeException e) {
            lock.lock();
            try {
                releaseSlotLocked();
            } finally {
                lock.unlock();
            }
            throw new PoolException(PoolException.Reason.CREATE_FAILED, "Failed to create connection", e);
        }
        metrics.incrementConnectionCreated();
        lock.lock();
        try {
            totalCreated++;
        } finally {
            lock.unlock();
        }
        return conn;
    }

    private GraphConnection checkOut(GraphConnection conn) {
        lock.lock();
        try {
            if (closed) {
                total--;
            } else {
                borrowed.add(conn);
                totalBorrowed++;
                log.debug("Connection borrowed (inUse={}, idle={})", total - idle.size(), idle.size());
                return conn;
            }
        } finally {
            lock.unlock();
        }
        closeQuietly(conn);
        throw new PoolException(PoolException.Reason.CLOSED, "Pool is closed");
    }

    @Override
    public void release(GraphConnection connection) {
        if (connection == null) {
            return;
        }
        boolean healthy = connection.isOpen();
        boolean closeIt = false;

        lock.lock();
        try {
            if (!borrowed.remove(connection)) {
                log.warn("Ignoring release of a connection not borrowed from this pool");
                return;
            }
            if (closed || !healthy) {
                releaseSlotLocked();
                closeIt = true;
            } else {
                returnLocked(connection);
            }
        } finally {
            lock.unlock();
        }

        if (closeIt) {
            if (!healthy) {
                metrics.incrementConnectionDiscarded();
                log.debug("Discarded unhealthy connection on release");
            }
            closeQuietly(connection);
        }
    }

    /**
     * Hands the connection to the longest waiter, or parks it in the idle set.
     * Caller must hold the lock.
     */
    private void returnLocked(GraphConnection connection) {
        Waiter waiter = waiters.pollFirst();
        if (waiter != null) {
            waiter.connection = connection;
            waiter.condition.signal();
            return;
        }
        idle.addLast(new IdleConnection(connection, System.nanoTime()));
    }

    /**
     * Gives up one slot of {@code total}: transferred to the first waiter so it can
     * open a connection itself, otherwise removed from the count. Caller must hold the lock.
     */
    private void releaseSlotLocked() {
        Waiter waiter = closed ? null : waiters.pollFirst();
        if (waiter != null) {
            waiter.slotGranted = true;
            waiter.condition.signal();
            return;
        }
        total--;
    }

    private void discard(GraphConnection connection) {
        lock.lock();
        try {
            releaseSlotLocked();
        } finally {
            lock.unlock();
        }
        metrics.incrementConnectionDiscarded();
        closeQuietly(connection);
    }

    /**
     * Closes idle connections unused for longer than the idle timeout, keeping at least
     * {@code minSize} open connections.
     */
    void evictIdle() {
        List<GraphConnection> expired = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            long now = System.nanoTime();
            long timeout = config.getIdleTimeout().toNanos();
            Iterator<IdleConnection> it = idle.iterator();
            while (it.hasNext() && total > config.getMinSize()) {
                IdleConnection ic = it.next();
                if (now - ic.idleSince() >= timeout) {
                    it.remove();
                    total--;
                    totalEvicted++;
                    expired.add(ic.connection());
                }
            }
        } finally {
            lock.unlock();
        }
        if (!expired.isEmpty()) {
            log.debug("Evicting {} idle connection(s)", expired.size());
        }
        for (GraphConnection conn : expired) {
            metrics.incrementConnectionEvicted();
            closeQuietly(conn);
        }
    }

    @Override
    public PoolStats getStats() {
        lock.lock();
        try {
            return new PoolStats(
                    idle.size(),
                    total - idle.size(),
                    total,
                    waiters.size(),
                    totalCreated,
                    totalBorrowed,
                    totalTimeouts,
                    totalEvicted
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        List<GraphConnection> toClose = new ArrayList<>();
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (IdleConnection ic : idle) {
                toClose.add(ic.connection());
            }
            total -= idle.size();
            idle.clear();
            for (Waiter waiter : waiters) {
                waiter.poolClosed = true;
                waiter.condition.signal();
            }
            waiters.clear();
        } finally {
            lock.unlock();
        }

        log.info("Closing connection pool...");
        toClose.forEach(this::closeQuietly);
        if (evictor != null) {
            evictor.shutdownNow();
            try {
                if (!evictor.awaitTermination(1, TimeUnit.SECONDS)) {
                    log.warn("Idle evictor did not stop within 1s");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Connection pool closed");
    }

    private void closeQuietly(GraphConnection connection) {
        try {
            connection.close();
        } catch (Exception e) {
            log.warn("Error closing connection: {}", e.getMessage());
        }
    }

    private record IdleConnection(GraphConnection connection, long idleSince) {}

    private record Handoff(GraphConnection connection) {}

    private static final class Waiter {
        private final Condition condition;
        private GraphConnection connection;
        private boolean slotGranted;
        private boolean cancelled;
        private boolean poolClosed;

        private Waiter(Condition condition) {
            this.condition = condition;
        }

        private boolean isResolved() {
            return connection != null || slotGranted || cancelled || poolClosed;
        }
    }
}
