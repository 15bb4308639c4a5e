package com.schema.migration.graph;

import com.schema.migration.support.InMemoryGraphStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionPoolTest {

    private InMemoryGraphStore store;
    private ExecutorService executor;
    private SimpleGraphConnectionPool pool;

    @BeforeEach
    void setUp() {
        store = InMemoryGraphStore.withDatabase("db");
        executor = Executors.newFixedThreadPool(8);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        if (pool != null) {
            pool.close();
        }
    }

    private static PoolConfig.Builder config(int minSize, int maxSize) {
        return PoolConfig.builder()
                .minSize(minSize)
                .maxSize(maxSize)
                .idleTimeout(Duration.ZERO)
                .waitTimeout(Duration.ofSeconds(5));
    }

    private SimpleGraphConnectionPool newPool(PoolConfig config) {
        pool = new SimpleGraphConnectionPool(config, store::connect);
        return pool;
    }

    private static void awaitWaiting(GraphConnectionPool pool, int waiting) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (pool.getStats().waiting() < waiting) {
            if (System.nanoTime() > deadline) {
                fail("Expected " + waiting + " waiter(s) but stats were " + pool.getStats());
            }
            Thread.sleep(5);
        }
    }

    // ========== PoolConfig Tests ==========

    @Nested
    @DisplayName("PoolConfig")
    class Config {

        @Test
        @DisplayName("Should create pool config with defaults")
        void defaults() {
            PoolConfig config = PoolConfig.defaults();
            assertEquals(2, config.getMinSize());
            assertEquals(10, config.getMaxSize());
            assertEquals(Duration.ofMinutes(5), config.getIdleTimeout());
            assertEquals(Duration.ofSeconds(10), config.getWaitTimeout());
            assertEquals(Duration.ofMinutes(5).dividedBy(2), config.getEvictionInterval());
            assertTrue(config.isTestOnBorrow());
            assertTrue(config.isBounded());
        }

        @Test
        @DisplayName("Should reject invalid sizes and durations")
        void validation() {
            assertThrows(IllegalArgumentException.class, () -> PoolConfig.builder().minSize(5).maxSize(2).build());
            assertThrows(IllegalArgumentException.class, () -> PoolConfig.builder().minSize(-1));
            assertThrows(IllegalArgumentException.class, () -> PoolConfig.builder().waitTimeout(Duration.ofMillis(-1)));
            assertThrows(IllegalArgumentException.class, () -> PoolConfig.builder().evictionInterval(Duration.ZERO));
        }

        @Test
        @DisplayName("A max size of zero means unbounded")
        void unbounded() {
            PoolConfig config = PoolConfig.builder().minSize(50).maxSize(0).build();
            assertFalse(config.isBounded());
        }
    }

    // ========== Borrow / Release Tests ==========

    @Nested
    @DisplayName("Borrow and release")
    class BorrowRelease {

        @Test
        @DisplayName("Should pre-warm minSize connections")
        void prewarm() {
            newPool(config(2, 5).build());

            PoolStats stats = pool.getStats();
            assertEquals(2, stats.available());
            assertEquals(2, stats.total());
            assertEquals(2, stats.totalCreated());
            assertEquals(2, store.openConnections());
        }

        @Test
        @DisplayName("A failed pre-warm should close what it opened")
        void prewarmAllOrNothing() {
            AtomicInteger attempts = new AtomicInteger();
            GraphConnectionFactory factory = () -> {
                if (attempts.incrementAndGet() == 3) {
                    throw new GraphStoreException("connection refused");
                }
                return store.connect();
            };

            PoolException e = assertThrows(PoolException.class,
                    () -> new SimpleGraphConnectionPool(config(3, 5).build(), factory));

            assertEquals(PoolException.Reason.CREATE_FAILED, e.getReason());
            assertEquals(0, store.openConnections());
        }

        @Test
        @DisplayName("Should reuse released connections")
        void reuse() {
            newPool(config(0, 5).build());

            GraphConnection first = pool.borrow();
            pool.release(first);
            GraphConnection second = pool.borrow();

            assertSame(first, second);
            assertEquals(1, pool.getStats().totalCreated());
            assertEquals(2, pool.getStats().totalBorrowed());
        }

        @Test
        @DisplayName("Should grow on demand up to maxSize")
        void grows() {
            newPool(config(1, 3).build());

            List<GraphConnection> borrowed = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                borrowed.add(pool.borrow());
            }

            PoolStats stats = pool.getStats();
            assertEquals(3, stats.total());
            assertEquals(3, stats.inUse());
            assertEquals(0, stats.available());
            borrowed.forEach(pool::release);
            assertEquals(3, pool.getStats().available());
        }

        @Test
        @DisplayName("An unbounded pool never waits")
        void unboundedPool() {
            newPool(config(0, 0).build());

            for (int i = 0; i < 20; i++) {
                pool.borrow();
            }

            assertEquals(20, pool.getStats().inUse());
        }

        @Test
        @DisplayName("Should ignore connections it did not lend")
        void foreignRelease() {
            newPool(config(1, 2).build());
            InMemoryGraphStore.InMemoryConnection foreign = store.connect();

            pool.release(foreign);
            pool.release(null);

            assertEquals(1, pool.getStats().total());
            assertTrue(foreign.isOpen());
        }

        @Test
        @DisplayName("A failed connection open should free its slot")
        void createFailureFreesSlot() {
            AtomicInteger attempts = new AtomicInteger();
            pool = new SimpleGraphConnectionPool(config(0, 1).build(), () -> {
                if (attempts.incrementAndGet() == 1) {
                    throw new GraphStoreException("connection refused");
                }
                return store.connect();
            });

            PoolException e = assertThrows(PoolException.class, () -> pool.borrow());
            assertEquals(PoolException.Reason.CREATE_FAILED, e.getReason());
            assertEquals(0, pool.getStats().total());

            assertNotNull(pool.borrow());
        }
    }

    // ========== Waiting Tests ==========

    @Nested
    @DisplayName("Waiting for a connection")
    class Waiting {

        @Test
        @DisplayName("Should time out after the wait timeout without leaking a slot")
        void timeout() {
            Duration waitTimeout = Duration.ofMillis(200);
            newPool(config(0, 2).waitTimeout(waitTimeout).build());
            GraphConnection a = pool.borrow();
            GraphConnection b = pool.borrow();

            long start = System.nanoTime();
            PoolException e = assertThrows(PoolException.class, () -> pool.borrow());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertEquals(PoolException.Reason.TIMEOUT, e.getReason());
            assertTrue(elapsed.compareTo(waitTimeout) >= 0, "gave up early after " + elapsed);
            assertTrue(elapsed.compareTo(waitTimeout.plusSeconds(2)) < 0, "waited too long: " + elapsed);
            assertTrue(e.isRetryable());
            PoolStats stats = pool.getStats();
            assertEquals(2, stats.total());
            assertEquals(0, stats.waiting());
            assertEquals(1, stats.totalTimeouts());

            pool.release(a);
            pool.release(b);
            assertEquals(2, pool.getStats().available());
        }

        @Test
        @DisplayName("Should hand released connections to waiters in arrival order")
        void fifoHandoff() throws Exception {
            newPool(config(0, 1).build());
            GraphConnection held = pool.borrow();

            Future<GraphConnection> first = executor.submit(() -> pool.borrow());
            awaitWaiting(pool, 1);
            Future<GraphConnection> second = executor.submit(() -> pool.borrow());
            awaitWaiting(pool, 2);

            pool.release(held);
            GraphConnection firstGot = first.get(5, TimeUnit.SECONDS);
            assertSame(held, firstGot);
            assertFalse(second.isDone());

            pool.release(firstGot);
            assertSame(held, second.get(5, TimeUnit.SECONDS));
            assertEquals(1, pool.getStats().totalCreated());
        }

        @Test
        @DisplayName("Should give up when the caller cancels")
        void cancelWhileWaiting() throws Exception {
            newPool(config(0, 1).waitTimeout(Duration.ZERO).build());
            GraphConnection held = pool.borrow();
            CancellationToken token = CancellationToken.create();

            Future<GraphConnection> waiting = executor.submit(() -> pool.borrow(token));
            awaitWaiting(pool, 1);
            token.cancel();

            ExecutionException e = assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
            PoolException cause = assertInstanceOf(PoolException.class, e.getCause());
            assertEquals(PoolException.Reason.CANCELLED, cause.getReason());
            assertEquals(0, pool.getStats().waiting());

            pool.release(held);
            assertEquals(1, pool.getStats().available());
        }

        @Test
        @DisplayName("Should refuse a borrow with an already cancelled token")
        void cancelledBeforeBorrow() {
            newPool(config(1, 1).build());
            CancellationToken token = CancellationToken.create();
            token.cancel();

            PoolException e = assertThrows(PoolException.class, () -> pool.borrow(token));

            assertEquals(PoolException.Reason.CANCELLED, e.getReason());
            assertEquals(1, pool.getStats().available());
        }

        @Test
        @DisplayName("Closing the pool should wake waiters")
        void closeWakesWaiters() throws Exception {
            newPool(config(0, 1).build());
            pool.borrow();

            Future<GraphConnection> waiting = executor.submit(() -> pool.borrow());
            awaitWaiting(pool, 1);
            pool.close();

            ExecutionException e = assertThrows(ExecutionException.class, () -> waiting.get(5, TimeUnit.SECONDS));
            PoolException cause = assertInstanceOf(PoolException.class, e.getCause());
            assertEquals(PoolException.Reason.CLOSED, cause.getReason());
            assertFalse(cause.isRetryable());
        }

        @Test
        @DisplayName("Statistics should stay consistent under concurrent use")
        void concurrentBorrowers() throws Exception {
            newPool(config(0, 3).build());
            List<Future<Integer>> futures = new ArrayList<>();

            for (int t = 0; t < 8; t++) {
                futures.add(executor.submit(() -> {
                    int maxTotal = 0;
                    for (int i = 0; i < 50; i++) {
                        GraphConnection conn = pool.borrow();
                        try {
                            maxTotal = Math.max(maxTotal, pool.getStats().total());
                        } finally {
                            pool.release(conn);
                        }
                    }
                    return maxTotal;
                }));
            }

            for (Future<Integer> future : futures) {
                assertTrue(future.get(30, TimeUnit.SECONDS) <= 3);
            }
            PoolStats stats = pool.getStats();
            assertEquals(0, stats.inUse());
            assertEquals(stats.total(), stats.available());
            assertEquals(400, stats.totalBorrowed());
            assertTrue(stats.totalCreated() <= 3);
        }
    }

    // ========== Health and Eviction Tests ==========

    @Nested
    @DisplayName("Health and eviction")
    class Health {

        @Test
        @DisplayName("Should discard a connection released broken")
        void brokenOnRelease() {
            newPool(config(0, 2).build());
            InMemoryGraphStore.InMemoryConnection conn = (InMemoryGraphStore.InMemoryConnection) pool.borrow();

            conn.breakConnection();
            pool.release(conn);

            assertEquals(0, pool.getStats().total());
        }

        @Test
        @DisplayName("Should replace an idle connection that broke")
        void brokenWhileIdle() {
            newPool(config(0, 2).build());
            InMemoryGraphStore.InMemoryConnection conn = (InMemoryGraphStore.InMemoryConnection) pool.borrow();
            pool.release(conn);
            conn.breakConnection();

            GraphConnection replacement = pool.borrow();

            assertNotSame(conn, replacement);
            assertTrue(replacement.isOpen());
            assertEquals(1, pool.getStats().total());
            assertEquals(2, pool.getStats().totalCreated());
        }

        @Test
        @DisplayName("Eviction should close idle connections but keep minSize")
        void evictIdle() throws Exception {
            newPool(config(1, 5)
                    .idleTimeout(Duration.ofMillis(1))
                    .evictionInterval(Duration.ofHours(1))
                    .build());
            List<GraphConnection> borrowed = List.of(pool.borrow(), pool.borrow(), pool.borrow());
            borrowed.forEach(pool::release);
            Thread.sleep(20);

            pool.evictIdle();

            PoolStats stats = pool.getStats();
            assertEquals(1, stats.total());
            assertEquals(2, stats.totalEvicted());
            assertEquals(1, store.openConnections());
        }

        @Test
        @DisplayName("Closing should close idle connections and those released later")
        void close() {
            newPool(config(2, 3).build());
            GraphConnection borrowed = pool.borrow();

            pool.close();
            assertEquals(1, store.openConnections());
            assertTrue(pool.isClosed());
            assertThrows(PoolException.class, () -> pool.borrow());

            pool.release(borrowed);
            assertEquals(0, store.openConnections());
            assertEquals(0, pool.getStats().total());
        }
    }

    // ========== PooledGraphConnection Tests ==========

    @Nested
    @DisplayName("PooledGraphConnection")
    class Pooled {

        private Database database;

        @BeforeEach
        void setUpDatabase() {
            newPool(config(1, 2).build());
            database = Database.pooled(pool, "db");
            database.executeSchema(CancellationToken.none(), "define attribute email, value string; entity user, owns email;");
        }

        @Test
        @DisplayName("Should borrow per transaction and release after commit")
        void releasesAfterCommit() {
            database.executeWrite(CancellationToken.none(), "insert $u isa user, has email \"a@b\";");

            PoolStats stats = pool.getStats();
            assertEquals(0, stats.inUse());
            assertEquals(2, stats.totalBorrowed());
        }

        @Test
        @DisplayName("Should release after a failed statement")
        void releasesAfterFailure() {
            assertThrows(GraphStoreException.class,
                    () -> database.executeWrite(CancellationToken.none(), "insert $u isa person;"));

            assertEquals(0, pool.getStats().inUse());
        }

        @Test
        @DisplayName("Schema and admin calls should release their connection")
        void adminCalls() {
            assertFalse(database.schema(CancellationToken.none()).isEmpty());
            assertTrue(database.getConnection().containsDatabase("db"));

            assertEquals(0, pool.getStats().inUse());
        }

        @Test
        @DisplayName("Closing the database handle should leave the pool open")
        void closingHandle() {
            database.close();
            assertFalse(pool.isClosed());
            assertTrue(database.getConnection().isOpen());
        }

        @Test
        @DisplayName("ensureDatabase should stop waiting for a connection once cancelled")
        void ensureDatabaseCancelledWhileWaiting() throws Exception {
            pool.close();
            newPool(config(1, 1).waitTimeout(Duration.ofSeconds(10)).build());
            Database other = Database.pooled(pool, "other");
            GraphConnection held = pool.borrow();
            CancellationToken token = CancellationToken.create();

            Future<Boolean> ensure = executor.submit(() -> other.ensureDatabase(token));
            awaitWaiting(pool, 1);
            long start = System.nanoTime();
            token.cancel();

            ExecutionException e = assertThrows(ExecutionException.class, () -> ensure.get(5, TimeUnit.SECONDS));
            PoolException cause = assertInstanceOf(PoolException.class, e.getCause());
            assertEquals(PoolException.Reason.CANCELLED, cause.getReason());
            assertTrue(Duration.ofNanos(System.nanoTime() - start).compareTo(Duration.ofSeconds(2)) < 0);
            assertEquals(0, pool.getStats().totalTimeouts());

            pool.release(held);
            assertFalse(other.getConnection().containsDatabase("other"));
            assertEquals(0, pool.getStats().inUse());
        }

        @Test
        @DisplayName("begin should stop waiting for a connection once cancelled")
        void beginCancelledWhileWaiting() throws Exception {
            pool.close();
            newPool(config(1, 1).waitTimeout(Duration.ofSeconds(10)).build());
            Database single = Database.pooled(pool, "db");
            GraphConnection held = pool.borrow();
            CancellationToken token = CancellationToken.create();

            Future<TransactionContext> begin = executor.submit(() -> single.begin(token, TransactionType.READ));
            awaitWaiting(pool, 1);
            token.cancel();

            ExecutionException e = assertThrows(ExecutionException.class, () -> begin.get(5, TimeUnit.SECONDS));
            PoolException cause = assertInstanceOf(PoolException.class, e.getCause());
            assertEquals(PoolException.Reason.CANCELLED, cause.getReason());

            pool.release(held);
            assertEquals(1, pool.getStats().available());
        }

        @Test
        @DisplayName("Admin calls should refuse an already cancelled token without borrowing")
        void adminCallsCancelled() {
            CancellationToken token = CancellationToken.create();
            token.cancel();
            GraphConnection connection = database.getConnection();
            long borrowed = pool.getStats().totalBorrowed();

            assertThrows(OperationCancelledException.class, () -> connection.containsDatabase("db", token));
            assertThrows(OperationCancelledException.class, () -> connection.createDatabase("other", token));
            assertThrows(OperationCancelledException.class, () -> connection.deleteDatabase("db", token));
            assertThrows(OperationCancelledException.class, () -> connection.databases(token));
            assertThrows(OperationCancelledException.class, () -> database.begin(token, TransactionType.READ));
            assertEquals(borrowed, pool.getStats().totalBorrowed());
        }

        @Test
        @DisplayName("A cancelled token should not borrow")
        void cancelled() {
            CancellationToken token = CancellationToken.create();
            token.cancel();

            assertThrows(OperationCancelledException.class, () -> database.executeRead(token,
                    "match $u isa user; reduce $count = count($u);"));
            assertEquals(1, pool.getStats().totalBorrowed());
        }
    }
}
