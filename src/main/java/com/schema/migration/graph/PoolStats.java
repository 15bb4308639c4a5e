package com.schema.migration.graph;

/**
 * Point-in-time statistics for a {@link GraphConnectionPool}.
 * All fields are read under the pool lock, so {@code available + inUse == total} holds.
 *
 * @param available     idle connections ready to be borrowed
 * @param inUse         connections currently borrowed (or being opened)
 * @param total         total number of managed connections
 * @param waiting       callers blocked waiting for a connection
 * @param totalCreated  cumulative connection creation count
 * @param totalBorrowed cumulative successful borrow count
 * @param totalTimeouts cumulative count of borrows that timed out
 * @param totalEvicted  cumulative count of idle connections closed by the evictor
 */
public record PoolStats(
        int available,
        int inUse,
        int total,
        int waiting,
        long totalCreated,
        long totalBorrowed,
        long totalTimeouts,
        long totalEvicted
) {
}
