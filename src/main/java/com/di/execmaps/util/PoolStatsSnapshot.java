package com.di.execmaps.util;

/**
 * Snapshot of HikariCP pool statistics for a single shard pool.
 * Used for logging and in the shard health details.
 */
public record PoolStatsSnapshot(
    String poolName,
    int maxPoolSize,
    int minIdle,
    int activeConnections,
    int idleConnections,
    int totalConnections,
    int threadsAwaitingConnection
) {}
