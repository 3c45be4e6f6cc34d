package com.askdb.pool;

/**
 * Point-in-time view of one tenant pool.
 */
public record PoolStats(
        String tenantId,
        int totalConnections,
        int activeConnections,
        int idleConnections,
        int threadsAwaitingConnection
) {
}
