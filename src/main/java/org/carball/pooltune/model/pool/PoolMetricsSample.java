package org.carball.pooltune.model.pool;

import java.time.Instant;

/**
 * Point-in-time snapshot of a connection pool, submitted by a pool observer.
 */
public record PoolMetricsSample(
        int totalConnections,
        int activeConnections,
        int idleConnections,
        long errorCount,
        long totalQueries,
        double avgResponseTimeMs,
        Instant timestamp
) {

    public PoolMetricsSample withTimestamp(Instant newTimestamp) {
        return new PoolMetricsSample(totalConnections, activeConnections, idleConnections,
                errorCount, totalQueries, avgResponseTimeMs, newTimestamp);
    }

    /**
     * Active share of the open connections, 0 when the pool is empty.
     */
    public double utilization() {
        return totalConnections > 0 ? (double) activeConnections / totalConnections : 0.0;
    }

    /**
     * Failed share of queries; an idle pool counts as one query to avoid division by zero.
     */
    public double errorRate() {
        return (double) errorCount / Math.max(totalQueries, 1);
    }
}
