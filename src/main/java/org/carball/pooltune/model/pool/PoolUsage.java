package org.carball.pooltune.model.pool;

public record PoolUsage(
        int totalConnections,
        int activeConnections,
        int idleConnections,
        double utilizationRate
) {
    public static final PoolUsage EMPTY = new PoolUsage(0, 0, 0, 0.0);

    public static PoolUsage of(PoolMetricsSample sample) {
        return new PoolUsage(sample.totalConnections(), sample.activeConnections(),
                sample.idleConnections(), sample.utilization());
    }
}
