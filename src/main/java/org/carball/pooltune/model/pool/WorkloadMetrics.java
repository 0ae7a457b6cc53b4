package org.carball.pooltune.model.pool;

/**
 * Summary of recent load, submitted by the caller for each optimization request.
 *
 * @param avgConnections    average connections in use
 * @param peakConnections   peak connections in use
 * @param avgResponseTimeMs average query response time
 * @param errorRate         failed share of queries, 0..1
 * @param throughput        queries per second
 */
public record WorkloadMetrics(
        double avgConnections,
        int peakConnections,
        double avgResponseTimeMs,
        double errorRate,
        double throughput
) {
    public WorkloadMetrics {
        if (avgConnections < 0 || peakConnections < 0 || avgResponseTimeMs < 0
                || errorRate < 0 || throughput < 0) {
            throw new IllegalArgumentException("Workload metrics must not be negative: avgConnections="
                    + avgConnections + ", peakConnections=" + peakConnections
                    + ", avgResponseTimeMs=" + avgResponseTimeMs + ", errorRate=" + errorRate
                    + ", throughput=" + throughput);
        }
    }
}
