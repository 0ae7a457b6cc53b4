package org.carball.pooltune.hikari;

import com.zaxxer.hikari.HikariPoolMXBean;
import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.model.pool.PoolMetricsSample;
import org.carball.pooltune.model.pool.WorkloadMetrics;
import org.carball.pooltune.model.query.QueryStats;
import org.carball.pooltune.monitor.QueryMonitor;
import org.carball.pooltune.pool.PoolConfigurationManager;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Samples a running Hikari pool together with the query monitor's aggregates,
 * feeds the samples to the configuration manager and condenses them into
 * workload metrics for optimization.
 */
@Slf4j
public class HikariPoolObserver {

    private final HikariPoolMXBean pool;
    private final QueryMonitor queryMonitor;
    private final PoolConfigurationManager manager;
    private final Clock clock;

    // Accumulated since the last workload snapshot
    private long observations;
    private long activeConnectionSum;
    private int peakActiveConnections;
    private long queriesAtWindowStart;
    private long errorsAtWindowStart;
    private Instant windowStart;

    public HikariPoolObserver(HikariPoolMXBean pool, QueryMonitor queryMonitor,
                              PoolConfigurationManager manager, Clock clock) {
        this.pool = pool;
        this.queryMonitor = queryMonitor;
        this.manager = manager;
        this.clock = clock;
        resetWindow(aggregate(queryMonitor.getQueryStats()));
    }

    /**
     * Takes one sample and records it with the configuration manager.
     */
    public synchronized PoolMetricsSample observe() {
        QueryTotals totals = aggregate(queryMonitor.getQueryStats());
        PoolMetricsSample sample = new PoolMetricsSample(
                pool.getTotalConnections(),
                pool.getActiveConnections(),
                pool.getIdleConnections(),
                totals.errors(),
                totals.queries(),
                totals.averageTimeMs(),
                clock.instant());

        observations++;
        activeConnectionSum += sample.activeConnections();
        peakActiveConnections = Math.max(peakActiveConnections, sample.activeConnections());

        if (pool.getThreadsAwaitingConnection() > 0) {
            log.debug("{} threads waiting for a connection", pool.getThreadsAwaitingConnection());
        }
        manager.updateMetrics(sample);
        return sample;
    }

    /**
     * Summarizes the observations since the previous call and starts a new window.
     */
    public synchronized WorkloadMetrics snapshotWorkload() {
        QueryTotals totals = aggregate(queryMonitor.getQueryStats());
        long queries = Math.max(0, totals.queries() - queriesAtWindowStart);
        long errors = Math.max(0, totals.errors() - errorsAtWindowStart);
        double seconds = Math.max(1.0, Duration.between(windowStart, clock.instant()).toMillis() / 1000.0);

        WorkloadMetrics metrics = new WorkloadMetrics(
                observations > 0 ? (double) activeConnectionSum / observations : 0.0,
                peakActiveConnections,
                totals.averageTimeMs(),
                queries > 0 ? Math.min(1.0, (double) errors / queries) : 0.0,
                queries / seconds);

        resetWindow(totals);
        return metrics;
    }

    private void resetWindow(QueryTotals totals) {
        observations = 0;
        activeConnectionSum = 0;
        peakActiveConnections = 0;
        queriesAtWindowStart = totals.queries();
        errorsAtWindowStart = totals.errors();
        windowStart = clock.instant();
    }

    private static QueryTotals aggregate(List<QueryStats> stats) {
        long queries = 0;
        long errors = 0;
        double weightedTime = 0.0;
        for (QueryStats stat : stats) {
            queries += stat.totalExecutions();
            errors += stat.errorCount();
            weightedTime += stat.averageExecutionTimeMs() * stat.totalExecutions();
        }
        return new QueryTotals(queries, errors, queries > 0 ? weightedTime / queries : 0.0);
    }

    private record QueryTotals(long queries, long errors, double averageTimeMs) {}
}
