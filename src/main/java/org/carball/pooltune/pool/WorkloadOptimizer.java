package org.carball.pooltune.pool;

import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.config.OptimizationTuning;
import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.config.PoolEnvironment;
import org.carball.pooltune.model.pool.OptimizationResult;
import org.carball.pooltune.model.pool.PerformanceGain;
import org.carball.pooltune.model.pool.RiskAssessment;
import org.carball.pooltune.model.pool.WorkloadMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Derives a recommended pool configuration from observed workload.
 * Pure computation; nothing is committed here.
 */
@Slf4j
public class WorkloadOptimizer {

    private final OptimizationTuning tuning;
    private final RiskAssessor riskAssessor;

    public WorkloadOptimizer(OptimizationTuning tuning) {
        this.tuning = tuning;
        this.riskAssessor = new RiskAssessor(tuning);
    }

    public OptimizationResult optimize(PoolConfiguration current, WorkloadMetrics metrics,
                                       PoolEnvironment environment, Instant now) {
        PoolConfiguration.PoolConfigurationBuilder recommended = current.toBuilder();
        List<String> improvements = new ArrayList<>();

        int maxConnections = current.getMaxConnections();
        int minConnections = current.getMinConnections();
        double utilization = maxConnections > 0 ? metrics.avgConnections() / maxConnections : 0.0;

        if (utilization >= tuning.getHighUtilization()) {
            int grown = Math.min((int) Math.ceil(maxConnections * tuning.getGrowthFactor()),
                    environment.getScalingCeiling());
            if (grown > maxConnections) {
                recommended.maxConnections(grown);
                improvements.add(String.format("Increased max connections from %d to %d (utilization %.0f%%)",
                        maxConnections, grown, utilization * 100));
                if (metrics.peakConnections() > maxConnections) {
                    int newMin = (int) Math.ceil(grown * tuning.getPeakMinimumShare());
                    if (newMin != minConnections) {
                        recommended.minConnections(newMin);
                        improvements.add("Adjusted min connections from " + minConnections + " to " + newMin
                                + " to absorb peaks of " + metrics.peakConnections());
                    }
                }
            } else {
                log.debug("High utilization but {} pool is already at its scaling ceiling of {}",
                        environment.getName(), environment.getScalingCeiling());
            }
        } else if (utilization < tuning.getLowUtilization() && maxConnections > environment.getBaseMaxConnections()) {
            int shrunk = Math.max((int) Math.ceil(maxConnections * tuning.getShrinkFactor()),
                    Math.max(environment.getBaseMaxConnections(), minConnections + 1));
            if (shrunk < maxConnections) {
                recommended.maxConnections(shrunk);
                improvements.add(String.format("Reduced max connections from %d to %d (utilization %.0f%%)",
                        maxConnections, shrunk, utilization * 100));
            }
        }

        long timeout = current.getConnectionTimeoutMs();
        if (metrics.avgResponseTimeMs() > tuning.getSlowResponseMs() && timeout > tuning.getTimeoutTighteningFloorMs()) {
            long tightened = Math.max(Math.round(timeout * tuning.getTimeoutFactor()), tuning.getMinimumTimeoutMs());
            if (tightened < timeout) {
                recommended.connectionTimeoutMs(tightened);
                improvements.add("Reduced connection timeout from " + timeout + "ms to " + tightened
                        + "ms to fail fast under slow responses");
            }
        }

        if (metrics.errorRate() > tuning.getRetryErrorRate()) {
            int retries = Math.min(current.getRetryAttempts() + tuning.getRetryIncrement(), tuning.getMaxRetryAttempts());
            long delay = Math.round(current.getRetryDelayMs() * tuning.getRetryDelayFactor());
            recommended.retryAttempts(retries).retryDelayMs(delay);
            improvements.add(String.format("Increased retries from %d to %d with %dms delay (error rate %.1f%%)",
                    current.getRetryAttempts(), retries, delay, metrics.errorRate() * 100));
        }

        PoolConfiguration proposal = recommended.build();
        PerformanceGain gain = projectGain(current, proposal);
        RiskAssessment risk = riskAssessor.assess(current, proposal, metrics, environment);

        log.info("Optimization for {}: {} improvements, risk {} ({})", environment.getName(),
                improvements.size(), risk.level().toJson(), risk.score());

        return new OptimizationResult(environment, current, proposal, improvements, gain, risk, now);
    }

    PerformanceGain projectGain(PoolConfiguration current, PoolConfiguration proposal) {
        double throughput = 0.0;
        int latency = 0;

        if (proposal.getMaxConnections() > current.getMaxConnections()) {
            double relativeGrowth = (double) (proposal.getMaxConnections() - current.getMaxConnections())
                    / current.getMaxConnections();
            throughput += tuning.getThroughputPerConnectionGrowth() * relativeGrowth;
            latency += tuning.getMaxGrowthLatencyGainMs();
        }
        if (proposal.getConnectionTimeoutMs() < current.getConnectionTimeoutMs()) {
            throughput += tuning.getTimeoutThroughputBonus();
        }
        if (proposal.getMinConnections() > current.getMinConnections()) {
            latency += tuning.getMinGrowthLatencyGainMs();
        }

        int currentSize = current.getMaxConnections() + current.getMinConnections();
        int proposedSize = proposal.getMaxConnections() + proposal.getMinConnections();
        double resourceChange = currentSize > 0 ? (proposedSize - currentSize) * 100.0 / currentSize : 0.0;

        return new PerformanceGain((int) Math.round(throughput * 100), latency, resourceChange);
    }
}
