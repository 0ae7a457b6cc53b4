package org.carball.pooltune.model.pool;

import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.config.PoolEnvironment;

import java.time.Instant;
import java.util.List;

/**
 * A workload optimization proposal. Never persisted; it is either applied or discarded.
 */
public record OptimizationResult(
        PoolEnvironment environment,
        PoolConfiguration currentConfig,
        PoolConfiguration recommendedConfig,
        List<String> improvements,
        PerformanceGain performanceGain,
        RiskAssessment riskAssessment,
        Instant generatedAt
) {
    public OptimizationResult {
        improvements = List.copyOf(improvements);
    }

    public boolean hasChanges() {
        return !currentConfig.equals(recommendedConfig);
    }
}
