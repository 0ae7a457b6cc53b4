package org.carball.pooltune.pool;

import org.carball.pooltune.config.OptimizationTuning;
import org.carball.pooltune.config.PoolConfiguration;
import org.carball.pooltune.config.PoolEnvironment;
import org.carball.pooltune.model.pool.RiskAssessment;
import org.carball.pooltune.model.pool.RiskLevel;
import org.carball.pooltune.model.pool.WorkloadMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores how risky it is to move from one pool configuration to another.
 * Each rule adds to the score and contributes one factor.
 */
public class RiskAssessor {

    private final OptimizationTuning tuning;

    public RiskAssessor(OptimizationTuning tuning) {
        this.tuning = tuning;
    }

    public RiskAssessment assess(PoolConfiguration current, PoolConfiguration recommended,
                                 WorkloadMetrics metrics, PoolEnvironment environment) {
        int score = 0;
        List<String> factors = new ArrayList<>();

        if (recommended.getMaxConnections() > current.getMaxConnections() * tuning.getRiskyGrowthMultiple()) {
            score += tuning.getRiskyGrowthScore();
            factors.add("Large increase in max connections (" + current.getMaxConnections()
                    + " -> " + recommended.getMaxConnections() + ")");
        }

        if (recommended.getConnectionTimeoutMs() < tuning.getRiskyTimeoutMs()) {
            score += tuning.getRiskyTimeoutScore();
            factors.add("Very short connection timeout (" + recommended.getConnectionTimeoutMs() + "ms)");
        }

        if (environment.isProductionLike() && score > 0) {
            score += tuning.getProductionScore();
            factors.add("Change targets a " + environment.getName() + " environment");
        }

        if (metrics.errorRate() > tuning.getHighErrorRate()) {
            score += tuning.getHighErrorRateScore();
            factors.add(String.format("High current error rate (%.1f%%)", metrics.errorRate() * 100));
        }

        if (metrics.avgResponseTimeMs() > tuning.getOverloadResponseMs()
                || metrics.errorRate() > tuning.getOverloadErrorRate()) {
            score += tuning.getOverloadScore();
            factors.add("System is under stress (avg response " + Math.round(metrics.avgResponseTimeMs())
                    + "ms, error rate " + String.format("%.1f%%", metrics.errorRate() * 100) + ")");
        }

        return new RiskAssessment(levelFor(score), score, factors);
    }

    RiskLevel levelFor(int score) {
        if (score > tuning.getHighRiskScore()) return RiskLevel.HIGH;
        if (score > tuning.getMediumRiskScore()) return RiskLevel.MEDIUM;
        return RiskLevel.LOW;
    }
}
