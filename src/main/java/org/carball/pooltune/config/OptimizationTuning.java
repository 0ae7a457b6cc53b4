package org.carball.pooltune.config;

import lombok.Builder;
import lombok.Value;

/**
 * Constants behind the workload optimizer and its risk assessment.
 * <p>
 * The defaults are heuristics carried over from earlier releases for
 * behavioral compatibility. None of them is derived from measurement, so
 * deployments are expected to tune them.
 */
@Value
@Builder(toBuilder = true)
public class OptimizationTuning {

    // Utilization (avg connections / max connections)
    @Builder.Default
    double highUtilization = 0.8;

    @Builder.Default
    double lowUtilization = 0.2;

    @Builder.Default
    double growthFactor = 1.5;

    @Builder.Default
    double shrinkFactor = 0.7;

    // Share of the new maximum kept warm when peaks exceed the old maximum
    @Builder.Default
    double peakMinimumShare = 0.3;

    // Connection timeout tightening
    @Builder.Default
    double slowResponseMs = 200;

    @Builder.Default
    long timeoutTighteningFloorMs = 5_000;

    @Builder.Default
    double timeoutFactor = 0.8;

    @Builder.Default
    long minimumTimeoutMs = 3_000;

    // Retries
    @Builder.Default
    double retryErrorRate = 0.05;

    @Builder.Default
    int retryIncrement = 2;

    @Builder.Default
    int maxRetryAttempts = 15;

    @Builder.Default
    double retryDelayFactor = 1.5;

    // Projected gains
    @Builder.Default
    double throughputPerConnectionGrowth = 0.6;

    @Builder.Default
    double timeoutThroughputBonus = 0.1;

    @Builder.Default
    int maxGrowthLatencyGainMs = 15;

    @Builder.Default
    int minGrowthLatencyGainMs = 10;

    // Risk scoring
    @Builder.Default
    double riskyGrowthMultiple = 3.0;

    @Builder.Default
    int riskyGrowthScore = 30;

    @Builder.Default
    long riskyTimeoutMs = 2_000;

    @Builder.Default
    int riskyTimeoutScore = 20;

    @Builder.Default
    int productionScore = 20;

    @Builder.Default
    double highErrorRate = 0.15;

    @Builder.Default
    int highErrorRateScore = 25;

    @Builder.Default
    double overloadResponseMs = 1_000;

    @Builder.Default
    double overloadErrorRate = 0.10;

    @Builder.Default
    int overloadScore = 30;

    @Builder.Default
    int highRiskScore = 50;

    @Builder.Default
    int mediumRiskScore = 20;

    public static OptimizationTuning defaults() {
        return OptimizationTuning.builder().build();
    }
}
