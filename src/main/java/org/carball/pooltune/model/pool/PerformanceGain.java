package org.carball.pooltune.model.pool;

/**
 * Projected effect of a recommended configuration.
 *
 * @param expectedThroughputIncrease percent, rounded to an integer
 * @param expectedLatencyDecreaseMs  additive latency estimate
 * @param resourceUtilizationChange  percent change of max + min connections
 */
public record PerformanceGain(
        int expectedThroughputIncrease,
        int expectedLatencyDecreaseMs,
        double resourceUtilizationChange
) {}
