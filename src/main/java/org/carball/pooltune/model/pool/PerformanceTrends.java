package org.carball.pooltune.model.pool;

import java.util.List;

/**
 * Time series derived from the pool metrics history.
 */
public record PerformanceTrends(
        List<TrendPoint> connectionUtilization,
        List<TrendPoint> responseTime,
        List<TrendPoint> errorRate
) {}
