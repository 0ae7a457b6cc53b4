package org.carball.pooltune.model.query;

import java.time.Instant;
import java.util.List;

/**
 * Aggregate statistics for one query pattern.
 *
 * @param successRate percent of successful executions
 * @param frequency   executions within the trailing minute
 */
public record QueryStats(
        String queryPattern,
        QueryType type,
        long totalExecutions,
        double averageExecutionTimeMs,
        long minExecutionTimeMs,
        long maxExecutionTimeMs,
        long totalRowsAffected,
        double averageRowsAffected,
        double successRate,
        long errorCount,
        Instant lastExecuted,
        int frequency,
        PerformanceLevel performanceLevel,
        List<String> optimizationSuggestions
) {
    public QueryStats {
        optimizationSuggestions = List.copyOf(optimizationSuggestions);
    }

    /**
     * Failed share of executions in percent.
     */
    public double errorRate() {
        return totalExecutions > 0 ? (errorCount * 100.0) / totalExecutions : 0.0;
    }
}
