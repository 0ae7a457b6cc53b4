package org.carball.pooltune.model.query;

/**
 * @param errorRate    percent of failed queries
 * @param cacheHitRate percent of queries served from cache
 */
public record ReportSummary(
        long totalQueries,
        double averageExecutionTimeMs,
        long slowQueries,
        double errorRate,
        double cacheHitRate
) {}
