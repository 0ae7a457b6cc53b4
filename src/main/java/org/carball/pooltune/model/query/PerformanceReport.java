package org.carball.pooltune.model.query;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of query performance over a time window.
 */
public record PerformanceReport(
        Instant generatedAt,
        ReportPeriod period,
        ReportSummary summary,
        Map<QueryType, QueryTypeSummary> queryTypeStats,
        List<SlowQueryRecord> topSlowQueries,
        List<String> optimizationRecommendations,
        List<IndexRecommendation> indexRecommendations
) {}
