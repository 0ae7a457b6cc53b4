package org.carball.pooltune.monitor;

import org.carball.pooltune.config.PerformanceThresholds;
import org.carball.pooltune.model.query.IndexRecommendation;
import org.carball.pooltune.model.query.PerformanceReport;
import org.carball.pooltune.model.query.QueryRecord;
import org.carball.pooltune.model.query.QueryType;
import org.carball.pooltune.model.query.QueryTypeSummary;
import org.carball.pooltune.model.query.ReportPeriod;
import org.carball.pooltune.model.query.ReportSummary;
import org.carball.pooltune.model.query.SlowQueryRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Aggregates the records of a time window into a {@link PerformanceReport}.
 */
class PerformanceReportBuilder {

    static final double BROAD_SLOWNESS_SHARE = 0.10;
    static final double READ_HEAVY_SHARE = 0.80;
    static final int IMPROVEMENT_PER_SLOW_QUERY = 15;
    static final int MAX_ESTIMATED_IMPROVEMENT = 95;
    static final int DEFAULT_ESTIMATED_IMPROVEMENT = 50;

    private final PerformanceThresholds thresholds;
    private final int topSlowQueryCount;

    PerformanceReportBuilder(PerformanceThresholds thresholds, int topSlowQueryCount) {
        this.thresholds = thresholds;
        this.topSlowQueryCount = topSlowQueryCount;
    }

    PerformanceReport build(List<QueryRecord> records, List<SlowQueryRecord> slowQueries,
                            Instant start, Instant end, int periodMinutes) {
        ReportSummary summary = summarize(records);
        Map<QueryType, QueryTypeSummary> byType = summarizeByType(records);

        List<SlowQueryRecord> topSlow = slowQueries.stream()
                .sorted(Comparator.comparingLong(SlowQueryRecord::executionTimeMs).reversed())
                .limit(topSlowQueryCount)
                .collect(Collectors.toList());

        return new PerformanceReport(
                end,
                new ReportPeriod(start, end, periodMinutes),
                summary,
                byType,
                topSlow,
                buildRecommendations(records, summary),
                buildIndexRecommendations(topSlow)
        );
    }

    private ReportSummary summarize(List<QueryRecord> records) {
        if (records.isEmpty()) {
            return new ReportSummary(0, 0.0, 0, 0.0, 0.0);
        }
        long total = records.size();
        long totalTime = 0;
        long slow = 0;
        long failed = 0;
        long cacheHits = 0;

        for (QueryRecord record : records) {
            totalTime += record.getExecutionTimeMs();
            if (record.getPerformanceLevel().isSlow()) slow++;
            if (!record.isSuccess()) failed++;
            if (record.servedFromCache()) cacheHits++;
        }

        return new ReportSummary(
                total,
                (double) totalTime / total,
                slow,
                (failed * 100.0) / total,
                (cacheHits * 100.0) / total
        );
    }

    private Map<QueryType, QueryTypeSummary> summarizeByType(List<QueryRecord> records) {
        Map<QueryType, List<QueryRecord>> grouped = records.stream()
                .collect(Collectors.groupingBy(QueryRecord::getType, () -> new EnumMap<>(QueryType.class),
                        Collectors.toList()));

        Map<QueryType, QueryTypeSummary> result = new EnumMap<>(QueryType.class);
        grouped.forEach((type, typeRecords) -> {
            double avg = typeRecords.stream().mapToLong(QueryRecord::getExecutionTimeMs).average().orElse(0.0);
            long slowCount = typeRecords.stream().filter(r -> r.getPerformanceLevel().isSlow()).count();
            result.put(type, new QueryTypeSummary(typeRecords.size(), avg, slowCount));
        });
        return result;
    }

    private List<String> buildRecommendations(List<QueryRecord> records, ReportSummary summary) {
        List<String> recommendations = new ArrayList<>();
        if (records.isEmpty()) {
            return recommendations;
        }
        double total = records.size();

        if (summary.slowQueries() / total > BROAD_SLOWNESS_SHARE) {
            recommendations.add(String.format("%.1f%% of queries are slow; broad query optimization is needed",
                    summary.slowQueries() * 100.0 / total));
        }

        long selects = records.stream().filter(r -> r.getType() == QueryType.SELECT).count();
        if (selects / total > READ_HEAVY_SHARE) {
            recommendations.add("Workload is read-heavy; focus on read-path and index tuning"
                    + " and consider read replicas or caching");
        }

        boolean slowTransaction = records.stream()
                .anyMatch(r -> r.getType() == QueryType.TRANSACTION && r.getExecutionTimeMs() > thresholds.getSlowMs());
        if (slowTransaction) {
            recommendations.add("Slow transactions detected; review transaction scope and lock duration");
        }
        return recommendations;
    }

    private List<IndexRecommendation> buildIndexRecommendations(List<SlowQueryRecord> slowQueries) {
        Map<String, Set<String>> columnsByTable = new LinkedHashMap<>();
        Map<String, Integer> queriesByTable = new LinkedHashMap<>();

        for (SlowQueryRecord slowQuery : slowQueries) {
            List<String> missing = slowQuery.analysis().missingIndexes();
            List<String> tables = slowQuery.record().getTablesAccessed();
            if (missing.isEmpty() || tables == null) {
                continue;
            }
            for (String table : tables) {
                columnsByTable.computeIfAbsent(table, t -> new LinkedHashSet<>()).addAll(missing);
                queriesByTable.merge(table, 1, Integer::sum);
            }
        }

        List<IndexRecommendation> result = new ArrayList<>();
        columnsByTable.forEach((table, columns) -> {
            int related = queriesByTable.getOrDefault(table, 0);
            int improvement = related > 0
                    ? Math.min(MAX_ESTIMATED_IMPROVEMENT, related * IMPROVEMENT_PER_SLOW_QUERY)
                    : DEFAULT_ESTIMATED_IMPROVEMENT;
            result.add(new IndexRecommendation(table, new ArrayList<>(columns), improvement,
                    improvement + "% faster queries on " + table));
        });
        result.sort(Comparator.comparingInt(IndexRecommendation::estimatedImprovementPercent).reversed());
        return result;
    }
}
