package org.carball.pooltune.monitor;

import lombok.extern.slf4j.Slf4j;
import org.carball.pooltune.analyzer.QueryTextAnalyzer;
import org.carball.pooltune.analyzer.SlowQueryAnalyzer;
import org.carball.pooltune.config.MonitorSettings;
import org.carball.pooltune.config.PerformanceThresholds;
import org.carball.pooltune.model.query.AlertType;
import org.carball.pooltune.model.query.PerformanceLevel;
import org.carball.pooltune.model.query.PerformanceReport;
import org.carball.pooltune.model.query.QueryAlert;
import org.carball.pooltune.model.query.QueryEvent;
import org.carball.pooltune.model.query.QueryMetadata;
import org.carball.pooltune.model.query.QueryRecord;
import org.carball.pooltune.model.query.QueryStats;
import org.carball.pooltune.model.query.SlowQueryAnalysis;
import org.carball.pooltune.model.query.SlowQueryRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Records completed query executions, keeps per-pattern statistics and a slow
 * query log, raises alerts and publishes periodic performance reports.
 * <p>
 * Recording never throws. Maintenance runs on a single daemon thread once
 * {@link #start()} is called.
 */
@Slf4j
public class QueryMonitor implements AutoCloseable {

    private final MonitorSettings settings;
    private final Clock clock;
    private final SlowQueryAnalyzer analyzer;
    private final Map<String, PatternBucket> buckets = new ConcurrentHashMap<>();
    private final SlowQueryLog slowQueryLog;
    private final List<QueryMonitorListener> listeners = new CopyOnWriteArrayList<>();
    private final Object schedulerLock = new Object();

    private volatile PerformanceThresholds thresholds;
    private volatile boolean monitoringEnabled;
    private ScheduledExecutorService scheduler;

    public QueryMonitor() {
        this(MonitorSettings.defaults());
    }

    public QueryMonitor(MonitorSettings settings) {
        this(settings, Clock.systemUTC(), new SlowQueryAnalyzer());
    }

    public QueryMonitor(MonitorSettings settings, Clock clock) {
        this(settings, clock, new SlowQueryAnalyzer());
    }

    public QueryMonitor(MonitorSettings settings, Clock clock, SlowQueryAnalyzer analyzer) {
        this.settings = settings;
        this.clock = clock;
        this.analyzer = analyzer;
        this.thresholds = settings.getThresholds();
        this.monitoringEnabled = settings.isMonitoringEnabled();
        this.slowQueryLog = new SlowQueryLog(settings.getMaxSlowQueries());
        thresholds.validate();
    }

    /**
     * Schedules the retention sweep and the periodic report. Calling it again has no effect.
     */
    public void start() {
        synchronized (schedulerLock) {
            if (scheduler != null) {
                return;
            }
            scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "pooltune-query-monitor");
                thread.setDaemon(true);
                return thread;
            });
            long cleanupMs = settings.getCleanupInterval().toMillis();
            long reportMs = settings.getReportInterval().toMillis();
            scheduler.scheduleAtFixedRate(() -> runSafely("cleanup", this::runCleanup),
                    cleanupMs, cleanupMs, TimeUnit.MILLISECONDS);
            scheduler.scheduleAtFixedRate(() -> runSafely("report", this::publishReport),
                    reportMs, reportMs, TimeUnit.MILLISECONDS);
            log.info("Query monitor started (cleanup every {}, report every {})",
                    settings.getCleanupInterval(), settings.getReportInterval());
        }
    }

    public Optional<QueryRecord> recordQuery(QueryEvent event) {
        if (event == null) {
            return Optional.empty();
        }
        return recordQuery(event.getQueryText(), event.getParams(), event.toMetadata());
    }

    /**
     * Records one completed query. Malformed input is logged and ignored.
     *
     * @return the stored record, or empty when monitoring is disabled or the input was rejected
     */
    public Optional<QueryRecord> recordQuery(String queryText, List<?> params, QueryMetadata metadata) {
        if (!monitoringEnabled) {
            return Optional.empty();
        }
        try {
            return Optional.of(doRecord(queryText, params, metadata == null ? QueryMetadata.of(0) : metadata));
        } catch (RuntimeException e) {
            log.warn("Failed to record query: {}", e.getMessage());
            log.debug("Query recording failure", e);
            return Optional.empty();
        }
    }

    private QueryRecord doRecord(String queryText, List<?> params, QueryMetadata metadata) {
        PerformanceThresholds current = thresholds;
        Instant now = clock.instant();
        String sanitized = QueryTextAnalyzer.sanitizeQuery(queryText);

        List<String> tables = metadata.getTablesAccessed().isEmpty()
                ? QueryTextAnalyzer.extractTableNames(sanitized)
                : metadata.getTablesAccessed();

        QueryRecord record = QueryRecord.builder()
                .id(QueryTextAnalyzer.generateQueryId(queryText, params))
                .query(sanitized)
                .pattern(QueryTextAnalyzer.extractPattern(sanitized))
                .params(QueryTextAnalyzer.sanitizeParams(params))
                .type(QueryTextAnalyzer.detectQueryType(sanitized))
                .executionTimeMs(Math.max(0, metadata.getExecutionTimeMs()))
                .rowsAffected(Math.max(0, metadata.getRowsAffected()))
                .poolTag(metadata.getPoolTag())
                .connectionType(metadata.getConnectionType())
                .timestamp(now)
                .success(metadata.isSuccess())
                .error(metadata.getError())
                .performanceLevel(classify(metadata.getExecutionTimeMs(), current))
                .cacheHit(metadata.getCacheHit())
                .indexUsage(metadata.getIndexUsage())
                .tablesAccessed(tables)
                .requestId(metadata.getRequestId())
                .sessionId(metadata.getSessionId())
                .userId(metadata.getUserId())
                .tags(metadata.getTags())
                .attributes(metadata.getAttributes())
                .build();

        QueryStats stats = store(record, now.minus(settings.getRetention()), current);

        log.debug("Recorded {} query {} in {}ms ({})", record.getType(), record.getId(),
                record.getExecutionTimeMs(), record.getPerformanceLevel());
        notifyListeners(listener -> listener.onQueryRecorded(record, stats));

        if (record.getPerformanceLevel().isSlow()) {
            SlowQueryAnalysis analysis = analyzer.analyze(record, current);
            SlowQueryRecord slowQuery = new SlowQueryRecord(record, analysis);
            slowQueryLog.add(slowQuery);
            notifyListeners(listener -> listener.onSlowQuery(slowQuery));
        }

        checkAlerts(record, stats, now);
        return record;
    }

    static PerformanceLevel classify(long executionTimeMs, PerformanceThresholds thresholds) {
        if (executionTimeMs < thresholds.getExcellentMs()) return PerformanceLevel.EXCELLENT;
        if (executionTimeMs < thresholds.getGoodMs()) return PerformanceLevel.GOOD;
        if (executionTimeMs < thresholds.getAcceptableMs()) return PerformanceLevel.ACCEPTABLE;
        if (executionTimeMs < thresholds.getSlowMs()) return PerformanceLevel.SLOW;
        return PerformanceLevel.VERY_SLOW;
    }

    private QueryStats store(QueryRecord record, Instant retentionCutoff, PerformanceThresholds current) {
        while (true) {
            PatternBucket bucket = bucketFor(record.getPattern());
            QueryStats stats = bucket.add(record, retentionCutoff, settings.getMaxRecordsPerPattern(), current);
            if (stats != null) {
                return stats;
            }
            // Retired concurrently by cleanup or eviction
            buckets.remove(bucket.pattern(), bucket);
        }
    }

    private PatternBucket bucketFor(String pattern) {
        PatternBucket existing = buckets.get(pattern);
        if (existing != null) {
            return existing;
        }
        if (buckets.size() >= settings.getPatternHardLimit()) {
            evictStalestPattern();
        }
        return buckets.computeIfAbsent(pattern, PatternBucket::new);
    }

    private void evictStalestPattern() {
        List<PatternBucket> snapshot = new ArrayList<>(buckets.values());
        snapshot.stream()
                .min(Comparator.comparing(PatternBucket::lastExecuted))
                .ifPresent(stalest -> {
                    if (removeBucket(stalest)) {
                        log.debug("Evicted stalest query pattern: {}", stalest.pattern());
                    }
                });
    }

    private boolean removeBucket(PatternBucket bucket) {
        bucket.retire();
        return buckets.remove(bucket.pattern(), bucket);
    }

    private void checkAlerts(QueryRecord record, QueryStats stats, Instant now) {
        if (record.getPerformanceLevel() == PerformanceLevel.VERY_SLOW) {
            raise(new QueryAlert(AlertType.VERY_SLOW_QUERY, record.getPattern(),
                    "Very slow query: " + record.getExecutionTimeMs() + "ms",
                    record.getExecutionTimeMs(), stats.errorCount(), stats.errorRate(), stats.frequency(),
                    stats.averageExecutionTimeMs(), stats.optimizationSuggestions(), now));
        }
        if (stats.errorCount() > settings.getErrorCountAlertThreshold()) {
            raise(new QueryAlert(AlertType.HIGH_ERROR_RATE, record.getPattern(),
                    String.format("High error rate: %d errors (%.1f%%)", stats.errorCount(), stats.errorRate()),
                    record.getExecutionTimeMs(), stats.errorCount(), stats.errorRate(), stats.frequency(),
                    stats.averageExecutionTimeMs(), stats.optimizationSuggestions(), now));
        }
        if (stats.frequency() > settings.getFrequencyAlertThreshold()) {
            raise(new QueryAlert(AlertType.HIGH_FREQUENCY_QUERY, record.getPattern(),
                    "High frequency query: " + stats.frequency() + " executions per minute",
                    record.getExecutionTimeMs(), stats.errorCount(), stats.errorRate(), stats.frequency(),
                    stats.averageExecutionTimeMs(), stats.optimizationSuggestions(), now));
        }
    }

    private void raise(QueryAlert alert) {
        log.warn("Query alert [{}]: {} - {}", alert.type().toJson(), alert.message(), alert.queryPattern());
        notifyListeners(listener -> listener.onAlert(alert));
    }

    private void notifyListeners(Consumer<QueryMonitorListener> event) {
        for (QueryMonitorListener listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Query monitor listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    public List<QueryStats> getQueryStats() {
        List<PatternBucket> snapshot = new ArrayList<>(buckets.values());
        return snapshot.stream().map(PatternBucket::stats).collect(Collectors.toList());
    }

    public Optional<QueryStats> getQueryStats(String pattern) {
        PatternBucket bucket = buckets.get(pattern);
        return bucket == null ? Optional.empty() : Optional.of(bucket.stats());
    }

    /**
     * Retained slow queries, slowest first.
     */
    public List<SlowQueryRecord> getSlowQueries() {
        return getSlowQueries(Integer.MAX_VALUE);
    }

    public List<SlowQueryRecord> getSlowQueries(int limit) {
        return slowQueryLog.slowest(limit);
    }

    /**
     * All retained records of the pattern, newest first; empty for unknown patterns.
     */
    public List<QueryRecord> getQueryRecords(String pattern) {
        return getQueryRecords(pattern, Integer.MAX_VALUE);
    }

    public List<QueryRecord> getQueryRecords(String pattern, int limit) {
        PatternBucket bucket = buckets.get(pattern);
        if (bucket == null || limit <= 0) {
            return List.of();
        }
        List<QueryRecord> records = bucket.records();
        List<QueryRecord> result = new ArrayList<>(Math.min(limit, records.size()));
        for (int i = records.size() - 1; i >= 0 && result.size() < limit; i--) {
            result.add(records.get(i));
        }
        return result;
    }

    public PerformanceReport generatePerformanceReport(int periodMinutes) {
        Instant end = clock.instant();
        Instant start = end.minus(Duration.ofMinutes(periodMinutes));

        List<QueryRecord> inWindow = new ArrayList<>();
        for (PatternBucket bucket : new ArrayList<>(buckets.values())) {
            for (QueryRecord record : bucket.records()) {
                if (!record.getTimestamp().isBefore(start)) {
                    inWindow.add(record);
                }
            }
        }

        return new PerformanceReportBuilder(thresholds, settings.getTopSlowQueryCount())
                .build(inWindow, slowQueryLog.since(start), start, end, periodMinutes);
    }

    /**
     * Drops records and slow queries older than the retention period and trims
     * the pattern map to the most recently executed patterns. Statistics of a
     * pattern survive the expiry of its records.
     */
    public void runCleanup() {
        Instant cutoff = clock.instant().minus(settings.getRetention());
        int removedPatterns = 0;

        for (PatternBucket bucket : new ArrayList<>(buckets.values())) {
            bucket.pruneOlderThan(cutoff);
        }

        if (buckets.size() > settings.getMaxPatterns()) {
            List<PatternBucket> byRecency = new ArrayList<>(buckets.values());
            byRecency.sort(Comparator.comparing(PatternBucket::lastExecuted).reversed());
            for (PatternBucket bucket : byRecency.subList(settings.getMaxPatterns(), byRecency.size())) {
                if (removeBucket(bucket)) {
                    removedPatterns++;
                }
            }
        }

        slowQueryLog.pruneOlderThan(cutoff);
        log.info("Query monitor cleanup removed {} patterns; {} patterns and {} slow queries retained",
                removedPatterns, buckets.size(), slowQueryLog.size());
    }

    /**
     * Builds a report over the configured period and hands it to the listeners.
     */
    public PerformanceReport publishReport() {
        PerformanceReport report = generatePerformanceReport(settings.getReportPeriodMinutes());
        log.info("Performance report: {} queries, {} slow, avg {}ms",
                report.summary().totalQueries(), report.summary().slowQueries(),
                String.format("%.1f", report.summary().averageExecutionTimeMs()));
        notifyListeners(listener -> listener.onPerformanceReport(report));
        return report;
    }

    public void setMonitoringEnabled(boolean enabled) {
        this.monitoringEnabled = enabled;
        log.info("Query monitoring {}", enabled ? "enabled" : "disabled");
    }

    public boolean isMonitoringEnabled() {
        return monitoringEnabled;
    }

    public void updateThresholds(PerformanceThresholds newThresholds) {
        newThresholds.validate();
        this.thresholds = newThresholds;
        log.info("Query thresholds updated");
    }

    public PerformanceThresholds getThresholds() {
        return thresholds;
    }

    public int getPatternCount() {
        return buckets.size();
    }

    public void addListener(QueryMonitorListener listener) {
        listeners.add(listener);
    }

    public void removeListener(QueryMonitorListener listener) {
        listeners.remove(listener);
    }

    /**
     * Stops the timers and discards all retained data.
     */
    @Override
    public void close() {
        synchronized (schedulerLock) {
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
        }
        new ArrayList<>(buckets.values()).forEach(this::removeBucket);
        slowQueryLog.clear();
        listeners.clear();
        log.info("Query monitor closed");
    }

    private void runSafely(String task, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Query monitor {} task failed", task, e);
        }
    }
}
