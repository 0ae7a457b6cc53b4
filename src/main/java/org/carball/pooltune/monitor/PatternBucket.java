package org.carball.pooltune.monitor;

import org.carball.pooltune.config.PerformanceThresholds;
import org.carball.pooltune.model.query.PerformanceLevel;
import org.carball.pooltune.model.query.QueryRecord;
import org.carball.pooltune.model.query.QueryStats;
import org.carball.pooltune.model.query.QueryType;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Retained records and running statistics for one query pattern.
 * All access goes through the bucket's own lock.
 */
class PatternBucket {

    static final Duration FREQUENCY_WINDOW = Duration.ofSeconds(60);
    static final double MIN_SUCCESS_RATE = 95.0;
    static final int CACHING_FREQUENCY = 60;
    static final double LARGE_ROW_COUNT = 1_000;
    static final double LARGE_RESULT_SET = 10_000;

    private final String pattern;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<QueryRecord> records = new ArrayDeque<>();

    private QueryType type;
    private long totalExecutions;
    private double averageExecutionTimeMs;
    private long minExecutionTimeMs = Long.MAX_VALUE;
    private long maxExecutionTimeMs;
    private long totalRowsAffected;
    private long errorCount;
    private Instant lastExecuted = Instant.EPOCH;
    private int frequency;
    private PerformanceLevel performanceLevel = PerformanceLevel.EXCELLENT;
    private List<String> suggestions = List.of();
    private boolean retired;

    PatternBucket(String pattern) {
        this.pattern = pattern;
    }

    /**
     * Stores the record and folds it into the running statistics.
     *
     * @return the statistics after the update, or {@code null} when the bucket
     * was retired and the caller must record into a fresh one
     */
    QueryStats add(QueryRecord record, Instant retentionCutoff, int capacity, PerformanceThresholds thresholds) {
        lock.lock();
        try {
            if (retired) {
                return null;
            }
            dropOlderThan(retentionCutoff);
            records.addLast(record);
            while (records.size() > capacity) {
                records.removeFirst();
            }

            type = record.getType();
            totalExecutions++;
            long executionTime = record.getExecutionTimeMs();
            averageExecutionTimeMs = (averageExecutionTimeMs * (totalExecutions - 1) + executionTime) / totalExecutions;
            minExecutionTimeMs = Math.min(minExecutionTimeMs, executionTime);
            maxExecutionTimeMs = Math.max(maxExecutionTimeMs, executionTime);
            totalRowsAffected += record.getRowsAffected();
            if (!record.isSuccess()) {
                errorCount++;
            }
            lastExecuted = record.getTimestamp();
            performanceLevel = record.getPerformanceLevel();
            frequency = countSince(record.getTimestamp().minus(FREQUENCY_WINDOW));
            suggestions = buildSuggestions(thresholds);

            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops expired records only; the running statistics are kept.
     */
    void pruneOlderThan(Instant cutoff) {
        lock.lock();
        try {
            dropOlderThan(cutoff);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the bucket as removed from the pattern map. Later {@link #add} calls are refused.
     */
    void retire() {
        lock.lock();
        try {
            retired = true;
        } finally {
            lock.unlock();
        }
    }

    QueryStats stats() {
        lock.lock();
        try {
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Oldest first.
     */
    List<QueryRecord> records() {
        lock.lock();
        try {
            return new ArrayList<>(records);
        } finally {
            lock.unlock();
        }
    }

    Instant lastExecuted() {
        lock.lock();
        try {
            return lastExecuted;
        } finally {
            lock.unlock();
        }
    }

    String pattern() {
        return pattern;
    }

    private void dropOlderThan(Instant cutoff) {
        Iterator<QueryRecord> it = records.iterator();
        while (it.hasNext()) {
            if (it.next().getTimestamp().isBefore(cutoff)) {
                it.remove();
            } else {
                break;
            }
        }
    }

    private int countSince(Instant since) {
        int count = 0;
        Iterator<QueryRecord> it = records.descendingIterator();
        while (it.hasNext()) {
            if (it.next().getTimestamp().isAfter(since)) {
                count++;
            } else {
                break;
            }
        }
        return count;
    }

    private double successRate() {
        return totalExecutions > 0 ? ((totalExecutions - errorCount) * 100.0) / totalExecutions : 100.0;
    }

    private double averageRowsAffected() {
        return totalExecutions > 0 ? (double) totalRowsAffected / totalExecutions : 0.0;
    }

    private List<String> buildSuggestions(PerformanceThresholds thresholds) {
        List<String> result = new ArrayList<>();
        double avgRows = averageRowsAffected();

        if (averageExecutionTimeMs > thresholds.getSlowMs()) {
            result.add("Average execution time exceeds " + thresholds.getSlowMs()
                    + "ms; review indexes and the query plan");
        }
        if (successRate() < MIN_SUCCESS_RATE) {
            result.add("Success rate is below " + (int) MIN_SUCCESS_RATE + "%; investigate query errors");
        }
        if (frequency > CACHING_FREQUENCY) {
            result.add("Query runs more than " + CACHING_FREQUENCY + " times per minute; consider caching results");
        }
        if (avgRows > LARGE_ROW_COUNT) {
            result.add("Query affects many rows on average; consider pagination or batching");
        }
        if (type == QueryType.SELECT && avgRows > LARGE_RESULT_SET) {
            result.add("Large result sets; add LIMIT or more selective filters");
        }
        return result;
    }

    private QueryStats snapshot() {
        return new QueryStats(
                pattern,
                type,
                totalExecutions,
                averageExecutionTimeMs,
                totalExecutions > 0 ? minExecutionTimeMs : 0,
                maxExecutionTimeMs,
                totalRowsAffected,
                averageRowsAffected(),
                successRate(),
                errorCount,
                lastExecuted,
                frequency,
                performanceLevel,
                suggestions
        );
    }
}
