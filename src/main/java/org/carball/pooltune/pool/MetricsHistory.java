package org.carball.pooltune.pool;

import org.carball.pooltune.model.pool.PerformanceTrends;
import org.carball.pooltune.model.pool.PoolMetricsSample;
import org.carball.pooltune.model.pool.TrendPoint;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded history of pool metrics samples, oldest dropped first.
 */
class MetricsHistory {

    static final int DEFAULT_CAPACITY = 100;

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<PoolMetricsSample> samples = new ArrayDeque<>();

    MetricsHistory(int capacity) {
        this.capacity = capacity;
    }

    void add(PoolMetricsSample sample) {
        lock.lock();
        try {
            samples.addLast(sample);
            while (samples.size() > capacity) {
                samples.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    Optional<PoolMetricsSample> latest() {
        lock.lock();
        try {
            return Optional.ofNullable(samples.peekLast());
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return samples.size();
        } finally {
            lock.unlock();
        }
    }

    PerformanceTrends trendsSince(Instant since) {
        List<PoolMetricsSample> window = new ArrayList<>();
        lock.lock();
        try {
            for (PoolMetricsSample sample : samples) {
                if (!sample.timestamp().isBefore(since)) {
                    window.add(sample);
                }
            }
        } finally {
            lock.unlock();
        }

        List<TrendPoint> utilization = new ArrayList<>(window.size());
        List<TrendPoint> responseTime = new ArrayList<>(window.size());
        List<TrendPoint> errorRate = new ArrayList<>(window.size());
        for (PoolMetricsSample sample : window) {
            utilization.add(new TrendPoint(sample.timestamp(), sample.utilization()));
            responseTime.add(new TrendPoint(sample.timestamp(), sample.avgResponseTimeMs()));
            errorRate.add(new TrendPoint(sample.timestamp(), sample.errorRate()));
        }
        return new PerformanceTrends(utilization, responseTime, errorRate);
    }
}
