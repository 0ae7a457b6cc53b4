package org.carball.pooltune.monitor;

import org.carball.pooltune.model.query.SlowQueryRecord;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Bounded global log of analyzed slow queries; the oldest entry is evicted first.
 */
class SlowQueryLog {

    private final int capacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<SlowQueryRecord> entries = new ArrayDeque<>();

    SlowQueryLog(int capacity) {
        this.capacity = capacity;
    }

    void add(SlowQueryRecord entry) {
        lock.lock();
        try {
            entries.addLast(entry);
            while (entries.size() > capacity) {
                entries.removeFirst();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Slowest first; ties keep the newer entry first.
     */
    List<SlowQueryRecord> slowest(int limit) {
        List<SlowQueryRecord> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(entries);
        } finally {
            lock.unlock();
        }
        Collections.reverse(snapshot);
        return snapshot.stream()
                .sorted(Comparator.comparingLong(SlowQueryRecord::executionTimeMs).reversed())
                .limit(Math.max(limit, 0))
                .collect(Collectors.toList());
    }

    List<SlowQueryRecord> since(Instant start) {
        lock.lock();
        try {
            List<SlowQueryRecord> result = new ArrayList<>();
            for (SlowQueryRecord entry : entries) {
                if (!entry.record().getTimestamp().isBefore(start)) {
                    result.add(entry);
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    void pruneOlderThan(Instant cutoff) {
        lock.lock();
        try {
            entries.removeIf(entry -> entry.record().getTimestamp().isBefore(cutoff));
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }
}
