package com.trendrank.engine;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import com.trendrank.model.BenchmarkRecord;
import com.trendrank.model.RankPolicy;

/**
 * Bounded, thread-safe log of build and refresh timings. The oldest record is evicted once the
 * capacity is reached.
 */
public class BenchmarkHistory {
    public static final int DEFAULT_CAPACITY = 1000;

    private final int capacity;
    private final Deque<BenchmarkRecord> records = new ArrayDeque<>();
    private long nextId = 1;

    public BenchmarkHistory() {
        this(DEFAULT_CAPACITY);
    }

    public BenchmarkHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Benchmark capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized BenchmarkRecord record(RankPolicy policy, int dataSize, long elapsedNanos, boolean refresh) {
        BenchmarkRecord record = new BenchmarkRecord(
                nextId++,
                Instant.now(),
                dataSize,
                policy.k(),
                policy.strategy(),
                policy.sortAlgorithm(),
                policy.selectAlgorithm(),
                elapsedNanos / 1_000_000.0,
                refresh);
        if (records.size() == capacity) {
            records.removeFirst();
        }
        records.addLast(record);
        return record;
    }

    /** Oldest first. */
    public synchronized List<BenchmarkRecord> records() {
        return new ArrayList<>(records);
    }

    /**
     * The record with the lowest time per item among builds ({@code refresh == false}) or refreshes.
     */
    public synchronized Optional<BenchmarkRecord> fastest(boolean refresh) {
        return records.stream()
                .filter(r -> r.refresh() == refresh && r.dataSize() > 0)
                .min(Comparator.comparingDouble(BenchmarkRecord::millisPerItem));
    }

    public synchronized void clear() {
        records.clear();
    }

    public synchronized int size() {
        return records.size();
    }
}
