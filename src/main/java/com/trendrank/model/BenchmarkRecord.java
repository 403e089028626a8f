package com.trendrank.model;

import java.time.Instant;

/**
 * One timed build or refresh.
 */
public record BenchmarkRecord(
        long recordId,
        Instant recordedAt,
        int dataSize,
        int topK,
        RankingStrategyType strategy,
        SortAlgorithm sortAlgorithm,
        SelectAlgorithm selectAlgorithm,
        double elapsedMillis,
        boolean refresh) {

    public double millisPerItem() {
        return dataSize > 0 ? elapsedMillis / dataSize : 0.0;
    }

    /** Microseconds per item, the figure used to compare runs of different sizes. */
    public double effectiveMicrosPerItem() {
        return millisPerItem() * 1000.0;
    }
}
