package com.trendrank.model;

import java.util.List;

/**
 * Outcome of a refresh: the new view, how long it took and what changed.
 */
public record RefreshResult(List<RankingKey> view, long elapsedNanos, RefreshStats stats) {

    public RefreshResult {
        view = List.copyOf(view);
    }

    public double elapsedMillis() {
        return elapsedNanos / 1_000_000.0;
    }
}
