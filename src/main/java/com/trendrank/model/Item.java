package com.trendrank.model;

import java.util.Objects;

/**
 * A scored item of a snapshot. Immutable for the duration of a refresh cycle.
 */
public record Item(String id, String title, long score, ItemMetrics metrics) {

    public Item {
        Objects.requireNonNull(id, "id");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Item id cannot be empty");
        }
        title = title == null ? "" : title;
        metrics = metrics == null ? ItemMetrics.EMPTY : metrics;
    }

    public Item(String id, String title, long score) {
        this(id, title, score, ItemMetrics.EMPTY);
    }

    public RankingKey toKey() {
        return new RankingKey(score, id, title);
    }
}
