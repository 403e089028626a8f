package com.trendrank.model;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered metric priority for lexicographic ranking. The first metric has the highest priority.
 */
public record MultiMetricConfig(List<MetricType> priority) {

    public static final int MAX_CUSTOM_METRICS = 5;

    public MultiMetricConfig {
        priority = priority == null ? List.of() : List.copyOf(priority);
    }

    /** Views, then likes, then comments. */
    public static MultiMetricConfig defaultConfig() {
        return new MultiMetricConfig(List.of(MetricType.VIEWS, MetricType.LIKES, MetricType.COMMENTS));
    }

    /** Change-based ranking: delta views, then delta likes, then delta comments. */
    public static MultiMetricConfig trendingConfig() {
        return new MultiMetricConfig(
                List.of(MetricType.DELTA_VIEWS, MetricType.DELTA_LIKES, MetricType.DELTA_COMMENTS));
    }

    /** Likes, then comments, then views. */
    public static MultiMetricConfig engagementConfig() {
        return new MultiMetricConfig(List.of(MetricType.LIKES, MetricType.COMMENTS, MetricType.VIEWS));
    }

    /**
     * Custom priority list. Falls back to {@link #defaultConfig()} when empty, and keeps at most
     * {@value #MAX_CUSTOM_METRICS} metrics.
     */
    public static MultiMetricConfig custom(List<MetricType> priority) {
        if (priority == null || priority.isEmpty()) {
            return defaultConfig();
        }
        return new MultiMetricConfig(priority.subList(0, Math.min(priority.size(), MAX_CUSTOM_METRICS)));
    }

    public MultiMetricKey keyFor(Item item) {
        long[] values = new long[priority.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = priority.get(i).valueOf(item);
        }
        return new MultiMetricKey(item.id(), item.title(), values);
    }

    public String describe() {
        return priority.stream().map(MetricType::displayName).collect(Collectors.joining(" > "));
    }
}
