package com.trendrank.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Ranking key over an ordered tuple of metric values.
 * <p>
 * Comparison is lexicographic and descending per field: the first differing field decides.
 * When every shared field ties, the longer tuple ranks ahead; the final fallback is title order.
 * Equality is identity by id.
 */
public final class MultiMetricKey implements Comparable<MultiMetricKey> {

    private final String id;
    private final String title;
    private final long[] metrics;

    public MultiMetricKey(String id, String title, long[] metrics) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title == null ? "" : title;
        this.metrics = metrics == null ? new long[0] : metrics.clone();
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public int size() {
        return metrics.length;
    }

    public long metric(int index) {
        return metrics[index];
    }

    public long[] metrics() {
        return metrics.clone();
    }

    /** Value of the highest-priority metric, or 0 for an empty tuple. */
    public long primary() {
        return metrics.length == 0 ? 0 : metrics[0];
    }

    @Override
    public int compareTo(MultiMetricKey other) {
        int shared = Math.min(metrics.length, other.metrics.length);
        for (int i = 0; i < shared; i++) {
            if (metrics[i] != other.metrics[i]) {
                return Long.compare(other.metrics[i], metrics[i]);
            }
        }
        if (metrics.length != other.metrics.length) {
            return Integer.compare(other.metrics.length, metrics.length);
        }
        return title.compareTo(other.title);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return id.equals(((MultiMetricKey) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "MultiMetricKey[id=" + id + ", metrics=" + Arrays.toString(metrics) + ", title=" + title + "]";
    }
}
