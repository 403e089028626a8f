package com.trendrank.model;

/**
 * Raw metric values of an item, as delivered by the snapshot provider.
 * Delta fields are the change since the provider's previous snapshot.
 */
public record ItemMetrics(
        long views,
        long likes,
        long comments,
        long deltaViews,
        long deltaLikes,
        long deltaComments,
        long recency,
        long durationSeconds) {

    public static final ItemMetrics EMPTY = new ItemMetrics(0, 0, 0, 0, 0, 0, 0, 0);

    public static ItemMetrics of(long views, long likes, long comments) {
        return new ItemMetrics(views, likes, comments, 0, 0, 0, 0, 0);
    }
}
