package com.trendrank.model;

/**
 * Strategies for building and refreshing a Top-K view.
 */
public enum RankingStrategyType {
    FULL_SORT("FullSort", "O(n log n)", "O(n log n)"),
    SELECT_THEN_SORT("SelectThenSort", "O(n + k log k)", "O(n + k log k)"),
    ORDER_STATISTICS_TREE("OrderStatisticsTree", "O(n log n)", "O(m log n)"),
    ONLINE_INSERT("OnlineInsert", "O(n + k log k)", "O(m * d)"),
    MULTI_METRIC("MultiMetric", "O(n + k log k)", "O(n + k log k)");

    private final String displayName;
    private final String buildComplexity;
    private final String refreshComplexity;

    RankingStrategyType(String displayName, String buildComplexity, String refreshComplexity) {
        this.displayName = displayName;
        this.buildComplexity = buildComplexity;
        this.refreshComplexity = refreshComplexity;
    }

    public String displayName() {
        return displayName;
    }

    public String buildComplexity() {
        return buildComplexity;
    }

    public String refreshComplexity() {
        return refreshComplexity;
    }

    /** True when the view is a plain array that supports in-place score updates. */
    public boolean isArrayBacked() {
        return this == FULL_SORT || this == SELECT_THEN_SORT || this == ONLINE_INSERT;
    }
}
