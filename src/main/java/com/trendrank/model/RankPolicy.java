package com.trendrank.model;

/**
 * Ranking policy: the strategy, the sort/select sub-algorithms it uses, the view size K and,
 * for {@link RankingStrategyType#MULTI_METRIC}, the metric priority.
 */
public record RankPolicy(
        RankingStrategyType strategy,
        SortAlgorithm sortAlgorithm,
        SelectAlgorithm selectAlgorithm,
        int k,
        MultiMetricConfig metricConfig) {

    public static final int DEFAULT_K = 100;

    public RankPolicy {
        strategy = strategy == null ? RankingStrategyType.FULL_SORT : strategy;
        sortAlgorithm = sortAlgorithm == null ? SortAlgorithm.QUICK : sortAlgorithm;
        selectAlgorithm = selectAlgorithm == null ? SelectAlgorithm.NTH_ELEMENT : selectAlgorithm;
        metricConfig = metricConfig == null ? MultiMetricConfig.defaultConfig() : metricConfig;
    }

    public static RankPolicy of(RankingStrategyType strategy, int k) {
        return new RankPolicy(strategy, null, null, k, null);
    }

    public RankPolicy withSort(SortAlgorithm sort) {
        return new RankPolicy(strategy, sort, selectAlgorithm, k, metricConfig);
    }

    public RankPolicy withSelect(SelectAlgorithm select) {
        return new RankPolicy(strategy, sortAlgorithm, select, k, metricConfig);
    }

    public RankPolicy withMetricConfig(MultiMetricConfig config) {
        return new RankPolicy(strategy, sortAlgorithm, selectAlgorithm, k, config);
    }

    /** Human readable description of the algorithms in use, e.g. "Quick Select + Merge Sort". */
    public String describe() {
        switch (strategy) {
            case FULL_SORT:
                return sortAlgorithm.displayName();
            case SELECT_THEN_SORT:
            case ONLINE_INSERT:
                return selectAlgorithm.displayName() + " + " + sortAlgorithm.displayName();
            case MULTI_METRIC:
                return metricConfig.describe();
            default:
                return strategy.displayName();
        }
    }
}
