package com.trendrank.engine;

import com.trendrank.model.RankPolicy;

public final class RankingStrategies {

    private RankingStrategies() {
    }

    public static RankingStrategy create(RankPolicy policy) {
        switch (policy.strategy()) {
            case FULL_SORT:
                return new FullSortStrategy(policy);
            case SELECT_THEN_SORT:
                return new SelectThenSortStrategy(policy);
            case ORDER_STATISTICS_TREE:
                return new OrderStatisticsTreeStrategy(policy);
            case ONLINE_INSERT:
                return new OnlineInsertStrategy(policy);
            case MULTI_METRIC:
                return new MultiMetricStrategy(policy);
            default:
                throw new IllegalArgumentException("Unsupported strategy " + policy.strategy());
        }
    }
}
