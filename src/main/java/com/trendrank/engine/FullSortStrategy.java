package com.trendrank.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.trendrank.algorithm.Sorts;
import com.trendrank.model.Item;
import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingKey;
import com.trendrank.model.RankingStrategyType;
import com.trendrank.model.RefreshStats;

/**
 * Sorts every key with the policy's sort algorithm and keeps the first K. Refresh rebuilds.
 */
public class FullSortStrategy implements RankingStrategy {
    private final RankPolicy policy;

    public FullSortStrategy(RankPolicy policy) {
        this.policy = policy;
    }

    @Override
    public RankingStrategyType type() {
        return RankingStrategyType.FULL_SORT;
    }

    @Override
    public void build(List<Item> items, RankedView view) {
        List<Item> distinct = Snapshots.distinct(items);
        List<RankingKey> keys = new ArrayList<>(distinct.size());
        for (Item item : distinct) {
            keys.add(item.toKey());
        }
        Sorts.sort(keys, Comparator.naturalOrder(), policy.sortAlgorithm());
        int limit = Math.max(0, Math.min(policy.k(), keys.size()));
        view.replaceAll(keys.subList(0, limit));
    }

    @Override
    public RefreshStats refresh(List<Item> items, RankedView view) {
        build(items, view);
        return RefreshStats.rebuilt(view.size());
    }
}
