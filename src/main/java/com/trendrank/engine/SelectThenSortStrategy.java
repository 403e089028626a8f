package com.trendrank.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.trendrank.algorithm.Sorts;
import com.trendrank.algorithm.TopKSelector;
import com.trendrank.model.Item;
import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingKey;
import com.trendrank.model.RankingStrategyType;
import com.trendrank.model.RefreshStats;

/**
 * Isolates the K best keys with the policy's selection algorithm, then sorts only those.
 * Refresh rebuilds.
 */
public class SelectThenSortStrategy implements RankingStrategy {
    private final RankPolicy policy;

    public SelectThenSortStrategy(RankPolicy policy) {
        this.policy = policy;
    }

    @Override
    public RankingStrategyType type() {
        return RankingStrategyType.SELECT_THEN_SORT;
    }

    @Override
    public void build(List<Item> items, RankedView view) {
        view.replaceAll(selectThenSort(items, policy));
    }

    @Override
    public RefreshStats refresh(List<Item> items, RankedView view) {
        build(items, view);
        return RefreshStats.rebuilt(view.size());
    }

    static List<RankingKey> selectThenSort(List<Item> items, RankPolicy policy) {
        List<Item> distinct = Snapshots.distinct(items);
        if (distinct.isEmpty() || policy.k() <= 0) {
            return List.of();
        }
        List<RankingKey> keys = new ArrayList<>(distinct.size());
        for (Item item : distinct) {
            keys.add(item.toKey());
        }
        List<RankingKey> top = TopKSelector.select(keys, policy.k(), policy.selectAlgorithm(),
                Comparator.naturalOrder(), RankingKey::score);
        Sorts.sort(top, Comparator.naturalOrder(), policy.sortAlgorithm());
        return top;
    }
}
