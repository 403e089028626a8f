package com.trendrank.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.trendrank.algorithm.Sorts;
import com.trendrank.algorithm.TopKSelector;
import com.trendrank.model.Item;
import com.trendrank.model.MultiMetricConfig;
import com.trendrank.model.MultiMetricKey;
import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingKey;
import com.trendrank.model.RankingStrategyType;
import com.trendrank.model.RefreshStats;

/**
 * Lexicographic ranking over the metric tuple configured in the policy. There is no incremental
 * path: every build and refresh recomputes all tuples and runs a full select-then-sort.
 * <p>
 * The single-metric view is kept in sync with each key's highest-priority metric as its score, in
 * tuple order.
 */
public class MultiMetricStrategy implements RankingStrategy {
    private final RankPolicy policy;
    private List<MultiMetricKey> ranked = List.of();

    public MultiMetricStrategy(RankPolicy policy) {
        this.policy = policy;
    }

    @Override
    public RankingStrategyType type() {
        return RankingStrategyType.MULTI_METRIC;
    }

    @Override
    public void build(List<Item> items, RankedView view) {
        List<Item> distinct = Snapshots.distinct(items);
        if (distinct.isEmpty() || policy.k() <= 0) {
            ranked = List.of();
            view.replaceAll(List.of());
            return;
        }
        MultiMetricConfig config = policy.metricConfig();
        List<MultiMetricKey> keys = new ArrayList<>(distinct.size());
        for (Item item : distinct) {
            keys.add(config.keyFor(item));
        }
        // tuples are not integral, binary partition select falls back to quick select here
        List<MultiMetricKey> top = TopKSelector.select(keys, policy.k(), policy.selectAlgorithm(),
                Comparator.naturalOrder());
        Sorts.sort(top, Comparator.naturalOrder(), policy.sortAlgorithm());
        ranked = List.copyOf(top);

        List<RankingKey> projected = new ArrayList<>(ranked.size());
        for (MultiMetricKey key : ranked) {
            projected.add(new RankingKey(key.primary(), key.id(), key.title()));
        }
        view.replaceAll(projected);
    }

    @Override
    public RefreshStats refresh(List<Item> items, RankedView view) {
        build(items, view);
        return RefreshStats.rebuilt(view.size());
    }

    @Override
    public List<MultiMetricKey> multiMetricView() {
        return ranked;
    }
}
