package com.trendrank.engine;

import java.util.List;

import com.trendrank.model.Item;
import com.trendrank.model.MultiMetricKey;
import com.trendrank.model.RankingStrategyType;
import com.trendrank.model.RefreshStats;

/**
 * One way of building and refreshing a Top-K view. Each implementation owns whatever state its
 * refresh path needs (a tree, a tuple list, nothing at all) and writes its result into the
 * {@link RankedView} handed in by the orchestrator.
 * <p>
 * Implementations read the item snapshot but never modify or retain it.
 */
public interface RankingStrategy {

    RankingStrategyType type();

    void build(List<Item> items, RankedView view);

    RefreshStats refresh(List<Item> items, RankedView view);

    /**
     * Full tuple view of the multi-metric strategy. Single-metric strategies have none.
     */
    default List<MultiMetricKey> multiMetricView() {
        return List.of();
    }
}
