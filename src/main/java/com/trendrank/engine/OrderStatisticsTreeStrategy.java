package com.trendrank.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trendrank.algorithm.OrderStatisticsTree;
import com.trendrank.model.Item;
import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingKey;
import com.trendrank.model.RankingStrategyType;
import com.trendrank.model.RefreshStats;

/**
 * Keeps every item of the snapshot in an {@link OrderStatisticsTree}; the view is its first K keys.
 * <p>
 * Refresh diffs the tree against the new snapshot: ids missing from the snapshot are removed, ids
 * whose key changed are updated, and ids never seen in the tree are inserted. The cost is
 * O(m log n) for m changed, added or removed items.
 */
public class OrderStatisticsTreeStrategy implements RankingStrategy {
    private static final Logger logger = LoggerFactory.getLogger(OrderStatisticsTreeStrategy.class);

    private final RankPolicy policy;
    private final OrderStatisticsTree<RankingKey> tree =
            new OrderStatisticsTree<>(Comparator.naturalOrder(), RankingKey::id);

    public OrderStatisticsTreeStrategy(RankPolicy policy) {
        this.policy = policy;
    }

    @Override
    public RankingStrategyType type() {
        return RankingStrategyType.ORDER_STATISTICS_TREE;
    }

    @Override
    public void build(List<Item> items, RankedView view) {
        tree.clear();
        for (Item item : items) {
            tree.insert(item.toKey());
        }
        view.replaceAll(tree.topK(policy.k()));
    }

    @Override
    public RefreshStats refresh(List<Item> items, RankedView view) {
        Map<String, Item> unseen = Snapshots.byId(items);
        List<String> removals = new ArrayList<>();
        List<RankingKey> updates = new ArrayList<>();

        for (RankingKey existing : tree.toList()) {
            Item item = unseen.remove(existing.id());
            if (item == null) {
                removals.add(existing.id());
            } else {
                RankingKey fresh = item.toKey();
                if (!fresh.sameRanking(existing)) {
                    updates.add(fresh);
                }
            }
        }

        for (String id : removals) {
            tree.removeById(id);
        }
        for (RankingKey fresh : updates) {
            tree.update(fresh.id(), fresh);
        }
        for (Item item : unseen.values()) {
            tree.insert(item.toKey());
        }

        view.replaceAll(tree.topK(policy.k()));
        logger.debug("Tree refresh: removed={}, updated={}, inserted={}, size={}",
                removals.size(), updates.size(), unseen.size(), tree.size());
        return RefreshStats.incremental(removals.size(), updates.size(), unseen.size(), 0, false);
    }

    OrderStatisticsTree<RankingKey> tree() {
        return tree;
    }
}
