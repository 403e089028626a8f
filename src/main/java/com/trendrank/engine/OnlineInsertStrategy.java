package com.trendrank.engine;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.trendrank.model.Item;
import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingKey;
import com.trendrank.model.RankingStrategyType;
import com.trendrank.model.RefreshStats;

/**
 * Patches the sorted array in place instead of re-sorting it.
 * <ol>
 * <li>Slots whose id left the snapshot are lazily deleted.</li>
 * <li>Slots whose key changed are rewritten and repaired by neighbor exchange.</li>
 * <li>Items new to the snapshot, and items whose key changed outside the view, are placed into free
 * slots (or appended) and repaired when they rank ahead of the current K-th entry.</li>
 * <li>Leftover free slots trigger a compaction.</li>
 * <li>The array is cut back to K entries.</li>
 * </ol>
 * Changes are applied one at a time, each followed by its repair, so every repair starts from an
 * array that is sorted apart from the entry being moved.
 * <p>
 * Items below the cutline that did not change are not touched. They can only reach the top K when
 * the view lost entries or an entry fell behind the previous cutline; in that case the view is
 * backfilled from the best of the remaining snapshot.
 */
public class OnlineInsertStrategy implements RankingStrategy {
    private static final Logger logger = LoggerFactory.getLogger(OnlineInsertStrategy.class);

    private final RankPolicy policy;
    private Map<String, RankingKey> previous = new HashMap<>();

    public OnlineInsertStrategy(RankPolicy policy) {
        this.policy = policy;
    }

    @Override
    public RankingStrategyType type() {
        return RankingStrategyType.ONLINE_INSERT;
    }

    @Override
    public void build(List<Item> items, RankedView view) {
        view.replaceAll(SelectThenSortStrategy.selectThenSort(items, policy));
        previous = keysOf(Snapshots.byId(items));
    }

    @Override
    public RefreshStats refresh(List<Item> items, RankedView view) {
        if (view.isEmpty()) {
            build(items, view);
            return RefreshStats.rebuilt(view.size());
        }
        int k = policy.k();
        Map<String, Item> incoming = Snapshots.byId(items);
        RankingKey oldCutline = view.kthLive(k).orElse(null);

        Set<String> matched = new HashSet<>();
        List<Integer> deletions = new ArrayList<>();
        List<RankingKey> changes = new ArrayList<>();
        for (int offset = 0; offset < view.slotCount(); offset++) {
            RankingKey current = view.slotAt(offset);
            if (current.isDeleted()) {
                continue;
            }
            Item item = incoming.get(current.id());
            if (item == null) {
                deletions.add(offset);
            } else {
                matched.add(current.id());
                RankingKey fresh = item.toKey();
                if (!fresh.sameRanking(current)) {
                    changes.add(fresh);
                }
            }
        }

        for (int offset : deletions) {
            view.markDeleted(offset);
        }
        for (RankingKey fresh : changes) {
            view.replace(fresh);
        }

        int inserted = 0;
        int promoted = 0;
        int reused = 0;
        RankingKey bar = null;
        for (Item item : incoming.values()) {
            if (matched.contains(item.id())) {
                continue;
            }
            RankingKey fresh = item.toKey();
            RankingKey before = previous.get(item.id());
            if (before != null && before.sameRanking(fresh)) {
                continue;
            }
            if (view.size() >= k) {
                // placements only raise the K-th entry, so a stale bar admits a superset
                if (bar == null) {
                    bar = view.kthLive(k).orElse(null);
                }
                if (bar == null || !fresh.ranksAheadOf(bar)) {
                    continue;
                }
            }
            if (view.place(fresh)) {
                reused++;
            }
            if (before == null) {
                inserted++;
            } else {
                promoted++;
            }
        }

        boolean compacted = view.hasFreeSlots();
        if (compacted) {
            view.compact();
        }
        boolean backfilled = needsBackfill(incoming, view, oldCutline);
        if (backfilled) {
            backfill(incoming, view);
        }
        view.truncate(k);
        previous = keysOf(incoming);

        logger.debug("Online refresh: removed={}, updated={}, inserted={}, reusedSlots={}, compacted={}, backfilled={}",
                deletions.size(), changes.size() + promoted, inserted, reused, compacted, backfilled);
        return RefreshStats.incremental(deletions.size(), changes.size() + promoted, inserted, reused, compacted);
    }

    /**
     * Unchanged items outside the view rank at or behind the previous cutline, so they matter only
     * when the view is short or its K-th entry now ranks behind that cutline.
     */
    private boolean needsBackfill(Map<String, Item> incoming, RankedView view, RankingKey oldCutline) {
        if (incoming.size() <= view.size()) {
            return false;
        }
        int k = policy.k();
        if (view.size() < k) {
            return true;
        }
        return oldCutline != null && view.kthLive(k).map(oldCutline::ranksAheadOf).orElse(false);
    }

    private void backfill(Map<String, Item> incoming, RankedView view) {
        List<Item> outside = new ArrayList<>();
        for (Item item : incoming.values()) {
            if (view.positionOf(item.id()).isEmpty()) {
                outside.add(item);
            }
        }
        List<RankingKey> best = SelectThenSortStrategy.selectThenSort(outside, policy);
        List<RankingKey> live = view.entries();
        int k = policy.k();
        List<RankingKey> merged = new ArrayList<>(k);
        int i = 0;
        int j = 0;
        while (merged.size() < k && (i < live.size() || j < best.size())) {
            if (j >= best.size() || (i < live.size() && !best.get(j).ranksAheadOf(live.get(i)))) {
                merged.add(live.get(i++));
            } else {
                merged.add(best.get(j++));
            }
        }
        view.replaceAll(merged);
    }

    private static Map<String, RankingKey> keysOf(Map<String, Item> snapshot) {
        Map<String, RankingKey> keys = new HashMap<>(Math.max(16, snapshot.size() * 4 / 3 + 1));
        for (Item item : snapshot.values()) {
            keys.put(item.id(), item.toKey());
        }
        return keys;
    }
}
