package com.trendrank.engine;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

import com.trendrank.model.RankingKey;

/**
 * Array-backed ranked view with a position index (id → offset).
 * <p>
 * Outside a lazy-deletion window the array is sorted by {@link RankingKey} order and the index maps
 * every id to its offset. During a window, deleted entries are overwritten with
 * {@link RankingKey#DELETED} and their offsets kept on a free list until they are reused by
 * {@link #place(RankingKey)} or dropped by {@link #compact()}. Sentinels never move: repair exchanges
 * an entry with its nearest live neighbor, so free-list offsets stay valid.
 */
public final class RankedView {

    private List<RankingKey> slots = new ArrayList<>();
    private final Map<String, Integer> positions = new HashMap<>();
    private final Deque<Integer> freeSlots = new ArrayDeque<>();

    /**
     * Replaces the whole view with an already ordered sequence and rebuilds the index.
     */
    public void replaceAll(List<RankingKey> ordered) {
        slots = new ArrayList<>(ordered);
        freeSlots.clear();
        rebuildIndex();
    }

    public void clear() {
        slots = new ArrayList<>();
        freeSlots.clear();
        positions.clear();
    }

    public void rebuildIndex() {
        positions.clear();
        for (int i = 0; i < slots.size(); i++) {
            RankingKey key = slots.get(i);
            if (!key.isDeleted()) {
                positions.put(key.id(), i);
            }
        }
    }

    /** Number of physical slots, sentinels included. */
    public int slotCount() {
        return slots.size();
    }

    public RankingKey slotAt(int offset) {
        return slots.get(offset);
    }

    /** Number of live entries. */
    public int size() {
        return slots.size() - freeSlots.size();
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    /** Live entries in rank order. */
    public List<RankingKey> entries() {
        return top(Integer.MAX_VALUE);
    }

    /**
     * The first {@code min(k, size)} live entries; {@code k <= 0} gives an empty list.
     */
    public List<RankingKey> top(int k) {
        if (k <= 0) {
            return List.of();
        }
        List<RankingKey> result = new ArrayList<>(Math.min(k, slots.size()));
        for (RankingKey key : slots) {
            if (result.size() >= k) {
                break;
            }
            if (!key.isDeleted()) {
                result.add(key);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * The {@code k}-th live entry (1-based), or empty when fewer than {@code k} entries are live.
     */
    public Optional<RankingKey> kthLive(int k) {
        if (k <= 0 || k > size()) {
            return Optional.empty();
        }
        int seen = 0;
        for (RankingKey key : slots) {
            if (!key.isDeleted() && ++seen == k) {
                return Optional.of(key);
            }
        }
        return Optional.empty();
    }

    public OptionalInt positionOf(String id) {
        Integer pos = positions.get(id);
        return pos == null ? OptionalInt.empty() : OptionalInt.of(pos);
    }

    public Optional<RankingKey> find(String id) {
        Integer pos = positions.get(id);
        return pos == null ? Optional.empty() : Optional.of(slots.get(pos));
    }

    public Map<String, Integer> positionIndex() {
        return Map.copyOf(positions);
    }

    public Set<String> indexedIds() {
        return new HashSet<>(positions.keySet());
    }

    public int freeSlotCount() {
        return freeSlots.size();
    }

    public boolean hasFreeSlots() {
        return !freeSlots.isEmpty();
    }

    /** True when live entries are in rank order. Sentinels are ignored. */
    public boolean isSorted() {
        RankingKey prev = null;
        for (RankingKey key : slots) {
            if (key.isDeleted()) {
                continue;
            }
            if (prev != null && key.ranksAheadOf(prev)) {
                return false;
            }
            prev = key;
        }
        return true;
    }

    /**
     * Sets the score of an indexed entry and moves it to its sorted position by neighbor exchange.
     *
     * @return false when the id is not indexed
     */
    public boolean updateScore(String id, long newScore) {
        Integer pos = positions.get(id);
        if (pos == null) {
            return false;
        }
        return replace(slots.get(pos).withScore(newScore));
    }

    /**
     * Replaces the entry holding {@code key.id()} and repairs its position.
     *
     * @return false when the id is not indexed
     */
    public boolean replace(RankingKey key) {
        Integer pos = positions.get(key.id());
        if (pos == null) {
            return false;
        }
        slots.set(pos, key);
        repair(pos);
        return true;
    }

    /**
     * Direct index write. No consistency check is made against the array.
     */
    public void mapping(String id, int offset) {
        positions.put(id, offset);
    }

    /**
     * Neighbor-exchange repair of the entry at {@code offset}: walk left while it ranks strictly
     * ahead of its left live neighbor, otherwise walk right while its right live neighbor ranks
     * strictly ahead of it. Costs O(distance moved).
     *
     * @return the entry's final offset
     */
    public int repair(int offset) {
        RankingKey moving = slots.get(offset);
        int prev = previousLive(offset);
        if (prev >= 0 && moving.ranksAheadOf(slots.get(prev))) {
            while (prev >= 0 && moving.ranksAheadOf(slots.get(prev))) {
                exchange(offset, prev);
                offset = prev;
                prev = previousLive(offset);
            }
            return offset;
        }
        int next = nextLive(offset);
        while (next >= 0 && slots.get(next).ranksAheadOf(moving)) {
            exchange(offset, next);
            offset = next;
            next = nextLive(offset);
        }
        return offset;
    }

    /**
     * Overwrites a live slot with the deleted sentinel, drops its index entry and pushes the offset
     * onto the free list.
     */
    public void markDeleted(int offset) {
        RankingKey key = slots.get(offset);
        if (key.isDeleted()) {
            return;
        }
        positions.remove(key.id(), offset);
        slots.set(offset, RankingKey.DELETED);
        freeSlots.push(offset);
    }

    /**
     * Puts a new entry into a free slot when one exists, otherwise appends it, then repairs its
     * position.
     *
     * @return true when a free slot was reused
     */
    public boolean place(RankingKey key) {
        boolean reused = !freeSlots.isEmpty();
        int offset;
        if (reused) {
            offset = freeSlots.pop();
            slots.set(offset, key);
        } else {
            offset = slots.size();
            slots.add(key);
        }
        positions.put(key.id(), offset);
        repair(offset);
        return reused;
    }

    /**
     * Copies live entries contiguously, discards sentinels and rebuilds the index. O(n).
     */
    public void compact() {
        List<RankingKey> live = new ArrayList<>(size());
        for (RankingKey key : slots) {
            if (!key.isDeleted()) {
                live.add(key);
            }
        }
        slots = live;
        freeSlots.clear();
        rebuildIndex();
    }

    /**
     * Keeps the first {@code k} slots and removes index entries of everything beyond.
     */
    public void truncate(int k) {
        int limit = Math.max(0, k);
        for (int i = slots.size() - 1; i >= limit; i--) {
            RankingKey key = slots.remove(i);
            if (key.isDeleted()) {
                freeSlots.remove(i);
            } else {
                positions.remove(key.id(), i);
            }
        }
    }

    private void exchange(int a, int b) {
        RankingKey ka = slots.get(a);
        RankingKey kb = slots.get(b);
        slots.set(a, kb);
        slots.set(b, ka);
        positions.put(kb.id(), a);
        positions.put(ka.id(), b);
    }

    private int previousLive(int offset) {
        for (int i = offset - 1; i >= 0; i--) {
            if (!slots.get(i).isDeleted()) {
                return i;
            }
        }
        return -1;
    }

    private int nextLive(int offset) {
        for (int i = offset + 1; i < slots.size(); i++) {
            if (!slots.get(i).isDeleted()) {
                return i;
            }
        }
        return -1;
    }
}
