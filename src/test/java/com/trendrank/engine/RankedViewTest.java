package com.trendrank.engine;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.trendrank.model.RankingKey;

class RankedViewTest {

    private RankedView view;

    private static RankingKey key(String id, long score) {
        return new RankingKey(score, id, id);
    }

    @BeforeEach
    void setUp() {
        view = new RankedView();
        view.replaceAll(List.of(key("A", 100), key("B", 90), key("C", 80), key("D", 70)));
    }

    @Test
    void update_score_moves_entry_left() {
        assertTrue(view.updateScore("D", 95));

        assertEquals(List.of("A", "D", "B", "C"), ids(view.entries()));
        assertEquals(Map.of("A", 0, "D", 1, "B", 2, "C", 3), view.positionIndex());
    }

    @Test
    void update_score_moves_entry_right() {
        assertTrue(view.updateScore("A", 75));

        assertEquals(List.of("B", "C", "A", "D"), ids(view.entries()));
        assertEquals(2, view.positionOf("A").getAsInt());
    }

    @Test
    void unchanged_position_when_still_in_order() {
        assertTrue(view.updateScore("B", 85));

        assertEquals(List.of("A", "B", "C", "D"), ids(view.entries()));
        assertFalse(view.updateScore("missing", 1));
    }

    @Test
    void repair_skips_sentinels() {
        view.markDeleted(1);
        view.markDeleted(2);

        assertTrue(view.updateScore("D", 500));

        assertEquals(List.of("D", "A"), ids(view.entries()));
        assertTrue(view.slotAt(1).isDeleted());
        assertTrue(view.slotAt(2).isDeleted());
        assertEquals(0, view.positionOf("D").getAsInt());
        assertEquals(3, view.positionOf("A").getAsInt());
        assertTrue(view.isSorted());
    }

    @Test
    void place_reuses_free_slot_and_repairs() {
        view.markDeleted(1);
        assertEquals(1, view.freeSlotCount());
        assertTrue(view.find("B").isEmpty());

        assertTrue(view.place(key("E", 75)));

        assertEquals(List.of("A", "C", "E", "D"), ids(view.entries()));
        assertFalse(view.hasFreeSlots());
        assertEquals(4, view.slotCount());
        assertTrue(view.isSorted());
    }

    @Test
    void place_appends_without_free_slots() {
        assertFalse(view.place(key("E", 85)));

        assertEquals(5, view.slotCount());
        assertEquals(List.of("A", "B", "E", "C", "D"), ids(view.entries()));
    }

    @Test
    void compact_drops_sentinels_and_rebuilds_index() {
        view.markDeleted(0);
        view.markDeleted(2);
        view.compact();

        assertEquals(2, view.slotCount());
        assertEquals(Map.of("B", 0, "D", 1), view.positionIndex());
        assertEquals(0, view.freeSlotCount());
    }

    @Test
    void truncate_removes_index_entries_beyond_k() {
        view.truncate(2);

        assertEquals(List.of("A", "B"), ids(view.entries()));
        assertEquals(Map.of("A", 0, "B", 1), view.positionIndex());

        view.truncate(0);
        assertTrue(view.isEmpty());
        assertTrue(view.positionIndex().isEmpty());
    }

    @Test
    void top_is_clamped() {
        assertEquals(2, view.top(2).size());
        assertEquals(4, view.top(10).size());
        assertTrue(view.top(0).isEmpty());
        assertTrue(view.top(-1).isEmpty());
    }

    @Test
    void mapping_writes_index_directly() {
        view.mapping("ghost", 2);

        assertEquals(2, view.positionOf("ghost").getAsInt());
        assertEquals("C", view.find("ghost").orElseThrow().id());
    }

    @Test
    void kth_live_skips_deleted_slots() {
        view.markDeleted(1);

        assertEquals("C", view.kthLive(2).get().id());
        assertEquals("D", view.kthLive(3).get().id());
        assertTrue(view.kthLive(4).isEmpty());
        assertTrue(view.kthLive(0).isEmpty());
    }

    private static List<String> ids(List<RankingKey> keys) {
        return keys.stream().map(RankingKey::id).toList();
    }
}
