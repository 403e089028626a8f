package com.trendrank.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.trendrank.engine.RankingOrchestrator;

class ItemTest {

    @Test
    void empty_id_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new Item("", "x", 100));
        assertThrows(NullPointerException.class, () -> new Item(null, "x", 100));
    }

    @Test
    void view_size_matches_index_for_accepted_items() {
        RankingOrchestrator orchestrator = new RankingOrchestrator();
        orchestrator.build(List.of(new Item(" ", "x", 100), new Item("B", "B", 50)),
                RankPolicy.of(RankingStrategyType.FULL_SORT, 2));

        assertEquals(2, orchestrator.size());
        assertEquals(2, orchestrator.getTopK(2).size());
        assertEquals(1, orchestrator.rankOf(" ").getAsInt());
        assertEquals(2, orchestrator.rankOf("B").getAsInt());
    }

    @Test
    void missing_title_and_metrics_default_to_empty() {
        Item item = new Item("a", null, 1, null);

        assertEquals("", item.title());
        assertEquals(ItemMetrics.EMPTY, item.metrics());
        assertEquals(new RankingKey(1, "a", ""), item.toKey());
    }
}
