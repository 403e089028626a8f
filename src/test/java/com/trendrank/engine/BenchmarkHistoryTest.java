package com.trendrank.engine;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingStrategyType;

class BenchmarkHistoryTest {

    private static final RankPolicy POLICY = RankPolicy.of(RankingStrategyType.FULL_SORT, 10);

    @Test
    void oldest_records_are_evicted_at_capacity() {
        BenchmarkHistory history = new BenchmarkHistory(3);
        for (int i = 0; i < 5; i++) {
            history.record(POLICY, 100, 1_000_000L, false);
        }

        assertEquals(3, history.size());
        assertEquals(3, history.records().get(0).recordId());
        assertEquals(5, history.records().get(2).recordId());
    }

    @Test
    void fastest_compares_time_per_item() {
        BenchmarkHistory history = new BenchmarkHistory();
        history.record(POLICY, 100, 10_000_000L, false);
        history.record(POLICY, 1000, 20_000_000L, false);
        history.record(POLICY, 10, 1_000L, true);

        assertEquals(1000, history.fastest(false).orElseThrow().dataSize());
        assertEquals(10, history.fastest(true).orElseThrow().dataSize());
        assertEquals(20.0, history.fastest(false).orElseThrow().elapsedMillis(), 1e-9);
        assertEquals(20.0, history.fastest(false).orElseThrow().effectiveMicrosPerItem(), 1e-9);
    }

    @Test
    void clear_empties_history() {
        BenchmarkHistory history = new BenchmarkHistory();
        history.record(POLICY, 1, 1L, false);
        history.clear();

        assertEquals(0, history.size());
        assertTrue(history.fastest(false).isEmpty());
    }

    @Test
    void capacity_must_be_positive() {
        assertThrows(IllegalArgumentException.class, () -> new BenchmarkHistory(0));
    }
}
