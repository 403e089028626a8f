package com.trendrank.scoring;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import com.trendrank.model.ItemMetrics;

class ScoringStrategyTest {

    @Test
    void engagement_boosts_log_views_by_capped_engagement_bonus() {
        assertEquals(300, ScoringStrategy.ENGAGEMENT.score(1000, 0, 0));
        // like rate 10% hits the 100% bonus cap
        assertEquals(400, ScoringStrategy.ENGAGEMENT.score(100, 10, 0));
        assertEquals(400, ScoringStrategy.ENGAGEMENT.score(100, 90, 90));
        assertEquals(0, ScoringStrategy.ENGAGEMENT.score(0, 5, 5));
    }

    @Test
    void weighted_compresses_weighted_sum() {
        assertEquals(3000, ScoringStrategy.WEIGHTED.score(1000, 0, 0));
        assertEquals(4000, ScoringStrategy.WEIGHTED.score(5000, 60, 10));
        assertEquals(0, ScoringStrategy.WEIGHTED.score(0, 0, 0));
    }

    @Test
    void normalized_caps_each_component_at_one_hundred() {
        assertEquals(1000, ScoringStrategy.NORMALIZED.score(10_000_000, 100_000, 10_000));
        assertEquals(1000, ScoringStrategy.NORMALIZED.score(Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE));
        assertEquals(0, ScoringStrategy.NORMALIZED.score(0, 0, 0));
    }

    @Test
    void legacy_sums_log_terms() {
        assertEquals(1000, ScoringStrategy.LEGACY.score(1000, 100, 10));
        assertEquals(0, ScoringStrategy.LEGACY.score(0, 0, 0));
    }

    @ParameterizedTest
    @EnumSource(ScoringStrategy.class)
    void scores_stay_within_bounds(ScoringStrategy strategy) {
        long[] samples = { 0, 1, 7, 1_000, 123_456_789, Long.MAX_VALUE };
        for (long views : samples) {
            for (long likes : samples) {
                long score = strategy.score(ItemMetrics.of(views, likes, likes / 2));
                assertTrue(score >= ScoringStrategy.MIN_SCORE && score <= ScoringStrategy.MAX_SCORE,
                        strategy + " produced " + score);
            }
        }
    }

    @Test
    void clamp_limits_raw_scores() {
        assertEquals(0, ScoringStrategy.clamp(-5));
        assertEquals(ScoringStrategy.MAX_SCORE, ScoringStrategy.clamp(2_000_000));
        assertEquals(123, ScoringStrategy.clamp(123));
    }
}
