package com.trendrank.service;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.trendrank.dto.ItemRequest;
import com.trendrank.dto.PolicyRequest;
import com.trendrank.dto.RankResponse;
import com.trendrank.dto.RankingEntryResponse;
import com.trendrank.dto.StatsResponse;
import com.trendrank.exception.BoardNotFoundException;
import com.trendrank.exception.InvalidItemException;
import com.trendrank.exception.InvalidPolicyException;
import com.trendrank.exception.ItemNotFoundException;
import com.trendrank.model.MetricType;
import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingKey;
import com.trendrank.model.RankingStrategyType;
import com.trendrank.model.RefreshResult;
import com.trendrank.model.SortAlgorithm;
import com.trendrank.scoring.ScoringStrategy;

class SnapshotIngestionServiceTest {

    private RankingBoardManager boardManager;
    private SnapshotIngestionService ingestionService;
    private RankingQueryService queryService;

    @BeforeEach
    void setUp() {
        boardManager = new RankingBoardManager();
        boardManager.initialize();
        ingestionService = new SnapshotIngestionService(boardManager);
        queryService = new RankingQueryService(boardManager);
    }

    private static ItemRequest scored(String id, long score) {
        return new ItemRequest(id, "title " + id, score, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    private static ItemRequest unscored(String id, long views, long likes, long comments) {
        return new ItemRequest(id, id, null, views, likes, comments, 0, 0, 0, 0, 0);
    }

    private static PolicyRequest policy(RankingStrategyType strategy, Integer k) {
        return new PolicyRequest(strategy, null, null, k, null, null);
    }

    @Test
    void build_refresh_and_query_a_board() {
        List<RankingKey> built = ingestionService.build("daily", policy(RankingStrategyType.ONLINE_INSERT, 3),
                List.of(scored("A", 100), scored("B", 90), scored("C", 80), scored("D", 70)));
        assertEquals(3, built.size());

        RefreshResult result = ingestionService.refresh("daily",
                List.of(scored("A", 100), scored("B", 90), scored("C", 80), scored("D", 95)));

        assertEquals(List.of("A", "D", "B"), result.view().stream().map(RankingKey::id).toList());

        List<RankingEntryResponse> top = queryService.getTopK("daily", 2);
        assertEquals(1, top.get(0).rank());
        assertEquals("D", top.get(1).id());
        assertEquals(95, top.get(1).score());

        RankResponse rank = queryService.getItemRank("daily", "B");
        assertEquals(3, rank.rank());
        assertEquals(90, rank.score());
        assertEquals(3, rank.viewSize());

        assertEquals(List.of("A", "B", "C"),
                queryService.getPreviousTopK("daily", 10).stream().map(RankingEntryResponse::id).toList());

        StatsResponse stats = queryService.getStats("daily");
        assertEquals(RankingStrategyType.ONLINE_INSERT, stats.strategy());
        assertEquals(1, stats.refreshCount());
        assertEquals(3, stats.size());
        assertEquals(2, queryService.getBenchmarks().size());
    }

    @Test
    void missing_scores_come_from_the_scoring_strategy() {
        List<RankingKey> view = ingestionService.build("scored", policy(RankingStrategyType.FULL_SORT, 5),
                List.of(unscored("small", 100, 10, 0), unscored("big", 1000, 0, 0)));

        long expected = ScoringStrategy.ENGAGEMENT.score(100, 10, 0);
        assertEquals("small", view.get(0).id());
        assertEquals(expected, view.get(0).score());
        assertEquals(300, view.get(1).score());
    }

    @Test
    void omitted_k_uses_default() {
        RankPolicy resolved = ingestionService.toPolicy(policy(RankingStrategyType.FULL_SORT, null));

        assertEquals(RankPolicy.DEFAULT_K, resolved.k());
        assertEquals(SortAlgorithm.QUICK, resolved.sortAlgorithm());
    }

    @Test
    void multi_metric_policy_resolves_presets_and_custom_lists() {
        RankPolicy trending = ingestionService.toPolicy(
                new PolicyRequest(RankingStrategyType.MULTI_METRIC, null, null, 5, "trending", null));
        RankPolicy custom = ingestionService.toPolicy(new PolicyRequest(RankingStrategyType.MULTI_METRIC, null, null,
                5, "trending", List.of(MetricType.COMMENTS)));

        assertEquals(MetricType.DELTA_VIEWS, trending.metricConfig().priority().get(0));
        assertEquals(List.of(MetricType.COMMENTS), custom.metricConfig().priority());
        assertThrows(InvalidPolicyException.class, () -> ingestionService.toPolicy(
                new PolicyRequest(RankingStrategyType.MULTI_METRIC, null, null, 5, null,
                        List.of(MetricType.VIEWS, MetricType.LIKES, MetricType.COMMENTS, MetricType.RECENCY,
                                MetricType.DURATION, MetricType.DELTA_LIKES))));
    }

    @Test
    void invalid_policies_and_items_are_rejected() {
        assertThrows(InvalidPolicyException.class,
                () -> ingestionService.build("b", policy(RankingStrategyType.FULL_SORT, 0), List.of()));
        assertThrows(InvalidPolicyException.class,
                () -> ingestionService.build("b", policy(RankingStrategyType.FULL_SORT, 1_000_000), List.of()));
        assertThrows(InvalidPolicyException.class, () -> ingestionService.build("b", policy(null, 3), List.of()));
        assertThrows(InvalidItemException.class,
                () -> ingestionService.build("b", policy(RankingStrategyType.FULL_SORT, 3), List.of(scored("x", -1))));
        assertThrows(InvalidItemException.class,
                () -> ingestionService.build("b", policy(RankingStrategyType.FULL_SORT, 3), List.of(scored(" ", 1))));
        assertTrue(boardManager.getBoardIds().isEmpty());
    }

    @Test
    void unknown_boards_are_not_found() {
        assertThrows(BoardNotFoundException.class, () -> ingestionService.refresh("nope", List.of()));
        assertThrows(BoardNotFoundException.class, () -> queryService.getTopK("nope", 3));
        assertThrows(BoardNotFoundException.class, () -> queryService.deleteBoard("nope"));
        assertThrows(BoardNotFoundException.class, () -> ingestionService.updateScore("nope", "a", 1));
    }

    @Test
    void score_update_requires_array_backed_board_and_ranked_item() {
        ingestionService.build("arr", policy(RankingStrategyType.FULL_SORT, 3),
                List.of(scored("A", 10), scored("B", 20)));
        ingestionService.build("tree", policy(RankingStrategyType.ORDER_STATISTICS_TREE, 3),
                List.of(scored("A", 10), scored("B", 20)));

        ingestionService.updateScore("arr", "A", 50);

        assertEquals(1, queryService.getItemRank("arr", "A").rank());
        assertThrows(ItemNotFoundException.class, () -> ingestionService.updateScore("arr", "Z", 50));
        assertThrows(ItemNotFoundException.class, () -> ingestionService.updateScore("tree", "A", 50));
        assertThrows(ItemNotFoundException.class, () -> queryService.getItemRank("arr", "Z"));
    }

    @Test
    void boards_can_be_listed_and_deleted() {
        ingestionService.build("b2", policy(RankingStrategyType.FULL_SORT, 3), List.of(scored("A", 1)));
        ingestionService.build("b1", policy(RankingStrategyType.FULL_SORT, 3), List.of(scored("A", 1)));

        assertEquals(List.of("b1", "b2"), queryService.getBoardIds());

        queryService.deleteBoard("b1");

        assertEquals(List.of("b2"), queryService.getBoardIds());
        queryService.clearBenchmarks();
        assertTrue(queryService.getBenchmarks().isEmpty());
    }

    @Test
    void percentile_is_relative_to_view_size() {
        ingestionService.build("p", policy(RankingStrategyType.SELECT_THEN_SORT, 4),
                List.of(scored("A", 4), scored("B", 3), scored("C", 2), scored("D", 1)));

        assertEquals(100.0, queryService.getItemRank("p", "A").percentile(), 1e-9);
        assertEquals(25.0, queryService.getItemRank("p", "D").percentile(), 1e-9);
    }
}
