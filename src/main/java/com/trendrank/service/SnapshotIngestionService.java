package com.trendrank.service;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.trendrank.dto.ItemRequest;
import com.trendrank.dto.PolicyRequest;
import com.trendrank.exception.BoardNotFoundException;
import com.trendrank.exception.InvalidItemException;
import com.trendrank.exception.InvalidPolicyException;
import com.trendrank.exception.ItemNotFoundException;
import com.trendrank.model.Item;
import com.trendrank.model.MultiMetricConfig;
import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingKey;
import com.trendrank.model.RankingStrategyType;
import com.trendrank.model.RefreshResult;
import com.trendrank.scoring.ScoringStrategy;

/**
 * Turns submitted snapshots into engine items and drives build, refresh and point updates on the
 * target board.
 */
@Service
public class SnapshotIngestionService {
    private final Logger logger = LoggerFactory.getLogger(SnapshotIngestionService.class);
    private final RankingBoardManager boardManager;

    @Value("${ranking.default-top-k:100}")
    private int defaultTopK = RankPolicy.DEFAULT_K;

    @Value("${ranking.max-top-k:10000}")
    private int maxTopK = 10000;

    @Value("${ranking.scoring-strategy:ENGAGEMENT}")
    private ScoringStrategy scoringStrategy = ScoringStrategy.ENGAGEMENT;

    @Autowired
    public SnapshotIngestionService(RankingBoardManager boardManager) {
        this.boardManager = boardManager;
    }

    public List<RankingKey> build(String boardId, PolicyRequest policyRequest, List<ItemRequest> itemRequests) {
        RankPolicy policy = toPolicy(policyRequest);
        List<Item> items = toItems(itemRequests);
        RankingBoard board = boardManager.getOrCreateBoard(boardId);
        List<RankingKey> view = board.execute(orchestrator -> orchestrator.build(items, policy));
        logger.info("Board {} built with {} ({}) from {} items, view size {}", boardId,
                policy.strategy().displayName(), policy.describe(), items.size(), view.size());
        return view;
    }

    public RefreshResult refresh(String boardId, List<ItemRequest> itemRequests) {
        List<Item> items = toItems(itemRequests);
        RefreshResult result = getBoard(boardId).execute(orchestrator -> orchestrator.refresh(items));
        logger.info("Board {} refreshed with {} items in {} ms", boardId, items.size(),
                String.format("%.3f", result.elapsedMillis()));
        return result;
    }

    public void updateScore(String boardId, String itemId, long score) {
        if (score < 0) {
            throw new InvalidItemException("Score cannot be negative");
        }
        boolean updated = getBoard(boardId).execute(orchestrator -> orchestrator.updateScore(itemId, score));
        if (!updated) {
            throw new ItemNotFoundException(
                    "Item " + itemId + " is not ranked on board " + boardId + " or the board does not support updates");
        }
    }

    RankPolicy toPolicy(PolicyRequest request) {
        if (request == null || request.strategy() == null) {
            throw new InvalidPolicyException("Ranking strategy is required");
        }
        int k = request.k() == null ? defaultTopK : request.k();
        if (k < 1 || k > maxTopK) {
            throw new InvalidPolicyException("K must be between 1 and " + maxTopK + ", got " + k);
        }
        MultiMetricConfig metricConfig = null;
        if (request.strategy() == RankingStrategyType.MULTI_METRIC) {
            metricConfig = toMetricConfig(request);
        }
        return new RankPolicy(request.strategy(), request.sortAlgorithm(), request.selectAlgorithm(), k,
                metricConfig);
    }

    private MultiMetricConfig toMetricConfig(PolicyRequest request) {
        if (request.metrics() != null && !request.metrics().isEmpty()) {
            if (request.metrics().size() > MultiMetricConfig.MAX_CUSTOM_METRICS) {
                throw new InvalidPolicyException(
                        "At most " + MultiMetricConfig.MAX_CUSTOM_METRICS + " metrics can be combined");
            }
            if (request.metrics().contains(null)) {
                throw new InvalidPolicyException("Metric list contains an empty entry");
            }
            return MultiMetricConfig.custom(request.metrics());
        }
        String preset = request.metricPreset() == null ? "" : request.metricPreset();
        switch (preset) {
            case "trending":
                return MultiMetricConfig.trendingConfig();
            case "engagement":
                return MultiMetricConfig.engagementConfig();
            default:
                return MultiMetricConfig.defaultConfig();
        }
    }

    List<Item> toItems(List<ItemRequest> requests) {
        if (requests == null) {
            throw new InvalidItemException("Item list is required");
        }
        List<Item> items = new ArrayList<>(requests.size());
        for (ItemRequest request : requests) {
            validateItem(request);
            long score = request.score() != null
                    ? request.score()
                    : scoringStrategy.score(request.views(), request.likes(), request.comments());
            items.add(new Item(request.id(), request.title(), score, request.toMetrics()));
        }
        return items;
    }

    private void validateItem(ItemRequest request) {
        if (request == null) {
            throw new InvalidItemException("Item cannot be null");
        }
        if (request.id() == null || request.id().isBlank()) {
            throw new InvalidItemException("Item id cannot be blank");
        }
        if (request.score() != null && request.score() < 0) {
            throw new InvalidItemException("Score of item " + request.id() + " cannot be negative");
        }
        if (request.views() < 0 || request.likes() < 0 || request.comments() < 0) {
            throw new InvalidItemException("Metrics of item " + request.id() + " cannot be negative");
        }
    }

    private RankingBoard getBoard(String boardId) {
        RankingBoard board = boardManager.getBoard(boardId);
        if (board == null) {
            throw new BoardNotFoundException("Board " + boardId + " not found");
        }
        return board;
    }
}
