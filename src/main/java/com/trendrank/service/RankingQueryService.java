package com.trendrank.service;

import java.util.List;
import java.util.OptionalInt;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.trendrank.dto.MultiMetricEntryResponse;
import com.trendrank.dto.RankResponse;
import com.trendrank.dto.RankingEntryResponse;
import com.trendrank.dto.StatsResponse;
import com.trendrank.exception.BoardNotFoundException;
import com.trendrank.exception.ItemNotFoundException;
import com.trendrank.model.BenchmarkRecord;
import com.trendrank.model.RankPolicy;
import com.trendrank.model.RankingKey;

@Service
public class RankingQueryService {
    private final RankingBoardManager boardManager;

    @Autowired
    public RankingQueryService(RankingBoardManager boardManager) {
        this.boardManager = boardManager;
    }

    public List<RankingEntryResponse> getTopK(String boardId, int limit) {
        List<RankingKey> top = getBoard(boardId).execute(orchestrator -> orchestrator.getTopK(limit));
        return RankingEntryResponse.fromView(top);
    }

    public List<RankingEntryResponse> getPreviousTopK(String boardId, int limit) {
        List<RankingKey> previous = getBoard(boardId).execute(orchestrator -> orchestrator.getPreviousTopK(limit));
        return RankingEntryResponse.fromView(previous);
    }

    public List<MultiMetricEntryResponse> getMultiMetricTopK(String boardId, int limit) {
        return MultiMetricEntryResponse.fromView(
                getBoard(boardId).execute(orchestrator -> orchestrator.getMultiMetricTopK(limit)));
    }

    public RankResponse getItemRank(String boardId, String itemId) {
        return getBoard(boardId).execute(orchestrator -> {
            OptionalInt rank = orchestrator.rankOf(itemId);
            if (rank.isEmpty()) {
                throw new ItemNotFoundException("Item " + itemId + " not found in board " + boardId);
            }
            long score = orchestrator.find(itemId).map(RankingKey::score).orElse(0L);
            int size = orchestrator.size();
            return new RankResponse(itemId, rank.getAsInt(), score, size,
                    calculatePercentile(rank.getAsInt(), size));
        });
    }

    public StatsResponse getStats(String boardId) {
        RankingBoard board = getBoard(boardId);
        return board.execute(orchestrator -> {
            if (!orchestrator.isBuilt()) {
                throw new IllegalStateException("Board " + boardId + " has not been built");
            }
            RankPolicy policy = orchestrator.policy();
            return new StatsResponse(
                    board.getBoardId(),
                    policy.strategy(),
                    policy.describe(),
                    policy.strategy().buildComplexity(),
                    policy.strategy().refreshComplexity(),
                    policy.k(),
                    orchestrator.size(),
                    orchestrator.buildTimeMillis(),
                    orchestrator.refreshTimeMillis(),
                    orchestrator.refreshCount());
        });
    }

    public List<String> getBoardIds() {
        return List.copyOf(boardManager.getBoardIds());
    }

    public void deleteBoard(String boardId) {
        if (!boardManager.removeBoard(boardId)) {
            throw new BoardNotFoundException("Board " + boardId + " not found");
        }
    }

    public List<BenchmarkRecord> getBenchmarks() {
        return boardManager.benchmarkHistory().records();
    }

    public void clearBenchmarks() {
        boardManager.benchmarkHistory().clear();
    }

    private RankingBoard getBoard(String boardId) {
        RankingBoard board = boardManager.getBoard(boardId);
        if (board == null) {
            throw new BoardNotFoundException("Board " + boardId + " not found");
        }
        return board;
    }

    private double calculatePercentile(int rank, int total) {
        if (total == 0)
            return 0.0;
        return ((total - rank + 1) * 100.0) / total;
    }
}
