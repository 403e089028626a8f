package com.trendrank.controller;

import java.util.List;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.trendrank.dto.BuildRequest;
import com.trendrank.dto.MultiMetricEntryResponse;
import com.trendrank.dto.RankResponse;
import com.trendrank.dto.RankingEntryResponse;
import com.trendrank.dto.RefreshRequest;
import com.trendrank.dto.RefreshResponse;
import com.trendrank.dto.ScoreUpdateRequest;
import com.trendrank.dto.StatsResponse;
import com.trendrank.model.RankingKey;
import com.trendrank.model.RefreshResult;
import com.trendrank.service.RankingQueryService;
import com.trendrank.service.SnapshotIngestionService;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

/**
 * Controller for building, refreshing and querying ranking boards.
 * Board ids are short alphanumeric names; item ids are opaque strings.
 */
@RestController
@RequestMapping("/api/v1/boards")
@Validated
public class RankingController {

    private static final int MAX_VIEW_LIMIT = 1000;
    private static final int MIN_VIEW_LIMIT = 1;
    private static final String BOARD_ID_REGEX = "^[A-Za-z0-9_-]{1,64}$";
    private static final String BOARD_ID_MESSAGE = "Board ID must be 1-64 letters, digits, '_' or '-'.";

    private final SnapshotIngestionService ingestionService;
    private final RankingQueryService queryService;

    @Autowired
    public RankingController(SnapshotIngestionService ingestionService, RankingQueryService queryService) {
        this.ingestionService = ingestionService;
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<List<String>> listBoards() {
        return ResponseEntity.ok(queryService.getBoardIds());
    }

    /**
     * Builds (or rebuilds) a board from a full snapshot. A rebuild discards all previous state,
     * including the previous strategy.
     *
     * @return the ranked view, best first
     */
    @PostMapping("/{boardId}/build")
    public ResponseEntity<List<RankingEntryResponse>> build(
            @PathVariable @Pattern(regexp = BOARD_ID_REGEX, message = BOARD_ID_MESSAGE) String boardId,
            @Valid @RequestBody BuildRequest request) {
        List<RankingKey> view = ingestionService.build(boardId, request.policy(), request.items());
        return ResponseEntity.ok(RankingEntryResponse.fromView(view));
    }

    /**
     * Applies a new snapshot with the policy the board was built with.
     */
    @PostMapping("/{boardId}/refresh")
    public ResponseEntity<RefreshResponse> refresh(
            @PathVariable @Pattern(regexp = BOARD_ID_REGEX, message = BOARD_ID_MESSAGE) String boardId,
            @Valid @RequestBody RefreshRequest request) {
        RefreshResult result = ingestionService.refresh(boardId, request.items());
        return ResponseEntity.ok(new RefreshResponse(
                RankingEntryResponse.fromView(result.view()),
                result.elapsedMillis(),
                result.stats()));
    }

    @GetMapping("/{boardId}/top")
    public ResponseEntity<List<RankingEntryResponse>> getTopK(
            @PathVariable @Pattern(regexp = BOARD_ID_REGEX, message = BOARD_ID_MESSAGE) String boardId,
            @RequestParam(defaultValue = "10") @Min(value = MIN_VIEW_LIMIT, message = "Limit must be at least "
                    + MIN_VIEW_LIMIT + ".") @Max(value = MAX_VIEW_LIMIT, message = "Limit cannot exceed "
                            + MAX_VIEW_LIMIT + ".") int limit) {
        return ResponseEntity.ok(queryService.getTopK(boardId, limit));
    }

    /**
     * The view as it was before the most recent refresh; empty until the first refresh.
     */
    @GetMapping("/{boardId}/previous")
    public ResponseEntity<List<RankingEntryResponse>> getPreviousTopK(
            @PathVariable @Pattern(regexp = BOARD_ID_REGEX, message = BOARD_ID_MESSAGE) String boardId,
            @RequestParam(defaultValue = "10") @Min(value = MIN_VIEW_LIMIT, message = "Limit must be at least "
                    + MIN_VIEW_LIMIT + ".") @Max(value = MAX_VIEW_LIMIT, message = "Limit cannot exceed "
                            + MAX_VIEW_LIMIT + ".") int limit) {
        return ResponseEntity.ok(queryService.getPreviousTopK(boardId, limit));
    }

    /**
     * Full metric tuples of a multi-metric board. Other boards answer with an empty list.
     */
    @GetMapping("/{boardId}/multi-metric")
    public ResponseEntity<List<MultiMetricEntryResponse>> getMultiMetricTopK(
            @PathVariable @Pattern(regexp = BOARD_ID_REGEX, message = BOARD_ID_MESSAGE) String boardId,
            @RequestParam(defaultValue = "10") @Min(value = MIN_VIEW_LIMIT, message = "Limit must be at least "
                    + MIN_VIEW_LIMIT + ".") @Max(value = MAX_VIEW_LIMIT, message = "Limit cannot exceed "
                            + MAX_VIEW_LIMIT + ".") int limit) {
        return ResponseEntity.ok(queryService.getMultiMetricTopK(boardId, limit));
    }

    @GetMapping("/{boardId}/items/{itemId}/rank")
    public ResponseEntity<RankResponse> getItemRank(
            @PathVariable @Pattern(regexp = BOARD_ID_REGEX, message = BOARD_ID_MESSAGE) String boardId,
            @PathVariable String itemId) {
        return ResponseEntity.ok(queryService.getItemRank(boardId, itemId));
    }

    /**
     * Point update of one ranked item. Only boards with an array-backed strategy accept it.
     */
    @PutMapping("/{boardId}/items/{itemId}/score")
    public ResponseEntity<Void> updateScore(
            @PathVariable @Pattern(regexp = BOARD_ID_REGEX, message = BOARD_ID_MESSAGE) String boardId,
            @PathVariable String itemId,
            @Valid @RequestBody ScoreUpdateRequest request) {
        ingestionService.updateScore(boardId, itemId, request.score());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{boardId}/stats")
    public ResponseEntity<StatsResponse> getStats(
            @PathVariable @Pattern(regexp = BOARD_ID_REGEX, message = BOARD_ID_MESSAGE) String boardId) {
        return ResponseEntity.ok(queryService.getStats(boardId));
    }

    @DeleteMapping("/{boardId}")
    public ResponseEntity<Void> deleteBoard(
            @PathVariable @Pattern(regexp = BOARD_ID_REGEX, message = BOARD_ID_MESSAGE) String boardId) {
        queryService.deleteBoard(boardId);
        return ResponseEntity.noContent().build();
    }
}
