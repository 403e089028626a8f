package com.trendrank.dto;

import java.util.List;

import com.trendrank.model.RefreshStats;

public record RefreshResponse(List<RankingEntryResponse> entries, double elapsedMillis, RefreshStats stats) {
}
