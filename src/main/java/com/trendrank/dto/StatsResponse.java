package com.trendrank.dto;

import com.trendrank.model.RankingStrategyType;

public record StatsResponse(
        String boardId,
        RankingStrategyType strategy,
        String algorithms,
        String buildComplexity,
        String refreshComplexity,
        int k,
        int size,
        double buildTimeMillis,
        double refreshTimeMillis,
        int refreshCount) {
}
