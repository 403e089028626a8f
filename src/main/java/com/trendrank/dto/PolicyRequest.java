package com.trendrank.dto;

import java.util.List;

import com.trendrank.model.MetricType;
import com.trendrank.model.RankingStrategyType;
import com.trendrank.model.SelectAlgorithm;
import com.trendrank.model.SortAlgorithm;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/**
 * Ranking policy as submitted with a build request. Omitted algorithms and K take the service
 * defaults. {@code metricPreset} and {@code metrics} only matter for the multi-metric strategy;
 * an explicit metric list wins over a preset.
 */
public record PolicyRequest(
        @NotNull(message = "Strategy is required") RankingStrategyType strategy,
        SortAlgorithm sortAlgorithm,
        SelectAlgorithm selectAlgorithm,
        @Min(value = 1, message = "K must be at least 1.") Integer k,
        @Pattern(regexp = "^(default|trending|engagement)?$", message = "Metric preset must be one of 'default', 'trending', 'engagement'.") String metricPreset,
        List<MetricType> metrics) {
}
