package com.trendrank.dto;

/**
 * Position of one item inside a board's view. {@code percentile} is relative to the view size.
 */
public record RankResponse(String id, int rank, long score, int viewSize, double percentile) {
}
