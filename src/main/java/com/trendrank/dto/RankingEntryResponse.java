package com.trendrank.dto;

import java.util.ArrayList;
import java.util.List;

import com.trendrank.model.RankingKey;

/**
 * One row of a ranked view. {@code rank} is 1-based.
 */
public record RankingEntryResponse(int rank, String id, String title, long score) {

    public static List<RankingEntryResponse> fromView(List<RankingKey> view) {
        List<RankingEntryResponse> responses = new ArrayList<>(view.size());
        int rank = 1;
        for (RankingKey key : view) {
            responses.add(new RankingEntryResponse(rank++, key.id(), key.title(), key.score()));
        }
        return responses;
    }
}
