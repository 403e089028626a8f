package com.trendrank.dto;

import java.util.ArrayList;
import java.util.List;

import com.trendrank.model.MultiMetricKey;

public record MultiMetricEntryResponse(int rank, String id, String title, List<Long> metrics) {

    public static List<MultiMetricEntryResponse> fromView(List<MultiMetricKey> view) {
        List<MultiMetricEntryResponse> responses = new ArrayList<>(view.size());
        int rank = 1;
        for (MultiMetricKey key : view) {
            List<Long> metrics = new ArrayList<>(key.size());
            for (long value : key.metrics()) {
                metrics.add(value);
            }
            responses.add(new MultiMetricEntryResponse(rank++, key.id(), key.title(), metrics));
        }
        return responses;
    }
}
