package com.trendrank.model;

/**
 * Metrics that can take part in a lexicographic multi-metric ranking.
 */
public enum MetricType {
    DELTA_VIEWS("DeltaViews"),
    DELTA_LIKES("DeltaLikes"),
    DELTA_COMMENTS("DeltaComments"),
    VIEWS("Views"),
    LIKES("Likes"),
    COMMENTS("Comments"),
    RECENCY("Recency"),
    DURATION("Duration"),
    ENGAGEMENT_RATE("EngagementRate"),
    CUSTOM_SCORE("CustomScore");

    private final String displayName;

    MetricType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Extracts this metric's value from an item.
     * Engagement rate is expressed in units of 0.01% (likes * 10000 / views).
     */
    public long valueOf(Item item) {
        ItemMetrics m = item.metrics();
        switch (this) {
            case DELTA_VIEWS:
                return m.deltaViews();
            case DELTA_LIKES:
                return m.deltaLikes();
            case DELTA_COMMENTS:
                return m.deltaComments();
            case VIEWS:
                return m.views();
            case LIKES:
                return m.likes();
            case COMMENTS:
                return m.comments();
            case RECENCY:
                return m.recency();
            case DURATION:
                return m.durationSeconds();
            case ENGAGEMENT_RATE:
                return m.views() > 0 ? m.likes() * 10000 / m.views() : 0;
            case CUSTOM_SCORE:
                return item.score();
            default:
                throw new IllegalStateException("Unhandled metric " + this);
        }
    }
}
