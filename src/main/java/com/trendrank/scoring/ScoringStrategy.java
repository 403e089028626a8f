package com.trendrank.scoring;

import com.trendrank.model.ItemMetrics;

/**
 * Formulas turning raw view/like/comment counts into the integral score the engine ranks by.
 * Every result is clamped to [{@link #MIN_SCORE}, {@link #MAX_SCORE}].
 */
public enum ScoringStrategy {
    /**
     * Log-scaled views boosted by the like and comment rates (bonus capped at 100%).
     */
    ENGAGEMENT("Engagement Rate", "Views + engagement bonus (like/comment ratio)") {
        @Override
        double raw(long views, long likes, long comments) {
            double safeViews = Math.max(views, 1);
            double base = Math.log10(safeViews) * 100.0;
            double likeRate = likes / safeViews;
            double commentRate = comments / safeViews;
            double bonus = Math.min(likeRate * 1000.0 + commentRate * 5000.0, 100.0);
            return base * (1.0 + bonus / 100.0);
        }
    },
    /** One like weighs 50 views, one comment 200; the sum is log-compressed. */
    WEIGHTED("Weighted Sum", "Views*1 + Likes*50 + Comments*200") {
        @Override
        double raw(long views, long likes, long comments) {
            double sum = views * 1.0 + likes * 50.0 + comments * 200.0;
            return Math.log10(Math.max(1.0, sum)) * 1000.0;
        }
    },
    NORMALIZED("Normalized", "Balanced 0-1000 scale with caps") {
        @Override
        double raw(long views, long likes, long comments) {
            double composite = normalize(views, 15.0) * 0.5
                    + normalize(likes, 20.0) * 0.3
                    + normalize(comments, 25.0) * 0.2;
            return composite * 10.0;
        }
    },
    LEGACY("Legacy", "Original log-based formula") {
        @Override
        double raw(long views, long likes, long comments) {
            return Math.log10(Math.max(1L, views)) * 100.0
                    + Math.log10(Math.max(1L, likes)) * 200.0
                    + Math.log10(Math.max(1L, comments)) * 300.0;
        }
    };

    public static final long MIN_SCORE = 0;
    public static final long MAX_SCORE = 1_000_000;

    private final String displayName;
    private final String description;

    ScoringStrategy(String displayName, String description) {
        this.displayName = displayName;
        this.description = description;
    }

    abstract double raw(long views, long likes, long comments);

    public long score(long views, long likes, long comments) {
        return clamp((long) raw(views, likes, comments));
    }

    public long score(ItemMetrics metrics) {
        return score(metrics.views(), metrics.likes(), metrics.comments());
    }

    public String displayName() {
        return displayName;
    }

    public String description() {
        return description;
    }

    static long clamp(long rawScore) {
        if (rawScore < MIN_SCORE) {
            return MIN_SCORE;
        }
        return Math.min(rawScore, MAX_SCORE);
    }

    private static double normalize(long value, double multiplier) {
        if (value <= 0) {
            return 0.0;
        }
        return Math.min(100.0, Math.log10(value) * multiplier);
    }
}
