package com.trendrank.model;

import java.util.Objects;

/**
 * Lightweight ranking key used by all single-metric strategies instead of the full {@link Item}.
 * Implements Comparable for ranking order (highest score first, then title ascending).
 * <p>
 * Equality is identity by {@code id} only, so {@code compareTo} is not consistent with
 * {@code equals}: two keys with the same score and title compare as equal even when their ids differ.
 */
public record RankingKey(long score, String id, String title) implements Comparable<RankingKey> {

    /**
     * Placeholder stored in lazily deleted slots. Ranks behind every real key. Recognised by
     * reference, so a real key never counts as deleted.
     */
    public static final RankingKey DELETED = new RankingKey(Long.MIN_VALUE, "", "");

    public RankingKey {
        Objects.requireNonNull(id, "id");
        title = title == null ? "" : title;
    }

    /**
     * Primary sort: score descending. Secondary sort: title ascending.
     *
     * @param other the key to compare against
     * @return a negative integer when this key ranks ahead of {@code other}
     */
    @Override
    public int compareTo(RankingKey other) {
        int scoreCompare = Long.compare(other.score, this.score);
        if (scoreCompare != 0) {
            return scoreCompare;
        }
        return this.title.compareTo(other.title);
    }

    public boolean ranksAheadOf(RankingKey other) {
        return compareTo(other) < 0;
    }

    public boolean isDeleted() {
        return this == DELETED;
    }

    public RankingKey withScore(long newScore) {
        return new RankingKey(newScore, id, title);
    }

    /**
     * @return true when score and title match, i.e. both keys occupy the same rank position
     */
    public boolean sameRanking(RankingKey other) {
        return other != null && score == other.score && title.equals(other.title);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return id.equals(((RankingKey) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }
}
