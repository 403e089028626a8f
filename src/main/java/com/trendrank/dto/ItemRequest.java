package com.trendrank.dto;

import com.trendrank.model.ItemMetrics;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

/**
 * One item of a submitted snapshot. {@code score} may be omitted, in which case the board's scoring
 * strategy derives it from views, likes and comments.
 */
public record ItemRequest(
        @NotBlank(message = "Item id is required") @Size(max = 128, message = "Item id cannot exceed 128 characters") String id,
        @Size(max = 512, message = "Title cannot exceed 512 characters") String title,
        Long score,
        @PositiveOrZero(message = "Views cannot be negative") long views,
        @PositiveOrZero(message = "Likes cannot be negative") long likes,
        @PositiveOrZero(message = "Comments cannot be negative") long comments,
        long deltaViews,
        long deltaLikes,
        long deltaComments,
        long recency,
        @PositiveOrZero(message = "Duration cannot be negative") long durationSeconds) {

    public ItemMetrics toMetrics() {
        return new ItemMetrics(views, likes, comments, deltaViews, deltaLikes, deltaComments, recency,
                durationSeconds);
    }
}
