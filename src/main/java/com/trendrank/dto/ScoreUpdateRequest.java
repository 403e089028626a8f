package com.trendrank.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record ScoreUpdateRequest(
        @NotNull(message = "Score is required") @PositiveOrZero(message = "Score cannot be negative") Long score) {
}
