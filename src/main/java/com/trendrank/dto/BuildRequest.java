package com.trendrank.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record BuildRequest(
        @NotNull(message = "Policy is required") @Valid PolicyRequest policy,
        @NotNull(message = "Items are required") List<@Valid ItemRequest> items) {
}
