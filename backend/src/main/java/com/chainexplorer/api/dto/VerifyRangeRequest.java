package com.chainexplorer.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * POST /api/v1/indexer/verify body: inclusive height range to re-check against the node.
 */
public record VerifyRangeRequest(
        @NotNull @PositiveOrZero Long fromHeight,
        @NotNull @PositiveOrZero Long toHeight
) {
}
