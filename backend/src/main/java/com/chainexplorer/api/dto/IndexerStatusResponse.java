package com.chainexplorer.api.dto;

import java.time.Instant;

/**
 * GET /api/v1/indexer/status response. Totals are base-unit decimal strings.
 */
public record IndexerStatusResponse(
        long indexedHeight,
        String tipHash,
        String phase,
        boolean halted,
        String haltReason,
        Instant haltedAt,
        Instant lastPollAt,
        Instant lastCommitAt,
        Instant backoffUntil,
        String totalFees,
        String totalLocked
) {
}
