package com.chainexplorer.api.dto;

import java.time.Instant;

/**
 * GET /api/v1/indexer/throughput response.
 */
public record ThroughputResponse(
        double currentTps,
        double avgTps1h,
        double avgBlockTime,
        long blocks1h,
        long txs1h,
        long tipHeight,
        Instant computedAt
) {
}
