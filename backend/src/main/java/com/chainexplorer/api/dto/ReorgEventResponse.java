package com.chainexplorer.api.dto;

import java.time.Instant;

public record ReorgEventResponse(
        long divergenceHeight,
        String oldHash,
        String newHash,
        long previousTip,
        int blocksRolledBack,
        String trigger,
        Instant detectedAt
) {
}
