package com.chainexplorer.ingestion.query;

import com.chainexplorer.domain.IndexerPhase;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Point-in-time view of the indexer for operators.
 */
public record IndexerStatus(
        long indexedHeight,
        String tipHash,
        IndexerPhase phase,
        boolean halted,
        String haltReason,
        Instant haltedAt,
        Instant lastPollAt,
        Instant lastCommitAt,
        Instant backoffUntil,
        BigInteger totalFees,
        BigInteger totalLocked
) {
}
