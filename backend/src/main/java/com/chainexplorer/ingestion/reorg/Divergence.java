package com.chainexplorer.ingestion.reorg;

/**
 * Lowest height at which the stored hash differs from the node's current hash.
 */
public record Divergence(long height, String localHash, String nodeHash) {
}
