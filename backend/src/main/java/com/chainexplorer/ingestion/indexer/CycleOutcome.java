package com.chainexplorer.ingestion.indexer;

/**
 * Result of one indexer cycle.
 */
public enum CycleOutcome {
    /** Nothing new on the node. */
    IDLE,
    /** One or more blocks committed. */
    ADVANCED,
    /** Reorg check or manual verification found no divergence. */
    VERIFIED,
    /** Divergence resolved by a rollback (catch-up may have followed). */
    ROLLED_BACK,
    /** Indexer is halted; nothing was attempted. */
    SKIPPED_HALTED,
    /** Still inside the backoff window after node failures. */
    BACKING_OFF,
    NODE_UNAVAILABLE,
    /** The node no longer has a height it advertised or that is stored locally. */
    NODE_ANOMALY,
    STORE_UNAVAILABLE,
    /** An integrity fault or a beyond-lookback reorg halted the indexer in this cycle. */
    HALTED
}
