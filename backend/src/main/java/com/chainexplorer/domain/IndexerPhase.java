package com.chainexplorer.domain;

/**
 * Phases of the indexer state machine, persisted in sync_state for operators.
 */
public enum IndexerPhase {
    CATCHING_UP,
    SYNCED,
    REORG_CHECK,
    ROLLING_BACK,
    HALTED
}
