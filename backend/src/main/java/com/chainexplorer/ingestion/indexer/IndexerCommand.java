package com.chainexplorer.ingestion.indexer;

/**
 * Work items of the indexer queue. Timer-driven commands coalesce: at most one of each kind is pending.
 */
public enum IndexerCommand {
    POLL(true),
    RESYNC(true),
    VERIFY_RANGE(false),
    RESUME(false);

    private final boolean coalescing;

    IndexerCommand(boolean coalescing) {
        this.coalescing = coalescing;
    }

    public boolean isCoalescing() {
        return coalescing;
    }
}
