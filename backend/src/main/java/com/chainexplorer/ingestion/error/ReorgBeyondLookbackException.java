package com.chainexplorer.ingestion.error;

/**
 * The node's history differs below the verified window. The indexer does not guess how far back to go.
 */
public class ReorgBeyondLookbackException extends IndexerException {

    private final long oldestCheckedHeight;

    public ReorgBeyondLookbackException(String message, long oldestCheckedHeight) {
        super(message);
        this.oldestCheckedHeight = oldestCheckedHeight;
    }

    public long getOldestCheckedHeight() {
        return oldestCheckedHeight;
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
