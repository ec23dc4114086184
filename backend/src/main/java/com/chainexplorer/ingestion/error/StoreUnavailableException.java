package com.chainexplorer.ingestion.error;

/**
 * A commit or rollback could not be applied. The store is transactional, so nothing of the cycle is visible.
 */
public class StoreUnavailableException extends IndexerException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
