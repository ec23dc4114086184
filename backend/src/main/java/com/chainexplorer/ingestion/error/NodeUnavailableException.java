package com.chainexplorer.ingestion.error;

/**
 * The chain node could not be reached or returned an unusable response. Never a signal of a rollback.
 */
public class NodeUnavailableException extends IndexerException {

    public NodeUnavailableException(String message) {
        super(message);
    }

    public NodeUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
