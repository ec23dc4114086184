package com.chainexplorer.ingestion.error;

/**
 * Base of the indexer failure taxonomy. Transient subtypes are retried; integrity subtypes halt indexing.
 */
public abstract class IndexerException extends RuntimeException {

    protected IndexerException(String message) {
        super(message);
    }

    protected IndexerException(String message, Throwable cause) {
        super(message, cause);
    }

    /** True when the failure clears by itself and the cycle can simply be retried. */
    public abstract boolean isTransient();
}
