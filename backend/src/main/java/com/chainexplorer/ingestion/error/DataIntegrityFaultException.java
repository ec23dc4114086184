package com.chainexplorer.ingestion.error;

/**
 * An invariant of the replica would be violated (negative balance, malformed block, broken hash chain).
 * Indexing halts until an operator resumes it.
 */
public class DataIntegrityFaultException extends IndexerException {

    private final Long height;

    public DataIntegrityFaultException(String message, Long height) {
        super(message);
        this.height = height;
    }

    public DataIntegrityFaultException(String message, Long height, Throwable cause) {
        super(message, cause);
        this.height = height;
    }

    /** Height at which the fault was found, null when not tied to a block. */
    public Long getHeight() {
        return height;
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
