package com.chainexplorer.ingestion.error;

/**
 * The node does not know the requested height or hash.
 */
public class NodeNotFoundException extends IndexerException {

    public NodeNotFoundException(String message) {
        super(message);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
