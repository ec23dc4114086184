package com.chainexplorer.ingestion.adapter;

/**
 * Read-only view of the chain node. Every call is idempotent and safe to retry.
 */
public interface NodeClient {

    /**
     * Current head height of the node.
     *
     * @throws com.chainexplorer.ingestion.error.NodeNotFoundException when the node has produced no block yet
     * @throws com.chainexplorer.ingestion.error.NodeUnavailableException on any transport failure
     */
    long currentHeight();

    /**
     * Block and transactions at the given height on the node's canonical chain.
     *
     * @throws com.chainexplorer.ingestion.error.NodeNotFoundException when the height is not produced
     * @throws com.chainexplorer.ingestion.error.NodeUnavailableException on any transport failure
     */
    NodeBlock getBlock(long height);

    /**
     * Block by hash, including blocks no longer canonical if the node still knows them.
     */
    NodeBlock getBlockByHash(String hash);
}
