package com.chainexplorer.ingestion.adapter;

import com.chainexplorer.domain.ChainBlock;
import com.chainexplorer.domain.ChainTransaction;

import java.util.List;

/**
 * A block as the node currently reports it, with its transactions in block order.
 */
public record NodeBlock(ChainBlock block, List<ChainTransaction> transactions) {

    public NodeBlock {
        transactions = List.copyOf(transactions);
    }

    public long height() {
        return block.getHeight();
    }

    public String hash() {
        return block.getHash();
    }

    public String prevHash() {
        return block.getPrevHash();
    }
}
