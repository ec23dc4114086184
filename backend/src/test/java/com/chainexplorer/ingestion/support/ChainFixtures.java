package com.chainexplorer.ingestion.support;

import com.chainexplorer.domain.ChainBlock;
import com.chainexplorer.domain.ChainTransaction;
import com.chainexplorer.domain.TxType;
import com.chainexplorer.ingestion.adapter.NodeBlock;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Hash-linked test chains. Hashes are "{fork}-{height}", so two forks differ exactly where they are built
 * separately. Every block carries one transfer from {@link #ALICE}, funded by a genesis allocation.
 */
public final class ChainFixtures {

    public static final String ALICE = "alice";
    public static final String BOB = "bob";
    public static final String CAROL = "carol";
    public static final String VALIDATOR = "validator-1";
    public static final BigInteger ALICE_GENESIS = BigInteger.valueOf(1_000_000);
    public static final long GENESIS_TIMESTAMP = 1_700_000_000L;
    public static final long BLOCK_TIME = 10L;

    private ChainFixtures() {
    }

    /**
     * Blocks {@code from..to} of a fork; block {@code from} links to {@code parentHash}.
     * Fork "a" pays bob 10 (fee 1) per block, any other fork pays carol 20 (fee 2).
     */
    public static List<NodeBlock> fork(String fork, long from, long to, String parentHash) {
        List<NodeBlock> blocks = new ArrayList<>();
        String prev = parentHash;
        for (long height = from; height <= to; height++) {
            boolean main = "a".equals(fork);
            NodeBlock block = block(fork, height, prev, List.of(transfer(fork + "-tx-" + height, height,
                    ALICE, main ? BOB : CAROL, main ? 10 : 20, main ? 1 : 2, height)));
            blocks.add(block);
            prev = block.hash();
        }
        return blocks;
    }

    /** Main chain "a" from genesis (height 0) to {@code to}. */
    public static List<NodeBlock> mainChain(long to) {
        return fork("a", 0, to, "");
    }

    public static String hash(String fork, long height) {
        return fork + "-" + height;
    }

    public static NodeBlock block(String fork, long height, String prevHash, List<ChainTransaction> txs) {
        ChainBlock block = new ChainBlock();
        block.setHeight(height);
        block.setHash(hash(fork, height));
        block.setPrevHash(prevHash);
        block.setTimestamp(GENESIS_TIMESTAMP + height * BLOCK_TIME);
        block.setChainId("testnet");
        block.setProposerAddress(VALIDATOR);
        block.setTxCount(txs.size());
        block.setTxRoot("txroot-" + fork + "-" + height);
        block.setStateRoot("state-" + fork + "-" + height);
        return new NodeBlock(block, txs);
    }

    public static ChainTransaction transfer(String hash, long height, String from, String to, long amount, long fee, long nonce) {
        return tx(hash, height, TxType.TRANSFER, from, to, amount, fee, nonce);
    }

    public static ChainTransaction tx(String hash, long height, TxType type, String from, String to,
                                      long amount, long fee, long nonce) {
        ChainTransaction tx = new ChainTransaction();
        tx.setHash(hash);
        tx.setBlockHeight(height);
        tx.setTxType(type);
        tx.setFromAddress(from);
        tx.setToAddress(to);
        tx.setAmount(BigInteger.valueOf(amount));
        tx.setFee(BigInteger.valueOf(fee));
        tx.setNonce(nonce);
        tx.setSignature("sig-" + hash);
        tx.setPubKey("pk-" + from);
        return tx;
    }
}
