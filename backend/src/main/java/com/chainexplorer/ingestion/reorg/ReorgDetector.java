package com.chainexplorer.ingestion.reorg;

import com.chainexplorer.ingestion.adapter.NodeBlock;
import com.chainexplorer.ingestion.adapter.NodeClient;
import com.chainexplorer.ingestion.error.DataIntegrityFaultException;
import com.chainexplorer.ingestion.error.ReorgBeyondLookbackException;
import com.chainexplorer.ingestion.store.ChainStore;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;

/**
 * Compares stored block hashes with the node's current view, oldest height first, so the reported height is
 * the true fork point and not the most recent mismatch.
 * <p>
 * Node failures propagate: an unreachable node is never read as "no reorg".
 */
@Slf4j
public class ReorgDetector {

    private final NodeClient nodeClient;
    private final ChainStore chainStore;
    private final long genesisHeight;
    private final boolean checkParentLink;

    /**
     * @param checkParentLink whether node blocks carry the parent's hash in {@code prevHash}; required to tell a
     *                        fork at the window start from one below it
     */
    public ReorgDetector(NodeClient nodeClient, ChainStore chainStore, long genesisHeight, boolean checkParentLink) {
        this.nodeClient = nodeClient;
        this.chainStore = chainStore;
        this.genesisHeight = genesisHeight;
        this.checkParentLink = checkParentLink;
    }

    /**
     * Verifies the trailing {@code depth} blocks up to {@code tip}.
     *
     * @throws ReorgBeyondLookbackException when the oldest verified block already differs and its parent link
     *                                      shows the fork is older than the window
     */
    public Optional<Divergence> findDivergence(long tip, int depth) {
        if (tip < genesisHeight || depth <= 0) {
            return Optional.empty();
        }
        long from = Math.max(genesisHeight, tip - depth + 1);
        return scan(from, tip, true);
    }

    /**
     * Operator-triggered verification of an explicit range, without the lookback bound.
     */
    public Optional<Divergence> verifyRange(long from, long to) {
        long start = Math.max(genesisHeight, from);
        if (to < start) {
            return Optional.empty();
        }
        return scan(start, to, false);
    }

    private Optional<Divergence> scan(long from, long to, boolean boundedByLookback) {
        for (long height = from; height <= to; height++) {
            long h = height;
            String localHash = chainStore.findBlockHash(height)
                    .orElseThrow(() -> new DataIntegrityFaultException("Stored chain has no block at height " + h, h));
            NodeBlock nodeBlock = nodeClient.getBlock(height);
            if (Objects.equals(localHash, nodeBlock.hash())) {
                continue;
            }
            log.warn("Hash mismatch at height {}: stored {} node {}", height, localHash, nodeBlock.hash());
            if (boundedByLookback && checkParentLink && height == from && height > genesisHeight) {
                ensureForkInsideWindow(nodeBlock);
            }
            return Optional.of(new Divergence(height, localHash, nodeBlock.hash()));
        }
        log.debug("Verified heights {}..{}: no divergence", from, to);
        return Optional.empty();
    }

    private void ensureForkInsideWindow(NodeBlock oldestChecked) {
        long parentHeight = oldestChecked.height() - 1;
        String storedParent = chainStore.findBlockHash(parentHeight).orElse(null);
        if (!Objects.equals(storedParent, oldestChecked.prevHash())) {
            throw new ReorgBeyondLookbackException(
                    "Node history differs below height " + oldestChecked.height()
                            + "; stored parent " + storedParent + " vs node parent " + oldestChecked.prevHash(),
                    oldestChecked.height());
        }
    }
}
