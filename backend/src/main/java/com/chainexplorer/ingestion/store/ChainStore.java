package com.chainexplorer.ingestion.store;

import com.chainexplorer.domain.ChainBlock;
import com.chainexplorer.domain.ChainTransaction;
import com.chainexplorer.domain.IndexerPhase;
import com.chainexplorer.domain.ReorgTrigger;
import com.chainexplorer.domain.SyncState;
import com.chainexplorer.domain.ThroughputSnapshot;
import com.chainexplorer.ingestion.adapter.NodeBlock;
import com.chainexplorer.ingestion.aggregation.BlockDelta;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Transactional persistence of the chain replica. Multi-row writes are all-or-nothing; readers never see a
 * block without its transactions or a half-applied account delta.
 * <p>
 * Failures surface as {@link com.chainexplorer.ingestion.error.StoreUnavailableException} (retry from the
 * unchanged prior state) or {@link com.chainexplorer.ingestion.error.DataIntegrityFaultException}.
 */
public interface ChainStore {

    /** Persisted sync state, or the initial state when nothing was ever written. */
    SyncState loadSyncState();

    Optional<ChainBlock> findBlock(long height);

    Optional<String> findBlockHash(long height);

    List<ChainTransaction> findTransactions(long height);

    /** Blocks with a timestamp strictly after the given epoch second. */
    List<ChainBlock> findBlocksAfterTimestamp(long epochSeconds);

    /**
     * Atomically stores the block and its transactions, applies the account deltas and advances the tip.
     * The block must be exactly one above the current tip.
     */
    SyncState commitBlock(NodeBlock block, BlockDelta delta, IndexerPhase phase);

    /**
     * Atomically reverts and deletes every stored block at or above {@code fromHeight}, from the tip down,
     * recomputes history-derived account fields, sets the tip to {@code fromHeight - 1} and records a reorg event.
     *
     * @param newHash node's hash at the divergence height, for the audit record (may be null)
     */
    RollbackResult rollbackFrom(long fromHeight, ReorgTrigger trigger, String newHash);

    void recordPoll(Instant at, IndexerPhase phase);

    void recordHalt(String reason);

    void clearHalt();

    void saveThroughput(ThroughputSnapshot snapshot);
}
