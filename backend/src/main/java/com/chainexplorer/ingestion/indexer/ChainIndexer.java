package com.chainexplorer.ingestion.indexer;

import com.chainexplorer.common.RetryPolicy;
import com.chainexplorer.domain.ChainBlock;
import com.chainexplorer.domain.IndexerPhase;
import com.chainexplorer.domain.ReorgTrigger;
import com.chainexplorer.domain.SyncState;
import com.chainexplorer.ingestion.adapter.NodeBlock;
import com.chainexplorer.ingestion.adapter.NodeClient;
import com.chainexplorer.ingestion.aggregation.BlockAggregator;
import com.chainexplorer.ingestion.aggregation.BlockDelta;
import com.chainexplorer.ingestion.aggregation.ThroughputCalculator;
import com.chainexplorer.ingestion.config.IndexerProperties;
import com.chainexplorer.ingestion.error.DataIntegrityFaultException;
import com.chainexplorer.ingestion.error.IndexerException;
import com.chainexplorer.ingestion.error.NodeNotFoundException;
import com.chainexplorer.ingestion.error.NodeUnavailableException;
import com.chainexplorer.ingestion.error.ReorgBeyondLookbackException;
import com.chainexplorer.ingestion.error.StoreUnavailableException;
import com.chainexplorer.ingestion.reorg.Divergence;
import com.chainexplorer.ingestion.reorg.ReorgDetector;
import com.chainexplorer.ingestion.store.ChainStore;
import com.chainexplorer.ingestion.store.RollbackResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Indexer state machine: catch-up from the stored tip to the node head, periodic reorg checks, operator range
 * verification and resume. Every cycle runs inside the {@link WriterGuard}, so at most one cycle mutates the
 * store at any time.
 * <p>
 * Transient failures (node or store unavailable) leave the store untouched and are retried on later ticks,
 * node failures with exponential backoff. Integrity faults and reorgs deeper than the lookback window halt the
 * indexer until an operator resumes it.
 */
@Slf4j
public class ChainIndexer {

    private final NodeClient nodeClient;
    private final ChainStore chainStore;
    private final BlockAggregator aggregator;
    private final ReorgDetector reorgDetector;
    private final ThroughputCalculator throughputCalculator;
    private final WriterGuard writerGuard;
    private final IndexerProperties properties;
    private final RetryPolicy backoffPolicy;
    private final Clock clock;

    private volatile IndexerPhase phase = IndexerPhase.CATCHING_UP;
    private volatile String haltReason;
    private int consecutiveNodeFailures;
    private volatile Instant pausedUntil = Instant.MIN;
    private int consecutiveParentMismatches;

    public ChainIndexer(NodeClient nodeClient,
                        ChainStore chainStore,
                        BlockAggregator aggregator,
                        ReorgDetector reorgDetector,
                        ThroughputCalculator throughputCalculator,
                        WriterGuard writerGuard,
                        IndexerProperties properties,
                        RetryPolicy backoffPolicy,
                        Clock clock) {
        this.nodeClient = nodeClient;
        this.chainStore = chainStore;
        this.aggregator = aggregator;
        this.reorgDetector = reorgDetector;
        this.throughputCalculator = throughputCalculator;
        this.writerGuard = writerGuard;
        this.properties = properties;
        this.backoffPolicy = backoffPolicy;
        this.clock = clock;
    }

    /**
     * One catch-up tick: commits blocks from tip+1 towards the node head, up to the per-tick limit.
     */
    public CycleOutcome pollTick() {
        return writerGuard.runExclusive("poll", () -> runCycle("poll", this::catchUp));
    }

    /**
     * One reorg check over the trailing lookback window, followed by catch-up when a rollback happened.
     */
    public CycleOutcome resyncTick() {
        return writerGuard.runExclusive("resync", () -> runCycle("resync", this::checkForReorg));
    }

    /**
     * Operator-triggered hash verification of {@code [fromHeight, toHeight]}, clamped to the stored tip.
     *
     * @throws IllegalArgumentException for an empty, inverted or oversized range
     */
    public CycleOutcome verifyRange(long fromHeight, long toHeight) {
        validateRange(fromHeight, toHeight);
        return writerGuard.runExclusive("verify", () -> runCycle("verify", () -> verify(fromHeight, toHeight)));
    }

    /**
     * Clears a halt so the next tick resumes from the stored tip.
     */
    public void resume() {
        writerGuard.runExclusive("resume", () -> {
            chainStore.clearHalt();
            log.info("Indexer resumed by operator (was halted: {})", haltReason);
            haltReason = null;
            consecutiveNodeFailures = 0;
            consecutiveParentMismatches = 0;
            pausedUntil = Instant.MIN;
            phase = IndexerPhase.CATCHING_UP;
            return null;
        });
    }

    public IndexerPhase getPhase() {
        return phase;
    }

    public boolean isHalted() {
        return haltReason != null;
    }

    public String getHaltReason() {
        return haltReason;
    }

    /** End of the current node backoff window, or {@link Instant#MIN} when not backing off. */
    public Instant getPausedUntil() {
        return pausedUntil;
    }

    public void validateRange(long fromHeight, long toHeight) {
        if (fromHeight < 0 || toHeight < fromHeight) {
            throw new IllegalArgumentException("Invalid range " + fromHeight + ".." + toHeight);
        }
        if (toHeight - fromHeight + 1 > properties.getMaxVerifyRange()) {
            throw new IllegalArgumentException("Range " + fromHeight + ".." + toHeight
                    + " exceeds " + properties.getMaxVerifyRange() + " blocks");
        }
    }

    private CycleOutcome runCycle(String cycle, Supplier<CycleOutcome> body) {
        try {
            SyncState state = chainStore.loadSyncState();
            if (state.isHalted() || haltReason != null) {
                haltReason = haltReason != null ? haltReason : state.getHaltReason();
                phase = IndexerPhase.HALTED;
                log.debug("Skipping {}: indexer halted ({})", cycle, haltReason);
                return CycleOutcome.SKIPPED_HALTED;
            }
            return body.get();
        } catch (NodeUnavailableException e) {
            return onNodeUnavailable(cycle, e);
        } catch (NodeNotFoundException e) {
            log.error("Node anomaly during {}: {}", cycle, e.getMessage());
            return CycleOutcome.NODE_ANOMALY;
        } catch (StoreUnavailableException e) {
            log.warn("Store unavailable during {}, retrying on next tick: {}", cycle, e.getMessage());
            return CycleOutcome.STORE_UNAVAILABLE;
        } catch (DataIntegrityFaultException | ReorgBeyondLookbackException e) {
            halt(cycle, e);
            return CycleOutcome.HALTED;
        }
    }

    private CycleOutcome catchUp() {
        Instant now = clock.instant();
        if (now.isBefore(pausedUntil)) {
            log.debug("Catch-up paused until {}", pausedUntil);
            return CycleOutcome.BACKING_OFF;
        }
        long head;
        try {
            head = nodeClient.currentHeight();
        } catch (NodeNotFoundException e) {
            log.debug("Node reports no blocks yet");
            nodeRecovered();
            return CycleOutcome.IDLE;
        }
        nodeRecovered();

        SyncState state = chainStore.loadSyncState();
        long tip = state.getIndexedHeight();
        int committed = 0;
        int rolledBack = 0;
        while (tip < head && committed < properties.getMaxBlocksPerTick()) {
            phase = IndexerPhase.CATCHING_UP;
            NodeBlock next = nodeClient.getBlock(tip + 1);
            if (!linksTo(next, state)) {
                RollbackResult result = rollBackParentMismatch(next, state);
                rolledBack += result.blocksRolledBack();
                state = chainStore.loadSyncState();
                tip = state.getIndexedHeight();
                continue;
            }
            BlockDelta delta = aggregator.applyBlock(next.block(), next.transactions());
            state = chainStore.commitBlock(next, delta, IndexerPhase.CATCHING_UP);
            tip = state.getIndexedHeight();
            committed++;
            consecutiveParentMismatches = 0;
        }

        phase = tip >= head ? IndexerPhase.SYNCED : IndexerPhase.CATCHING_UP;
        chainStore.recordPoll(now, phase);
        refreshThroughput(tip);
        if (committed > 0) {
            log.debug("Committed {} block(s), tip {} head {}", committed, tip, head);
        }
        if (rolledBack > 0) {
            return CycleOutcome.ROLLED_BACK;
        }
        return committed > 0 ? CycleOutcome.ADVANCED : CycleOutcome.IDLE;
    }

    private CycleOutcome checkForReorg() {
        long tip = chainStore.loadSyncState().getIndexedHeight();
        IndexerPhase before = phase;
        phase = IndexerPhase.REORG_CHECK;
        Optional<Divergence> divergence = reorgDetector.findDivergence(tip, properties.getResyncDepth());
        if (divergence.isEmpty()) {
            phase = before;
            return CycleOutcome.VERIFIED;
        }
        return rollBackAndCatchUp(divergence.get(), ReorgTrigger.RESYNC_CHECK);
    }

    private CycleOutcome verify(long fromHeight, long toHeight) {
        long tip = chainStore.loadSyncState().getIndexedHeight();
        long to = Math.min(toHeight, tip);
        IndexerPhase before = phase;
        phase = IndexerPhase.REORG_CHECK;
        Optional<Divergence> divergence = reorgDetector.verifyRange(fromHeight, to);
        if (divergence.isEmpty()) {
            log.info("Verified heights {}..{}: stored hashes match the node", fromHeight, to);
            phase = before;
            return CycleOutcome.VERIFIED;
        }
        return rollBackAndCatchUp(divergence.get(), ReorgTrigger.MANUAL_VERIFY);
    }

    private CycleOutcome rollBackAndCatchUp(Divergence divergence, ReorgTrigger trigger) {
        RollbackResult result = rollBack(divergence.height(), trigger, divergence.nodeHash());
        refreshThroughput(result.newTip());
        CycleOutcome afterCatchUp = catchUp();
        if (afterCatchUp == CycleOutcome.ROLLED_BACK || afterCatchUp == CycleOutcome.ADVANCED
                || afterCatchUp == CycleOutcome.IDLE) {
            return CycleOutcome.ROLLED_BACK;
        }
        return afterCatchUp;
    }

    private RollbackResult rollBackParentMismatch(NodeBlock next, SyncState state) {
        consecutiveParentMismatches++;
        long tip = state.getIndexedHeight();
        if (consecutiveParentMismatches > properties.getResyncDepth()) {
            throw new ReorgBeyondLookbackException("Parent link still broken after rolling back "
                    + (consecutiveParentMismatches - 1) + " block(s); fork is older than height " + (tip + 1),
                    tip + 1);
        }
        log.warn("Block {} parent {} ({}) does not match stored tip {} ({}), rolling back tip",
                next.height(), next.prevHash(), describeNodeBlock(next.prevHash()), tip, state.getTipHash());
        return rollBack(tip, ReorgTrigger.PARENT_MISMATCH, null);
    }

    private String describeNodeBlock(String hash) {
        if (hash == null) {
            return "no parent hash";
        }
        try {
            return "node height " + nodeClient.getBlockByHash(hash).height();
        } catch (NodeNotFoundException e) {
            return "unknown to node";
        }
    }

    private RollbackResult rollBack(long fromHeight, ReorgTrigger trigger, String newHash) {
        phase = IndexerPhase.ROLLING_BACK;
        RollbackResult result = chainStore.rollbackFrom(fromHeight, trigger, newHash);
        log.warn("Reorg ({}): rolled back {} block(s) from height {}, tip {} -> {}, {} account(s) touched",
                trigger, result.blocksRolledBack(), fromHeight, result.previousTip(), result.newTip(),
                result.touchedAccounts().size());
        phase = IndexerPhase.CATCHING_UP;
        return result;
    }

    private boolean linksTo(NodeBlock next, SyncState state) {
        if (!properties.isVerifyParentLink() || next.height() <= aggregator.getGenesisHeight()) {
            return true;
        }
        return Objects.equals(next.prevHash(), state.getTipHash());
    }

    private void refreshThroughput(long tip) {
        try {
            Instant now = clock.instant();
            long nowSeconds = now.getEpochSecond();
            List<ChainBlock> recent = chainStore.findBlocksAfterTimestamp(nowSeconds - throughputCalculator.getWindowSeconds());
            chainStore.saveThroughput(throughputCalculator.compute(recent, nowSeconds, tip, now));
        } catch (StoreUnavailableException e) {
            log.warn("Throughput refresh skipped, kept previous snapshot: {}", e.getMessage());
        }
    }

    private CycleOutcome onNodeUnavailable(String cycle, NodeUnavailableException e) {
        if (!"poll".equals(cycle)) {
            log.warn("Node unavailable during {}, retrying on next interval: {}", cycle, e.getMessage());
            return CycleOutcome.NODE_UNAVAILABLE;
        }
        long delay = backoffPolicy.delayMs(consecutiveNodeFailures);
        consecutiveNodeFailures++;
        pausedUntil = clock.instant().plusMillis(delay);
        log.warn("Node unavailable ({} consecutive), pausing catch-up for {} ms: {}",
                consecutiveNodeFailures, delay, e.getMessage());
        return CycleOutcome.NODE_UNAVAILABLE;
    }

    private void nodeRecovered() {
        if (consecutiveNodeFailures > 0) {
            log.info("Node reachable again after {} failed tick(s)", consecutiveNodeFailures);
        }
        consecutiveNodeFailures = 0;
        pausedUntil = Instant.MIN;
    }

    private void halt(String cycle, IndexerException e) {
        String reason = e.getClass().getSimpleName() + ": " + e.getMessage();
        haltReason = reason;
        phase = IndexerPhase.HALTED;
        log.error("Indexer halted during {}: {}", cycle, reason, e);
        try {
            chainStore.recordHalt(reason);
        } catch (StoreUnavailableException storeDown) {
            log.error("Could not persist halt, indexer stays halted in memory: {}", storeDown.getMessage());
        }
    }
}
