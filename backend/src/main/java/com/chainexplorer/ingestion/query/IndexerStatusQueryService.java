package com.chainexplorer.ingestion.query;

import com.chainexplorer.config.CaffeineConfig;
import com.chainexplorer.domain.IndexerPhase;
import com.chainexplorer.domain.ReorgEvent;
import com.chainexplorer.domain.ReorgEventRepository;
import com.chainexplorer.domain.SyncState;
import com.chainexplorer.domain.SyncStateRepository;
import com.chainexplorer.domain.ThroughputSnapshot;
import com.chainexplorer.domain.ThroughputSnapshotRepository;
import com.chainexplorer.ingestion.config.IndexerProperties;
import com.chainexplorer.ingestion.indexer.ChainIndexer;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Read-only indexer views for the operator API (GET /indexer/status, /throughput, /reorgs).
 */
@Service
@RequiredArgsConstructor
public class IndexerStatusQueryService {

    private final SyncStateRepository syncStateRepository;
    private final ThroughputSnapshotRepository throughputSnapshotRepository;
    private final ReorgEventRepository reorgEventRepository;
    private final ChainIndexer chainIndexer;
    private final IndexerProperties properties;
    private final Clock clock;

    @Cacheable(cacheNames = CaffeineConfig.INDEXER_STATUS_CACHE, key = "'status'")
    public IndexerStatus currentStatus() {
        SyncState state = syncStateRepository.findById(SyncState.SINGLETON_ID)
                .orElseGet(() -> SyncState.initial(properties.getGenesisHeight()));
        boolean halted = state.isHalted() || chainIndexer.isHalted();
        IndexerPhase phase = halted ? IndexerPhase.HALTED : chainIndexer.getPhase();
        Instant pausedUntil = chainIndexer.getPausedUntil();
        Instant backoffUntil = pausedUntil.isAfter(clock.instant()) ? pausedUntil : null;
        return new IndexerStatus(
                state.getIndexedHeight(),
                state.getTipHash(),
                phase,
                halted,
                state.getHaltReason() != null ? state.getHaltReason() : chainIndexer.getHaltReason(),
                state.getHaltedAt(),
                state.getLastPollAt(),
                state.getLastCommitAt(),
                backoffUntil,
                state.getTotalFees(),
                state.getTotalLocked());
    }

    @Cacheable(cacheNames = CaffeineConfig.INDEXER_STATUS_CACHE, key = "'throughput'")
    public ThroughputSnapshot currentThroughput() {
        return throughputSnapshotRepository.findById(ThroughputSnapshot.SINGLETON_ID)
                .orElseGet(() -> ThroughputSnapshot.empty(
                        syncStateRepository.findById(SyncState.SINGLETON_ID)
                                .map(SyncState::getIndexedHeight)
                                .orElse(properties.getGenesisHeight() - 1),
                        clock.instant()));
    }

    public List<ReorgEvent> recentReorgs(int limit) {
        int size = Math.max(1, Math.min(limit, 500));
        return reorgEventRepository.findAllByOrderByDetectedAtDesc(PageRequest.of(0, size));
    }
}
