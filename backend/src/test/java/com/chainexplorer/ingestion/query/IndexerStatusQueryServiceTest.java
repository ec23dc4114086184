package com.chainexplorer.ingestion.query;

import com.chainexplorer.domain.IndexerPhase;
import com.chainexplorer.domain.ReorgEventRepository;
import com.chainexplorer.domain.SyncState;
import com.chainexplorer.domain.SyncStateRepository;
import com.chainexplorer.domain.ThroughputSnapshot;
import com.chainexplorer.domain.ThroughputSnapshotRepository;
import com.chainexplorer.ingestion.config.IndexerProperties;
import com.chainexplorer.ingestion.indexer.ChainIndexer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IndexerStatusQueryServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private SyncStateRepository syncStateRepository;
    @Mock
    private ThroughputSnapshotRepository throughputSnapshotRepository;
    @Mock
    private ReorgEventRepository reorgEventRepository;
    @Mock
    private ChainIndexer chainIndexer;

    private IndexerStatusQueryService service;

    @BeforeEach
    void setUp() {
        service = new IndexerStatusQueryService(syncStateRepository, throughputSnapshotRepository,
                reorgEventRepository, chainIndexer, new IndexerProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("status combines the persisted sync state with the live phase")
    void currentStatus_running_usesLivePhase() {
        SyncState state = SyncState.initial(0);
        state.setIndexedHeight(120);
        state.setTipHash("a-120");
        state.setTotalFees(BigInteger.valueOf(121));
        when(syncStateRepository.findById(SyncState.SINGLETON_ID)).thenReturn(Optional.of(state));
        when(chainIndexer.isHalted()).thenReturn(false);
        when(chainIndexer.getPhase()).thenReturn(IndexerPhase.SYNCED);
        when(chainIndexer.getPausedUntil()).thenReturn(Instant.EPOCH);
        when(chainIndexer.getHaltReason()).thenReturn(null);

        IndexerStatus status = service.currentStatus();

        assertThat(status.indexedHeight()).isEqualTo(120);
        assertThat(status.tipHash()).isEqualTo("a-120");
        assertThat(status.phase()).isEqualTo(IndexerPhase.SYNCED);
        assertThat(status.halted()).isFalse();
        assertThat(status.backoffUntil()).isNull();
        assertThat(status.totalFees()).isEqualTo(BigInteger.valueOf(121));
    }

    @Test
    @DisplayName("persisted halt wins over the live phase and reports its reason")
    void currentStatus_haltedInStore_reportsHalted() {
        SyncState state = SyncState.initial(0);
        state.setHalted(true);
        state.setHaltReason("Negative balance for bob");
        state.setHaltedAt(NOW.minusSeconds(30));
        when(syncStateRepository.findById(SyncState.SINGLETON_ID)).thenReturn(Optional.of(state));
        when(chainIndexer.getPausedUntil()).thenReturn(Instant.EPOCH);

        IndexerStatus status = service.currentStatus();

        assertThat(status.phase()).isEqualTo(IndexerPhase.HALTED);
        assertThat(status.halted()).isTrue();
        assertThat(status.haltReason()).isEqualTo("Negative balance for bob");
        assertThat(status.haltedAt()).isEqualTo(NOW.minusSeconds(30));
    }

    @Test
    @DisplayName("halt only known in memory (store was down) is still reported")
    void currentStatus_haltedInMemory_reportsHalted() {
        when(syncStateRepository.findById(SyncState.SINGLETON_ID)).thenReturn(Optional.empty());
        when(chainIndexer.isHalted()).thenReturn(true);
        when(chainIndexer.getHaltReason()).thenReturn("Reorg below lookback at 41");
        when(chainIndexer.getPausedUntil()).thenReturn(Instant.EPOCH);

        IndexerStatus status = service.currentStatus();

        assertThat(status.indexedHeight()).isEqualTo(-1);
        assertThat(status.phase()).isEqualTo(IndexerPhase.HALTED);
        assertThat(status.haltReason()).isEqualTo("Reorg below lookback at 41");
    }

    @Test
    @DisplayName("future pause is reported as backoff")
    void currentStatus_backingOff_reportsBackoffUntil() {
        when(syncStateRepository.findById(SyncState.SINGLETON_ID)).thenReturn(Optional.empty());
        when(chainIndexer.isHalted()).thenReturn(false);
        when(chainIndexer.getPhase()).thenReturn(IndexerPhase.CATCHING_UP);
        when(chainIndexer.getPausedUntil()).thenReturn(NOW.plusSeconds(4));

        assertThat(service.currentStatus().backoffUntil()).isEqualTo(NOW.plusSeconds(4));
    }

    @Test
    @DisplayName("missing throughput snapshot yields an empty one at the indexed height")
    void currentThroughput_noSnapshot_empty() {
        SyncState state = SyncState.initial(0);
        state.setIndexedHeight(42);
        when(throughputSnapshotRepository.findById(ThroughputSnapshot.SINGLETON_ID)).thenReturn(Optional.empty());
        when(syncStateRepository.findById(SyncState.SINGLETON_ID)).thenReturn(Optional.of(state));

        ThroughputSnapshot snapshot = service.currentThroughput();

        assertThat(snapshot.getTipHeight()).isEqualTo(42);
        assertThat(snapshot.getCurrentTps()).isZero();
        assertThat(snapshot.getComputedAt()).isEqualTo(NOW);
    }

    @Test
    @DisplayName("reorg history limit is clamped")
    void recentReorgs_clampsLimit() {
        when(reorgEventRepository.findAllByOrderByDetectedAtDesc(PageRequest.of(0, 500))).thenReturn(List.of());
        when(reorgEventRepository.findAllByOrderByDetectedAtDesc(PageRequest.of(0, 1))).thenReturn(List.of());

        assertThat(service.recentReorgs(10_000)).isEmpty();
        assertThat(service.recentReorgs(0)).isEmpty();

        verify(reorgEventRepository).findAllByOrderByDetectedAtDesc(PageRequest.of(0, 500));
        verify(reorgEventRepository).findAllByOrderByDetectedAtDesc(PageRequest.of(0, 1));
    }
}
