package com.chainexplorer.ingestion.reorg;

import com.chainexplorer.domain.IndexerPhase;
import com.chainexplorer.ingestion.adapter.NodeBlock;
import com.chainexplorer.ingestion.aggregation.AccountLedger;
import com.chainexplorer.ingestion.aggregation.BlockAggregator;
import com.chainexplorer.ingestion.error.DataIntegrityFaultException;
import com.chainexplorer.ingestion.error.NodeUnavailableException;
import com.chainexplorer.ingestion.error.ReorgBeyondLookbackException;
import com.chainexplorer.ingestion.store.ChainStore;
import com.chainexplorer.ingestion.support.FakeNodeClient;
import com.chainexplorer.ingestion.support.InMemoryChainStore;
import com.chainexplorer.ingestion.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.chainexplorer.ingestion.support.ChainFixtures.ALICE;
import static com.chainexplorer.ingestion.support.ChainFixtures.ALICE_GENESIS;
import static com.chainexplorer.ingestion.support.ChainFixtures.fork;
import static com.chainexplorer.ingestion.support.ChainFixtures.hash;
import static com.chainexplorer.ingestion.support.ChainFixtures.mainChain;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReorgDetectorTest {

    private BlockAggregator aggregator;
    private InMemoryChainStore store;
    private FakeNodeClient node;

    @Mock
    private ChainStore brokenStore;

    @BeforeEach
    void setUp() {
        aggregator = new BlockAggregator(0, Map.of(ALICE, ALICE_GENESIS));
        store = new InMemoryChainStore(aggregator, new AccountLedger(true), new MutableClock(Instant.EPOCH));
        node = new FakeNodeClient();
    }

    @Test
    @DisplayName("identical chains have no divergence")
    void findDivergence_sameChain_empty() {
        index(mainChain(50));
        node.serve(mainChain(50));

        assertThat(new ReorgDetector(node, store, 0, true).findDivergence(50, 10)).isEmpty();
    }

    @Test
    @DisplayName("reports the oldest mismatching height, not the most recent one")
    void findDivergence_reportsForkPoint() {
        index(mainChain(50));
        node.serve(mainChain(44)).serve(fork("b", 45, 50, hash("a", 44)));

        Optional<Divergence> divergence = new ReorgDetector(node, store, 0, true).findDivergence(50, 10);

        assertThat(divergence).contains(new Divergence(45, hash("a", 45), hash("b", 45)));
    }

    @Test
    @DisplayName("fork below the window start is a reorg beyond lookback")
    void findDivergence_forkBelowWindow_throws() {
        index(mainChain(50));
        node.serve(mainChain(29)).serve(fork("b", 30, 50, hash("a", 29)));

        assertThatThrownBy(() -> new ReorgDetector(node, store, 0, true).findDivergence(50, 10))
                .isInstanceOf(ReorgBeyondLookbackException.class);
    }

    @Test
    @DisplayName("fork exactly at the window start is inside the lookback")
    void findDivergence_forkAtWindowStart_found() {
        index(mainChain(50));
        node.serve(mainChain(40)).serve(fork("b", 41, 50, hash("a", 40)));

        assertThat(new ReorgDetector(node, store, 0, true).findDivergence(50, 10))
                .map(Divergence::height).contains(41L);
    }

    @Test
    @DisplayName("without parent links a mismatch at the window start is reported as is")
    void findDivergence_parentLinkDisabled_reportsWindowStart() {
        index(mainChain(50));
        node.serve(mainChain(29)).serve(fork("b", 30, 50, hash("a", 29)));

        assertThat(new ReorgDetector(node, store, 0, false).findDivergence(50, 10))
                .map(Divergence::height).contains(41L);
    }

    @Test
    @DisplayName("window is clamped at genesis; a different genesis is reported without a parent check")
    void findDivergence_shortChain_clampedAtGenesis() {
        index(mainChain(3));
        node.serve(fork("b", 0, 3, ""));

        assertThat(new ReorgDetector(node, store, 0, true).findDivergence(3, 10))
                .map(Divergence::height).contains(0L);
    }

    @Test
    @DisplayName("empty store has nothing to verify")
    void findDivergence_nothingIndexed_empty() {
        assertThat(new ReorgDetector(node, store, 0, true).findDivergence(-1, 10)).isEmpty();
        assertThat(node.calls()).isZero();
    }

    @Test
    @DisplayName("node failure propagates instead of being read as no reorg")
    void findDivergence_nodeUnavailable_propagates() {
        index(mainChain(5));
        node.failWith(new NodeUnavailableException("down"));

        assertThatThrownBy(() -> new ReorgDetector(node, store, 0, true).findDivergence(5, 10))
                .isInstanceOf(NodeUnavailableException.class);
    }

    @Test
    @DisplayName("a stored height without a block is an integrity fault")
    void findDivergence_missingLocalBlock_fails() {
        when(brokenStore.findBlockHash(5L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> new ReorgDetector(node, brokenStore, 0, true).findDivergence(5, 1))
                .isInstanceOf(DataIntegrityFaultException.class)
                .hasMessageContaining("height 5");
    }

    @Test
    @DisplayName("range verification is not limited by the lookback depth")
    void verifyRange_findsOldFork() {
        index(mainChain(50));
        node.serve(mainChain(9)).serve(fork("b", 10, 50, hash("a", 9)));

        assertThat(new ReorgDetector(node, store, 0, true).verifyRange(0, 50))
                .map(Divergence::height).contains(10L);
    }

    private void index(List<NodeBlock> blocks) {
        for (NodeBlock block : blocks) {
            store.commitBlock(block, aggregator.applyBlock(block.block(), block.transactions()), IndexerPhase.CATCHING_UP);
        }
    }
}
