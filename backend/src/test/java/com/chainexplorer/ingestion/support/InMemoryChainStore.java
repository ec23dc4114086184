package com.chainexplorer.ingestion.support;

import com.chainexplorer.domain.Account;
import com.chainexplorer.domain.ChainBlock;
import com.chainexplorer.domain.ChainTransaction;
import com.chainexplorer.domain.IndexerPhase;
import com.chainexplorer.domain.ReorgEvent;
import com.chainexplorer.domain.ReorgTrigger;
import com.chainexplorer.domain.SyncState;
import com.chainexplorer.domain.ThroughputSnapshot;
import com.chainexplorer.ingestion.adapter.NodeBlock;
import com.chainexplorer.ingestion.aggregation.AccountDelta;
import com.chainexplorer.ingestion.aggregation.AccountHistory;
import com.chainexplorer.ingestion.aggregation.AccountLedger;
import com.chainexplorer.ingestion.aggregation.BlockAggregator;
import com.chainexplorer.ingestion.aggregation.BlockDelta;
import com.chainexplorer.ingestion.error.DataIntegrityFaultException;
import com.chainexplorer.ingestion.error.StoreUnavailableException;
import com.chainexplorer.ingestion.store.ChainStore;
import com.chainexplorer.ingestion.store.RollbackResult;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Chain store held in memory with the same atomicity as the Mongo store: a failed commit or rollback restores
 * the prior state. Can be switched to "unavailable" to simulate an unreachable database.
 */
public class InMemoryChainStore implements ChainStore {

    private final BlockAggregator aggregator;
    private final AccountLedger ledger;
    private final Clock clock;

    private NavigableMap<Long, ChainBlock> blocks = new TreeMap<>();
    private Map<Long, List<ChainTransaction>> transactions = new HashMap<>();
    private Map<String, Account> accounts = new TreeMap<>();
    private final List<ReorgEvent> reorgEvents = new ArrayList<>();
    private SyncState state;
    private ThroughputSnapshot throughput;
    private volatile boolean unavailable;

    public InMemoryChainStore(BlockAggregator aggregator, AccountLedger ledger, Clock clock) {
        this.aggregator = aggregator;
        this.ledger = ledger;
        this.clock = clock;
        this.state = SyncState.initial(aggregator.getGenesisHeight());
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    @Override
    public synchronized SyncState loadSyncState() {
        checkAvailable();
        return copy(state);
    }

    @Override
    public synchronized Optional<ChainBlock> findBlock(long height) {
        checkAvailable();
        return Optional.ofNullable(blocks.get(height));
    }

    @Override
    public Optional<String> findBlockHash(long height) {
        return findBlock(height).map(ChainBlock::getHash);
    }

    @Override
    public synchronized List<ChainTransaction> findTransactions(long height) {
        checkAvailable();
        return List.copyOf(transactions.getOrDefault(height, List.of()));
    }

    @Override
    public synchronized List<ChainBlock> findBlocksAfterTimestamp(long epochSeconds) {
        checkAvailable();
        return blocks.values().stream().filter(b -> b.getTimestamp() > epochSeconds).toList();
    }

    @Override
    public synchronized SyncState commitBlock(NodeBlock block, BlockDelta delta, IndexerPhase phase) {
        checkAvailable();
        long height = block.height();
        if (height != state.getIndexedHeight() + 1) {
            throw new DataIntegrityFaultException("Out-of-order commit: expected height "
                    + (state.getIndexedHeight() + 1) + " but got " + height, height);
        }
        Set<String> known = new HashSet<>();
        transactions.values().forEach(list -> list.forEach(tx -> known.add(tx.getHash())));
        for (ChainTransaction tx : block.transactions()) {
            if (!known.add(tx.getHash())) {
                throw new DataIntegrityFaultException("Duplicate transaction hash " + tx.getHash(), height);
            }
        }
        Map<String, Account> before = copyAccounts();
        Instant now = clock.instant();
        try {
            applyDeltas(delta, height, now);
        } catch (RuntimeException e) {
            accounts = before;
            throw e;
        }
        blocks.put(height, block.block());
        transactions.put(height, List.copyOf(block.transactions()));
        state.setIndexedHeight(height);
        state.setTipHash(block.hash());
        state.setLastCommitAt(now);
        state.setPhase(phase);
        state.setTotalFees(state.getTotalFees().add(delta.feeDelta()));
        state.setTotalLocked(state.getTotalLocked().add(delta.lockedDelta()));
        return copy(state);
    }

    @Override
    public synchronized RollbackResult rollbackFrom(long fromHeight, ReorgTrigger trigger, String newHash) {
        checkAvailable();
        long tip = state.getIndexedHeight();
        if (fromHeight > tip) {
            return RollbackResult.nothing(tip);
        }
        Map<String, Account> accountsBefore = copyAccounts();
        NavigableMap<Long, ChainBlock> blocksBefore = new TreeMap<>(blocks);
        Map<Long, List<ChainTransaction>> txsBefore = new HashMap<>(transactions);
        try {
            Instant now = clock.instant();
            Set<String> touched = new TreeSet<>();
            BigInteger fees = BigInteger.ZERO;
            BigInteger locked = BigInteger.ZERO;
            String oldHash = null;
            for (long height = tip; height >= fromHeight; height--) {
                ChainBlock block = blocks.get(height);
                if (block == null) {
                    throw new DataIntegrityFaultException("Stored chain has a gap at height " + height, height);
                }
                BlockDelta revert = aggregator.revertBlock(block, transactions.getOrDefault(height, List.of()));
                applyDeltas(revert, height, now);
                touched.addAll(revert.accounts().keySet());
                fees = fees.add(revert.feeDelta());
                locked = locked.add(revert.lockedDelta());
                blocks.remove(height);
                transactions.remove(height);
                oldHash = block.getHash();
            }
            for (String address : touched) {
                ledger.recompute(accounts.get(address), historyOf(address, fromHeight), now);
            }
            state.setIndexedHeight(fromHeight - 1);
            ChainBlock newTip = blocks.get(fromHeight - 1);
            state.setTipHash(newTip != null ? newTip.getHash() : null);
            state.setPhase(IndexerPhase.ROLLING_BACK);
            state.setTotalFees(state.getTotalFees().add(fees));
            state.setTotalLocked(state.getTotalLocked().add(locked));

            int removed = (int) (tip - fromHeight + 1);
            ReorgEvent event = new ReorgEvent();
            event.setDivergenceHeight(fromHeight);
            event.setOldHash(oldHash);
            event.setNewHash(newHash);
            event.setPreviousTip(tip);
            event.setBlocksRolledBack(removed);
            event.setTrigger(trigger);
            event.setDetectedAt(now);
            reorgEvents.add(event);
            return new RollbackResult(tip, fromHeight - 1, removed, oldHash, Set.copyOf(touched));
        } catch (RuntimeException e) {
            accounts = accountsBefore;
            blocks = blocksBefore;
            transactions = txsBefore;
            throw e;
        }
    }

    @Override
    public synchronized void recordPoll(Instant at, IndexerPhase phase) {
        checkAvailable();
        state.setLastPollAt(at);
        if (!state.isHalted()) {
            state.setPhase(phase);
        }
    }

    @Override
    public synchronized void recordHalt(String reason) {
        checkAvailable();
        state.setHalted(true);
        state.setHaltReason(reason);
        state.setHaltedAt(clock.instant());
        state.setPhase(IndexerPhase.HALTED);
    }

    @Override
    public synchronized void clearHalt() {
        checkAvailable();
        state.setHalted(false);
        state.setHaltReason(null);
        state.setHaltedAt(null);
        state.setPhase(IndexerPhase.CATCHING_UP);
    }

    @Override
    public synchronized void saveThroughput(ThroughputSnapshot snapshot) {
        checkAvailable();
        this.throughput = snapshot;
    }

    public synchronized Map<String, Account> accounts() {
        return copyAccounts();
    }

    public synchronized Optional<Account> account(String address) {
        return Optional.ofNullable(accounts.get(address)).map(InMemoryChainStore::copy);
    }

    public synchronized List<ReorgEvent> reorgEvents() {
        return List.copyOf(reorgEvents);
    }

    public synchronized ThroughputSnapshot throughput() {
        return throughput;
    }

    public synchronized int blockCount() {
        return blocks.size();
    }

    /** sum(balances) + fees + locked; zero for any consistent store. */
    public synchronized BigInteger conservationResidual() {
        BigInteger balances = accounts.values().stream().map(Account::getBalance).reduce(BigInteger.ZERO, BigInteger::add);
        return balances.add(state.getTotalFees()).add(state.getTotalLocked());
    }

    private void applyDeltas(BlockDelta delta, long height, Instant now) {
        for (Map.Entry<String, AccountDelta> entry : delta.accounts().entrySet()) {
            Account updated = ledger.apply(accounts.get(entry.getKey()), entry.getKey(), entry.getValue(), height, now);
            accounts.put(entry.getKey(), updated);
        }
    }

    private AccountHistory historyOf(String address, long fromHeight) {
        AccountHistory history = AccountHistory.none();
        long nextNonce = 0;
        boolean validator = false;
        for (Map.Entry<Long, List<ChainTransaction>> entry : transactions.entrySet()) {
            for (ChainTransaction tx : entry.getValue()) {
                boolean sent = address.equals(tx.getFromAddress());
                if (sent) {
                    nextNonce = Math.max(nextNonce, tx.getNonce() + 1);
                    validator |= tx.getTxType().marksValidator();
                }
                if (sent || address.equals(tx.getToAddress())) {
                    history = history.including(entry.getKey());
                }
            }
        }
        for (ChainBlock block : blocks.values()) {
            if (address.equals(block.getProposerAddress())) {
                validator = true;
                history = history.including(block.getHeight());
            }
        }
        long genesis = aggregator.getGenesisHeight();
        if (fromHeight > genesis && aggregator.getGenesisAllocations().containsKey(address)) {
            history = history.including(genesis);
        }
        return new AccountHistory(nextNonce, history.firstSeenHeight(), history.lastSeenHeight(), validator);
    }

    private void checkAvailable() {
        if (unavailable) {
            throw new StoreUnavailableException("In-memory store switched off", null);
        }
    }

    private Map<String, Account> copyAccounts() {
        Map<String, Account> copy = new TreeMap<>();
        accounts.forEach((address, account) -> copy.put(address, copy(account)));
        return copy;
    }

    private static Account copy(Account a) {
        Account c = new Account(a.getAddress());
        c.setBalance(a.getBalance());
        c.setNonce(a.getNonce());
        c.setTxCount(a.getTxCount());
        c.setTxSentCount(a.getTxSentCount());
        c.setTxReceivedCount(a.getTxReceivedCount());
        c.setFirstSeenHeight(a.getFirstSeenHeight());
        c.setLastSeenHeight(a.getLastSeenHeight());
        c.setValidator(a.isValidator());
        c.setUpdatedAt(a.getUpdatedAt());
        return c;
    }

    private static SyncState copy(SyncState s) {
        SyncState c = new SyncState();
        c.setIndexedHeight(s.getIndexedHeight());
        c.setTipHash(s.getTipHash());
        c.setLastPollAt(s.getLastPollAt());
        c.setLastCommitAt(s.getLastCommitAt());
        c.setPhase(s.getPhase());
        c.setHalted(s.isHalted());
        c.setHaltReason(s.getHaltReason());
        c.setHaltedAt(s.getHaltedAt());
        c.setTotalFees(s.getTotalFees());
        c.setTotalLocked(s.getTotalLocked());
        return c;
    }
}
