package com.chainexplorer.ingestion.store;

import com.chainexplorer.domain.Account;
import com.chainexplorer.domain.ChainBlock;
import com.chainexplorer.domain.ChainTransaction;
import com.chainexplorer.domain.IndexerPhase;
import com.chainexplorer.domain.ReorgEvent;
import com.chainexplorer.domain.ReorgTrigger;
import com.chainexplorer.domain.SyncState;
import com.chainexplorer.domain.ThroughputSnapshot;
import com.chainexplorer.domain.TxType;
import com.chainexplorer.ingestion.adapter.NodeBlock;
import com.chainexplorer.ingestion.aggregation.AccountDelta;
import com.chainexplorer.ingestion.aggregation.AccountHistory;
import com.chainexplorer.ingestion.aggregation.AccountLedger;
import com.chainexplorer.ingestion.aggregation.BlockAggregator;
import com.chainexplorer.ingestion.aggregation.BlockDelta;
import com.chainexplorer.ingestion.error.DataIntegrityFaultException;
import com.chainexplorer.ingestion.error.IndexerException;
import com.chainexplorer.ingestion.error.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Chain store on MongoDB multi-document transactions (requires a replica set). Commit and rollback each run
 * in one transaction, so a failed cycle leaves nothing behind and can be retried from the prior state.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MongoChainStore implements ChainStore {

    private static final Set<TxType> VALIDATOR_TYPES = Set.of(TxType.STAKE, TxType.UPDATE_VALIDATOR);

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate transactionTemplate;
    private final BlockAggregator aggregator;
    private final AccountLedger ledger;
    private final Clock clock;

    @Override
    public SyncState loadSyncState() {
        return read(this::loadOrInitial, "load sync state");
    }

    @Override
    public Optional<ChainBlock> findBlock(long height) {
        return read(() -> Optional.ofNullable(mongoTemplate.findById(height, ChainBlock.class)), "find block " + height);
    }

    @Override
    public Optional<String> findBlockHash(long height) {
        return findBlock(height).map(ChainBlock::getHash);
    }

    @Override
    public List<ChainTransaction> findTransactions(long height) {
        return read(() -> transactionsOf(height), "find transactions of " + height);
    }

    @Override
    public List<ChainBlock> findBlocksAfterTimestamp(long epochSeconds) {
        Query query = new Query(where("timestamp").gt(epochSeconds)).with(Sort.by(Sort.Direction.ASC, "_id"));
        return read(() -> mongoTemplate.find(query, ChainBlock.class), "find recent blocks");
    }

    @Override
    public SyncState commitBlock(NodeBlock nodeBlock, BlockDelta delta, IndexerPhase phase) {
        long height = nodeBlock.height();
        return inTransaction(() -> {
            SyncState state = loadOrInitial();
            long expected = state.getIndexedHeight() + 1;
            if (height != expected) {
                throw new DataIntegrityFaultException("Out-of-order commit: expected height " + expected + " but got " + height, height);
            }
            Instant now = clock.instant();
            ChainBlock block = nodeBlock.block();
            block.setIndexedAt(now);
            mongoTemplate.insert(block);
            List<ChainTransaction> transactions = nodeBlock.transactions();
            if (!transactions.isEmpty()) {
                transactions.forEach(tx -> tx.setIndexedAt(now));
                mongoTemplate.insert(transactions, ChainTransaction.class);
            }
            applyDeltas(delta, height, now);

            state.setIndexedHeight(height);
            state.setTipHash(block.getHash());
            state.setLastCommitAt(now);
            state.setPhase(phase);
            state.setTotalFees(state.getTotalFees().add(delta.feeDelta()));
            state.setTotalLocked(state.getTotalLocked().add(delta.lockedDelta()));
            mongoTemplate.save(state);
            return state;
        }, "commit of block " + height);
    }

    @Override
    public RollbackResult rollbackFrom(long fromHeight, ReorgTrigger trigger, String newHash) {
        if (fromHeight < aggregator.getGenesisHeight()) {
            throw new IllegalArgumentException("Cannot roll back below genesis height " + aggregator.getGenesisHeight());
        }
        return inTransaction(() -> {
            SyncState state = loadOrInitial();
            long tip = state.getIndexedHeight();
            if (fromHeight > tip) {
                return RollbackResult.nothing(tip);
            }
            Instant now = clock.instant();
            Set<String> touched = new TreeSet<>();
            BigInteger fees = BigInteger.ZERO;
            BigInteger locked = BigInteger.ZERO;
            String oldHash = null;

            for (long height = tip; height >= fromHeight; height--) {
                ChainBlock block = mongoTemplate.findById(height, ChainBlock.class);
                if (block == null) {
                    throw new DataIntegrityFaultException("Stored chain has a gap at height " + height + " below tip " + tip, height);
                }
                BlockDelta revert = aggregator.revertBlock(block, transactionsOf(height));
                applyDeltas(revert, height, now);
                touched.addAll(revert.accounts().keySet());
                fees = fees.add(revert.feeDelta());
                locked = locked.add(revert.lockedDelta());
                mongoTemplate.remove(new Query(where("blockHeight").is(height)), ChainTransaction.class);
                mongoTemplate.remove(block);
                oldHash = block.getHash();
            }

            for (String address : touched) {
                Account account = mongoTemplate.findById(address, Account.class);
                if (account != null) {
                    mongoTemplate.save(ledger.recompute(account, historyOf(address, fromHeight), now));
                }
            }

            long newTip = fromHeight - 1;
            ChainBlock newTipBlock = mongoTemplate.findById(newTip, ChainBlock.class);
            state.setIndexedHeight(newTip);
            state.setTipHash(newTipBlock != null ? newTipBlock.getHash() : null);
            state.setPhase(IndexerPhase.ROLLING_BACK);
            state.setTotalFees(state.getTotalFees().add(fees));
            state.setTotalLocked(state.getTotalLocked().add(locked));
            mongoTemplate.save(state);

            int removed = (int) (tip - fromHeight + 1);
            ReorgEvent event = new ReorgEvent();
            event.setDivergenceHeight(fromHeight);
            event.setOldHash(oldHash);
            event.setNewHash(newHash);
            event.setPreviousTip(tip);
            event.setBlocksRolledBack(removed);
            event.setTrigger(trigger);
            event.setDetectedAt(now);
            mongoTemplate.insert(event);
            return new RollbackResult(tip, newTip, removed, oldHash, Set.copyOf(touched));
        }, "rollback from height " + fromHeight);
    }

    @Override
    public void recordPoll(Instant at, IndexerPhase phase) {
        inTransaction(() -> {
            SyncState state = loadOrInitial();
            state.setLastPollAt(at);
            if (!state.isHalted()) {
                state.setPhase(phase);
            }
            return mongoTemplate.save(state);
        }, "record poll");
    }

    @Override
    public void recordHalt(String reason) {
        inTransaction(() -> {
            SyncState state = loadOrInitial();
            state.setHalted(true);
            state.setHaltReason(reason);
            state.setHaltedAt(clock.instant());
            state.setPhase(IndexerPhase.HALTED);
            return mongoTemplate.save(state);
        }, "record halt");
    }

    @Override
    public void clearHalt() {
        inTransaction(() -> {
            SyncState state = loadOrInitial();
            state.setHalted(false);
            state.setHaltReason(null);
            state.setHaltedAt(null);
            state.setPhase(IndexerPhase.CATCHING_UP);
            return mongoTemplate.save(state);
        }, "clear halt");
    }

    @Override
    public void saveThroughput(ThroughputSnapshot snapshot) {
        read(() -> mongoTemplate.save(snapshot), "save throughput");
    }

    private void applyDeltas(BlockDelta delta, long height, Instant now) {
        for (Map.Entry<String, AccountDelta> entry : delta.accounts().entrySet()) {
            Account existing = mongoTemplate.findById(entry.getKey(), Account.class);
            mongoTemplate.save(ledger.apply(existing, entry.getKey(), entry.getValue(), height, now));
        }
    }

    /**
     * History left after rolling back everything from {@code fromHeight}; runs inside the rollback transaction
     * after the deletes, so it only sees remaining rows.
     */
    private AccountHistory historyOf(String address, long fromHeight) {
        Criteria touches = new Criteria().orOperator(where("fromAddress").is(address), where("toAddress").is(address));

        ChainTransaction highestNonce = mongoTemplate.findOne(new Query(where("fromAddress").is(address))
                .with(Sort.by(Sort.Direction.DESC, "nonce")).limit(1), ChainTransaction.class);
        ChainTransaction firstTx = mongoTemplate.findOne(new Query(touches)
                .with(Sort.by(Sort.Direction.ASC, "blockHeight")).limit(1), ChainTransaction.class);
        ChainTransaction lastTx = mongoTemplate.findOne(new Query(touches)
                .with(Sort.by(Sort.Direction.DESC, "blockHeight")).limit(1), ChainTransaction.class);
        ChainBlock firstProposed = mongoTemplate.findOne(new Query(where("proposerAddress").is(address))
                .with(Sort.by(Sort.Direction.ASC, "_id")).limit(1), ChainBlock.class);
        ChainBlock lastProposed = mongoTemplate.findOne(new Query(where("proposerAddress").is(address))
                .with(Sort.by(Sort.Direction.DESC, "_id")).limit(1), ChainBlock.class);
        boolean validatorTx = mongoTemplate.exists(new Query(where("fromAddress").is(address)
                .and("txType").in(VALIDATOR_TYPES)), ChainTransaction.class);

        AccountHistory history = new AccountHistory(
                highestNonce != null ? highestNonce.getNonce() + 1 : 0,
                null, null,
                validatorTx || firstProposed != null);
        if (firstTx != null) {
            history = history.including(firstTx.getBlockHeight()).including(lastTx.getBlockHeight());
        }
        if (firstProposed != null) {
            history = history.including(firstProposed.getHeight()).including(lastProposed.getHeight());
        }
        long genesis = aggregator.getGenesisHeight();
        if (fromHeight > genesis && aggregator.getGenesisAllocations().containsKey(address)) {
            history = history.including(genesis);
        }
        return history;
    }

    private List<ChainTransaction> transactionsOf(long height) {
        Query query = new Query(where("blockHeight").is(height)).with(Sort.by(Sort.Direction.ASC, "txIndex"));
        return mongoTemplate.find(query, ChainTransaction.class);
    }

    private SyncState loadOrInitial() {
        SyncState state = mongoTemplate.findById(SyncState.SINGLETON_ID, SyncState.class);
        return state != null ? state : SyncState.initial(aggregator.getGenesisHeight());
    }

    private <T> T inTransaction(Supplier<T> work, String what) {
        return read(() -> transactionTemplate.execute(status -> work.get()), what);
    }

    private <T> T read(Supplier<T> work, String what) {
        try {
            return work.get();
        } catch (IndexerException e) {
            throw e;
        } catch (DuplicateKeyException e) {
            throw new DataIntegrityFaultException(what + " violates a unique key: " + e.getMessage(), null, e);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Store operation failed: {}: {}", what, e.getMessage());
            throw new StoreUnavailableException(what + " failed: " + e.getMessage(), e);
        }
    }
}
