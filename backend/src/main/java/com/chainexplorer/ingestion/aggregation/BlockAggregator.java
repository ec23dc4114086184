package com.chainexplorer.ingestion.aggregation;

import com.chainexplorer.domain.ChainBlock;
import com.chainexplorer.domain.ChainTransaction;
import com.chainexplorer.domain.TxType;
import com.chainexplorer.ingestion.error.DataIntegrityFaultException;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives per-account deltas from a block's transactions. Stateless; all amounts are exact integers.
 * <ul>
 *   <li>Fees are debited from the sender into the fee sink, never credited to an account.</li>
 *   <li>TRANSFER/COMPUTE/SUBMIT_RESULT move the amount to the recipient (to the locked sink without one).</li>
 *   <li>STAKE/DELEGATE lock the amount, UNSTAKE/UNDELEGATE unlock it back to the sender.</li>
 *   <li>Genesis allocations are minted from the locked sink at the genesis height.</li>
 * </ul>
 */
public class BlockAggregator {

    private final long genesisHeight;
    private final Map<String, BigInteger> genesisAllocations;

    public BlockAggregator(long genesisHeight, Map<String, BigInteger> genesisAllocations) {
        this.genesisHeight = genesisHeight;
        this.genesisAllocations = Map.copyOf(genesisAllocations);
    }

    public BlockDelta applyBlock(ChainBlock block, List<ChainTransaction> transactions) {
        long height = block.getHeight();
        Map<String, AccountDelta> accounts = new TreeMap<>();
        BigInteger fees = BigInteger.ZERO;
        BigInteger locked = BigInteger.ZERO;

        if (height == genesisHeight) {
            for (Map.Entry<String, BigInteger> allocation : genesisAllocations.entrySet()) {
                accounts.merge(allocation.getKey(),
                        new AccountDelta(allocation.getValue(), 0, 0, 0, null, height, false), AccountDelta::plus);
                locked = locked.subtract(allocation.getValue());
            }
        }

        for (ChainTransaction tx : transactions) {
            String sender = tx.getFromAddress();
            if (sender == null || sender.isBlank()) {
                throw new DataIntegrityFaultException("Transaction " + tx.getHash() + " has no sender", height);
            }
            BigInteger amount = tx.getAmount();
            BigInteger fee = tx.getFee();
            BigInteger senderBalance = fee.negate();
            fees = fees.add(fee);

            String recipient = tx.hasRecipient() ? tx.getToAddress() : null;
            TxType type = tx.getTxType();
            switch (type.valueFlow()) {
                case TO_RECIPIENT -> {
                    senderBalance = senderBalance.subtract(amount);
                    if (recipient == null) {
                        locked = locked.add(amount);
                    }
                }
                case LOCK -> {
                    senderBalance = senderBalance.subtract(amount);
                    locked = locked.add(amount);
                }
                case UNLOCK -> {
                    senderBalance = senderBalance.add(amount);
                    locked = locked.subtract(amount);
                }
                case FEE_ONLY -> {
                }
            }

            accounts.merge(sender, new AccountDelta(senderBalance, 1, 1, 0,
                    tx.getNonce() + 1, height, type.marksValidator()), AccountDelta::plus);
            if (recipient != null) {
                BigInteger received = type.valueFlow() == TxType.ValueFlow.TO_RECIPIENT ? amount : BigInteger.ZERO;
                long countAsTouch = recipient.equals(sender) ? 0 : 1;
                accounts.merge(recipient, new AccountDelta(received, countAsTouch, 0, 1,
                        null, height, false), AccountDelta::plus);
            }
        }

        String proposer = block.getProposerAddress();
        if (proposer != null && !proposer.isBlank()) {
            accounts.merge(proposer, new AccountDelta(BigInteger.ZERO, 0, 0, 0, null, height, true), AccountDelta::plus);
        }
        return new BlockDelta(height, accounts, fees, locked);
    }

    /**
     * Exact inverse of {@link #applyBlock} for balances, counts and sinks. Nonce, first/last seen and the
     * validator flag are left to {@link AccountLedger#recompute}.
     */
    public BlockDelta revertBlock(ChainBlock block, List<ChainTransaction> transactions) {
        return applyBlock(block, transactions).negate();
    }

    public long getGenesisHeight() {
        return genesisHeight;
    }

    public Map<String, BigInteger> getGenesisAllocations() {
        return genesisAllocations;
    }
}
