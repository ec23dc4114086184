package com.chainexplorer.ingestion.aggregation;

import com.chainexplorer.domain.Account;
import com.chainexplorer.ingestion.error.DataIntegrityFaultException;

import java.time.Instant;

/**
 * Applies account deltas to account documents and checks the invariants every store must enforce.
 */
public class AccountLedger {

    private final boolean enforceNonNegativeBalances;

    public AccountLedger(boolean enforceNonNegativeBalances) {
        this.enforceNonNegativeBalances = enforceNonNegativeBalances;
    }

    /**
     * @param existing current document, or null when the address is new
     * @throws DataIntegrityFaultException on a negative balance (when enforced) or a negative count
     */
    public Account apply(Account existing, String address, AccountDelta delta, long height, Instant now) {
        Account account = existing != null ? existing : new Account(address);
        account.setBalance(account.getBalance().add(delta.balanceDelta()));
        account.setTxCount(account.getTxCount() + delta.txCountDelta());
        account.setTxSentCount(account.getTxSentCount() + delta.txSentDelta());
        account.setTxReceivedCount(account.getTxReceivedCount() + delta.txReceivedDelta());
        if (delta.nextNonce() != null) {
            account.setNonce(Math.max(account.getNonce(), delta.nextNonce()));
        }
        if (delta.seenHeight() != null) {
            long seen = delta.seenHeight();
            account.setFirstSeenHeight(account.getFirstSeenHeight() == null ? seen : Math.min(account.getFirstSeenHeight(), seen));
            account.setLastSeenHeight(account.getLastSeenHeight() == null ? seen : Math.max(account.getLastSeenHeight(), seen));
        }
        if (delta.validatorEvidence()) {
            account.setValidator(true);
        }
        account.setUpdatedAt(now);

        if (enforceNonNegativeBalances && account.getBalance().signum() < 0) {
            throw new DataIntegrityFaultException(
                    "Balance of " + address + " would become " + account.getBalance() + " at height " + height, height);
        }
        if (account.getTxCount() < 0 || account.getTxSentCount() < 0 || account.getTxReceivedCount() < 0) {
            throw new DataIntegrityFaultException("Negative transaction count for " + address + " at height " + height, height);
        }
        return account;
    }

    /**
     * Replaces the history-derived fields with what the remaining stored history shows.
     */
    public Account recompute(Account account, AccountHistory history, Instant now) {
        account.setNonce(history.nextNonce());
        account.setFirstSeenHeight(history.firstSeenHeight());
        account.setLastSeenHeight(history.lastSeenHeight());
        account.setValidator(history.validator());
        account.setUpdatedAt(now);
        return account;
    }
}
