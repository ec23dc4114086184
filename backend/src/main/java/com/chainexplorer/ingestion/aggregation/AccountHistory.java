package com.chainexplorer.ingestion.aggregation;

/**
 * What the remaining stored history says about an account after a rollback.
 *
 * @param nextNonce       highest remaining sent nonce + 1, or 0
 * @param firstSeenHeight lowest remaining height touching the account, null when none
 * @param lastSeenHeight  highest remaining height touching the account, null when none
 * @param validator       account still proposes a block or has a remaining STAKE/UPDATE_VALIDATOR
 */
public record AccountHistory(long nextNonce, Long firstSeenHeight, Long lastSeenHeight, boolean validator) {

    public static AccountHistory none() {
        return new AccountHistory(0, null, null, false);
    }

    /** Widens the seen range with a height that touches the account outside of transactions. */
    public AccountHistory including(long height) {
        Long first = firstSeenHeight == null ? height : Math.min(firstSeenHeight, height);
        Long last = lastSeenHeight == null ? height : Math.max(lastSeenHeight, height);
        return new AccountHistory(nextNonce, first, last, validator);
    }
}
