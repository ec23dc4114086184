package com.chainexplorer.ingestion.aggregation;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * All account deltas of one block plus the two sinks value can flow into: fees, and locked value
 * (stake, delegation, escrow, genesis mint). For every block
 * {@code sum(balanceDelta) + feeDelta + lockedDelta == 0}.
 */
public record BlockDelta(long height, Map<String, AccountDelta> accounts, BigInteger feeDelta, BigInteger lockedDelta) {

    public BlockDelta {
        accounts = Collections.unmodifiableMap(new TreeMap<>(accounts));
    }

    public BlockDelta negate() {
        Map<String, AccountDelta> negated = new TreeMap<>();
        accounts.forEach((address, delta) -> negated.put(address, delta.negate()));
        return new BlockDelta(height, negated, feeDelta.negate(), lockedDelta.negate());
    }

    /** Combines with another delta of the same block, e.g. an apply with its revert. */
    public BlockDelta plus(BlockDelta other) {
        Map<String, AccountDelta> merged = new TreeMap<>(accounts);
        other.accounts.forEach((address, delta) -> merged.merge(address, delta, AccountDelta::plus));
        return new BlockDelta(height, merged, feeDelta.add(other.feeDelta), lockedDelta.add(other.lockedDelta));
    }

    /** Net change of spendable balances across all touched accounts. */
    public BigInteger netBalanceChange() {
        return accounts.values().stream()
                .map(AccountDelta::balanceDelta)
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    public boolean conservesValue() {
        return netBalanceChange().add(feeDelta).add(lockedDelta).signum() == 0;
    }
}
