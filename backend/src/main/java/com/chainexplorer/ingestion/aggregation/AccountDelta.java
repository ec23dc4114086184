package com.chainexplorer.ingestion.aggregation;

import java.math.BigInteger;

/**
 * Signed change to one account attributable to one block.
 * <p>
 * Balance and counts are additive and exactly invertible. {@code nextNonce}, {@code seenHeight} and
 * {@code validatorEvidence} are forward-only hints: a reverted delta carries none of them and the affected
 * fields are recomputed from the remaining history instead.
 */
public record AccountDelta(
        BigInteger balanceDelta,
        long txCountDelta,
        long txSentDelta,
        long txReceivedDelta,
        Long nextNonce,
        Long seenHeight,
        boolean validatorEvidence
) {

    public static final AccountDelta ZERO = new AccountDelta(BigInteger.ZERO, 0, 0, 0, null, null, false);

    public AccountDelta negate() {
        return new AccountDelta(balanceDelta.negate(), -txCountDelta, -txSentDelta, -txReceivedDelta,
                null, null, false);
    }

    /** Sums two deltas of the same account; hints keep the furthest-reaching value. */
    public AccountDelta plus(AccountDelta other) {
        return new AccountDelta(
                balanceDelta.add(other.balanceDelta),
                txCountDelta + other.txCountDelta,
                txSentDelta + other.txSentDelta,
                txReceivedDelta + other.txReceivedDelta,
                maxOf(nextNonce, other.nextNonce),
                maxOf(seenHeight, other.seenHeight),
                validatorEvidence || other.validatorEvidence);
    }

    /** True when balance and all counts are unchanged. */
    public boolean isNeutral() {
        return balanceDelta.signum() == 0 && txCountDelta == 0 && txSentDelta == 0 && txReceivedDelta == 0;
    }

    private static Long maxOf(Long a, Long b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return Math.max(a, b);
    }
}
