package com.chainexplorer.ingestion.store;

import java.util.Set;

/**
 * Outcome of an atomic rollback.
 *
 * @param previousTip      tip before the rollback
 * @param newTip           tip after the rollback (divergence height - 1)
 * @param blocksRolledBack number of blocks removed
 * @param oldHash          stored hash at the divergence height, null when nothing was removed
 * @param touchedAccounts  accounts whose aggregates were reverted and recomputed
 */
public record RollbackResult(long previousTip, long newTip, int blocksRolledBack, String oldHash, Set<String> touchedAccounts) {

    public static RollbackResult nothing(long tip) {
        return new RollbackResult(tip, tip, 0, null, Set.of());
    }
}
