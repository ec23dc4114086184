package com.chainexplorer.domain;

/**
 * What caused a rollback.
 */
public enum ReorgTrigger {
    /** Periodic lookback verification found a different hash. */
    RESYNC_CHECK,
    /** Next block did not link to the stored tip during catch-up. */
    PARENT_MISMATCH,
    /** Operator-requested range verification. */
    MANUAL_VERIFY
}
