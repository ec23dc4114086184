package com.chainexplorer.domain;

import java.util.Locale;

/**
 * Transaction types produced by the node. Wire values are the upper-case names.
 */
public enum TxType {
    TRANSFER(ValueFlow.TO_RECIPIENT),
    STAKE(ValueFlow.LOCK),
    UNSTAKE(ValueFlow.UNLOCK),
    DELEGATE(ValueFlow.LOCK),
    UNDELEGATE(ValueFlow.UNLOCK),
    COMPUTE(ValueFlow.TO_RECIPIENT),
    SUBMIT_RESULT(ValueFlow.TO_RECIPIENT),
    UNJAIL(ValueFlow.FEE_ONLY),
    UPDATE_VALIDATOR(ValueFlow.FEE_ONLY);

    private final ValueFlow valueFlow;

    TxType(ValueFlow valueFlow) {
        this.valueFlow = valueFlow;
    }

    public ValueFlow valueFlow() {
        return valueFlow;
    }

    /** True when the sender of this type is acting as (or becoming) a validator. */
    public boolean marksValidator() {
        return this == STAKE || this == UPDATE_VALIDATOR;
    }

    /**
     * Parses a wire value; blank defaults to TRANSFER like the node does.
     *
     * @throws IllegalArgumentException for an unknown type
     */
    public static TxType fromWire(String value) {
        if (value == null || value.isBlank()) {
            return TRANSFER;
        }
        return TxType.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /**
     * Where the amount of a transaction goes. Fees are always debited from the sender into the fee sink.
     */
    public enum ValueFlow {
        /** Sender to recipient; to the locked sink when there is no recipient. */
        TO_RECIPIENT,
        /** Sender balance into the locked (staked/delegated) sink. */
        LOCK,
        /** Locked sink back to the sender balance. */
        UNLOCK,
        /** Amount is ignored. */
        FEE_ONLY
    }
}
