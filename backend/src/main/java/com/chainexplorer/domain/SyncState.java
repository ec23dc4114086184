package com.chainexplorer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Singleton indexer progress row. Written after every commit and rollback, inside the same transaction,
 * so the tip here always matches the stored blocks.
 */
@Document(collection = "sync_state")
@NoArgsConstructor
@Getter
@Setter
public class SyncState {

    public static final String SINGLETON_ID = "indexer";

    @Id
    private String id = SINGLETON_ID;
    /** Tip: highest stored height; genesis height - 1 before anything is indexed. */
    private long indexedHeight;
    private String tipHash;
    private Instant lastPollAt;
    private Instant lastCommitAt;
    private IndexerPhase phase = IndexerPhase.CATCHING_UP;
    private boolean halted;
    private String haltReason;
    private Instant haltedAt;
    /** Fee sink: sum of all fees of indexed blocks. */
    private BigInteger totalFees = BigInteger.ZERO;
    /** Staked, delegated and escrowed value net of genesis mint. */
    private BigInteger totalLocked = BigInteger.ZERO;

    public static SyncState initial(long genesisHeight) {
        SyncState state = new SyncState();
        state.setIndexedHeight(genesisHeight - 1);
        return state;
    }
}
