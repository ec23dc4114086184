package com.chainexplorer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Block mirrored from the chain node, keyed by height. Never mutated; removed only by reorg rollback
 * together with its transactions.
 */
@Document(collection = "blocks")
@CompoundIndex(name = "proposer_height", def = "{'proposerAddress': 1, '_id': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainBlock {

    @Id
    @EqualsAndHashCode.Include
    private Long height;
    @Indexed(unique = true)
    private String hash;
    private String prevHash;
    /** Epoch seconds as reported by the node. */
    @Indexed
    private long timestamp;
    private String chainId;
    private String proposerAddress;
    private int txCount;
    private long gasUsed;
    private long gasLimit;
    private String txRoot;
    private String stateRoot;
    private String computeRoot;
    private String zkStateProofHash;
    private String zkComputeProofHash;
    /** Post-quantum proposer signature, only on nodes that produce one. */
    private String pqSignature;
    private Integer pqSigSchemeId;
    private Instant indexedAt;
}
