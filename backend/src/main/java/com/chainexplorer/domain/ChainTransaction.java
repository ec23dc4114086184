package com.chainexplorer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Map;

/**
 * Transaction of a mirrored block. Created and deleted atomically with its block.
 * Amount and fee are exact nonnegative integers in the chain's base unit.
 */
@Document(collection = "transactions")
@CompoundIndexes({
        @CompoundIndex(name = "from_nonce", def = "{'fromAddress': 1, 'nonce': 1}"),
        @CompoundIndex(name = "block_index", def = "{'blockHeight': 1, 'txIndex': 1}"),
        @CompoundIndex(name = "type_height", def = "{'txType': 1, 'blockHeight': 1}")
})
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChainTransaction {

    @Id
    @EqualsAndHashCode.Include
    private String hash;
    private long blockHeight;
    private int txIndex;
    private TxType txType;
    @Indexed
    private String fromAddress;
    @Indexed
    private String toAddress;
    private BigInteger amount = BigInteger.ZERO;
    private BigInteger fee = BigInteger.ZERO;
    private long nonce;
    private Long gasPrice;
    private Long gasLimit;
    private Long gasUsed;
    private String signature;
    private String pubKey;
    private Map<String, Object> payload;
    private Instant indexedAt;

    public boolean hasRecipient() {
        return toAddress != null && !toAddress.isBlank();
    }
}
