package com.chainexplorer.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Derived per-address aggregate. Written only through the indexer's commit and rollback path; never deleted.
 * {@code nonce} is the next expected nonce (highest sent nonce + 1).
 */
@Document(collection = "accounts")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Account {

    @Id
    @EqualsAndHashCode.Include
    private String address;
    private BigInteger balance = BigInteger.ZERO;
    private long nonce;
    @Indexed
    private long txCount;
    private long txSentCount;
    private long txReceivedCount;
    private Long firstSeenHeight;
    private Long lastSeenHeight;
    @Indexed
    private boolean validator;
    private Instant updatedAt;

    public Account(String address) {
        this.address = address;
    }
}
