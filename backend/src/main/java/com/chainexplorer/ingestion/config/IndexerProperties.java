package com.chainexplorer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Indexer loop settings: poll/resync cadence, lookback depth and integrity switches.
 */
@ConfigurationProperties(prefix = "explorer.indexer")
@NoArgsConstructor
@Getter
@Setter
public class IndexerProperties {

    /** Start the poll and resync timers with the application. */
    private boolean enabled = true;

    /** Delay between catch-up ticks. */
    private long pollIntervalMs = 2_000;

    /** Delay between reorg checks. */
    private long resyncIntervalMs = 300_000;

    /** Number of trailing blocks re-verified per reorg check (lookback depth D). */
    private int resyncDepth = 10;

    /** Height of the chain's first block. Its parent link is not checked. */
    private long genesisHeight = 0;

    /** Upper bound of blocks committed per poll tick so resync ticks are not starved. */
    private int maxBlocksPerTick = 500;

    /** Trailing time window for average throughput. */
    private long throughputWindowSeconds = 3_600;

    /** Trailing time window for "current" TPS. */
    private long currentTpsWindowSeconds = 60;

    /** Check that each fetched block links to the stored tip. */
    private boolean verifyParentLink = true;

    /** Treat a negative account balance as an integrity fault. */
    private boolean enforceNonNegativeBalances = true;

    /** Largest range accepted by a manual verification. */
    private long maxVerifyRange = 10_000;

    /** Balances minted at the genesis block, in base units. */
    private Map<String, BigInteger> genesisAllocations = new LinkedHashMap<>();

    public void setGenesisAllocations(Map<String, BigInteger> genesisAllocations) {
        this.genesisAllocations = genesisAllocations != null ? genesisAllocations : new LinkedHashMap<>();
    }
}
