package com.chainexplorer.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Precomputed throughput over the trailing time window. Singleton, refreshed by the indexer.
 */
@Document(collection = "throughput_stats")
@NoArgsConstructor
@Getter
@Setter
public class ThroughputSnapshot {

    public static final String SINGLETON_ID = "current";

    @Id
    private String id = SINGLETON_ID;
    private double currentTps;
    private double avgTps1h;
    private double avgBlockTime;
    private long blocksInWindow;
    private long txsInWindow;
    private long tipHeight;
    private Instant computedAt;

    public static ThroughputSnapshot empty(long tipHeight, Instant computedAt) {
        ThroughputSnapshot s = new ThroughputSnapshot();
        s.setTipHeight(tipHeight);
        s.setComputedAt(computedAt);
        return s;
    }
}
