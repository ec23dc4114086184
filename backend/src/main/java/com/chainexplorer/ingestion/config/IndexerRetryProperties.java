package com.chainexplorer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for node calls and for catch-up backoff (exponential backoff ± jitter).
 */
@ConfigurationProperties(prefix = "explorer.indexer.retry")
@NoArgsConstructor
@Getter
@Setter
public class IndexerRetryProperties {

    /** Base delay in ms for first retry; doubles each attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Max attempts per node call, including the first. Default 3. */
    private int maxAttempts = 3;

    /** Ceiling for the catch-up pause after repeated node failures. Default 60s. */
    private long maxDelayMs = 60_000L;
}
