package com.chainexplorer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Chain node endpoints and client throttling. Documented in application.yml.
 */
@ConfigurationProperties(prefix = "explorer.node")
@NoArgsConstructor
@Getter
@Setter
public class NodeProperties {

    /** Node base URLs, used round-robin. */
    private List<String> urls = new ArrayList<>(List.of("http://localhost:8000"));

    /** Prometheus metric on GET /metrics that carries the head height. */
    private String heightMetric = "computechain_block_height";

    /** Per-request timeout. */
    private long requestTimeoutMs = 30_000;

    /** Request budget per second against the node. */
    private int maxRequestsPerSecond = 50;

    /** How long a call may wait for a rate limiter permit before failing as unavailable. */
    private long limiterTimeoutMs = 5_000;

    public void setUrls(List<String> urls) {
        this.urls = urls != null ? urls : new ArrayList<>();
    }
}
