package com.chainexplorer.ingestion.config;

import com.chainexplorer.common.RetryPolicy;
import com.chainexplorer.config.AsyncConfig;
import com.chainexplorer.ingestion.adapter.HttpNodeClient;
import com.chainexplorer.ingestion.adapter.NodeBlockParser;
import com.chainexplorer.ingestion.adapter.NodeClient;
import com.chainexplorer.ingestion.adapter.NodeHttpClient;
import com.chainexplorer.ingestion.adapter.RpcEndpointRotator;
import com.chainexplorer.ingestion.adapter.WebClientNodeHttpClient;
import com.chainexplorer.ingestion.aggregation.AccountLedger;
import com.chainexplorer.ingestion.aggregation.BlockAggregator;
import com.chainexplorer.ingestion.aggregation.ThroughputCalculator;
import com.chainexplorer.ingestion.indexer.ChainIndexer;
import com.chainexplorer.ingestion.indexer.IndexerWorkQueue;
import com.chainexplorer.ingestion.indexer.WriterGuard;
import com.chainexplorer.ingestion.reorg.ReorgDetector;
import com.chainexplorer.ingestion.store.ChainStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Wires the node client, aggregation, reorg detection and the indexer loop from explorer.* properties.
 */
@Configuration
@EnableConfigurationProperties({ NodeProperties.class, IndexerProperties.class, IndexerRetryProperties.class })
public class IngestionConfig {

    @Autowired
    private IndexerRetryProperties retryProperties;

    private RetryPolicy retryPolicy() {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts(),
                retryProperties.getMaxDelayMs());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RpcEndpointRotator nodeEndpointRotator(NodeProperties properties) {
        return new RpcEndpointRotator(properties.getUrls(), retryPolicy());
    }

    @Bean(name = "nodeRateLimiter")
    public RateLimiter nodeRateLimiter(NodeProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("chain-node", config);
    }

    @Bean
    public NodeHttpClient nodeHttpClient(WebClient.Builder webClientBuilder, NodeProperties properties) {
        return new WebClientNodeHttpClient(webClientBuilder, Duration.ofMillis(properties.getRequestTimeoutMs()));
    }

    @Bean
    public NodeBlockParser nodeBlockParser(ObjectMapper objectMapper) {
        return new NodeBlockParser(objectMapper);
    }

    @Bean
    public NodeClient nodeClient(NodeHttpClient nodeHttpClient,
                                 RpcEndpointRotator nodeEndpointRotator,
                                 @Qualifier("nodeRateLimiter") RateLimiter nodeRateLimiter,
                                 NodeBlockParser nodeBlockParser,
                                 NodeProperties properties) {
        return new HttpNodeClient(nodeHttpClient, nodeEndpointRotator, nodeRateLimiter, nodeBlockParser,
                properties.getHeightMetric());
    }

    @Bean
    public BlockAggregator blockAggregator(IndexerProperties properties) {
        return new BlockAggregator(properties.getGenesisHeight(), properties.getGenesisAllocations());
    }

    @Bean
    public AccountLedger accountLedger(IndexerProperties properties) {
        return new AccountLedger(properties.isEnforceNonNegativeBalances());
    }

    @Bean
    public ThroughputCalculator throughputCalculator(IndexerProperties properties) {
        return new ThroughputCalculator(properties.getThroughputWindowSeconds(), properties.getCurrentTpsWindowSeconds());
    }

    @Bean
    public ReorgDetector reorgDetector(NodeClient nodeClient, ChainStore chainStore, IndexerProperties properties) {
        return new ReorgDetector(nodeClient, chainStore, properties.getGenesisHeight(), properties.isVerifyParentLink());
    }

    @Bean
    public WriterGuard writerGuard() {
        return new WriterGuard();
    }

    @Bean
    public IndexerWorkQueue indexerWorkQueue(@Qualifier(AsyncConfig.INDEXER_EXECUTOR) Executor indexerExecutor) {
        return new IndexerWorkQueue(indexerExecutor);
    }

    @Bean
    public ChainIndexer chainIndexer(NodeClient nodeClient,
                                     ChainStore chainStore,
                                     BlockAggregator blockAggregator,
                                     ReorgDetector reorgDetector,
                                     ThroughputCalculator throughputCalculator,
                                     WriterGuard writerGuard,
                                     IndexerProperties properties,
                                     Clock clock) {
        return new ChainIndexer(nodeClient, chainStore, blockAggregator, reorgDetector, throughputCalculator,
                writerGuard, properties, retryPolicy(), clock);
    }
}
