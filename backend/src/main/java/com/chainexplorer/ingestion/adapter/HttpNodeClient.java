package com.chainexplorer.ingestion.adapter;

import com.chainexplorer.config.CaffeineConfig;
import com.chainexplorer.ingestion.error.DataIntegrityFaultException;
import com.chainexplorer.ingestion.error.NodeNotFoundException;
import com.chainexplorer.ingestion.error.NodeUnavailableException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;

import java.util.function.Function;

/**
 * Node client over the node's HTTP API: head height from GET /metrics (Prometheus text),
 * blocks from GET /block/{height} and GET /block/hash/{hash}.
 * Transport failures are retried across endpoints with backoff; 404 and integrity faults are not.
 */
@Slf4j
public class HttpNodeClient implements NodeClient {

    private final NodeHttpClient httpClient;
    private final RpcEndpointRotator rotator;
    private final RateLimiter rateLimiter;
    private final NodeBlockParser parser;
    private final String heightMetric;

    public HttpNodeClient(NodeHttpClient httpClient, RpcEndpointRotator rotator, RateLimiter rateLimiter,
                          NodeBlockParser parser, String heightMetric) {
        this.httpClient = httpClient;
        this.rotator = rotator;
        this.rateLimiter = rateLimiter;
        this.parser = parser;
        this.heightMetric = heightMetric;
    }

    @Override
    public long currentHeight() {
        String metrics;
        try {
            metrics = callWithRetry(endpoint -> endpoint + "/metrics");
        } catch (NodeNotFoundException e) {
            log.debug("Node serves no /metrics ({}), falling back to /block/latest", e.getMessage());
            metrics = null;
        }
        Long fromMetric = parseMetric(metrics);
        if (fromMetric != null) {
            return fromMetric;
        }
        log.debug("Metric {} missing from /metrics, falling back to /block/latest", heightMetric);
        return parser.parse(callWithRetry(endpoint -> endpoint + "/block/latest"), null).height();
    }

    @Override
    public NodeBlock getBlock(long height) {
        return parser.parse(callWithRetry(endpoint -> endpoint + "/block/" + height), height);
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.NODE_BLOCK_BY_HASH_CACHE, key = "#hash")
    public NodeBlock getBlockByHash(String hash) {
        return parser.parse(callWithRetry(endpoint -> endpoint + "/block/hash/" + hash), null);
    }

    Long parseMetric(String metrics) {
        if (metrics == null) {
            return null;
        }
        String prefix = heightMetric + " ";
        for (String line : metrics.split("\n")) {
            if (line.startsWith(prefix)) {
                String value = line.substring(prefix.length()).trim();
                try {
                    return (long) Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    throw new NodeUnavailableException("Unparsable " + heightMetric + " value: " + value, e);
                }
            }
        }
        return null;
    }

    private String callWithRetry(Function<String, String> urlForEndpoint) {
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < rotator.getMaxAttempts(); attempt++) {
            if (attempt > 0) {
                sleepQuietly(rotator.retryDelayMs(attempt - 1));
            }
            String url = urlForEndpoint.apply(rotator.getNextEndpoint());
            try {
                if (!rateLimiter.acquirePermission()) {
                    throw new NodeUnavailableException("Node request budget exhausted for " + url);
                }
                String body = httpClient.get(url).block();
                if (body == null) {
                    throw new NodeNotFoundException("Empty response from " + url);
                }
                return body;
            } catch (NodeNotFoundException | DataIntegrityFaultException e) {
                throw e;
            } catch (RuntimeException e) {
                lastException = e;
                log.debug("Node call {} failed (attempt {}): {}", url, attempt + 1, e.getMessage());
            }
        }
        throw new NodeUnavailableException(
                "Node unavailable after " + rotator.getMaxAttempts() + " attempts: " + messageOf(lastException),
                lastException);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(Math.max(0L, millis));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NodeUnavailableException("Interrupted during node retry", e);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
