package com.chainexplorer.ingestion.adapter;

import com.chainexplorer.ingestion.error.NodeNotFoundException;
import com.chainexplorer.ingestion.error.NodeUnavailableException;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Node transport using WebClient. Used by HttpNodeClient.
 */
public class WebClientNodeHttpClient implements NodeHttpClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientNodeHttpClient(WebClient.Builder builder, Duration timeout) {
        this.webClient = builder.build();
        this.timeout = timeout;
    }

    @Override
    public Mono<String> get(String url) {
        return webClient.get()
                .uri(url)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(WebClientResponseException.NotFound.class, e -> new NodeNotFoundException("Not found: " + url))
                .onErrorMap(WebClientResponseException.class,
                        e -> new NodeUnavailableException("HTTP " + e.getStatusCode().value() + " from " + url, e))
                .onErrorMap(WebClientRequestException.class, e -> new NodeUnavailableException(e.getMessage(), e))
                .onErrorMap(TimeoutException.class, e -> new NodeUnavailableException("Timed out: " + url, e));
    }
}
