package com.chainexplorer.ingestion.adapter;

import reactor.core.publisher.Mono;

/**
 * Raw HTTP GET against the chain node, separated from parsing for testing.
 * Retries and endpoint rotation are handled by {@link HttpNodeClient}.
 */
public interface NodeHttpClient {

    /**
     * @param url absolute URL
     * @return response body; errors with {@link com.chainexplorer.ingestion.error.NodeNotFoundException} on 404
     * and {@link com.chainexplorer.ingestion.error.NodeUnavailableException} on any other failure
     */
    Mono<String> get(String url);
}
