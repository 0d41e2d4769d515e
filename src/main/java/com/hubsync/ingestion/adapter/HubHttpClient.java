package com.hubsync.ingestion.adapter;

import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Raw Hub HTTP API access. Returns the response body as JSON text.
 */
public interface HubHttpClient {

    Mono<String> get(String endpointUrl, String path, Map<String, Object> queryParams);
}
