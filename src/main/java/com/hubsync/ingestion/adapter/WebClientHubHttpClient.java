package com.hubsync.ingestion.adapter;

import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Hub HTTP client using WebClient. Used by {@link HttpHubClient}.
 */
public class WebClientHubHttpClient implements HubHttpClient {

    private final WebClient webClient;

    public WebClientHubHttpClient(WebClient.Builder builder) {
        this.webClient = builder.build();
    }

    @Override
    public Mono<String> get(String endpointUrl, String path, Map<String, Object> queryParams) {
        UriComponentsBuilder uri = UriComponentsBuilder.fromHttpUrl(endpointUrl).path(path);
        if (queryParams != null) {
            queryParams.forEach((k, v) -> {
                if (v != null) {
                    uri.queryParam(k, v);
                }
            });
        }
        return webClient.get()
                .uri(uri.build().toUri())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .bodyToMono(String.class)
                .onErrorMap(WebClientResponseException.class,
                        e -> new HubConnectionException("Hub returned " + e.getStatusCode().value() + " for " + path, e))
                .onErrorMap(WebClientRequestException.class,
                        e -> new HubConnectionException("Hub unreachable at " + endpointUrl + ": " + e.getMessage(), e));
    }
}
