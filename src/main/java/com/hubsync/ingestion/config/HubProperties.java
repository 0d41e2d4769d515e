package com.hubsync.ingestion.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Hub connection config. Several urls rotate round-robin on retries.
 */
@ConfigurationProperties(prefix = "hubsync.hub")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class HubProperties {

    /** Hub HTTP API base urls, e.g. http://localhost:2281. */
    @NotEmpty
    private List<String> urls = new ArrayList<>(List.of("http://localhost:2281"));

    /** Name under which the subscriber records its Hub position. */
    private String hubId = "shuttle";

    /** Per-call timeout; a timed out call is a retryable connection failure. */
    @Min(1)
    private long timeoutMs = 30_000;

    /** Page size for message and proof queries. */
    @Min(1)
    private int pageSize = 1000;

    /** Client-side cap on Hub requests per second. */
    @Min(1)
    private int maxRequestsPerSecond = 50;

    /** Max wait for a local limiter permit before the call fails. */
    private long limiterTimeoutMs = 10_000;
}
