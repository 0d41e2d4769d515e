package com.hubsync.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Backoff used by the subscriber, consumer and queue retries (exponential ± jitter). Documented in application.yml.
 */
@ConfigurationProperties(prefix = "hubsync.retry")
@NoArgsConstructor
@Getter
@Setter
public class RetryProperties {

    /** Base delay in ms for the first retry; doubles each attempt. */
    private long baseDelayMs = 1000L;

    /** Ceiling for a single delay. */
    private long maxDelayMs = 30_000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). */
    private double jitterFactor = 0.2;

    /** Max attempts for a single Hub call before it is reported as failed. */
    private int maxAttempts = 5;
}
