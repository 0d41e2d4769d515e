package com.hubsync.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Durable stream consumer and subscriber loop config.
 */
@ConfigurationProperties(prefix = "hubsync.stream")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class StreamProperties {

    /** Consumer name; checkpoints are kept per (consumerGroup, shard). */
    private String consumerGroup = "hub-sync";

    /** Entries read per consumer poll. */
    @Min(1)
    private int batchSize = 100;

    /** Sleep when the stream (or the Hub event feed) has nothing new. */
    @Min(1)
    private long pollIntervalMs = 1_000;

    /** Delay before the consumer starts, giving the subscriber time to create the stream. */
    private long startupDelayMs = 10_000;
}
