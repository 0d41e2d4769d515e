package com.hubsync.ingestion.config;

import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Shard assignment of this process. totalShards=0 means unsharded.
 */
@ConfigurationProperties(prefix = "hubsync.shard")
@Validated
@NoArgsConstructor
@Getter
@Setter
public class ShardProperties {

    @Min(0)
    private int totalShards = 0;

    @Min(0)
    private int shardIndex = 0;
}
