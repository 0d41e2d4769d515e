package com.hubsync.ingestion.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hubsync.common.RetryPolicy;
import com.hubsync.domain.ShardKey;
import com.hubsync.domain.StreamCheckpointRepository;
import com.hubsync.ingestion.adapter.HttpHubClient;
import com.hubsync.ingestion.adapter.HubClient;
import com.hubsync.ingestion.adapter.HubHttpClient;
import com.hubsync.ingestion.adapter.HubJsonCodec;
import com.hubsync.ingestion.adapter.WebClientHubHttpClient;
import com.hubsync.ingestion.stream.DurableStream;
import com.hubsync.ingestion.stream.MongoDurableStream;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Wires the Hub client, the durable stream and the shared retry policy from {@code hubsync.*} properties.
 */
@Configuration
@EnableConfigurationProperties({ HubProperties.class, ShardProperties.class, StreamProperties.class, BackfillProperties.class, RetryProperties.class })
public class IngestionConfig {

    @Bean
    public RetryPolicy retryPolicy(RetryProperties retryProperties) {
        return new RetryPolicy(
                retryProperties.getBaseDelayMs(),
                retryProperties.getMaxDelayMs(),
                retryProperties.getJitterFactor(),
                retryProperties.getMaxAttempts());
    }

    @Bean
    public ShardKey shardKey(ShardProperties shardProperties) {
        return new ShardKey(shardProperties.getTotalShards(), shardProperties.getShardIndex());
    }

    @Bean
    public HubJsonCodec hubJsonCodec(ObjectMapper objectMapper) {
        return new HubJsonCodec(objectMapper);
    }

    @Bean
    public HubHttpClient hubHttpClient(WebClient.Builder webClientBuilder) {
        return new WebClientHubHttpClient(webClientBuilder);
    }

    @Bean(name = "hubRateLimiter")
    public RateLimiter hubRateLimiter(HubProperties hubProperties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, hubProperties.getMaxRequestsPerSecond()))
                .timeoutDuration(Duration.ofMillis(Math.max(0L, hubProperties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("hub-rpc", config);
    }

    @Bean
    public HubClient hubClient(HubHttpClient hubHttpClient,
                               RetryPolicy retryPolicy,
                               @Qualifier("hubRateLimiter") RateLimiter hubRateLimiter,
                               HubJsonCodec hubJsonCodec,
                               HubProperties hubProperties) {
        return new HttpHubClient(hubHttpClient, hubProperties.getUrls(), retryPolicy, hubRateLimiter, hubJsonCodec,
                Duration.ofMillis(hubProperties.getTimeoutMs()));
    }

    @Bean
    public DurableStream durableStream(MongoTemplate mongoTemplate,
                                       StreamCheckpointRepository checkpointRepository,
                                       HubJsonCodec hubJsonCodec) {
        return new MongoDurableStream(mongoTemplate, checkpointRepository, hubJsonCodec);
    }
}
