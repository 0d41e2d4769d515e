package com.hubsync.config;

import com.hubsync.ingestion.config.BackfillProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: one long-running loop each for the subscriber and consumer, {@code concurrency} loops for
 * backfill workers.
 */
@Configuration
public class AsyncConfig {

    public static final String SUBSCRIBER_EXECUTOR = "subscriber-executor";
    public static final String CONSUMER_EXECUTOR = "consumer-executor";
    public static final String BACKFILL_EXECUTOR = "backfill-executor";

    @Bean(name = SUBSCRIBER_EXECUTOR)
    public Executor subscriberExecutor() {
        return singleLoop("hub-subscriber-");
    }

    @Bean(name = CONSUMER_EXECUTOR)
    public Executor consumerExecutor() {
        return singleLoop("stream-consumer-");
    }

    @Bean(name = BACKFILL_EXECUTOR)
    public Executor backfillExecutor(BackfillProperties backfillProperties) {
        int loops = Math.max(1, backfillProperties.getConcurrency());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(loops);
        e.setMaxPoolSize(loops);
        e.setThreadNamePrefix("backfill-");
        e.initialize();
        return e;
    }

    private static Executor singleLoop(String prefix) {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(1);
        e.setThreadNamePrefix(prefix);
        e.initialize();
        return e;
    }
}
