package com.hubsync;

import com.hubsync.ingestion.config.BackfillProperties;
import com.hubsync.ingestion.config.StreamProperties;
import com.hubsync.ingestion.job.backfill.BackfillOrchestrator;
import com.hubsync.ingestion.job.backfill.BackfillWorker;
import com.hubsync.ingestion.processor.HubEventProcessor;
import com.hubsync.ingestion.processor.MessageHandler;
import com.hubsync.ingestion.stream.HubEventHandler;
import com.hubsync.ingestion.stream.HubEventHandler.HandleOutcome;
import com.hubsync.ingestion.stream.HubEventStreamConsumer;
import com.hubsync.ingestion.stream.HubEventSubscriber;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry: {@code start} runs subscriber and consumer, {@code backfill [fid...]} enqueues a backfill and
 * runs the worker, {@code worker} runs the worker only. Without a command nothing is started.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class HubSyncCommandRunner implements ApplicationRunner {

    static final String START = "start";
    static final String BACKFILL = "backfill";
    static final String WORKER = "worker";

    private final HubEventSubscriber subscriber;
    private final HubEventStreamConsumer consumer;
    private final HubEventProcessor processor;
    private final MessageHandler messageHandler;
    private final BackfillOrchestrator orchestrator;
    private final BackfillWorker worker;
    private final StreamProperties streamProperties;
    private final BackfillProperties backfillProperties;

    @Override
    public void run(ApplicationArguments args) throws Exception {
        List<String> commandLine = args.getNonOptionArgs();
        if (commandLine.isEmpty()) {
            log.info("No command given (expected {}, {} or {})", START, BACKFILL, WORKER);
            return;
        }
        String command = commandLine.get(0);
        switch (command) {
            case START -> start();
            case BACKFILL -> backfill(commandLine.subList(1, commandLine.size()));
            case WORKER -> worker.run();
            default -> throw new IllegalArgumentException("Unknown command '" + command + "'");
        }
    }

    void start() throws InterruptedException {
        subscriber.start();
        long delay = streamProperties.getStartupDelayMs();
        if (delay > 0) {
            log.info("Waiting {} ms for the subscriber before starting the consumer", delay);
            Thread.sleep(delay);
        }
        consumer.start(streamHandler());
    }

    void backfill(List<String> fidArgs) {
        List<Long> fids = new ArrayList<>(backfillProperties.getFids());
        for (String arg : fidArgs) {
            for (String part : arg.split(",")) {
                if (!part.isBlank()) {
                    fids.add(Long.parseLong(part.trim()));
                }
            }
        }
        orchestrator.backfillFids(fids);
        worker.run();
    }

    HubEventHandler streamHandler() {
        return event -> processor.processHubEvent(event, messageHandler)
                .map(applied -> applied.skipped() ? HandleOutcome.skippedEvent() : HandleOutcome.applied());
    }

    @PreDestroy
    public void shutdown() {
        subscriber.stop();
        consumer.stop();
        worker.stop();
    }
}
