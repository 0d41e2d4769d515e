package com.hubsync.ingestion.stream;

import com.hubsync.common.Result;
import com.hubsync.common.RetryPolicy;
import com.hubsync.domain.HubEvent;
import com.hubsync.domain.ShardKey;
import com.hubsync.ingestion.adapter.HubJsonCodec;
import com.hubsync.ingestion.config.StreamProperties;
import com.hubsync.ingestion.stream.HubEventHandler.HandleOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads this shard's stream after the committed checkpoint and hands entries to the handler one at a time,
 * in entry order. The checkpoint moves only after the handler succeeded; a failed entry is retried after a
 * backoff and never passed over.
 */
@Component
@Slf4j
public class HubEventStreamConsumer {

    private final DurableStream stream;
    private final ShardKey shardKey;
    private final HubJsonCodec codec;
    private final StreamProperties streamProperties;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final String consumerId;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopRequested;

    public HubEventStreamConsumer(DurableStream stream,
                                  ShardKey shardKey,
                                  HubJsonCodec codec,
                                  StreamProperties streamProperties,
                                  RetryPolicy retryPolicy,
                                  @Qualifier("consumer-executor") Executor executor) {
        this.stream = stream;
        this.shardKey = shardKey;
        this.codec = codec;
        this.streamProperties = streamProperties;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
        this.consumerId = streamProperties.getConsumerGroup() + ":" + shardKey.key();
    }

    public void start(HubEventHandler handler) {
        if (!running.compareAndSet(false, true)) {
            log.debug("Stream consumer {} already running", consumerId);
            return;
        }
        stopRequested = false;
        log.info("Starting stream consumer {} after entry {}", consumerId, currentCheckpoint());
        executor.execute(() -> consumeLoop(handler));
    }

    /**
     * Lets the entry in flight finish (its transaction commits), then exits the loop.
     */
    public void stop() {
        stopRequested = true;
        running.set(false);
    }

    public boolean isRunning() {
        return running.get();
    }

    public String getConsumerId() {
        return consumerId;
    }

    public long currentCheckpoint() {
        return stream.getCheckpoint(consumerId).orElse(0L);
    }

    private void consumeLoop(HubEventHandler handler) {
        int failures = 0;
        try {
            while (running.get()) {
                try {
                    BatchOutcome outcome = pollOnce(handler);
                    if (outcome.failed()) {
                        if (!retryPolicy.sleep(failures++)) {
                            break;
                        }
                    } else {
                        failures = 0;
                        if (outcome.processed() == 0 && !sleep(streamProperties.getPollIntervalMs())) {
                            break;
                        }
                    }
                } catch (DataAccessException e) {
                    log.warn("Stream consumer {} could not read or checkpoint: {}", consumerId, e.getMessage());
                    if (!retryPolicy.sleep(failures++)) {
                        break;
                    }
                } catch (RuntimeException e) {
                    log.error("Stream consumer {} hit an unexpected error, retrying", consumerId, e);
                    if (!retryPolicy.sleep(failures++)) {
                        break;
                    }
                }
            }
        } finally {
            running.set(false);
            log.info("Stream consumer {} exited", consumerId);
        }
    }

    /**
     * Processes one batch. Stops at the first failed entry, leaving the checkpoint on the entry before it.
     */
    BatchOutcome pollOnce(HubEventHandler handler) {
        long checkpoint = currentCheckpoint();
        List<StreamRecord> batch = stream.readAfter(shardKey.key(), checkpoint, streamProperties.getBatchSize());
        int processed = 0;
        for (StreamRecord record : batch) {
            if (record.entryId() <= checkpoint) {
                throw new IllegalStateException("Stream " + shardKey + " returned entry " + record.entryId()
                        + " at or before checkpoint " + checkpoint);
            }
            Result<HandleOutcome> result = apply(handler, record);
            if (result.isFailure()) {
                log.warn("Entry {} (hub event {}) on stream {} failed, will retry: {}",
                        record.entryId(), record.hubEventId(), shardKey, result.getErrorMessage().orElse("unknown"));
                return new BatchOutcome(processed, true);
            }
            if (result.getValue().map(HandleOutcome::skipped).orElse(false)) {
                log.debug("Handler skipped hub event {} (entry {})", record.hubEventId(), record.entryId());
            }
            stream.setCheckpoint(consumerId, record.entryId());
            checkpoint = record.entryId();
            processed++;
            if (stopRequested) {
                break;
            }
        }
        return new BatchOutcome(processed, false);
    }

    private Result<HandleOutcome> apply(HubEventHandler handler, StreamRecord record) {
        HubEvent event;
        try {
            event = codec.readEvent(record.payload());
        } catch (IllegalArgumentException e) {
            return Result.failure("Undecodable stream entry " + record.entryId() + ": " + e.getMessage(), e);
        }
        try {
            Result<HandleOutcome> result = handler.handle(event);
            return result != null ? result : Result.failure("Handler returned no result for hub event " + event.id());
        } catch (RuntimeException e) {
            return Result.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
    }

    private boolean sleep(long ms) {
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    record BatchOutcome(int processed, boolean failed) {
    }
}
