package com.hubsync.ingestion.stream;

import com.hubsync.common.RetryPolicy;
import com.hubsync.domain.HubEvent;
import com.hubsync.domain.ShardKey;
import com.hubsync.ingestion.adapter.HubClient;
import com.hubsync.ingestion.adapter.HubConnectionException;
import com.hubsync.ingestion.adapter.HubEventPage;
import com.hubsync.ingestion.config.HubProperties;
import com.hubsync.ingestion.config.StreamProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Follows the Hub event feed and appends events owned by this shard to the durable stream.
 * <p>
 * The resume point is the subscriber's own position (last Hub event id handled), persisted after every
 * event. A crash between an append and the position write re-appends that event on restart; the processor's
 * idempotence absorbs the duplicate.
 */
@Component
@Slf4j
public class HubEventSubscriber {

    private final HubClient hubClient;
    private final DurableStream stream;
    private final ShardKey shardKey;
    private final StreamProperties streamProperties;
    private final RetryPolicy retryPolicy;
    private final Executor executor;
    private final String positionName;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopRequested;
    private volatile long lastAppendedEventId;

    public HubEventSubscriber(HubClient hubClient,
                              DurableStream stream,
                              ShardKey shardKey,
                              HubProperties hubProperties,
                              StreamProperties streamProperties,
                              RetryPolicy retryPolicy,
                              @Qualifier("subscriber-executor") Executor executor) {
        this.hubClient = hubClient;
        this.stream = stream;
        this.shardKey = shardKey;
        this.streamProperties = streamProperties;
        this.retryPolicy = retryPolicy;
        this.executor = executor;
        this.positionName = "hub-subscriber:" + hubProperties.getHubId() + ":" + shardKey.key();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            log.debug("Hub subscriber for shard {} already running", shardKey);
            return;
        }
        stopRequested = false;
        log.info("Starting hub subscriber for shard {} from event {}", shardKey, resumeFromEventId());
        executor.execute(this::subscribeLoop);
    }

    /**
     * Stops after the event in flight; everything appended so far stays in the stream.
     */
    public void stop() {
        stopRequested = true;
        if (running.compareAndSet(true, false)) {
            log.info("Stopping hub subscriber for shard {} at hub event {}", shardKey, lastAppendedEventId);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getLastAppendedEventId() {
        return lastAppendedEventId;
    }

    private void subscribeLoop() {
        int failures = 0;
        try {
            while (running.get()) {
                try {
                    int handled = pollOnce();
                    failures = 0;
                    if (handled == 0 && !sleep(streamProperties.getPollIntervalMs())) {
                        break;
                    }
                } catch (HubConnectionException | DataAccessException e) {
                    log.warn("Hub subscription for shard {} failed, resubscribing from event {}: {}",
                            shardKey, resumeFromEventId(), e.getMessage());
                    if (!retryPolicy.sleep(failures++)) {
                        break;
                    }
                } catch (RuntimeException e) {
                    log.error("Hub subscription for shard {} hit an unexpected error, retrying", shardKey, e);
                    if (!retryPolicy.sleep(failures++)) {
                        break;
                    }
                }
            }
        } finally {
            running.set(false);
            log.info("Hub subscriber for shard {} exited", shardKey);
        }
    }

    /**
     * Fetches one page of the Hub feed after the stored position and appends the events this shard owns.
     *
     * @return number of Hub events looked at (owned or not); 0 when the feed had nothing new
     */
    int pollOnce() {
        long from = resumeFromEventId();
        HubEventPage page = hubClient.getEvents(from);
        if (page.isEmpty()) {
            return 0;
        }
        int handled = 0;
        long position = from - 1;
        for (HubEvent event : page.events()) {
            if (event.id() < from) {
                continue;
            }
            if (shardKey.owns(event)) {
                stream.append(shardKey.key(), event);
                lastAppendedEventId = event.id();
            }
            position = event.id();
            stream.setCheckpoint(positionName, position);
            handled++;
            if (stopRequested) {
                return handled;
            }
        }
        if (page.lastEventId() > position) {
            stream.setCheckpoint(positionName, page.lastEventId());
            handled++;
        }
        return handled;
    }

    /** First Hub event id not yet handled. */
    long resumeFromEventId() {
        return stream.getCheckpoint(positionName).map(id -> id + 1).orElse(0L);
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
}
