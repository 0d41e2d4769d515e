package com.hubsync.ingestion.stream;

import com.hubsync.domain.HubEvent;

import java.util.List;
import java.util.Optional;

/**
 * Ordered, appendable, replayable log keyed by shard, plus named positions that live outside
 * the relational store's transactions.
 */
public interface DurableStream {

    /**
     * Appends the event under the shard key and returns its entry id. Entry ids increase strictly per shard.
     */
    long append(String shardKey, HubEvent event);

    /**
     * Up to {@code limit} entries with id strictly greater than {@code afterEntryId}, in entry order.
     */
    List<StreamRecord> readAfter(String shardKey, long afterEntryId, int limit);

    Optional<Long> getCheckpoint(String consumerId);

    void setCheckpoint(String consumerId, long entryId);
}
