package com.hubsync.ingestion.stream;

import com.hubsync.domain.HubEvent;
import com.hubsync.ingestion.adapter.HubJsonCodec;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Durable stream kept in memory for ordering and restart scenarios. Survives "restarts" as long as the same
 * instance is handed to the new consumer.
 */
class InMemoryDurableStream implements DurableStream {

    private final HubJsonCodec codec;
    private final Map<String, List<StreamRecord>> entries = new HashMap<>();
    private final Map<String, Long> checkpoints = new HashMap<>();
    private final Set<Long> failCheckpointOnce = new HashSet<>();
    private RuntimeException nextReadFailure;

    InMemoryDurableStream(HubJsonCodec codec) {
        this.codec = codec;
    }

    @Override
    public synchronized long append(String shardKey, HubEvent event) {
        return appendRaw(shardKey, event.id(), codec.writeEvent(event));
    }

    synchronized long appendRaw(String shardKey, long hubEventId, String payload) {
        List<StreamRecord> shard = entries.computeIfAbsent(shardKey, k -> new ArrayList<>());
        long entryId = shard.size() + 1L;
        shard.add(new StreamRecord(shardKey, entryId, hubEventId, payload));
        return entryId;
    }

    @Override
    public synchronized List<StreamRecord> readAfter(String shardKey, long afterEntryId, int limit) {
        if (nextReadFailure != null) {
            RuntimeException failure = nextReadFailure;
            nextReadFailure = null;
            throw failure;
        }
        return entries.getOrDefault(shardKey, List.of()).stream()
                .filter(r -> r.entryId() > afterEntryId)
                .limit(limit)
                .toList();
    }

    @Override
    public synchronized Optional<Long> getCheckpoint(String consumerId) {
        return Optional.ofNullable(checkpoints.get(consumerId));
    }

    @Override
    public synchronized void setCheckpoint(String consumerId, long entryId) {
        if (failCheckpointOnce.remove(entryId)) {
            throw new DataAccessResourceFailureException("stream unavailable while checkpointing " + entryId);
        }
        checkpoints.put(consumerId, entryId);
    }

    /** The next attempt to checkpoint {@code entryId} fails, as if the process died right after applying it. */
    synchronized void failCheckpointOnce(long entryId) {
        failCheckpointOnce.add(entryId);
    }

    /** The next read throws {@code failure}. */
    synchronized void failNextRead(RuntimeException failure) {
        nextReadFailure = failure;
    }

    synchronized List<StreamRecord> entries(String shardKey) {
        return List.copyOf(entries.getOrDefault(shardKey, List.of()));
    }
}
