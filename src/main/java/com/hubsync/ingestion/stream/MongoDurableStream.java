package com.hubsync.ingestion.stream;

import com.hubsync.domain.HubEvent;
import com.hubsync.domain.SequenceCounter;
import com.hubsync.domain.StreamCheckpoint;
import com.hubsync.domain.StreamCheckpointRepository;
import com.hubsync.domain.StreamEntry;
import com.hubsync.ingestion.adapter.HubJsonCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * {@link DurableStream} on MongoDB. Entry ids come from a per-shard counter in {@code sequence_counters};
 * the unique (shardKey, entryId) index rejects a second writer racing on the same id.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoDurableStream implements DurableStream {

    static final String SEQUENCE_PREFIX = "stream:";

    private final MongoTemplate mongoTemplate;
    private final StreamCheckpointRepository checkpointRepository;
    private final HubJsonCodec codec;

    @Override
    public long append(String shardKey, HubEvent event) {
        long entryId = nextEntryId(shardKey);
        StreamEntry entry = new StreamEntry();
        entry.setShardKey(shardKey);
        entry.setEntryId(entryId);
        entry.setHubEventId(event.id());
        entry.setEventType(event.type().name());
        entry.setPayload(codec.writeEvent(event));
        entry.setAppendedAt(Instant.now());
        mongoTemplate.insert(entry);
        log.debug("Appended hub event {} to stream {} as entry {}", event.id(), shardKey, entryId);
        return entryId;
    }

    @Override
    public List<StreamRecord> readAfter(String shardKey, long afterEntryId, int limit) {
        Query query = new Query(where("shardKey").is(shardKey).and("entryId").gt(afterEntryId))
                .with(Sort.by(Sort.Direction.ASC, "entryId"))
                .limit(limit);
        return mongoTemplate.find(query, StreamEntry.class).stream()
                .map(e -> new StreamRecord(e.getShardKey(), e.getEntryId(), e.getHubEventId(), e.getPayload()))
                .toList();
    }

    @Override
    public Optional<Long> getCheckpoint(String consumerId) {
        return checkpointRepository.findById(consumerId).map(StreamCheckpoint::getPosition);
    }

    @Override
    public void setCheckpoint(String consumerId, long entryId) {
        StreamCheckpoint checkpoint = new StreamCheckpoint();
        checkpoint.setName(consumerId);
        checkpoint.setPosition(entryId);
        checkpoint.setUpdatedAt(Instant.now());
        checkpointRepository.save(checkpoint);
    }

    private long nextEntryId(String shardKey) {
        SequenceCounter counter = mongoTemplate.findAndModify(
                new Query(where("_id").is(SEQUENCE_PREFIX + shardKey)),
                new Update().inc("value", 1),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceCounter.class);
        if (counter == null) {
            throw new IllegalStateException("Sequence counter missing for stream " + shardKey);
        }
        return counter.getValue();
    }
}
