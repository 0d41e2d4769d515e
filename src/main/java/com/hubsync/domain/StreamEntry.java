package com.hubsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One appended Hub event in the durable stream. entryId increases strictly per shardKey.
 * The payload is the event in Hub JSON form so the stream can be replayed without the Hub.
 */
@Document(collection = "hub_event_stream")
@CompoundIndex(name = "shard_entry", def = "{'shardKey': 1, 'entryId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StreamEntry {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String shardKey;
    private long entryId;
    /** Hub-side id of the event; duplicates are possible after a subscriber restart. */
    private long hubEventId;
    private String eventType;
    private String payload;
    private Instant appendedAt;
}
