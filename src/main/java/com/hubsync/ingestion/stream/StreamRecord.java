package com.hubsync.ingestion.stream;

/**
 * Entry read back from the stream. The payload stays encoded until the consumer decodes it, so a corrupt
 * entry fails in the consumer's handler path rather than in the read.
 */
public record StreamRecord(String shardKey, long entryId, long hubEventId, String payload) {
}
