package com.hubsync.domain;

import java.time.Instant;

/**
 * A message row as read back from the store, with its deletion markers.
 */
public record StoredMessage(Message message, Instant deletedAt, Instant prunedAt, Instant revokedAt) {

    public boolean isPruned() {
        return prunedAt != null;
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public MessageState state() {
        return deletedAt == null ? MessageState.CREATED : MessageState.DELETED;
    }
}
