package com.hubsync.ingestion.processor;

import com.hubsync.domain.HubEvent;
import com.hubsync.domain.Message;
import com.hubsync.domain.MessageState;
import com.hubsync.domain.StoreMessageOperation;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcOperations;

/**
 * Application callbacks run inside the event's store transaction. Writes through {@code txn} commit or roll back
 * together with the event; an exception rolls back the whole event.
 */
public interface MessageHandler {

    /**
     * Called for every message an event touches.
     *
     * @param isNew     the store row was created or moved to deleted by this call; false on redelivery
     * @param wasMissed the message was found by reconciliation rather than the live stream
     */
    void handleMessageMerge(Message message,
                            NamedParameterJdbcOperations txn,
                            StoreMessageOperation operation,
                            MessageState state,
                            boolean isNew,
                            boolean wasMissed);

    /**
     * Called first for every event. Returning true skips the built-in processing of the event.
     */
    default boolean onHubEvent(HubEvent event, NamedParameterJdbcOperations txn) {
        return false;
    }
}
