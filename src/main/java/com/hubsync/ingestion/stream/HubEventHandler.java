package com.hubsync.ingestion.stream;

import com.hubsync.common.Result;
import com.hubsync.domain.HubEvent;

/**
 * Applies one stream entry. A failure result (or a thrown exception) keeps the consumer on this entry;
 * a success, skipped or not, lets the checkpoint move past it.
 */
@FunctionalInterface
public interface HubEventHandler {

    Result<HandleOutcome> handle(HubEvent event);

    record HandleOutcome(boolean skipped) {

        public static HandleOutcome applied() {
            return new HandleOutcome(false);
        }

        public static HandleOutcome skippedEvent() {
            return new HandleOutcome(true);
        }
    }
}
