package com.hubsync.ingestion.processor;

/**
 * Outcome of applying one Hub event.
 *
 * @param firstDelivery the bookkeeping row was new; false when the event had been applied before
 * @param skipped       the handler took over the event and built-in processing did not run
 */
public record AppliedEvent(long eventId, boolean firstDelivery, boolean skipped) {
}
