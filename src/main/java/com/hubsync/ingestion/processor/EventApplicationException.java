package com.hubsync.ingestion.processor;

/**
 * A single Hub event or reconciliation repair failed to apply; its transaction was rolled back.
 */
public class EventApplicationException extends RuntimeException {

    public EventApplicationException(String message) {
        super(message);
    }

    public EventApplicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
