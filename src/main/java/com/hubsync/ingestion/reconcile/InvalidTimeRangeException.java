package com.hubsync.ingestion.reconcile;

/**
 * A reconciliation time range that cannot be used: negative bound or start after stop.
 */
public class InvalidTimeRangeException extends RuntimeException {

    public InvalidTimeRangeException(String message) {
        super(message);
    }
}
