package com.hubsync.ingestion.adapter;

/**
 * Thrown when the Hub is unreachable, answers with an HTTP error or times out. Always retryable by the caller's loop.
 */
public class HubConnectionException extends RuntimeException {

    public HubConnectionException(String message) {
        super(message);
    }

    public HubConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
