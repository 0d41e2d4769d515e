package com.hubsync.ingestion.job.backfill;

/**
 * Backfill cannot be planned because the fid upper bound is unknown.
 */
public class MissingMetadataException extends RuntimeException {

    public MissingMetadataException(String message) {
        super(message);
    }

    public MissingMetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
