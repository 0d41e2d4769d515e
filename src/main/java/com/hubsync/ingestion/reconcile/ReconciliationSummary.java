package com.hubsync.ingestion.reconcile;

/**
 * Counts reported by one reconciliation call. {@code skipped} is set when the call did not run (invalid range).
 */
public record ReconciliationSummary(
        long fid,
        int hubCount,
        int dbCount,
        int missingInDb,
        int missingInHub,
        int prunedInDb,
        int revokedInDb,
        boolean skipped
) {

    public static ReconciliationSummary skipped(long fid) {
        return new ReconciliationSummary(fid, 0, 0, 0, 0, 0, 0, true);
    }

    public ReconciliationSummary plus(ReconciliationSummary other) {
        return new ReconciliationSummary(fid,
                hubCount + other.hubCount,
                dbCount + other.dbCount,
                missingInDb + other.missingInDb,
                missingInHub + other.missingInHub,
                prunedInDb + other.prunedInDb,
                revokedInDb + other.revokedInDb,
                skipped && other.skipped);
    }
}
