package com.hubsync.ingestion.adapter;

/**
 * Subset of the Hub's /v1/info response.
 *
 * @param numFidEvents highest identity id known to the Hub (0 when dbstats are unavailable)
 */
public record HubInfo(String version, boolean syncing, long numMessages, long numFidEvents, long numFnameEvents) {
}
