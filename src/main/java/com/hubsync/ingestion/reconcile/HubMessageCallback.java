package com.hubsync.ingestion.reconcile;

import com.hubsync.domain.Message;

/**
 * Receives every Hub message of a reconciled fid once, with how the store's copy compares.
 */
@FunctionalInterface
public interface HubMessageCallback {

    void onHubMessage(Message message, boolean missingInDb, boolean prunedInDb, boolean revokedInDb);
}
