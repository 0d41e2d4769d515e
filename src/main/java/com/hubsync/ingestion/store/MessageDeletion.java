package com.hubsync.ingestion.store;

/**
 * Why a message row is being marked deleted.
 */
public enum MessageDeletion {
    /** Removed by a later message (e.g. CastRemove) or a conflicting add. */
    REMOVED,
    /** Pruned by the Hub for storage limits. */
    PRUNED,
    /** Revoked because its signer was removed. */
    REVOKED
}
