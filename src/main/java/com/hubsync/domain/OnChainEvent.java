package com.hubsync.domain;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Append-only on-chain event mirrored by the Hub. Keyed by (chainId, txHash, logIndex).
 *
 * @param blockTimestamp Unix seconds
 * @param body           type-specific body (id register, signer add/remove, storage rent, signer migrated)
 */
public record OnChainEvent(
        long chainId,
        long blockNumber,
        long blockTimestamp,
        int logIndex,
        String txHash,
        OnChainEventType type,
        long fid,
        JsonNode body
) {
}
