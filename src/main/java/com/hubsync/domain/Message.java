package com.hubsync.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * A signed Hub message. Identity is (fid, hash); immutable once created.
 *
 * @param hash      0x-prefixed hex content hash
 * @param fid       owning identity
 * @param type      message kind
 * @param timestamp Farcaster time in seconds
 * @param signer    0x-prefixed signer key, may be null for store-reconstructed rows
 * @param signature signature as sent by the Hub, may be null
 * @param body      type-specific body as JSON
 */
public record Message(
        String hash,
        long fid,
        MessageType type,
        long timestamp,
        String signer,
        String signature,
        JsonNode body
) {

    public Message {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(type, "type");
        hash = hash.toLowerCase();
    }

    public Instant timestampInstant() {
        return FarcasterTime.toInstant(timestamp);
    }
}
