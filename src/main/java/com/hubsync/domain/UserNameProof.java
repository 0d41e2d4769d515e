package com.hubsync.domain;

/**
 * Proof that {@code owner} holds {@code name} on behalf of {@code fid}. Proofs are re-signed in place,
 * so {@link #identityKey()} leaves the timestamp out.
 *
 * @param timestamp Unix seconds
 */
public record UserNameProof(
        String name,
        long fid,
        String owner,
        UserNameType type,
        long timestamp,
        String signature
) {

    public UserNameProof {
        owner = owner == null ? "" : owner.toLowerCase();
    }

    public String identityKey() {
        return name + "-" + fid + "-" + owner + "-" + type.name();
    }
}
