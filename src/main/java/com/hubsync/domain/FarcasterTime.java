package com.hubsync.domain;

import java.time.Instant;

/**
 * Conversions between Farcaster time (seconds since 2021-01-01T00:00:00Z) and {@link Instant}.
 * Message timestamps are Farcaster time; username proof and on-chain block timestamps are Unix seconds.
 */
public final class FarcasterTime {

    public static final long FARCASTER_EPOCH_SECONDS = 1_609_459_200L;

    private FarcasterTime() {
    }

    public static Instant toInstant(long farcasterSeconds) {
        if (farcasterSeconds < 0) {
            throw new IllegalArgumentException("Farcaster time must be non-negative: " + farcasterSeconds);
        }
        return Instant.ofEpochSecond(FARCASTER_EPOCH_SECONDS + farcasterSeconds);
    }

    public static long fromInstant(Instant instant) {
        long seconds = instant.getEpochSecond() - FARCASTER_EPOCH_SECONDS;
        if (seconds < 0) {
            throw new IllegalArgumentException("Instant precedes Farcaster epoch: " + instant);
        }
        return seconds;
    }
}
