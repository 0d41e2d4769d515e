package com.hubsync.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, capped at {@code maxDelayMs}. Used by the subscriber, consumer and
 * backfill loops to space out retries after a failed Hub call, stream read or store write.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("Invalid delays: base=" + baseDelayMs + " max=" + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt: min(base * 2^attempt, max), then jitter.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return jitter(baseDelayMs);
        }
        long exponential = Math.min(baseDelayMs * (1L << Math.min(attempt, 20)), maxDelayMs);
        return jitter(exponential);
    }

    /**
     * Sleeps for {@link #delayMs(int)}. Returns false if the thread was interrupted (interrupt flag restored).
     */
    public boolean sleep(int attempt) {
        try {
            Thread.sleep(delayMs(attempt));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 1s base, 30s ceiling, ±20% jitter, 5 max attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 30_000L, 0.2, 5);
    }
}
