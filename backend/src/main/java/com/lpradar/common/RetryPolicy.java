package com.lpradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for JSON-RPC retries, capped at a maximum delay.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, long maxDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.maxDelayMs = Math.max(this.baseDelayMs, maxDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the retry that follows the given zero-based failed attempt:
     * baseDelay * 2^attempt, capped at maxDelay, then jittered.
     */
    public long delayMs(int attempt) {
        long exponential = attempt <= 0
                ? baseDelayMs
                : baseDelayMs * (1L << Math.min(attempt, 20));
        return jitter(Math.min(exponential, maxDelayMs));
    }

    /** True while another attempt is allowed after {@code attemptsMade} calls. */
    public boolean canRetry(int attemptsMade) {
        return attemptsMade < maxAttempts;
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double factor = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 500ms base, 10s cap, ±20% jitter, 4 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 10_000L, 0.2, 4);
    }
}
