package com.vaultledger.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for read-only JSON-RPC calls. Ledger mutations are never retried.
 */
public final class RetryPolicy {

    private static final int MAX_SHIFT = 16;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (baseDelayMs < 0 || jitterFactor < 0 || jitterFactor > 1 || maxAttempts < 1) {
            throw new IllegalArgumentException("Invalid retry policy: baseDelayMs=" + baseDelayMs
                    + ", jitterFactor=" + jitterFactor + ", maxAttempts=" + maxAttempts);
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the retry that follows the given zero-based attempt: baseDelay * 2^attempt, then jitter.
     */
    public long delayMs(int attempt) {
        int shift = Math.max(0, Math.min(attempt, MAX_SHIFT));
        return jitter(baseDelayMs << shift);
    }

    private long jitter(long value) {
        if (jitterFactor == 0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 500ms base, ±20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3);
    }
}
