package com.eventrelay.common.retry;

import java.util.function.LongUnaryOperator;

public record RetryOptions(
        int attempts,
        long backoffMs,
        double backoffMultiplier,
        long jitterMs,
        long maxBackoffMs
) {
    public static final long DEFAULT_BACKOFF_MS = 250L;
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final long DEFAULT_JITTER_MS = 100L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 30_000L;

    public static RetryOptions of(int attempts) {
        return new RetryOptions(attempts, DEFAULT_BACKOFF_MS, DEFAULT_MULTIPLIER, DEFAULT_JITTER_MS, DEFAULT_MAX_BACKOFF_MS);
    }

    public RetryOptions withBackoff(long backoffMs, long jitterMs) {
        return new RetryOptions(attempts, backoffMs, backoffMultiplier, jitterMs, maxBackoffMs);
    }

    long delayBefore(int attemptIndex, LongUnaryOperator jitter) {
        return Backoff.delay(backoffMs, backoffMultiplier, attemptIndex, maxBackoffMs, jitterMs, jitter);
    }
}
