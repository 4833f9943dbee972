package com.eventrelay.common.retry;

import java.util.function.LongUnaryOperator;

public final class Backoff {
    private Backoff() {}

    public static long exponential(long baseMs, double multiplier, int attemptIndex) {
        if (baseMs <= 0) {
            return 0L;
        }
        double raw = baseMs * Math.pow(multiplier, Math.max(0, attemptIndex));
        if (Double.isNaN(raw) || raw >= Long.MAX_VALUE) {
            return Long.MAX_VALUE;
        }
        return (long) raw;
    }

    public static long delay(long baseMs, double multiplier, int attemptIndex,
                             long maxMs, long jitterMs, LongUnaryOperator jitter) {
        long delay = exponential(baseMs, multiplier, attemptIndex);
        if (maxMs > 0) {
            delay = Math.min(delay, maxMs);
        }
        if (jitterMs > 0) {
            long extra = jitter.applyAsLong(jitterMs);
            delay = delay > Long.MAX_VALUE - extra ? Long.MAX_VALUE : delay + extra;
        }
        return delay;
    }
}
