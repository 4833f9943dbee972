package com.eventrelay.common.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;
import java.util.function.Predicate;

/**
 * Synchronous bounded retry with exponential backoff and jitter. Sleeps on the calling
 * thread between attempts; nothing is requeued.
 *
 * <p>Exceptions rejected by {@link #retryOn(Predicate)} propagate immediately: runtime
 * exceptions as they are, checked ones wrapped in {@link CompletionException}.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private static final LongUnaryOperator RANDOM_JITTER = bound -> ThreadLocalRandom.current().nextLong(bound);

    private final RetryOptions options;
    private final Sleeper sleeper;
    private final LongUnaryOperator jitter;
    private final Predicate<? super Exception> retryOn;

    public RetryPolicy(RetryOptions options) {
        this(options, Sleeper.threadSleep(), RANDOM_JITTER, e -> true);
    }

    public RetryPolicy(RetryOptions options, Sleeper sleeper, LongUnaryOperator jitter) {
        this(options, sleeper, jitter, e -> true);
    }

    private RetryPolicy(RetryOptions options, Sleeper sleeper, LongUnaryOperator jitter,
                        Predicate<? super Exception> retryOn) {
        this.options = Objects.requireNonNull(options, "options");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.jitter = Objects.requireNonNull(jitter, "jitter");
        this.retryOn = Objects.requireNonNull(retryOn, "retryOn");
    }

    public RetryPolicy retryOn(Predicate<? super Exception> predicate) {
        return new RetryPolicy(options, sleeper, jitter, predicate);
    }

    public <T> T execute(Callable<T> fn) {
        Exception lastError = null;
        int performed = 0;
        for (int attempt = 0; attempt < options.attempts(); attempt++) {
            performed++;
            try {
                return fn.call();
            } catch (Exception e) {
                lastError = e;
                if (!retryOn.test(e)) {
                    log.debug("Not retrying non-retryable failure attempt={} error={}", performed, e.toString());
                    throw e instanceof RuntimeException re ? re : new CompletionException(e);
                }
                if (performed >= options.attempts()) {
                    break;
                }
                long delay = options.delayBefore(attempt, jitter);
                log.warn("Attempt {}/{} failed, retrying in {}ms error={}",
                        performed, options.attempts(), delay, e.getMessage());
                pause(delay, performed, e);
            }
        }
        if (lastError == null) {
            throw new RetryExhaustedException("Retry exhausted without any attempt, attempts=" + options.attempts());
        }
        throw new RetryExhaustedException(performed, lastError);
    }

    public void run(Runnable fn) {
        execute(() -> {
            fn.run();
            return null;
        });
    }

    private void pause(long delay, int performed, Exception lastError) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            RetryExhaustedException ex = new RetryExhaustedException(performed, lastError);
            ex.addSuppressed(ie);
            throw ex;
        }
    }
}
