package com.eventrelay.common.retry;

public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(String message) {
        super(message);
        this.attempts = 0;
    }

    public RetryExhaustedException(int attempts, Throwable lastError) {
        super("Operation failed after " + attempts + " attempt(s): "
                + (lastError == null ? "unknown error" : lastError.getMessage()), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
