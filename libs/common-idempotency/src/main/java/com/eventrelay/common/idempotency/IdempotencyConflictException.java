package com.eventrelay.common.idempotency;

public class IdempotencyConflictException extends RuntimeException {

    private final String key;

    public IdempotencyConflictException(String key) {
        super("Idempotent operation already in progress key=" + IdempotencyKeys.mask(key));
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
