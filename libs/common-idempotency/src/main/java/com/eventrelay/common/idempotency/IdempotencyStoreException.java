package com.eventrelay.common.idempotency;

public class IdempotencyStoreException extends RuntimeException {
    public IdempotencyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
