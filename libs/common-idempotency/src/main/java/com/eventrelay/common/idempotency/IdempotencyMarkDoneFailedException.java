package com.eventrelay.common.idempotency;

public class IdempotencyMarkDoneFailedException extends RuntimeException {

    private final transient Object result;

    public IdempotencyMarkDoneFailedException(String message, Object result, Throwable cause) {
        super(message, cause);
        this.result = result;
    }

    public Object getResult() {
        return result;
    }
}
