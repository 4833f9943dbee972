package com.eventrelay.common.idempotency;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IdempotencyStatus {
    PENDING("pending"),
    COMPLETED("completed");

    private final String wire;

    IdempotencyStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static IdempotencyStatus fromWire(String value) {
        for (IdempotencyStatus s : values()) {
            if (s.wire.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown idempotency status: " + value);
    }
}
