package com.eventrelay.common.idempotency;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IdempotencyRecord(
        String key,
        IdempotencyStatus status,
        JsonNode response,
        Long expiresAt
) {
    public static IdempotencyRecord pending(String key, long expiresAt) {
        return new IdempotencyRecord(key, IdempotencyStatus.PENDING, null, expiresAt);
    }

    public static IdempotencyRecord completed(String key, JsonNode response, long expiresAt) {
        return new IdempotencyRecord(key, IdempotencyStatus.COMPLETED, response, expiresAt);
    }

    public boolean isCompleted() {
        return status == IdempotencyStatus.COMPLETED;
    }
}
