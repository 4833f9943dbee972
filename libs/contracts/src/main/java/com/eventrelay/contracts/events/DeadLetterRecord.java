package com.eventrelay.contracts.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Map;

public record DeadLetterRecord(
        String id,
        Map<String, String> headers,
        JsonNode body,
        String timestamp,
        int retryCount,
        String error,
        String deadLetteredAt
) {
    public static DeadLetterRecord of(EventEnvelope envelope, String error, Instant deadLetteredAt) {
        return new DeadLetterRecord(
                envelope.id(),
                envelope.headers(),
                envelope.body(),
                envelope.timestamp(),
                envelope.retryCount(),
                error,
                deadLetteredAt.toString()
        );
    }
}
