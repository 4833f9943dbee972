package com.eventrelay.contracts.events;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Internal envelope for an externally produced event. {@code id} is stable across
 * retries; {@code body} is owned by the processor and never inspected by the pipeline.
 */
public record EventEnvelope(
        String id,
        Map<String, String> headers,
        JsonNode body,
        String timestamp,
        int retryCount
) {
    public EventEnvelope {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public EventEnvelope nextRetry() {
        return new EventEnvelope(id, headers, body, timestamp, retryCount + 1);
    }

    public String header(String name) {
        return headers.get(name);
    }
}
