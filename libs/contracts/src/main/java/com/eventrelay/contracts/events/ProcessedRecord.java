package com.eventrelay.contracts.events;

public record ProcessedRecord(
        String webhookId,
        boolean success,
        long duration,
        String timestamp
) {
    public static ProcessedRecord success(String webhookId, long durationMs, String timestamp) {
        return new ProcessedRecord(webhookId, true, durationMs, timestamp);
    }
}
