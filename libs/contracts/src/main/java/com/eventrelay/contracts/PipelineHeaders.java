package com.eventrelay.contracts;

public final class PipelineHeaders {
    private PipelineHeaders() {}

    public static final String CORRELATION_ID = "x-correlation-id";

    public static final String RETRY_COUNT = "x-retry-count";

    public static final String DLQ_REASON = "x-dlq-reason";
}
