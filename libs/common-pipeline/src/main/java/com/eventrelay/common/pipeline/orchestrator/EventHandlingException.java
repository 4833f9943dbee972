package com.eventrelay.common.pipeline.orchestrator;

public class EventHandlingException extends RuntimeException {
    public EventHandlingException(String message, Throwable cause) {
        super(message, cause);
    }
}
