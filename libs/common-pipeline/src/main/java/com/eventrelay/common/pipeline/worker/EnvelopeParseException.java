package com.eventrelay.common.pipeline.worker;

public class EnvelopeParseException extends RuntimeException {
    public EnvelopeParseException(String message) {
        super(message);
    }

    public EnvelopeParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
