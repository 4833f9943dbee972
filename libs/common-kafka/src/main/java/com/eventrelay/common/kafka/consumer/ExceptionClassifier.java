package com.eventrelay.common.kafka.consumer;

import com.eventrelay.common.idempotency.IdempotencyKeyResolveException;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.apache.kafka.common.errors.SerializationException;
import org.springframework.kafka.listener.ListenerExecutionFailedException;

import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public class ExceptionClassifier {

    private static final List<Class<? extends Exception>> NON_RETRYABLE = List.of(
            NonRetryableEventException.class,
            IdempotencyKeyResolveException.class,
            JsonProcessingException.class,
            SerializationException.class
    );

    public List<Class<? extends Exception>> nonRetryableTypes() {
        return NON_RETRYABLE;
    }

    public boolean isRetryable(Throwable ex) {
        Throwable cause = unwrap(ex);
        for (Class<? extends Exception> type : NON_RETRYABLE) {
            if (type.isInstance(cause)) {
                return false;
            }
        }
        return true;
    }

    public String reason(Throwable ex) {
        Throwable cause = unwrap(ex);
        String message = cause.getMessage();
        String reason = message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
        reason = reason.replaceAll("[\\r\\n]+", " ");
        return reason.length() > 500 ? reason.substring(0, 500) : reason;
    }

    public Throwable unwrap(Throwable ex) {
        Throwable current = ex;
        while ((current instanceof ListenerExecutionFailedException
                || current instanceof CompletionException
                || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
