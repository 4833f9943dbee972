package com.eventrelay.common.pipeline.worker;

import com.eventrelay.common.idempotency.IdempotencyConflictException;
import com.eventrelay.common.idempotency.IdempotencyMarkDoneFailedException;
import com.eventrelay.common.idempotency.IdempotencyStoreException;
import com.eventrelay.common.idempotency.IdempotencyTemplate;
import com.eventrelay.common.kafka.consumer.ExceptionClassifier;
import com.eventrelay.common.kafka.publish.PublishException;
import com.eventrelay.common.kafka.publish.RecordPublisher;
import com.eventrelay.common.retry.Backoff;
import com.eventrelay.common.retry.Sleeper;
import com.eventrelay.contracts.PipelineHeaders;
import com.eventrelay.contracts.events.DeadLetterRecord;
import com.eventrelay.contracts.events.EventEnvelope;
import com.eventrelay.contracts.events.ProcessedRecord;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.listener.AcknowledgingMessageListener;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumes envelopes from the inbound topic and drives each one to exactly one outcome:
 * processed, requeued with {@code retryCount + 1}, or dead-lettered. The offset is committed
 * only after the outcome record has been published; otherwise the record is nacked and
 * redelivered by the transport.
 */
public class EventWorker implements AcknowledgingMessageListener<String, String> {

    private static final Logger log = LoggerFactory.getLogger(EventWorker.class);

    static final String MDC_CORRELATION_ID = "correlationId";

    private final WorkerProperties properties;
    private final EnvelopeParser parser;
    private final IdempotencyTemplate idempotency;
    private final EventProcessor processor;
    private final RecordPublisher publisher;
    private final ExceptionClassifier classifier;
    private final WorkerMetrics metrics;
    private final Sleeper sleeper;
    private final Clock clock;
    private final boolean mdcEnabled;

    public EventWorker(WorkerProperties properties,
                       EnvelopeParser parser,
                       IdempotencyTemplate idempotency,
                       EventProcessor processor,
                       RecordPublisher publisher,
                       ExceptionClassifier classifier,
                       WorkerMetrics metrics,
                       Sleeper sleeper,
                       Clock clock,
                       boolean mdcEnabled) {
        this.properties = properties;
        this.parser = parser;
        this.idempotency = idempotency;
        this.processor = processor;
        this.publisher = publisher;
        this.classifier = classifier;
        this.metrics = metrics;
        this.sleeper = sleeper;
        this.clock = clock;
        this.mdcEnabled = mdcEnabled;
    }

    @Override
    public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
        EventEnvelope envelope;
        try {
            envelope = parser.parse(record.value());
        } catch (EnvelopeParseException e) {
            log.error("Unparseable envelope, leaving offset uncommitted topic={} partition={} offset={} reason={}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            ack.nack(properties.getRedeliveryBackoff());
            return;
        }

        String correlationId = correlationId(record, envelope);
        try (MDC.MDCCloseable ignored = mdcEnabled && correlationId != null
                ? MDC.putCloseable(MDC_CORRELATION_ID, correlationId)
                : null) {
            handle(envelope, correlationId, ack);
        }
    }

    private void handle(EventEnvelope envelope, String correlationId, Acknowledgment ack) {
        String key = properties.getInboundTopic() + ":" + envelope.id();
        AtomicBoolean invoked = new AtomicBoolean();
        Long duration;
        try {
            duration = idempotency.execute(key, Long.class, () -> {
                invoked.set(true);
                return process(envelope);
            });
        } catch (IdempotencyConflictException e) {
            metrics.recordConflict();
            log.info("Event already in flight elsewhere, skipping id={} retryCount={}",
                    envelope.id(), envelope.retryCount());
            ack.acknowledge();
            return;
        } catch (IdempotencyMarkDoneFailedException e) {
            // processing succeeded; only the completion marker is missing
            duration = (Long) e.getResult();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while processing id={}, leaving offset uncommitted", envelope.id());
            ack.nack(properties.getRedeliveryBackoff());
            return;
        } catch (IdempotencyStoreException e) {
            if (invoked.get()) {
                onFailure(envelope, correlationId, e, ack);
                return;
            }
            // store unreachable before processing; the event itself has not failed
            log.error("Idempotency store failed id={}, leaving offset uncommitted", envelope.id(), e);
            ack.nack(properties.getRedeliveryBackoff());
            return;
        } catch (Exception e) {
            onFailure(envelope, correlationId, e, ack);
            return;
        }

        if (!invoked.get()) {
            metrics.recordDuplicate();
            log.info("Duplicate delivery of completed event id={}", envelope.id());
        }
        long elapsed = duration == null ? 0L : duration;
        try {
            publisher.publish(properties.getProcessedTopic(), envelope.id(),
                    ProcessedRecord.success(envelope.id(), elapsed, clock.instant().toString()),
                    headers(correlationId));
        } catch (PublishException e) {
            log.error("Publish processed record failed id={}, leaving offset uncommitted", envelope.id(), e);
            ack.nack(properties.getRedeliveryBackoff());
            return;
        }
        ack.acknowledge();
        if (invoked.get()) {
            log.debug("Processed id={} durationMs={}", envelope.id(), elapsed);
            maybeLogMetrics(metrics.recordProcessed());
        }
    }

    private long process(EventEnvelope envelope) throws Exception {
        if (envelope.retryCount() > 0) {
            long delay = Backoff.exponential(properties.getRetryDelayMs(), 2.0, envelope.retryCount() - 1);
            log.debug("Delaying retry id={} retryCount={} delayMs={}", envelope.id(), envelope.retryCount(), delay);
            sleeper.sleep(delay);
        }
        long start = clock.millis();
        processor.process(envelope);
        return clock.millis() - start;
    }

    private void onFailure(EventEnvelope envelope, String correlationId, Exception error, Acknowledgment ack) {
        String reason = classifier.reason(error);
        boolean retryable = classifier.isRetryable(error);
        try {
            if (retryable && envelope.retryCount() < properties.getMaxRetries()) {
                EventEnvelope next = envelope.nextRetry();
                Map<String, String> headers = headers(correlationId);
                headers.put(PipelineHeaders.RETRY_COUNT, Integer.toString(next.retryCount()));
                publisher.publish(properties.getInboundTopic(), next.id(), next, headers);
                ack.acknowledge();
                metrics.recordRetried();
                log.warn("Processing failed, requeued id={} retryCount={} reason={}",
                        envelope.id(), next.retryCount(), reason);
                return;
            }

            Map<String, String> headers = headers(correlationId);
            headers.put(PipelineHeaders.DLQ_REASON, reason);
            publisher.publish(properties.getDeadLetterTopic(), envelope.id(),
                    DeadLetterRecord.of(envelope, reason, clock.instant()), headers);
            ack.acknowledge();
            long total = metrics.recordDeadLettered();
            log.error("Processing failed, dead-lettered id={} retryCount={} retryable={} reason={}",
                    envelope.id(), envelope.retryCount(), retryable, reason, error);
            maybeLogMetrics(total);
        } catch (PublishException e) {
            log.error("Publish failure outcome failed id={}, leaving offset uncommitted", envelope.id(), e);
            ack.nack(properties.getRedeliveryBackoff());
        }
    }

    private void maybeLogMetrics(long terminalOutcomes) {
        if (terminalOutcomes % properties.getMetricsLogInterval() == 0) {
            MetricsSnapshot snapshot = metrics.snapshot();
            log.info("Worker metrics topic={} processed={} failed={} retried={} deadLettered={} duplicates={} conflicts={} successRate={}",
                    properties.getInboundTopic(), snapshot.processed(), snapshot.failed(), snapshot.retried(),
                    snapshot.deadLettered(), snapshot.duplicates(), snapshot.conflicts(),
                    String.format("%.4f", snapshot.successRate()));
        }
    }

    private static Map<String, String> headers(String correlationId) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (correlationId != null) {
            headers.put(PipelineHeaders.CORRELATION_ID, correlationId);
        }
        return headers;
    }

    private static String correlationId(ConsumerRecord<String, String> record, EventEnvelope envelope) {
        Header header = record.headers() == null ? null : record.headers().lastHeader(PipelineHeaders.CORRELATION_ID);
        if (header != null && header.value() != null) {
            return new String(header.value(), StandardCharsets.UTF_8);
        }
        String fromEnvelope = envelope.header(PipelineHeaders.CORRELATION_ID);
        return fromEnvelope != null ? fromEnvelope : envelope.id();
    }
}
