package com.eventrelay.common.pipeline.worker;

import com.eventrelay.common.idempotency.IdempotencyTemplate;
import com.eventrelay.common.idempotency.store.IdempotencyStore;
import com.eventrelay.common.idempotency.store.InMemoryIdempotencyStore;
import com.eventrelay.common.kafka.consumer.ExceptionClassifier;
import com.eventrelay.common.kafka.consumer.NonRetryableEventException;
import com.eventrelay.contracts.PipelineHeaders;
import com.eventrelay.contracts.events.DeadLetterRecord;
import com.eventrelay.contracts.events.EventEnvelope;
import com.eventrelay.contracts.events.ProcessedRecord;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class EventWorkerTest {

    private static final String INBOUND = "webhooks.inbound.v1";
    private static final String PROCESSED = "webhooks.processed.v1";
    private static final String DLQ = "webhooks.dlq.v1";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InMemoryIdempotencyStore store = new InMemoryIdempotencyStore();
    private final RecordingPublisher publisher = new RecordingPublisher();
    private final List<Long> sleeps = new ArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();
    private final WorkerProperties properties = new WorkerProperties();
    private final WorkerMetrics metrics = new WorkerMetrics(INBOUND);
    private long offset;

    @BeforeEach
    void setUp() {
        properties.setInboundTopic(INBOUND);
        properties.setProcessedTopic(PROCESSED);
        properties.setDeadLetterTopic(DLQ);
        properties.setMaxRetries(3);
        properties.setRetryDelayMs(1000);
    }

    private EventWorker worker(EventProcessor processor) {
        return worker(store, processor);
    }

    private EventWorker worker(IdempotencyStore idempotencyStore, EventProcessor processor) {
        IdempotencyTemplate template = new IdempotencyTemplate(idempotencyStore, objectMapper, "pipeline", Duration.ofHours(24));
        EventProcessor counting = envelope -> {
            calls.incrementAndGet();
            processor.process(envelope);
        };
        return new EventWorker(properties, new EnvelopeParser(objectMapper), template, counting, publisher,
                new ExceptionClassifier(), metrics, sleeps::add, Clock.fixed(NOW, ZoneOffset.UTC), true);
    }

    private ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>(INBOUND, 0, offset++, "wh-1", value);
    }

    private String envelopeJson(String id, int retryCount) {
        return "{\"id\":\"" + id + "\",\"headers\":{\"content-type\":\"application/json\"},"
                + "\"body\":{\"event\":\"order.created\",\"amount\":42},"
                + "\"timestamp\":\"2026-03-01T09:59:00Z\",\"retryCount\":" + retryCount + "}";
    }

    @Test
    void successPublishesProcessedRecordAndCommits() {
        EventWorker worker = worker(envelope -> { });
        Acknowledgment ack = mock(Acknowledgment.class);

        worker.onMessage(record(envelopeJson("wh-1", 0)), ack);

        verify(ack).acknowledge();
        assertThat(publisher.on(PROCESSED)).singleElement().satisfies(p -> {
            assertThat(p.key()).isEqualTo("wh-1");
            assertThat(p.payload()).isEqualTo(ProcessedRecord.success("wh-1", 0, NOW.toString()));
            assertThat(p.headers()).containsEntry(PipelineHeaders.CORRELATION_ID, "wh-1");
        });
        assertThat(sleeps).isEmpty();
        assertThat(metrics.snapshot().processed()).isEqualTo(1);
        assertThat(store.find("pipeline:" + INBOUND + ":wh-1")).get()
                .satisfies(r -> assertThat(r.isCompleted()).isTrue());
    }

    @Test
    void firstFailureRequeuesSameEventWithIncrementedRetryCount() {
        EventWorker worker = worker(envelope -> {
            throw new IllegalStateException("downstream 503");
        });
        Acknowledgment ack = mock(Acknowledgment.class);

        worker.onMessage(record(envelopeJson("wh-1", 0)), ack);

        verify(ack).acknowledge();
        assertThat(publisher.on(INBOUND)).singleElement().satisfies(p -> {
            EventEnvelope requeued = (EventEnvelope) p.payload();
            assertThat(requeued.id()).isEqualTo("wh-1");
            assertThat(requeued.retryCount()).isEqualTo(1);
            assertThat(requeued.body().get("amount").asInt()).isEqualTo(42);
            assertThat(requeued.timestamp()).isEqualTo("2026-03-01T09:59:00Z");
            assertThat(p.headers()).containsEntry(PipelineHeaders.RETRY_COUNT, "1");
        });
        assertThat(publisher.on(PROCESSED)).isEmpty();
        assertThat(publisher.on(DLQ)).isEmpty();
        assertThat(metrics.snapshot().retried()).isEqualTo(1);
        assertThat(metrics.snapshot().failed()).isZero();
        assertThat(store.size()).isZero();
    }

    @Test
    void failureAtRetryBudgetIsDeadLettered() {
        EventWorker worker = worker(envelope -> {
            throw new IllegalStateException("downstream 503");
        });
        Acknowledgment ack = mock(Acknowledgment.class);

        worker.onMessage(record(envelopeJson("wh-1", 3)), ack);

        verify(ack).acknowledge();
        assertThat(publisher.on(INBOUND)).isEmpty();
        assertThat(publisher.on(DLQ)).singleElement().satisfies(p -> {
            DeadLetterRecord dead = (DeadLetterRecord) p.payload();
            assertThat(dead.id()).isEqualTo("wh-1");
            assertThat(dead.retryCount()).isEqualTo(3);
            assertThat(dead.error()).isEqualTo("downstream 503");
            assertThat(dead.deadLetteredAt()).isEqualTo(NOW.toString());
            assertThat(dead.body().get("event").asText()).isEqualTo("order.created");
            assertThat(p.headers()).containsEntry(PipelineHeaders.DLQ_REASON, "downstream 503");
        });
        assertThat(metrics.snapshot().deadLettered()).isEqualTo(1);
        assertThat(metrics.snapshot().failed()).isEqualTo(1);
        assertThat(sleeps).containsExactly(4000L);
    }

    @Test
    void alwaysFailingEventIsRetriedUntilBudgetThenDeadLetteredOnce() throws Exception {
        EventWorker worker = worker(envelope -> {
            throw new IllegalStateException("always failing");
        });

        String next = envelopeJson("wh-1", 0);
        for (int i = 0; i < 4; i++) {
            Acknowledgment ack = mock(Acknowledgment.class);
            worker.onMessage(record(next), ack);
            verify(ack).acknowledge();
            List<RecordingPublisher.Published> requeued = publisher.on(INBOUND);
            if (!requeued.isEmpty()) {
                next = objectMapper.writeValueAsString(requeued.get(requeued.size() - 1).payload());
            }
        }

        assertThat(calls).hasValue(4);
        assertThat(publisher.on(INBOUND)).hasSize(3)
                .extracting(p -> ((EventEnvelope) p.payload()).retryCount())
                .containsExactly(1, 2, 3);
        assertThat(publisher.on(DLQ)).hasSize(1);
        assertThat(publisher.on(PROCESSED)).isEmpty();
        assertThat(sleeps).containsExactly(1000L, 2000L, 4000L);
        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.retried()).isEqualTo(3);
        assertThat(snapshot.deadLettered()).isEqualTo(1);
        assertThat(snapshot.processed()).isZero();
        assertThat(snapshot.successRate()).isZero();
    }

    @Test
    void nonRetryableFailureSkipsRetryBudget() {
        EventWorker worker = worker(envelope -> {
            throw new NonRetryableEventException("invalid signature");
        });
        Acknowledgment ack = mock(Acknowledgment.class);

        worker.onMessage(record(envelopeJson("wh-1", 0)), ack);

        assertThat(publisher.on(INBOUND)).isEmpty();
        assertThat(publisher.on(DLQ)).singleElement()
                .satisfies(p -> assertThat(((DeadLetterRecord) p.payload()).error()).isEqualTo("invalid signature"));
        assertThat(metrics.snapshot().deadLettered()).isEqualTo(1);
    }

    @Test
    void pendingKeyHeldElsewhereIsAcknowledgedWithoutProcessing() {
        store.createPending("pipeline:" + INBOUND + ":wh-1", Duration.ofMinutes(5));
        EventWorker worker = worker(envelope -> { });
        Acknowledgment ack = mock(Acknowledgment.class);

        worker.onMessage(record(envelopeJson("wh-1", 0)), ack);

        verify(ack).acknowledge();
        assertThat(calls).hasValue(0);
        assertThat(publisher.published).isEmpty();
        assertThat(metrics.snapshot().conflicts()).isEqualTo(1);
        assertThat(metrics.snapshot().processed()).isZero();
    }

    @Test
    void redeliveryOfCompletedEventDoesNotInvokeProcessorAgain() {
        EventWorker worker = worker(envelope -> { });

        worker.onMessage(record(envelopeJson("wh-1", 0)), mock(Acknowledgment.class));
        Acknowledgment second = mock(Acknowledgment.class);
        worker.onMessage(record(envelopeJson("wh-1", 0)), second);

        verify(second).acknowledge();
        assertThat(calls).hasValue(1);
        assertThat(publisher.on(PROCESSED)).hasSize(2);
        assertThat(metrics.snapshot().processed()).isEqualTo(1);
        assertThat(metrics.snapshot().duplicates()).isEqualTo(1);
    }

    @Test
    void unparseableRecordIsNotCommitted() {
        EventWorker worker = worker(envelope -> { });

        for (String value : new String[]{"not json", "[1,2]", "{\"body\":{}}", "{\"id\":\"wh-1\",\"retryCount\":-1}", null}) {
            Acknowledgment ack = mock(Acknowledgment.class);
            worker.onMessage(record(value), ack);
            verify(ack, never()).acknowledge();
            verify(ack).nack(Duration.ofSeconds(1));
        }
        assertThat(calls).hasValue(0);
        assertThat(publisher.published).isEmpty();
    }

    @Test
    void failedOutcomePublishLeavesOffsetUncommittedAndRedeliveryRepublishes() {
        EventWorker worker = worker(envelope -> { });
        publisher.failOn(PROCESSED);
        Acknowledgment first = mock(Acknowledgment.class);

        worker.onMessage(record(envelopeJson("wh-1", 0)), first);

        verify(first, never()).acknowledge();
        verify(first).nack(any(Duration.class));

        publisher.recover(PROCESSED);
        Acknowledgment second = mock(Acknowledgment.class);
        worker.onMessage(record(envelopeJson("wh-1", 0)), second);

        verify(second).acknowledge();
        assertThat(calls).hasValue(1);
        assertThat(publisher.on(PROCESSED)).hasSize(1);
    }

    @Test
    void correlationIdFromRecordHeaderIsPropagatedAndExposedInMdc() {
        AtomicReference<String> seen = new AtomicReference<>();
        EventWorker worker = worker(envelope -> seen.set(MDC.get("correlationId")));
        ConsumerRecord<String, String> record = record(envelopeJson("wh-1", 0));
        record.headers().add(PipelineHeaders.CORRELATION_ID, "corr-77".getBytes(StandardCharsets.UTF_8));

        worker.onMessage(record, mock(Acknowledgment.class));

        assertThat(seen).hasValue("corr-77");
        assertThat(MDC.get("correlationId")).isNull();
        assertThat(publisher.on(PROCESSED)).singleElement()
                .satisfies(p -> assertThat(p.headers()).containsEntry(PipelineHeaders.CORRELATION_ID, "corr-77"));
    }

    @Test
    void everyDeliveredEventEndsInExactlyOneTerminalCounter() {
        AtomicInteger n = new AtomicInteger();
        properties.setMaxRetries(0);
        EventWorker worker = worker(envelope -> {
            if (n.incrementAndGet() % 3 == 0) {
                throw new IllegalStateException("every third fails");
            }
        });

        for (int i = 0; i < 30; i++) {
            worker.onMessage(record(envelopeJson("wh-" + i, 0)), mock(Acknowledgment.class));
        }

        MetricsSnapshot snapshot = metrics.snapshot();
        assertThat(snapshot.processed()).isEqualTo(20);
        assertThat(snapshot.failed()).isEqualTo(10);
        assertThat(snapshot.processed() + snapshot.failed()).isEqualTo(30);
        assertThat(snapshot.successRate()).isCloseTo(2.0 / 3, offset(1e-9));
    }

    @Test
    void unreachableStoreLeavesOffsetUncommittedWithoutSpendingRetryBudget() {
        IdempotencyStore down = mock(IdempotencyStore.class);
        when(down.find(anyString())).thenThrow(new IllegalStateException("redis connection refused"));
        EventWorker worker = worker(down, envelope -> { });

        for (int retryCount = 0; retryCount < 4; retryCount++) {
            Acknowledgment ack = mock(Acknowledgment.class);
            worker.onMessage(record(envelopeJson("wh-1", retryCount)), ack);
            verify(ack, never()).acknowledge();
            verify(ack).nack(Duration.ofSeconds(1));
        }

        assertThat(calls).hasValue(0);
        assertThat(sleeps).isEmpty();
        assertThat(publisher.published).isEmpty();
        assertThat(metrics.snapshot()).isEqualTo(new MetricsSnapshot(0, 0, 0, 0, 0, 0));
    }

    @Test
    void storeLockFailureIsAlsoRedelivered() {
        IdempotencyStore flaky = mock(IdempotencyStore.class);
        when(flaky.find(anyString())).thenReturn(Optional.empty());
        when(flaky.createPending(anyString(), any())).thenThrow(new IllegalStateException("command timed out"));
        EventWorker worker = worker(flaky, envelope -> { });
        Acknowledgment ack = mock(Acknowledgment.class);

        worker.onMessage(record(envelopeJson("wh-1", 0)), ack);

        verify(ack).nack(Duration.ofSeconds(1));
        assertThat(publisher.on(INBOUND)).isEmpty();
        assertThat(publisher.on(DLQ)).isEmpty();
    }

    @Test
    void veryLongEventIdIsProcessedAndDeduplicated() {
        String id = "x".repeat(250);
        EventWorker worker = worker(envelope -> { });

        worker.onMessage(record(envelopeJson(id, 0)), mock(Acknowledgment.class));
        worker.onMessage(record(envelopeJson(id, 0)), mock(Acknowledgment.class));

        assertThat(calls).hasValue(1);
        assertThat(publisher.on(DLQ)).isEmpty();
        assertThat(publisher.on(PROCESSED)).hasSize(2)
                .allSatisfy(p -> assertThat(((ProcessedRecord) p.payload()).webhookId()).isEqualTo(id));
        assertThat(metrics.snapshot().processed()).isEqualTo(1);
        assertThat(metrics.snapshot().duplicates()).isEqualTo(1);
    }
}
