package com.eventrelay.common.pipeline.orchestrator;

import com.eventrelay.common.idempotency.IdempotencyConflictException;
import com.eventrelay.common.idempotency.IdempotencyKeys;
import com.eventrelay.common.idempotency.IdempotencyMarkDoneFailedException;
import com.eventrelay.common.idempotency.IdempotencyTemplate;
import com.eventrelay.common.kafka.consumer.NonRetryableEventException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.listener.MessageListener;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Multi-topic consumer that deduplicates by a payload-derived key and dispatches to the
 * handler registered for the record's topic. Handler failures propagate so the container's
 * error handler redelivers and eventually dead-letters the record.
 */
public class KeyedEventOrchestrator implements MessageListener<String, String> {

    private static final Logger log = LoggerFactory.getLogger(KeyedEventOrchestrator.class);

    private final Map<String, TopicHandler> handlers = new LinkedHashMap<>();
    private final DedupKeyExtractor keyExtractor;
    private final IdempotencyTemplate idempotency;
    private final ObjectMapper objectMapper;

    public KeyedEventOrchestrator(Collection<? extends TopicHandler> handlers,
                                  DedupKeyExtractor keyExtractor,
                                  IdempotencyTemplate idempotency,
                                  ObjectMapper objectMapper) {
        for (TopicHandler handler : handlers) {
            TopicHandler previous = this.handlers.putIfAbsent(handler.topic(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handler for topic " + handler.topic()
                        + ": " + previous.getClass().getName() + " and " + handler.getClass().getName());
            }
        }
        this.keyExtractor = keyExtractor;
        this.idempotency = idempotency;
        this.objectMapper = objectMapper;
    }

    public Set<String> handledTopics() {
        return handlers.keySet();
    }

    @Override
    public void onMessage(ConsumerRecord<String, String> record) {
        TopicHandler handler = handlers.get(record.topic());
        if (handler == null) {
            log.warn("No handler registered, skipping topic={} partition={} offset={}",
                    record.topic(), record.partition(), record.offset());
            return;
        }

        JsonNode payload = parse(record);
        Optional<String> key = keyExtractor.extract(payload);
        if (key.isEmpty()) {
            log.warn("No dedup key on payload, processing without idempotency topic={} offset={} fields={}",
                    record.topic(), record.offset(), keyExtractor.fields());
            invoke(handler, payload, record);
            return;
        }

        try {
            idempotency.execute(key.get(), Object.class, () -> {
                invoke(handler, payload, record);
                return null;
            });
        } catch (IdempotencyConflictException e) {
            log.info("Event in flight elsewhere, skipping topic={} key={}",
                    record.topic(), IdempotencyKeys.mask(key.get()));
        } catch (IdempotencyMarkDoneFailedException e) {
            log.warn("Handled but completion marker not stored topic={} key={}",
                    record.topic(), IdempotencyKeys.mask(key.get()));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new EventHandlingException("Handler failed topic=" + record.topic(), e);
        }
    }

    private void invoke(TopicHandler handler, JsonNode payload, ConsumerRecord<String, String> record) {
        try {
            handler.handle(payload);
        } catch (RuntimeException e) {
            log.warn("Handler failed topic={} partition={} offset={}",
                    record.topic(), record.partition(), record.offset(), e);
            throw e;
        } catch (Exception e) {
            log.warn("Handler failed topic={} partition={} offset={}",
                    record.topic(), record.partition(), record.offset(), e);
            throw new EventHandlingException("Handler failed topic=" + record.topic(), e);
        }
    }

    private JsonNode parse(ConsumerRecord<String, String> record) {
        if (record.value() == null) {
            throw new NonRetryableEventException("Empty payload topic=" + record.topic() + " offset=" + record.offset());
        }
        try {
            return objectMapper.readTree(record.value());
        } catch (JsonProcessingException e) {
            throw new NonRetryableEventException("Payload is not JSON topic=" + record.topic()
                    + " offset=" + record.offset(), e);
        }
    }
}
