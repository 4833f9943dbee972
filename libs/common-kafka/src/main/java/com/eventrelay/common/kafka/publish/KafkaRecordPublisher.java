package com.eventrelay.common.kafka.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public class KafkaRecordPublisher implements RecordPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaRecordPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public KafkaRecordPublisher(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper, Duration timeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public void publish(String topic, String key, Object payload, Map<String, String> headers) {
        ProducerRecord<String, String> record = new ProducerRecord<>(topic, key, toJson(payload));
        if (headers != null) {
            headers.forEach((name, value) -> {
                if (value != null) {
                    record.headers().add(name, value.getBytes(StandardCharsets.UTF_8));
                }
            });
        }
        try {
            kafkaTemplate.send(record).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("Published record topic={} key={}", topic, key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new PublishException("Failed to publish to " + topic + " key=" + key, e);
        }
    }

    private String toJson(Object payload) {
        if (payload instanceof String s) {
            return s;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new PublishException("Cannot serialize payload of type " + payload.getClass().getSimpleName(), e);
        }
    }
}
