package com.eventrelay.common.kafka.consumer;

import com.eventrelay.common.kafka.config.CommonKafkaProperties;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaOperations;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.lang.Nullable;
import org.springframework.util.backoff.BackOff;

import java.util.function.BiFunction;

/**
 * Builds the transport-level error handler: re-seek with exponential backoff, then publish
 * to {@code <topic><suffix>}. Non-retryable failures skip straight to the dead-letter topic.
 */
public class CommonErrorHandlerFactory {

    private static final Logger log = LoggerFactory.getLogger(CommonErrorHandlerFactory.class);

    private final CommonKafkaProperties properties;
    private final ExceptionClassifier classifier;

    public CommonErrorHandlerFactory(CommonKafkaProperties properties, ExceptionClassifier classifier) {
        this.properties = properties;
        this.classifier = classifier;
    }

    public DefaultErrorHandler build(@Nullable KafkaOperations<?, ?> kafkaOperations) {
        DeadLetterPublishingRecoverer recoverer = (properties.getDlt().isEnabled() && kafkaOperations != null)
                ? buildRecoverer(kafkaOperations)
                : null;
        DefaultErrorHandler handler = recoverer == null
                ? new DefaultErrorHandler(backOff())
                : new DefaultErrorHandler(recoverer, backOff());
        handler.setRetryListeners((record, ex, deliveryAttempt) ->
                log.warn("Redelivering record topic={} partition={} offset={} attempt={} reason={}",
                        record.topic(), record.partition(), record.offset(), deliveryAttempt, classifier.reason(ex)));
        classifier.nonRetryableTypes().forEach(handler::addNotRetryableExceptions);
        return handler;
    }

    public String deadLetterTopic(String topic) {
        return topic + properties.getDlt().getSuffix();
    }

    private DeadLetterPublishingRecoverer buildRecoverer(KafkaOperations<?, ?> kafkaOperations) {
        BiFunction<ConsumerRecord<?, ?>, Exception, TopicPartition> resolver = (rec, ex) -> {
            int partition = properties.getDlt().isSamePartition() ? rec.partition() : -1;
            log.error("Dead-lettering record topic={} partition={} offset={} reason={}",
                    rec.topic(), rec.partition(), rec.offset(), classifier.reason(ex));
            return new TopicPartition(deadLetterTopic(rec.topic()), partition);
        };
        return new DeadLetterPublishingRecoverer(kafkaOperations, resolver);
    }

    BackOff backOff() {
        CommonKafkaProperties.Retry r = properties.getRetry();
        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(r.getMaxAttempts());
        backOff.setInitialInterval(r.getInitialBackoffMs());
        backOff.setMultiplier(r.getMultiplier());
        backOff.setMaxInterval(r.getMaxBackoffMs());
        return backOff;
    }
}
