package com.eventrelay.common.kafka.consumer;

import com.eventrelay.common.kafka.config.CommonKafkaProperties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.Properties;

public class ListenerContainerFactoryProvider {

    private final CommonKafkaProperties properties;

    public ListenerContainerFactoryProvider(CommonKafkaProperties properties) {
        this.properties = properties;
    }

    public ConcurrentKafkaListenerContainerFactory<String, String> build(ConsumerFactory<String, String> consumerFactory,
                                                                         ContainerProperties.AckMode ackMode,
                                                                         @Nullable CommonErrorHandler errorHandler) {
        ConcurrentKafkaListenerContainerFactory<String, String> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(consumerFactory);
        ContainerProperties container = factory.getContainerProperties();
        container.setAckMode(ackMode);
        container.setPollTimeout(properties.getConsumer().getPollTimeoutMs());
        container.setMissingTopicsFatal(properties.getConsumer().isMissingTopicsFatal());
        container.setShutdownTimeout(properties.getConsumer().getShutdownTimeoutMs());
        Integer maxPollRecords = properties.getConsumer().getMaxPollRecords();
        if (maxPollRecords != null) {
            Properties overrides = new Properties();
            overrides.setProperty(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, String.valueOf(maxPollRecords));
            container.setKafkaConsumerProperties(overrides);
        }
        if (errorHandler != null) {
            factory.setCommonErrorHandler(errorHandler);
        }
        return factory;
    }

    public ConcurrentMessageListenerContainer<String, String> createContainer(ConcurrentKafkaListenerContainerFactory<String, String> factory,
                                                                             Collection<String> topics,
                                                                             String groupId,
                                                                             int concurrency,
                                                                             Object listener) {
        ConcurrentMessageListenerContainer<String, String> container = factory.createContainer(topics.toArray(String[]::new));
        container.getContainerProperties().setGroupId(groupId);
        container.getContainerProperties().setMessageListener(listener);
        container.setConcurrency(Math.max(1, concurrency));
        container.setBeanName(groupId + "-container");
        return container;
    }
}
