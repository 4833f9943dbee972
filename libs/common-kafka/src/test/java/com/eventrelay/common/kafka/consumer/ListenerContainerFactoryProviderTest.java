package com.eventrelay.common.kafka.consumer;

import com.eventrelay.common.kafka.config.CommonKafkaProperties;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class ListenerContainerFactoryProviderTest {

    @SuppressWarnings("unchecked")
    private final ConsumerFactory<String, String> consumerFactory = mock(ConsumerFactory.class);

    @Test
    void appliesConsumerSettingsToContainer() {
        CommonKafkaProperties props = new CommonKafkaProperties();
        props.getConsumer().setPollTimeoutMs(500);
        props.getConsumer().setMaxPollRecords(1);

        ConcurrentKafkaListenerContainerFactory<String, String> factory = new ListenerContainerFactoryProvider(props)
                .build(consumerFactory, ContainerProperties.AckMode.MANUAL_IMMEDIATE, null);

        ContainerProperties container = factory.getContainerProperties();
        assertThat(container.getAckMode()).isEqualTo(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        assertThat(container.getPollTimeout()).isEqualTo(500);
        assertThat(container.getKafkaConsumerProperties().getProperty(ConsumerConfig.MAX_POLL_RECORDS_CONFIG))
                .isEqualTo("1");
    }

    @Test
    void leavesMaxPollRecordsToConsumerFactoryWhenUnset() {
        ConcurrentKafkaListenerContainerFactory<String, String> factory =
                new ListenerContainerFactoryProvider(new CommonKafkaProperties())
                        .build(consumerFactory, ContainerProperties.AckMode.RECORD, null);

        assertThat(factory.getContainerProperties().getKafkaConsumerProperties()
                .getProperty(ConsumerConfig.MAX_POLL_RECORDS_CONFIG)).isNull();
    }
}
