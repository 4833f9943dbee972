package com.eventrelay.common.kafka.autoconfigure;

import com.eventrelay.common.kafka.config.CommonKafkaProperties;
import com.eventrelay.common.kafka.consumer.CommonErrorHandlerFactory;
import com.eventrelay.common.kafka.consumer.ExceptionClassifier;
import com.eventrelay.common.kafka.consumer.ListenerContainerFactoryProvider;
import com.eventrelay.common.kafka.publish.KafkaRecordPublisher;
import com.eventrelay.common.kafka.publish.RecordPublisher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Duration;

@AutoConfiguration(after = {KafkaAutoConfiguration.class, JacksonAutoConfiguration.class})
@ConditionalOnClass(KafkaTemplate.class)
@EnableConfigurationProperties(CommonKafkaProperties.class)
public class KafkaConsumerAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ExceptionClassifier exceptionClassifier() {
        return new ExceptionClassifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public CommonErrorHandlerFactory commonErrorHandlerFactory(CommonKafkaProperties props,
                                                               ExceptionClassifier classifier) {
        return new CommonErrorHandlerFactory(props, classifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public ListenerContainerFactoryProvider listenerContainerFactoryProvider(CommonKafkaProperties props) {
        return new ListenerContainerFactoryProvider(props);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(KafkaTemplate.class)
    public RecordPublisher recordPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                           ObjectProvider<ObjectMapper> objectMapper,
                                           CommonKafkaProperties props) {
        return new KafkaRecordPublisher(kafkaTemplate, objectMapper.getIfAvailable(ObjectMapper::new),
                Duration.ofMillis(props.getPublish().getTimeoutMs()));
    }
}
