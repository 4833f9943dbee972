package com.eventrelay.common.pipeline.autoconfigure;

import com.eventrelay.common.idempotency.IdempotencyTemplate;
import com.eventrelay.common.idempotency.autoconfigure.IdempotencyAutoConfiguration;
import com.eventrelay.common.kafka.autoconfigure.KafkaConsumerAutoConfiguration;
import com.eventrelay.common.kafka.config.CommonKafkaProperties;
import com.eventrelay.common.kafka.consumer.CommonErrorHandlerFactory;
import com.eventrelay.common.kafka.consumer.ExceptionClassifier;
import com.eventrelay.common.kafka.consumer.ListenerContainerFactoryProvider;
import com.eventrelay.common.kafka.publish.RecordPublisher;
import com.eventrelay.common.pipeline.orchestrator.DedupKeyExtractor;
import com.eventrelay.common.pipeline.orchestrator.KeyedEventOrchestrator;
import com.eventrelay.common.pipeline.orchestrator.OrchestratorProperties;
import com.eventrelay.common.pipeline.orchestrator.TopicHandler;
import com.eventrelay.common.pipeline.worker.EnvelopeParser;
import com.eventrelay.common.pipeline.worker.EventProcessor;
import com.eventrelay.common.pipeline.worker.EventWorker;
import com.eventrelay.common.pipeline.worker.WorkerMetrics;
import com.eventrelay.common.pipeline.worker.WorkerProperties;
import com.eventrelay.common.retry.Sleeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;

import java.time.Clock;
import java.util.Collection;
import java.util.List;

/**
 * Registers the envelope worker and the keyed orchestrator as listener containers. Both are
 * opt-in; the containers are lifecycle beans, so they start with the context and drain their
 * in-flight record before the producer and store connections are closed on shutdown.
 */
@AutoConfiguration(after = {IdempotencyAutoConfiguration.class, KafkaConsumerAutoConfiguration.class})
@EnableConfigurationProperties({WorkerProperties.class, OrchestratorProperties.class})
public class PipelineAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PipelineAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public EnvelopeParser envelopeParser(ObjectProvider<ObjectMapper> objectMapper) {
        return new EnvelopeParser(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "pipeline.worker", name = "enabled", havingValue = "true")
    @ConditionalOnBean({EventProcessor.class, RecordPublisher.class})
    static class WorkerConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public WorkerMetrics workerMetrics(WorkerProperties properties) {
            return new WorkerMetrics(properties.getInboundTopic());
        }

        @Bean
        public EventWorker eventWorker(WorkerProperties properties,
                                       EnvelopeParser parser,
                                       IdempotencyTemplate idempotency,
                                       EventProcessor processor,
                                       RecordPublisher publisher,
                                       ExceptionClassifier classifier,
                                       WorkerMetrics metrics,
                                       CommonKafkaProperties kafkaProperties,
                                       ObjectProvider<Sleeper> sleeper,
                                       ObjectProvider<Clock> clock) {
            return new EventWorker(properties, parser, idempotency, processor, publisher, classifier, metrics,
                    sleeper.getIfAvailable(Sleeper::threadSleep),
                    clock.getIfAvailable(Clock::systemUTC),
                    kafkaProperties.getLogging().isMdcEnabled());
        }

        @Bean
        public ConcurrentMessageListenerContainer<String, String> eventWorkerContainer(
                ListenerContainerFactoryProvider provider,
                ConsumerFactory<String, String> consumerFactory,
                WorkerProperties properties,
                EventWorker worker) {
            // offsets are committed by the worker itself, never by the error handler
            ConcurrentKafkaListenerContainerFactory<String, String> factory =
                    provider.build(consumerFactory, ContainerProperties.AckMode.MANUAL_IMMEDIATE, null);
            log.info("Registering event worker topic={} groupId={} maxRetries={} concurrency={}",
                    properties.getInboundTopic(), properties.getGroupId(), properties.getMaxRetries(),
                    properties.getConcurrency());
            return provider.createContainer(factory, List.of(properties.getInboundTopic()),
                    properties.getGroupId(), properties.getConcurrency(), worker);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "pipeline.orchestrator", name = "enabled", havingValue = "true")
    static class OrchestratorConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public DedupKeyExtractor dedupKeyExtractor(OrchestratorProperties properties) {
            return new DedupKeyExtractor(properties.getKeyFields());
        }

        @Bean
        public KeyedEventOrchestrator keyedEventOrchestrator(ObjectProvider<TopicHandler> handlers,
                                                             DedupKeyExtractor keyExtractor,
                                                             IdempotencyTemplate idempotency,
                                                             ObjectProvider<ObjectMapper> objectMapper) {
            return new KeyedEventOrchestrator(handlers.orderedStream().toList(), keyExtractor, idempotency,
                    objectMapper.getIfAvailable(ObjectMapper::new));
        }

        @Bean
        public ConcurrentMessageListenerContainer<String, String> orchestratorContainer(
                ListenerContainerFactoryProvider provider,
                CommonErrorHandlerFactory errorHandlerFactory,
                ConsumerFactory<String, String> consumerFactory,
                ObjectProvider<KafkaTemplate<?, ?>> kafkaTemplate,
                OrchestratorProperties properties,
                KeyedEventOrchestrator orchestrator) {
            Collection<String> topics = properties.getTopics().isEmpty()
                    ? orchestrator.handledTopics()
                    : properties.getTopics();
            if (topics.isEmpty()) {
                throw new IllegalStateException("Orchestrator enabled without topics or handlers");
            }
            ConcurrentKafkaListenerContainerFactory<String, String> factory = provider.build(consumerFactory,
                    ContainerProperties.AckMode.RECORD, errorHandlerFactory.build(kafkaTemplate.getIfAvailable()));
            log.info("Registering keyed orchestrator topics={} groupId={} keyFields={}",
                    topics, properties.getGroupId(), properties.getKeyFields());
            return provider.createContainer(factory, topics, properties.getGroupId(),
                    properties.getConcurrency(), orchestrator);
        }
    }
}
