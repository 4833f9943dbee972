package com.eventrelay.relay.config;

import com.eventrelay.common.kafka.consumer.NonRetryableEventException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RelayClientConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayClientConfig.class);

    @Bean
    public RestClientCustomizer relayTimeouts(RelayProperties properties) {
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(properties.connectTimeout())
                .withReadTimeout(properties.readTimeout());
        return builder -> builder.requestFactory(ClientHttpRequestFactories.get(settings));
    }

    @Bean
    public CircuitBreakerRegistry relayCircuitBreakers(RelayProperties properties) {
        return circuitBreakers(properties.circuitBreaker());
    }

    /**
     * One breaker per downstream host. It opens after {@code failureThreshold} consecutive failures,
     * stays open for {@code openDuration}, then lets a single trial call through. Rejected
     * requests (4xx) say nothing about the host's health and are not counted.
     */
    public static CircuitBreakerRegistry circuitBreakers(RelayProperties.Breaker settings) {
        int threshold = settings.failureThreshold();
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(threshold)
                .minimumNumberOfCalls(threshold)
                .failureRateThreshold(100f)
                .waitDurationInOpenState(settings.openDuration())
                .permittedNumberOfCallsInHalfOpenState(1)
                .ignoreExceptions(NonRetryableEventException.class)
                .build();
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.getEventPublisher().onEntryAdded(added -> added.getAddedEntry().getEventPublisher()
                .onStateTransition(event -> log.warn("Circuit breaker name={} transition={}",
                        event.getCircuitBreakerName(), event.getStateTransition())));
        return registry;
    }
}
