package com.eventrelay.relay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Downstream endpoints. Topic names contain dots, so map keys are bracketed in YAML:
 * {@code relay.endpoints."[whatsapp.inbound.v1]"}.
 */
@Validated
@ConfigurationProperties(prefix = "relay")
public record RelayProperties(
        @NotBlank String processorUrl,
        Map<String, String> endpoints,
        @NotNull @DefaultValue("PT5S") Duration connectTimeout,
        @NotNull @DefaultValue("PT30S") Duration readTimeout,
        @DefaultValue({"408", "429"}) Set<Integer> retriableStatusCodes,
        @Valid @DefaultValue Breaker circuitBreaker
) {
    public RelayProperties {
        endpoints = endpoints == null ? Map.of() : Map.copyOf(endpoints);
        retriableStatusCodes = retriableStatusCodes == null ? Set.of(408, 429) : Set.copyOf(retriableStatusCodes);
        circuitBreaker = circuitBreaker == null ? new Breaker(5, Duration.ofSeconds(30)) : circuitBreaker;
    }

    public String endpointFor(String topic) {
        return endpoints.get(topic);
    }

    public boolean isRetriable(int statusCode) {
        return retriableStatusCodes.contains(statusCode);
    }

    public record Breaker(
            @Min(1) @DefaultValue("5") int failureThreshold,
            @NotNull @DefaultValue("PT30S") Duration openDuration
    ) {
    }
}
