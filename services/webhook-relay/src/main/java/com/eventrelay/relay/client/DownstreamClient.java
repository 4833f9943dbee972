package com.eventrelay.relay.client;

import com.eventrelay.common.kafka.consumer.NonRetryableEventException;
import com.eventrelay.common.retry.RetryPolicy;
import com.eventrelay.relay.config.RelayProperties;
import com.fasterxml.jackson.databind.JsonNode;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.net.URI;
import java.util.Map;

/**
 * POSTs JSON to business endpoints. 5xx, I/O failures and the configured retriable statuses
 * (408 and 429 by default) are retried in-process through the shared {@link RetryPolicy}; any
 * other 4xx means the request itself is wrong and is never retried. Each attempt goes through
 * the host's circuit breaker, and an open breaker fails the call without retrying it here.
 */
@Component
public class DownstreamClient {

    private static final Logger log = LoggerFactory.getLogger(DownstreamClient.class);

    private final RestClient restClient;
    private final RetryPolicy retryPolicy;
    private final CircuitBreakerRegistry circuitBreakers;
    private final RelayProperties properties;

    public DownstreamClient(RestClient.Builder builder, RetryPolicy retryPolicy,
                            CircuitBreakerRegistry circuitBreakers, RelayProperties properties) {
        this.restClient = builder.build();
        this.retryPolicy = retryPolicy.retryOn(e ->
                !(e instanceof NonRetryableEventException) && !(e instanceof CallNotPermittedException));
        this.circuitBreakers = circuitBreakers;
        this.properties = properties;
    }

    public void post(String url, JsonNode body, Map<String, String> headers) {
        CircuitBreaker breaker = circuitBreakers.circuitBreaker(hostOf(url));
        try {
            retryPolicy.run(() -> breaker.executeRunnable(() -> send(url, body, headers)));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open, skipping downstream call url={}", url);
            throw e;
        }
    }

    private void send(String url, JsonNode body, Map<String, String> headers) {
        restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(h -> headers.forEach(h::set))
                .body(body == null ? "null" : body.toString())
                .retrieve()
                .onStatus(status -> status.is4xxClientError() && !properties.isRetriable(status.value()),
                        (request, response) -> {
                            log.warn("Downstream rejected request url={} status={}", url, response.getStatusCode());
                            throw new NonRetryableEventException("Downstream rejected request url=" + url
                                    + " status=" + response.getStatusCode().value());
                        })
                .toBodilessEntity();
    }

    private static String hostOf(String url) {
        String host = URI.create(url).getHost();
        return host == null ? url : host;
    }
}
