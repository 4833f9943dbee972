package com.eventrelay.relay.handler;

import com.eventrelay.common.kafka.consumer.NonRetryableEventException;
import com.eventrelay.common.pipeline.orchestrator.TopicHandler;
import com.eventrelay.relay.client.DownstreamClient;
import com.eventrelay.relay.config.RelayProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

public abstract class ForwardingTopicHandler implements TopicHandler {

    private final DownstreamClient client;
    private final RelayProperties properties;

    protected ForwardingTopicHandler(DownstreamClient client, RelayProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public void handle(JsonNode payload) {
        String url = properties.endpointFor(topic());
        if (url == null || url.isBlank()) {
            throw new NonRetryableEventException("No endpoint configured for topic=" + topic());
        }
        client.post(url, payload, headers(payload));
    }

    protected Map<String, String> headers(JsonNode payload) {
        return Map.of("x-source-topic", topic());
    }
}
