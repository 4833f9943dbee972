package com.eventrelay.relay.processor;

import com.eventrelay.common.pipeline.worker.EventProcessor;
import com.eventrelay.contracts.PipelineHeaders;
import com.eventrelay.contracts.events.EventEnvelope;
import com.eventrelay.relay.client.DownstreamClient;
import com.eventrelay.relay.config.RelayProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class HttpForwardingProcessor implements EventProcessor {

    static final String WEBHOOK_ID = "x-webhook-id";

    private final DownstreamClient client;
    private final RelayProperties properties;

    public HttpForwardingProcessor(DownstreamClient client, RelayProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public void process(EventEnvelope envelope) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(WEBHOOK_ID, envelope.id());
        headers.put(PipelineHeaders.RETRY_COUNT, Integer.toString(envelope.retryCount()));
        String correlationId = envelope.header(PipelineHeaders.CORRELATION_ID);
        if (correlationId != null) {
            headers.put(PipelineHeaders.CORRELATION_ID, correlationId);
        }
        client.post(properties.processorUrl(), envelope.body(), headers);
    }
}
