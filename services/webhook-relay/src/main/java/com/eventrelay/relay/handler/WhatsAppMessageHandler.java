package com.eventrelay.relay.handler;

import com.eventrelay.contracts.Topics;
import com.eventrelay.relay.client.DownstreamClient;
import com.eventrelay.relay.config.RelayProperties;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class WhatsAppMessageHandler extends ForwardingTopicHandler {

    public WhatsAppMessageHandler(DownstreamClient client, RelayProperties properties) {
        super(client, properties);
    }

    @Override
    public String topic() {
        return Topics.WHATSAPP_INBOUND;
    }

    @Override
    protected Map<String, String> headers(JsonNode payload) {
        Map<String, String> headers = new LinkedHashMap<>(super.headers(payload));
        JsonNode from = payload.get("from");
        if (from != null && from.isTextual()) {
            headers.put("x-whatsapp-from", from.asText());
        }
        return headers;
    }
}
