package com.eventrelay.common.pipeline.worker;

import com.eventrelay.contracts.events.EventEnvelope;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

public class EnvelopeParser {

    private final ObjectMapper objectMapper;

    public EnvelopeParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public EventEnvelope parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new EnvelopeParseException("Empty record value");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new EnvelopeParseException("Record value is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new EnvelopeParseException("Envelope must be a JSON object");
        }

        JsonNode id = root.get("id");
        if (id == null || !id.isValueNode() || id.isNull() || id.asText().isBlank()) {
            throw new EnvelopeParseException("Envelope id is missing");
        }

        JsonNode retryNode = root.get("retryCount");
        int retryCount = 0;
        if (retryNode != null && !retryNode.isNull()) {
            if (!retryNode.canConvertToInt() || !retryNode.isIntegralNumber()) {
                throw new EnvelopeParseException("Envelope retryCount is not an integer id=" + id.asText());
            }
            retryCount = retryNode.intValue();
            if (retryCount < 0) {
                throw new EnvelopeParseException("Envelope retryCount is negative id=" + id.asText());
            }
        }

        JsonNode timestamp = root.get("timestamp");
        if (timestamp != null && !timestamp.isNull() && !timestamp.isTextual()) {
            throw new EnvelopeParseException("Envelope timestamp must be an ISO-8601 string id=" + id.asText());
        }

        return new EventEnvelope(
                id.asText(),
                headers(root.get("headers"), id.asText()),
                root.get("body"),
                timestamp == null || timestamp.isNull() ? null : timestamp.asText(),
                retryCount
        );
    }

    private Map<String, String> headers(JsonNode node, String id) {
        Map<String, String> headers = new LinkedHashMap<>();
        if (node == null || node.isNull()) {
            return headers;
        }
        if (!node.isObject()) {
            throw new EnvelopeParseException("Envelope headers must be an object id=" + id);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isNull()) {
                headers.put(field.getKey(), field.getValue().isValueNode()
                        ? field.getValue().asText()
                        : field.getValue().toString());
            }
        }
        return headers;
    }
}
