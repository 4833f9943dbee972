package com.eventrelay.common.pipeline.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

public class DedupKeyExtractor {

    private final List<String> fields;

    public DedupKeyExtractor(List<String> fields) {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("At least one key field is required");
        }
        this.fields = List.copyOf(fields);
    }

    public Optional<String> extract(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            return Optional.empty();
        }
        for (String field : fields) {
            JsonNode value = payload.get(field);
            if (value != null && value.isValueNode() && !value.isNull() && !value.asText().isBlank()) {
                return Optional.of(field + ":" + value.asText());
            }
        }
        return Optional.empty();
    }

    public List<String> fields() {
        return fields;
    }
}
