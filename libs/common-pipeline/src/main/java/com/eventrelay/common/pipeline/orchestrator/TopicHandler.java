package com.eventrelay.common.pipeline.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;

public interface TopicHandler {

    String topic();

    void handle(JsonNode payload) throws Exception;
}
