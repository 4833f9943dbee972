package com.eventrelay.common.kafka.publish;

import java.util.Map;

public interface RecordPublisher {

    void publish(String topic, String key, Object payload, Map<String, String> headers);
}
