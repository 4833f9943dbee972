package com.eventrelay.common.pipeline.worker;

import com.eventrelay.contracts.events.EventEnvelope;

@FunctionalInterface
public interface EventProcessor {

    void process(EventEnvelope envelope) throws Exception;
}
