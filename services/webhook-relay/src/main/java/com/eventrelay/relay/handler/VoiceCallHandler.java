package com.eventrelay.relay.handler;

import com.eventrelay.contracts.Topics;
import com.eventrelay.relay.client.DownstreamClient;
import com.eventrelay.relay.config.RelayProperties;
import org.springframework.stereotype.Component;

@Component
public class VoiceCallHandler extends ForwardingTopicHandler {

    public VoiceCallHandler(DownstreamClient client, RelayProperties properties) {
        super(client, properties);
    }

    @Override
    public String topic() {
        return Topics.VOICE_CALLS;
    }
}
