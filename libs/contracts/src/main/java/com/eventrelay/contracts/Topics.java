package com.eventrelay.contracts;

public final class Topics {
    private Topics() {}

    public static final String WEBHOOKS_INBOUND = "webhooks.inbound.v1";
    public static final String WEBHOOKS_PROCESSED = "webhooks.processed.v1";
    public static final String WEBHOOKS_DLQ = "webhooks.dlq.v1";

    public static final String WHATSAPP_INBOUND = "whatsapp.inbound.v1";
    public static final String VOICE_CALLS = "voice.calls.v1";
}
