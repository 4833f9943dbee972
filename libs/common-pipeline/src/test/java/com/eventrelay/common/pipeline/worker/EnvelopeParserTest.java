package com.eventrelay.common.pipeline.worker;

import com.eventrelay.contracts.events.EventEnvelope;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnvelopeParserTest {

    private final EnvelopeParser parser = new EnvelopeParser(new ObjectMapper());

    @Test
    void parsesFullEnvelope() {
        EventEnvelope envelope = parser.parse("""
                {"id":"wh-9","headers":{"x-correlation-id":"c-1","x-attempt":2},
                 "body":{"nested":{"ok":true}},"timestamp":"2026-03-01T09:59:00Z","retryCount":2}
                """);

        assertThat(envelope.id()).isEqualTo("wh-9");
        assertThat(envelope.headers()).containsEntry("x-correlation-id", "c-1").containsEntry("x-attempt", "2");
        assertThat(envelope.body().at("/nested/ok").asBoolean()).isTrue();
        assertThat(envelope.timestamp()).isEqualTo("2026-03-01T09:59:00Z");
        assertThat(envelope.retryCount()).isEqualTo(2);
    }

    @Test
    void missingOptionalFieldsDefault() {
        EventEnvelope envelope = parser.parse("{\"id\":\"wh-1\"}");

        assertThat(envelope.retryCount()).isZero();
        assertThat(envelope.headers()).isEmpty();
        assertThat(envelope.body()).isNull();
        assertThat(envelope.timestamp()).isNull();
    }

    @Test
    void rejectsEnvelopesOutsideTheSchema() {
        assertThatThrownBy(() -> parser.parse("{\"id\":\"\"}")).isInstanceOf(EnvelopeParseException.class);
        assertThatThrownBy(() -> parser.parse("{\"id\":{\"a\":1}}")).isInstanceOf(EnvelopeParseException.class);
        assertThatThrownBy(() -> parser.parse("{\"id\":\"wh-1\",\"retryCount\":1.5}"))
                .isInstanceOf(EnvelopeParseException.class);
        assertThatThrownBy(() -> parser.parse("{\"id\":\"wh-1\",\"headers\":[]}"))
                .isInstanceOf(EnvelopeParseException.class);
        assertThatThrownBy(() -> parser.parse("{\"id\":\"wh-1\",\"timestamp\":123}"))
                .isInstanceOf(EnvelopeParseException.class);
        assertThatThrownBy(() -> parser.parse("{\"id\":\"wh-1\""))
                .isInstanceOf(EnvelopeParseException.class)
                .hasMessageContaining("not valid JSON");
    }
}
