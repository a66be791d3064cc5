package com.gateway.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec(new ObjectMapper());

    @Test
    void encode_writesEnvelopeFields() throws Exception {
        MessageEnvelope envelope = MessageEnvelope.publish("chat/lobby", Map.of("priority", "high"), Map.of("text", "hi"));

        JsonNode json = new ObjectMapper().readTree(codec.encode(envelope));

        assertThat(json.path("id").asText()).isEqualTo(envelope.id());
        assertThat(json.path("operation").asText()).isEqualTo("publish");
        assertThat(json.path("channel").asText()).isEqualTo("chat/lobby");
        assertThat(json.path("headers").path("priority").asText()).isEqualTo("high");
        assertThat(json.path("payload").path("text").asText()).isEqualTo("hi");
        assertThat(json.has("timestamp")).isTrue();
    }

    @Test
    void decode_unwrapsEnvelopes() {
        MessageEnvelope envelope = MessageEnvelope.publish("chat/lobby", Map.of("priority", "high"), Map.of("text", "hi"));

        InboundMessage message = codec.decode("ignored", codec.encode(envelope), Map.of("transport", "x"));

        assertThat(message.messageId()).isEqualTo(envelope.id());
        assertThat(message.channel()).isEqualTo("chat/lobby");
        assertThat(message.headers()).containsEntry("priority", "high").containsEntry("transport", "x");
        assertThat(((JsonNode) message.payload()).path("text").asText()).isEqualTo("hi");
    }

    @Test
    void decode_plainJsonIsKeptAsTree() {
        InboundMessage message = codec.decode("sensors", "{\"temp\": 21}".getBytes(StandardCharsets.UTF_8), null);

        assertThat(message.messageId()).isNull();
        assertThat(message.channel()).isEqualTo("sensors");
        assertThat(((JsonNode) message.payload()).path("temp").asInt()).isEqualTo(21);
    }

    @Test
    void decode_nonJsonIsKeptAsText() {
        InboundMessage message = codec.decode("raw", "hello there", Map.of());

        assertThat(message.payload()).isEqualTo("hello there");
    }
}
