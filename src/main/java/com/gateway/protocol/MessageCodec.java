package com.gateway.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.exception.GatewayException;
import com.gateway.exception.ErrorKind;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns envelopes into bytes and inbound bytes back into {@link InboundMessage}s.
 */
public class MessageCodec {

    private final ObjectMapper objectMapper;

    public MessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(MessageEnvelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new GatewayException(ErrorKind.INTERNAL, "Payload cannot be serialized as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String encodeText(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new GatewayException(ErrorKind.INTERNAL, "Message cannot be serialized as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public InboundMessage decode(String channel, byte[] data, Map<String, String> transportHeaders) {
        Map<String, String> headers = new LinkedHashMap<>(transportHeaders == null ? Map.of() : transportHeaders);
        JsonNode tree;
        try {
            tree = objectMapper.readTree(data);
        } catch (IOException e) {
            return new InboundMessage(channel, null, headers, new String(data, StandardCharsets.UTF_8), Instant.now());
        }
        if (tree == null || tree.isMissingNode()) {
            return new InboundMessage(channel, null, headers, new String(data, StandardCharsets.UTF_8), Instant.now());
        }
        if (isEnvelope(tree)) {
            tree.path("headers").properties().forEach(header -> headers.put(header.getKey(), header.getValue().asText()));
            String envelopeChannel = tree.path("channel").asText(channel);
            return new InboundMessage(envelopeChannel, tree.path("id").asText(), headers, tree.get("payload"), Instant.now());
        }
        return new InboundMessage(channel, null, headers, tree, Instant.now());
    }

    public InboundMessage decode(String channel, String text, Map<String, String> transportHeaders) {
        return decode(channel, text.getBytes(StandardCharsets.UTF_8), transportHeaders);
    }

    private boolean isEnvelope(JsonNode tree) {
        return tree.isObject() && tree.has("id") && tree.has("operation") && tree.has("payload");
    }
}
