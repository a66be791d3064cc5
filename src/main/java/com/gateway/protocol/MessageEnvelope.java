package com.gateway.protocol;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * The wrapper every published payload travels in.
 */
public record MessageEnvelope(String id, String timestamp, String channel, String operation,
                              Map<String, String> headers, Object payload) {

    public static MessageEnvelope publish(String channel, Map<String, String> headers, Object payload) {
        return new MessageEnvelope(UUID.randomUUID().toString(), Instant.now().toString(), channel, "publish",
                headers == null ? Map.of() : Map.copyOf(headers), payload);
    }
}
