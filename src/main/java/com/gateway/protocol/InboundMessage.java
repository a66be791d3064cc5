package com.gateway.protocol;

import java.time.Instant;
import java.util.Map;

/**
 * A message received on a subscription. When the message was a gateway envelope its fields
 * are unwrapped, otherwise {@code messageId} is {@code null} and {@code payload} holds the
 * decoded message.
 */
public record InboundMessage(String channel, String messageId, Map<String, String> headers, Object payload, Instant receivedAt) {
}
