package com.gateway.spec.asyncapi;

import java.util.Locale;

/**
 * Maps AsyncAPI binding and server protocol names onto adapter protocol names.
 */
public final class ProtocolNames {

    public static final String UNKNOWN = "unknown";

    private ProtocolNames() {
    }

    public static String normalize(String name) {
        if (name == null) {
            return UNKNOWN;
        }
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "ws", "wss", "websocket", "websockets" -> "websocket";
            case "mqtt", "mqtts", "secure-mqtt" -> "mqtt";
            case "amqp", "amqps" -> "amqp";
            case "kafka", "kafka-secure" -> "kafka";
            case "nats" -> "nats";
            default -> UNKNOWN;
        };
    }
}
