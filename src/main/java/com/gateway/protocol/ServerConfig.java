package com.gateway.protocol;

import java.time.Duration;
import java.util.Map;

/**
 * Where and how a pub/sub adapter connects.
 *
 * @param url            The server address as declared by the document.
 * @param options        Transport options such as {@code username}, {@code password} or
 *                       {@code clientId}.
 * @param connectTimeout Upper bound for establishing the connection.
 */
public record ServerConfig(String url, Map<String, String> options, Duration connectTimeout) {

    public ServerConfig {
        options = options == null ? Map.of() : Map.copyOf(options);
    }

    public String option(String name) {
        return options.get(name);
    }
}
