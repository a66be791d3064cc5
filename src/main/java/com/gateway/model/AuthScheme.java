package com.gateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * The authentication schemes the dispatcher implements.
 */
public enum AuthScheme {
    BASIC("basic"),
    BEARER("bearer"),
    API_KEY("api_key"),
    OAUTH2("oauth2");

    private final String value;

    AuthScheme(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AuthScheme fromValue(String value) {
        return Arrays.stream(values())
                .filter(scheme -> scheme.value.equalsIgnoreCase(value) || scheme.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown authentication scheme: " + value));
    }
}
