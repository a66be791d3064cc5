package com.gateway.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * The placement of a parameter in an outgoing request.
 */
public enum ParameterLocation {
    PATH,
    QUERY,
    HEADER,
    COOKIE,
    CHANNEL;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ParameterLocation fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
