package com.gateway.auth;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The outcome of one authentication attempt: either credentials to place on the request, or
 * the reason the attempt could not be satisfied. Reasons never contain secret values.
 * <p>
 * {@code connectionOptions} carries the same credentials in the form broker clients take
 * them ({@code username}, {@code password}, {@code token}), for pub/sub connections.
 */
public record AuthResult(Status status,
                         String reason,
                         Map<String, String> headers,
                         Map<String, String> queryParams,
                         Map<String, String> cookies,
                         Map<String, String> connectionOptions) {

    public enum Status {
        APPLIED,
        FAILED,
        /**
         * The configuration would apply but the user's OAuth2 token has expired.
         */
        EXPIRED
    }

    public static AuthResult header(String name, String value) {
        return applied(Map.of(name, value), Map.of(), Map.of());
    }

    public static AuthResult query(String name, String value) {
        return applied(Map.of(), Map.of(name, value), Map.of());
    }

    public static AuthResult cookie(String name, String value) {
        return applied(Map.of(), Map.of(), Map.of(name, value));
    }

    public static AuthResult failed(String reason) {
        return new AuthResult(Status.FAILED, reason, Map.of(), Map.of(), Map.of(), Map.of());
    }

    public static AuthResult expired(String reason) {
        return new AuthResult(Status.EXPIRED, reason, Map.of(), Map.of(), Map.of(), Map.of());
    }

    private static AuthResult applied(Map<String, String> headers, Map<String, String> query, Map<String, String> cookies) {
        return new AuthResult(Status.APPLIED, null, new LinkedHashMap<>(headers), new LinkedHashMap<>(query),
                new LinkedHashMap<>(cookies), Map.of());
    }

    public AuthResult withConnectionOptions(Map<String, String> options) {
        return new AuthResult(status, reason, headers, queryParams, cookies, Map.copyOf(options));
    }

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
