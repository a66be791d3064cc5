package com.gateway.protocol;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.Data;
import lombok.ToString;
import org.springframework.util.LinkedCaseInsensitiveMap;

/**
 * A fully built outgoing request, independent of the transport that will carry it.
 * <p>
 * Authentication material is added last by the auth dispatcher, which also records which
 * headers, query parameters and cookies are secret so {@link #redacted()} can mask them.
 */
@Data
public class WireRequest {

    public static final String REDACTED = "***";

    private static final Set<String> ALWAYS_SENSITIVE_HEADERS = Set.of("authorization", "proxy-authorization", "cookie");

    private String protocol;

    /**
     * The upper-case HTTP verb, or {@code publish}/{@code subscribe} for pub/sub endpoints.
     */
    private String method;

    /**
     * For REST endpoints, the absolute URL without query string.
     */
    private String url;

    /**
     * The path or channel with every placeholder substituted.
     */
    private String address;

    /**
     * For pub/sub endpoints, the broker the channel lives on.
     */
    private String serverAddress;

    private Map<String, String> headers = new LinkedCaseInsensitiveMap<>();

    private Map<String, Object> queryParams = new LinkedHashMap<>();

    private Map<String, Object> channelParams = new LinkedHashMap<>();

    private Map<String, String> cookies = new LinkedHashMap<>();

    private Object body;

    /**
     * Credentials for the broker connection of a pub/sub request, set by the auth dispatcher.
     * They never travel inside a message.
     */
    @ToString.Exclude
    private Map<String, String> connectionOptions = new LinkedHashMap<>();

    private Set<String> sensitiveHeaders = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);

    private Set<String> sensitiveQueryParams = new HashSet<>();

    private Set<String> sensitiveCookies = new HashSet<>();

    /**
     * The headers that may be copied into a published message: every caller and parameter
     * header except the ones carrying secrets.
     */
    public Map<String, String> messageHeaders() {
        Map<String, String> safe = new LinkedHashMap<>();
        headers.forEach((name, value) -> {
            if (!isSensitiveHeader(name)) {
                safe.put(name, value);
            }
        });
        return safe;
    }

    private boolean isSensitiveHeader(String name) {
        return sensitiveHeaders.contains(name) || ALWAYS_SENSITIVE_HEADERS.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * A snapshot of this request safe to log or persist: secret header, query and cookie values
     * are replaced by {@value #REDACTED}.
     */
    public Map<String, Object> redacted() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("protocol", protocol);
        snapshot.put("method", method);
        snapshot.put("url", url != null ? url : address);
        if (serverAddress != null) {
            snapshot.put("server", serverAddress);
        }

        Map<String, String> safeHeaders = new LinkedHashMap<>();
        headers.forEach((name, value) -> safeHeaders.put(name, isSensitiveHeader(name) ? REDACTED : value));
        snapshot.put("headers", safeHeaders);

        Map<String, Object> safeQuery = new LinkedHashMap<>();
        queryParams.forEach((name, value) -> safeQuery.put(name, sensitiveQueryParams.contains(name) ? REDACTED : value));
        snapshot.put("query", safeQuery);

        if (!cookies.isEmpty()) {
            Map<String, String> safeCookies = new LinkedHashMap<>();
            cookies.forEach((name, value) -> safeCookies.put(name, sensitiveCookies.contains(name) ? REDACTED : value));
            snapshot.put("cookies", safeCookies);
        }
        if (!channelParams.isEmpty()) {
            snapshot.put("channelParams", channelParams);
        }
        snapshot.put("body", body);
        return snapshot;
    }
}
