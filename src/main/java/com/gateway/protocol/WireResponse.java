package com.gateway.protocol;

import java.util.Map;

/**
 * The transport level outcome of a call.
 *
 * @param status  The HTTP status, or {@code null} for pub/sub operations.
 * @param headers Response headers, first value per name.
 * @param body    A JSON tree when the payload was JSON, otherwise text; for pub/sub an
 *                acknowledgement map.
 */
public record WireResponse(Integer status, Map<String, String> headers, Object body) {

    public static WireResponse acknowledgement(Map<String, Object> body) {
        return new WireResponse(null, Map.of(), body);
    }

    /**
     * Whether the call should count as a success in endpoint statistics: a 2xx status, or any
     * acknowledged pub/sub operation.
     */
    public boolean isSuccessful() {
        return status == null || (status >= 200 && status < 300);
    }
}
