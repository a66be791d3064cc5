package com.gateway.dto.request;

import java.util.Map;

/**
 * A record that encapsulates the caller supplied data of one endpoint call.
 *
 * @param params  Parameter values keyed by name. Path, header, cookie and query (or channel)
 *                parameters are all supplied here and placed according to the endpoint.
 * @param headers Extra headers to send as-is.
 * @param body    The request body (REST) or message payload (pub/sub), may be {@code null}.
 * @param userId  The user on whose behalf the call is made, needed for OAuth2.
 */
public record CallRequest(Map<String, Object> params, Map<String, String> headers, Object body, String userId) {

    public CallRequest {
        params = params == null ? Map.of() : params;
        headers = headers == null ? Map.of() : headers;
    }

    public static CallRequest of(Map<String, Object> params) {
        return new CallRequest(params, Map.of(), null, null);
    }
}
