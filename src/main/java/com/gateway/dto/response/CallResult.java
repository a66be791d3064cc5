package com.gateway.dto.response;

import com.gateway.exception.ErrorKind;
import java.util.Map;

/**
 * The structured outcome of an endpoint call. A call that reached the backend is successful
 * whatever status it returned; {@code success} is {@code false} only when the gateway could not
 * complete the call, in which case {@code errorKind} and {@code error} describe why.
 *
 * @param callId     The identifier of the call log entry.
 * @param endpointId The endpoint that was called, {@code null} when it could not be found.
 * @param success    Whether the call completed.
 * @param status     The HTTP status, or {@code null} for pub/sub calls and failures.
 * @param headers    The response headers (first value per name).
 * @param body       The decoded response body: a JSON tree, text, or a pub/sub acknowledgement.
 * @param errorKind  The failure category when {@code success} is {@code false}.
 * @param error      The failure message when {@code success} is {@code false}.
 * @param latencyMs  The wall-clock duration of the call.
 */
public record CallResult(String callId,
                         String endpointId,
                         boolean success,
                         Integer status,
                         Map<String, String> headers,
                         Object body,
                         ErrorKind errorKind,
                         String error,
                         long latencyMs) {
}
