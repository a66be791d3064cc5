package com.gateway.model;

import java.time.Instant;
import java.util.Map;
import lombok.Data;

/**
 * An append-only record of one endpoint call. The request snapshot has its secrets redacted
 * before the entry is created.
 */
@Data
public class CallLog {

    private String id;

    private String endpointId;

    private String protocol;

    private Map<String, Object> request;

    private Object response;

    /**
     * The HTTP status of the response, or {@code null} for pub/sub calls and failures.
     */
    private Integer status;

    private boolean success;

    private String error;

    private long latencyMs;

    private Instant timestamp;
}
