package com.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * A single callable operation, normalized from either a REST path/verb pair or a pub/sub
 * channel/operation pair.
 * <p>
 * The statistics fields are maintained by the store and only change through its atomic
 * call-recording operation.
 */
@Data
public class Endpoint {

    /**
     * A unique identifier generated at extraction time.
     */
    private String id;

    /**
     * The identifier of the {@link ApiDocument} that owns this endpoint.
     */
    private String apiDocumentId;

    /**
     * The path or channel template, which may contain {@code {name}} placeholders
     * (e.g. "/pets/{petId}" or "rooms/{roomId}").
     */
    private String addressPattern;

    /**
     * The protocol whose adapter executes this endpoint (e.g. "http", "mqtt", "kafka").
     */
    private String protocol;

    /**
     * The lower-case HTTP verb for REST endpoints, or {@code publish}/{@code subscribe} for
     * pub/sub endpoints.
     */
    private String operationKind;

    /**
     * The operation identifier taken from the document, or a generated one when absent.
     */
    private String operationId;

    private String description;

    /**
     * The merged parameters of the operation.
     *
     * @see Parameter
     */
    private List<Parameter> parameters = new ArrayList<>();

    /**
     * The schema of the request body (REST) or message payload (pub/sub), if declared.
     */
    private JsonNode requestSchema;

    /**
     * The response schemas keyed by status code, if declared.
     */
    private JsonNode responseSchema;

    /**
     * The security requirements that apply to this operation.
     */
    private List<EndpointSecurity> securityRequirements = new ArrayList<>();

    private List<String> tags = new ArrayList<>();

    /**
     * For pub/sub endpoints, the address of the document server that speaks this endpoint's
     * protocol.
     */
    private String serverAddress;

    private long callCount;

    /**
     * Calls whose outcome was a 2xx status or, for pub/sub, an acknowledged operation.
     */
    private long successCount;

    private long errorCount;

    /**
     * The running average latency of every recorded call, in milliseconds.
     */
    private double averageLatencyMs;

    private Instant lastCalledAt;
}
