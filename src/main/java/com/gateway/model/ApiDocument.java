package com.gateway.model;

import java.time.Instant;
import lombok.Data;

/**
 * A callable API derived from a {@link Specification}. Endpoints and authentication
 * configurations hang off a document.
 */
@Data
public class ApiDocument {

    private String id;

    /**
     * The identifier of the specification this document was derived from.
     */
    private String specId;

    private String name;

    private String version;

    /**
     * The specification family, either {@code rest} or {@code pubsub}.
     */
    private String specFamily;

    /**
     * The address relative endpoint paths are joined onto. Either the caller's override at
     * registration time or the first server declared by the document.
     */
    private String baseAddress;

    private Instant createdAt;
}
