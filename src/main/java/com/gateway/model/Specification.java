package com.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import lombok.Data;

/**
 * A registered specification document, stored both as submitted and with every resolvable
 * {@code $ref} expanded.
 * <p>
 * Lombok's {@code @Data} annotation generates standard boilerplate code.
 */
@Data
public class Specification {

    /**
     * The unique identifier generated at registration time.
     */
    private String specId;

    /**
     * The human-readable name supplied by the caller.
     */
    private String name;

    /**
     * The specification family, either {@code rest} or {@code pubsub}.
     */
    private String specFamily;

    /**
     * The document exactly as submitted (JSON or YAML text).
     */
    private String rawContent;

    /**
     * The document with references expanded. Cycles are kept as circular markers.
     */
    private JsonNode resolvedContent;

    /**
     * The {@code info.version} of the document, if any.
     */
    private String version;

    /**
     * The servers declared by the document.
     */
    private List<ServerInfo> servers;

    private Instant createdAt;
}
