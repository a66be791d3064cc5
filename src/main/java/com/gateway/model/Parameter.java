package com.gateway.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;

/**
 * A parameter accepted by an {@link Endpoint}.
 */
@Data
public class Parameter {

    private String name;

    /**
     * Where the parameter is placed on the wire.
     */
    private ParameterLocation location;

    /**
     * Whether the caller must supply a value. Path and channel parameters are always required.
     */
    private boolean required;

    /**
     * The parameter schema, used to coerce caller supplied values.
     */
    private JsonNode schema;

    private String description;
}
