package com.gateway.model;

import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Data;

/**
 * An authentication configuration attached to an {@link ApiDocument}, or to every document
 * when {@link #global} is set.
 */
@Data
public class AuthConfig {

    private String id;

    private String apiDocumentId;

    private AuthScheme scheme;

    /**
     * Scheme specific settings and secret material. Keys by scheme:
     * <ul>
     *     <li>basic: {@code username}, {@code password}</li>
     *     <li>bearer: {@code token}</li>
     *     <li>api_key: {@code location} (header, query or cookie), {@code name}, {@code value}</li>
     *     <li>oauth2: {@code authorization_url}, {@code token_url}, {@code client_id},
     *     {@code client_secret}, {@code redirect_uri}, {@code scope}</li>
     * </ul>
     */
    private Map<String, String> config = new LinkedHashMap<>();

    /**
     * When {@code true} (the default) a call fails if this configuration cannot be satisfied
     * and no other configuration succeeds.
     */
    private boolean required = true;

    private boolean global;

    /**
     * Higher priorities are attempted first.
     */
    private int priority;
}
