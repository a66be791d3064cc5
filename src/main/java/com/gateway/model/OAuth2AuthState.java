package com.gateway.model;

import java.time.Instant;
import lombok.Data;

/**
 * A pending OAuth2 authorization-code flow, created when a user is sent to the provider and
 * consumed by the first callback that presents its state nonce.
 */
@Data
public class OAuth2AuthState {

    private String id;

    private String authConfigId;

    private String userId;

    private String apiDocumentId;

    /**
     * The opaque value sent as the {@code state} query parameter.
     */
    private String stateNonce;

    /**
     * The PKCE verifier. Never exposed outside the token exchange.
     */
    private String codeVerifier;

    private String codeChallenge;

    private String redirectUri;

    private String scope;

    private Instant expiresAt;

    /**
     * Set exactly once, by the callback that wins the compare-and-set in the store.
     */
    private boolean consumed;

    private Instant createdAt;
}
