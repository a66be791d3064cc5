package com.gateway.model;

import java.time.Instant;
import lombok.Data;

/**
 * The OAuth2 tokens a user obtained for one {@link ApiDocument}.
 */
@Data
public class UserAuthorization {

    private String id;

    private String userId;

    private String apiDocumentId;

    private String authConfigId;

    private String accessToken;

    private String refreshToken;

    private String tokenType;

    private String scope;

    /**
     * When the access token stops being valid, or {@code null} if the provider did not say.
     */
    private Instant expiresAt;

    private String providerSubject;

    private Instant createdAt;

    private Instant updatedAt;
}
