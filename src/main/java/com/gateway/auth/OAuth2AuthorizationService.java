package com.gateway.auth;

import com.gateway.config.GatewayProperties;
import com.gateway.dto.response.AuthorizationRequest;
import com.gateway.exception.AuthenticationFailedException;
import com.gateway.exception.AuthorizationExpiredException;
import com.gateway.exception.ExpiredStateException;
import com.gateway.exception.InvalidSpecificationException;
import com.gateway.exception.InvalidStateException;
import com.gateway.model.AuthConfig;
import com.gateway.model.AuthScheme;
import com.gateway.model.OAuth2AuthState;
import com.gateway.model.UserAuthorization;
import com.gateway.service.api.GatewayStore;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Runs the OAuth2 authorization-code flow with PKCE for a user and a document.
 * <p>
 * {@link #initiateAuthorization} persists a single-use state and returns the provider URL;
 * {@link #handleCallback} validates the state, consumes it atomically and exchanges the code
 * for tokens. Tokens are refreshed only when {@link #refreshAuthorization} is called.
 */
@Service
@Slf4j
public class OAuth2AuthorizationService {

    private final GatewayStore store;
    private final TokenEndpointClient tokenClient;
    private final AuthDispatcher authDispatcher;
    private final Clock clock;
    private final Duration stateExpiry;
    private final String defaultScope;

    public OAuth2AuthorizationService(GatewayStore store, TokenEndpointClient tokenClient, AuthDispatcher authDispatcher,
                                      GatewayProperties properties, Clock clock) {
        this.store = store;
        this.tokenClient = tokenClient;
        this.authDispatcher = authDispatcher;
        this.clock = clock;
        this.stateExpiry = properties.getOauth2().getStateExpiry();
        this.defaultScope = properties.getOauth2().getDefaultScope();
    }

    /**
     * Creates a pending authorization for the highest-priority OAuth2 configuration that
     * applies to the document.
     *
     * @throws AuthenticationFailedException if the document has no OAuth2 configuration.
     */
    public AuthorizationRequest initiateAuthorization(String userId, String apiDocumentId) {
        AuthConfig config = oauth2Config(apiDocumentId);
        String authorizationUrl = require(config, "authorization_url");
        String redirectUri = require(config, "redirect_uri");
        String clientId = require(config, "client_id");

        Pkce pkce = Pkce.generate();
        Instant now = clock.instant();
        OAuth2AuthState state = new OAuth2AuthState();
        state.setId(UUID.randomUUID().toString());
        state.setAuthConfigId(config.getId());
        state.setUserId(userId);
        state.setApiDocumentId(apiDocumentId);
        state.setStateNonce(Pkce.randomToken(16));
        state.setCodeVerifier(pkce.codeVerifier());
        state.setCodeChallenge(pkce.codeChallenge());
        state.setRedirectUri(redirectUri);
        state.setScope(config.getConfig().getOrDefault("scope", defaultScope));
        state.setCreatedAt(now);
        state.setExpiresAt(now.plus(stateExpiry));
        store.saveAuthState(state);

        String url = UriComponentsBuilder.fromUriString(authorizationUrl)
                .queryParam("response_type", "code")
                .queryParam("client_id", clientId)
                .queryParam("redirect_uri", redirectUri)
                .queryParam("scope", state.getScope())
                .queryParam("state", state.getStateNonce())
                .queryParam("code_challenge", state.getCodeChallenge())
                .queryParam("code_challenge_method", Pkce.METHOD)
                .encode()
                .build()
                .toUriString();
        log.info("Started OAuth2 authorization {} for user '{}' on document {}", state.getId(), userId, apiDocumentId);
        return new AuthorizationRequest(state.getId(), url, state.getExpiresAt());
    }

    /**
     * Completes a pending authorization.
     *
     * @throws InvalidStateException if the state is unknown, does not match, or was already used.
     * @throws ExpiredStateException if the state is past its expiry.
     */
    public UserAuthorization handleCallback(String stateId, String code, String callbackState) {
        OAuth2AuthState state = store.findAuthState(stateId)
                .orElseThrow(() -> new InvalidStateException("Unknown authorization state " + stateId));
        if (callbackState == null || !MessageDigest.isEqual(
                state.getStateNonce().getBytes(StandardCharsets.UTF_8), callbackState.getBytes(StandardCharsets.UTF_8))) {
            log.warn("State parameter mismatch for authorization {}", stateId);
            throw new InvalidStateException("State parameter does not match authorization " + stateId);
        }
        if (state.isConsumed()) {
            throw new InvalidStateException("Authorization " + stateId + " was already completed");
        }
        if (!clock.instant().isBefore(state.getExpiresAt())) {
            throw new ExpiredStateException("Authorization " + stateId + " expired at " + state.getExpiresAt());
        }
        if (!store.consumeAuthState(stateId)) {
            throw new InvalidStateException("Authorization " + stateId + " was already completed");
        }
        AuthConfig config = store.findAuthConfig(state.getAuthConfigId())
                .orElseThrow(() -> new InvalidStateException("Auth config of authorization " + stateId + " no longer exists"));

        TokenResponse tokens = tokenClient.exchangeCode(config, code, state.getCodeVerifier(), state.getRedirectUri());
        UserAuthorization authorization = store.findUserAuthorization(state.getUserId(), state.getApiDocumentId())
                .orElseGet(UserAuthorization::new);
        if (authorization.getId() == null) {
            authorization.setId(UUID.randomUUID().toString());
            authorization.setCreatedAt(clock.instant());
        }
        authorization.setUserId(state.getUserId());
        authorization.setApiDocumentId(state.getApiDocumentId());
        authorization.setAuthConfigId(config.getId());
        applyTokens(authorization, tokens, state.getScope());
        store.saveUserAuthorization(authorization);
        log.info("User '{}' authorized document {}", state.getUserId(), state.getApiDocumentId());
        return authorization;
    }

    /**
     * Exchanges the stored refresh token for a new access token.
     *
     * @throws AuthenticationFailedException if the user never authorized the document.
     * @throws AuthorizationExpiredException if there is no refresh token to use.
     */
    public UserAuthorization refreshAuthorization(String userId, String apiDocumentId) {
        UserAuthorization authorization = store.findUserAuthorization(userId, apiDocumentId)
                .orElseThrow(() -> new AuthenticationFailedException(
                        List.of("user '" + userId + "' has not authorized document " + apiDocumentId)));
        if (authorization.getRefreshToken() == null) {
            throw new AuthorizationExpiredException("No refresh token stored for user '" + userId + "', authorize again");
        }
        AuthConfig config = store.findAuthConfig(authorization.getAuthConfigId())
                .orElseGet(() -> oauth2Config(apiDocumentId));
        TokenResponse tokens = tokenClient.refresh(config, authorization.getRefreshToken());
        applyTokens(authorization, tokens, authorization.getScope());
        store.saveUserAuthorization(authorization);
        log.info("Refreshed OAuth2 authorization of user '{}' for document {}", userId, apiDocumentId);
        return authorization;
    }

    public OAuth2Status authorizationStatus(String userId, String apiDocumentId) {
        Instant now = clock.instant();
        Optional<UserAuthorization> authorization = store.findUserAuthorization(userId, apiDocumentId);
        if (authorization.isPresent()) {
            Instant expiresAt = authorization.get().getExpiresAt();
            return expiresAt != null && !now.isBefore(expiresAt) ? OAuth2Status.EXPIRED : OAuth2Status.AUTHORIZED;
        }
        boolean pending = store.listAuthStates(userId, apiDocumentId).stream()
                .anyMatch(state -> !state.isConsumed() && now.isBefore(state.getExpiresAt()));
        return pending ? OAuth2Status.AWAITING_CALLBACK : OAuth2Status.NO_AUTHORIZATION;
    }

    public boolean revokeAuthorization(String userId, String apiDocumentId) {
        boolean removed = store.deleteUserAuthorization(userId, apiDocumentId);
        if (removed) {
            log.info("Revoked OAuth2 authorization of user '{}' for document {}", userId, apiDocumentId);
        }
        return removed;
    }

    private void applyTokens(UserAuthorization authorization, TokenResponse tokens, String requestedScope) {
        Instant now = clock.instant();
        authorization.setAccessToken(tokens.accessToken());
        if (tokens.refreshToken() != null) {
            authorization.setRefreshToken(tokens.refreshToken());
        }
        authorization.setTokenType(tokens.tokenType() != null ? tokens.tokenType() : "Bearer");
        authorization.setScope(tokens.scope() != null ? tokens.scope() : requestedScope);
        authorization.setExpiresAt(tokens.expiresIn() != null ? now.plusSeconds(tokens.expiresIn()) : null);
        authorization.setUpdatedAt(now);
    }

    private AuthConfig oauth2Config(String apiDocumentId) {
        return authDispatcher.applicableConfigs(apiDocumentId).stream()
                .filter(config -> config.getScheme() == AuthScheme.OAUTH2)
                .findFirst()
                .orElseThrow(() -> new AuthenticationFailedException(
                        List.of("no oauth2 configuration for document " + apiDocumentId)));
    }

    private static String require(AuthConfig config, String key) {
        String value = config.getConfig().get(key);
        if (value == null || value.isBlank()) {
            throw new InvalidSpecificationException(key, "oauth2 config " + config.getId() + " has no " + key);
        }
        return value;
    }
}
