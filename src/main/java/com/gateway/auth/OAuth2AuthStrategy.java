package com.gateway.auth;

import com.gateway.model.AuthConfig;
import com.gateway.model.AuthScheme;
import com.gateway.model.UserAuthorization;
import com.gateway.service.api.GatewayStore;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Sends the calling user's OAuth2 access token. Expiry is only noticed here, at call time;
 * tokens are never refreshed automatically.
 */
@Component
public class OAuth2AuthStrategy implements AuthStrategy {

    private final GatewayStore store;
    private final Clock clock;

    public OAuth2AuthStrategy(GatewayStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @Override
    public AuthScheme scheme() {
        return AuthScheme.OAUTH2;
    }

    @Override
    public AuthResult authenticate(AuthConfig config, AuthContext context) {
        if (context.userId() == null) {
            return AuthResult.failed("oauth2 config " + config.getId() + " needs a user");
        }
        Optional<UserAuthorization> authorization = store.findUserAuthorization(context.userId(), context.apiDocumentId());
        if (authorization.isEmpty() || authorization.get().getAccessToken() == null) {
            return AuthResult.failed("user '" + context.userId() + "' has not authorized oauth2 config " + config.getId());
        }
        UserAuthorization token = authorization.get();
        if (token.getExpiresAt() != null && !clock.instant().isBefore(token.getExpiresAt())) {
            return AuthResult.expired("oauth2 authorization of user '" + context.userId() + "' expired at " + token.getExpiresAt());
        }
        String tokenType = token.getTokenType() == null || "bearer".equalsIgnoreCase(token.getTokenType())
                ? "Bearer"
                : token.getTokenType();
        return AuthResult.header(HttpHeaders.AUTHORIZATION, tokenType + " " + token.getAccessToken())
                .withConnectionOptions(Map.of("token", token.getAccessToken()));
    }
}
