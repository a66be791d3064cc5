package com.gateway.auth;

import com.gateway.model.AuthConfig;
import com.gateway.model.AuthScheme;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component
public class BearerAuthStrategy implements AuthStrategy {

    @Override
    public AuthScheme scheme() {
        return AuthScheme.BEARER;
    }

    @Override
    public AuthResult authenticate(AuthConfig config, AuthContext context) {
        String token = config.getConfig().get("token");
        if (token == null || token.isBlank()) {
            return AuthResult.failed("bearer config " + config.getId() + " has no token");
        }
        return AuthResult.header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .withConnectionOptions(Map.of("token", token));
    }
}
