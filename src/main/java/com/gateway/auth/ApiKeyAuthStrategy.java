package com.gateway.auth;

import com.gateway.model.AuthConfig;
import com.gateway.model.AuthScheme;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Places an API key in a header (the default), a query parameter or a cookie.
 */
@Component
public class ApiKeyAuthStrategy implements AuthStrategy {

    static final String DEFAULT_NAME = "X-API-Key";

    @Override
    public AuthScheme scheme() {
        return AuthScheme.API_KEY;
    }

    @Override
    public AuthResult authenticate(AuthConfig config, AuthContext context) {
        String value = config.getConfig().get("value");
        if (value == null || value.isBlank()) {
            return AuthResult.failed("api_key config " + config.getId() + " has no value");
        }
        String name = config.getConfig().getOrDefault("name", DEFAULT_NAME);
        String location = config.getConfig().getOrDefault("location", "header").toLowerCase(Locale.ROOT);
        return switch (location) {
            case "header" -> AuthResult.header(name, value);
            case "query" -> AuthResult.query(name, value);
            case "cookie" -> AuthResult.cookie(name, value);
            default -> AuthResult.failed("api_key config " + config.getId() + " has unknown location '" + location + "'");
        };
    }
}
