package com.gateway.auth;

import com.gateway.model.AuthConfig;
import com.gateway.model.AuthScheme;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component
public class BasicAuthStrategy implements AuthStrategy {

    @Override
    public AuthScheme scheme() {
        return AuthScheme.BASIC;
    }

    @Override
    public AuthResult authenticate(AuthConfig config, AuthContext context) {
        String username = config.getConfig().get("username");
        String password = config.getConfig().get("password");
        if (username == null || password == null) {
            return AuthResult.failed("basic config " + config.getId() + " has no username or password");
        }
        String credentials = Base64.getEncoder().encodeToString((username + ":" + password).getBytes(StandardCharsets.UTF_8));
        return AuthResult.header(HttpHeaders.AUTHORIZATION, "Basic " + credentials)
                .withConnectionOptions(Map.of("username", username, "password", password));
    }
}
