package com.gateway.auth;

import com.gateway.model.AuthConfig;

/**
 * Talks to an OAuth2 provider's token endpoint. Errors raised by implementations never carry
 * the code verifier or the client secret.
 */
public interface TokenEndpointClient {

    TokenResponse exchangeCode(AuthConfig config, String code, String codeVerifier, String redirectUri);

    TokenResponse refresh(AuthConfig config, String refreshToken);
}
