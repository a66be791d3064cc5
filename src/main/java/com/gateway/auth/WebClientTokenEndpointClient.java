package com.gateway.auth;

import com.gateway.config.GatewayProperties;
import com.gateway.exception.AuthenticationFailedException;
import com.gateway.exception.InvalidSpecificationException;
import com.gateway.model.AuthConfig;
import com.gateway.protocol.TransportErrors;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Posts form-encoded token requests with the shared {@link WebClient}. The client secret, if
 * configured, is sent in the form body.
 * <p>
 * A rejected request is reported with the provider's status only: response bodies of token
 * endpoints may echo the submitted parameters.
 */
@Component
@Slf4j
public class WebClientTokenEndpointClient implements TokenEndpointClient {

    private final WebClient webClient;
    private final Duration timeout;

    public WebClientTokenEndpointClient(WebClient webClient, GatewayProperties properties) {
        this.webClient = webClient;
        this.timeout = properties.getOauth2().getTokenTimeout();
    }

    @Override
    public TokenResponse exchangeCode(AuthConfig config, String code, String codeVerifier, String redirectUri) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        form.add("redirect_uri", redirectUri);
        form.add("code_verifier", codeVerifier);
        return post(config, form);
    }

    @Override
    public TokenResponse refresh(AuthConfig config, String refreshToken) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        return post(config, form);
    }

    private TokenResponse post(AuthConfig config, MultiValueMap<String, String> form) {
        String tokenUrl = config.getConfig().get("token_url");
        if (tokenUrl == null) {
            throw new InvalidSpecificationException("token_url", "oauth2 config " + config.getId() + " has no token_url");
        }
        form.add("client_id", config.getConfig().get("client_id"));
        if (config.getConfig().get("client_secret") != null) {
            form.add("client_secret", config.getConfig().get("client_secret"));
        }
        String grantType = form.getFirst("grant_type");
        log.info("Requesting {} grant from {}", grantType, tokenUrl);

        TokenResponse response;
        try {
            response = webClient.post()
                    .uri(tokenUrl)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .bodyToMono(TokenResponse.class)
                    .timeout(timeout)
                    .block();
        } catch (WebClientResponseException e) {
            log.warn("Token endpoint {} rejected the {} grant with status {}", tokenUrl, grantType, e.getStatusCode().value());
            throw new AuthenticationFailedException(List.of("token endpoint answered " + e.getStatusCode().value()));
        } catch (RuntimeException e) {
            throw TransportErrors.translate(tokenUrl, e);
        }
        if (response == null || response.accessToken() == null) {
            throw new AuthenticationFailedException(List.of("token endpoint response has no access_token"));
        }
        return response;
    }
}
