package com.gateway.auth;

import com.gateway.exception.AuthenticationFailedException;
import com.gateway.exception.AuthorizationExpiredException;
import com.gateway.model.ApiDocument;
import com.gateway.model.AuthConfig;
import com.gateway.model.AuthScheme;
import com.gateway.protocol.WireRequest;
import com.gateway.service.api.GatewayStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Applies the authentication configured for a document to an outgoing request.
 * <p>
 * The document's own configurations and the global ones are attempted in descending
 * priority (document configurations first on a tie). The first one that can be satisfied is
 * applied and its values are marked secret on the request. If none can be satisfied the call
 * fails with every attempt's reason, unless no configuration is required, in which case the
 * request goes out unauthenticated. An expired OAuth2 token fails the call as such, even when
 * every configuration is optional: the user authorized and has to refresh.
 */
@Component
@Slf4j
public class AuthDispatcher {

    private final Map<AuthScheme, AuthStrategy> strategies = new EnumMap<>(AuthScheme.class);
    private final GatewayStore store;

    public AuthDispatcher(List<AuthStrategy> strategies, GatewayStore store) {
        strategies.forEach(strategy -> this.strategies.put(strategy.scheme(), strategy));
        this.store = store;
    }

    /**
     * @throws AuthorizationExpiredException if no configuration applied and the user's OAuth2
     *                                       token has expired.
     * @throws AuthenticationFailedException if a required configuration exists and none could
     *                                       be satisfied.
     */
    public void apply(WireRequest request, ApiDocument document, String userId) {
        List<AuthConfig> configs = applicableConfigs(document.getId());
        if (configs.isEmpty()) {
            return;
        }
        AuthContext context = new AuthContext(userId, document.getId());
        List<String> reasons = new ArrayList<>();
        String expired = null;
        for (AuthConfig config : configs) {
            AuthStrategy strategy = strategies.get(config.getScheme());
            if (strategy == null) {
                reasons.add("no strategy for scheme " + config.getScheme());
                continue;
            }
            AuthResult result = strategy.authenticate(config, context);
            if (result.isApplied()) {
                applyTo(request, result);
                log.debug("Applied {} auth config {} to request for document {}", config.getScheme().value(), config.getId(), document.getId());
                return;
            }
            if (result.status() == AuthResult.Status.EXPIRED && expired == null) {
                expired = result.reason();
            }
            reasons.add(result.reason());
        }

        if (expired != null) {
            log.warn("OAuth2 authorization expired for document {}, refresh it before calling", document.getId());
            throw new AuthorizationExpiredException(expired);
        }
        if (configs.stream().noneMatch(AuthConfig::isRequired)) {
            log.debug("No optional auth config could be applied for document {}, calling unauthenticated", document.getId());
            return;
        }
        throw new AuthenticationFailedException(reasons);
    }

    /**
     * The document and global configurations in the order they are attempted.
     */
    public List<AuthConfig> applicableConfigs(String documentId) {
        List<AuthConfig> configs = new ArrayList<>(store.listAuthConfigs(documentId));
        configs.addAll(store.listGlobalAuthConfigs());
        configs.sort(Comparator.comparingInt(AuthConfig::getPriority).reversed());
        return configs;
    }

    private static void applyTo(WireRequest request, AuthResult result) {
        result.headers().forEach((name, value) -> {
            request.getHeaders().put(name, value);
            request.getSensitiveHeaders().add(name);
        });
        result.queryParams().forEach((name, value) -> {
            request.getQueryParams().put(name, value);
            request.getSensitiveQueryParams().add(name);
        });
        result.cookies().forEach((name, value) -> {
            request.getCookies().put(name, value);
            request.getSensitiveCookies().add(name);
        });
        request.getConnectionOptions().putAll(result.connectionOptions());
    }
}
