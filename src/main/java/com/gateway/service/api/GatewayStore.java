package com.gateway.service.api;

import com.gateway.model.ApiDocument;
import com.gateway.model.AuthConfig;
import com.gateway.model.CallLog;
import com.gateway.model.Endpoint;
import com.gateway.model.OAuth2AuthState;
import com.gateway.model.Specification;
import com.gateway.model.UserAuthorization;
import java.util.List;
import java.util.Optional;

/**
 * An interface defining the contract for the gateway's persistent state: registered
 * specifications with their documents and endpoints, authentication configurations, pending
 * OAuth2 flows, user tokens and the call log.
 * <p>
 * Implementations must make {@link #saveRegistration}, {@link #recordCall} and
 * {@link #consumeAuthState} atomic.
 */
public interface GatewayStore {

    /**
     * Stores a specification together with the document and endpoints derived from it. Either
     * all three are stored or, if persisting fails, none of them is.
     *
     * @param specification The parsed and resolved specification.
     * @param document      The API document created for it.
     * @param endpoints     The endpoints extracted from it, already attached to the document.
     */
    void saveRegistration(Specification specification, ApiDocument document, List<Endpoint> endpoints);

    Optional<Specification> findSpecification(String specId);

    Optional<ApiDocument> findDocument(String documentId);

    List<ApiDocument> listDocuments();

    /**
     * Removes a document with its specification, endpoints, authentication configurations and
     * user authorizations.
     *
     * @return {@code false} if no such document exists.
     */
    boolean deleteDocument(String documentId);

    Optional<Endpoint> findEndpoint(String endpointId);

    /**
     * @param documentId The owning document, or {@code null} for every endpoint.
     */
    List<Endpoint> listEndpoints(String documentId);

    /**
     * Appends the entry to the call log and folds it into the endpoint's statistics in one
     * atomic step.
     *
     * @return The endpoint with its updated statistics, or empty if the endpoint is unknown.
     */
    Optional<Endpoint> recordCall(CallLog callLog);

    /**
     * The most recent call log entries, newest first.
     *
     * @param endpointId Restricts the result to one endpoint, may be {@code null}.
     * @param limit      The maximum number of entries returned.
     */
    List<CallLog> recentCalls(String endpointId, int limit);

    AuthConfig saveAuthConfig(AuthConfig config);

    Optional<AuthConfig> findAuthConfig(String authConfigId);

    /**
     * The configurations attached to the document, not including global ones.
     */
    List<AuthConfig> listAuthConfigs(String documentId);

    List<AuthConfig> listGlobalAuthConfigs();

    void saveAuthState(OAuth2AuthState state);

    Optional<OAuth2AuthState> findAuthState(String stateId);

    /**
     * Marks the state as consumed if it is not already.
     *
     * @return {@code true} only for the single caller that performed the transition.
     */
    boolean consumeAuthState(String stateId);

    /**
     * The authorization states a user started for a document, in no particular order.
     */
    List<OAuth2AuthState> listAuthStates(String userId, String documentId);

    /**
     * Stores the authorization, replacing any previous one of the same user and document.
     */
    void saveUserAuthorization(UserAuthorization authorization);

    Optional<UserAuthorization> findUserAuthorization(String userId, String documentId);

    boolean deleteUserAuthorization(String userId, String documentId);
}
