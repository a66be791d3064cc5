package com.gateway.service.api;

import com.gateway.auth.OAuth2Status;
import com.gateway.dto.request.CallRequest;
import com.gateway.dto.request.RegisterSpecificationRequest;
import com.gateway.dto.response.AuthorizationRequest;
import com.gateway.dto.response.CallResult;
import com.gateway.dto.response.RegistrationResult;
import com.gateway.model.ApiDocument;
import com.gateway.model.AuthConfig;
import com.gateway.model.CallLog;
import com.gateway.model.Endpoint;
import com.gateway.model.UserAuthorization;
import com.gateway.protocol.InboundMessage;
import com.gateway.spec.asyncapi.GatewaySubscriptions;
import java.util.List;

/**
 * The entry point of the gateway: registers specification documents and calls the endpoints
 * they describe.
 * <p>
 * Registration is all-or-nothing and reports failures as exceptions. Calls never throw for
 * failures of the call itself; they return a {@link CallResult} describing the failure.
 */
public interface Gateway {

    /**
     * Registers a document given as text.
     *
     * @param name        A name for the API, or {@code null} to use the document title.
     * @param rawContent  The OpenAPI or AsyncAPI document, JSON or YAML.
     * @param familyHint  The family to register under instead of detecting it, may be {@code null}.
     * @param baseAddress Overrides the document's first server, may be {@code null}.
     * @return The created document and its endpoints.
     * @throws com.gateway.exception.GatewayException if the document cannot be registered;
     *                                                nothing is stored in that case.
     */
    RegistrationResult registerSpecification(String name, String rawContent, String familyHint, String baseAddress);

    /**
     * Registers a document read from a URL or a local file.
     */
    RegistrationResult registerSpecification(RegisterSpecificationRequest request);

    /**
     * Calls an endpoint by identifier.
     */
    CallResult callEndpoint(String endpointId, CallRequest request);

    /**
     * Calls the endpoint of the document whose address pattern matches the concrete address.
     * Patterns with fewer placeholders are tried first. A query string on the address is
     * merged into the parameters.
     *
     * @param operationKind The HTTP verb or {@code publish}/{@code subscribe}, case-insensitive.
     */
    CallResult callByAddress(String address, String operationKind, String documentId, CallRequest request);

    AuthorizationRequest beginAuthorization(String userId, String documentId);

    UserAuthorization completeAuthorization(String stateId, String code, String state);

    UserAuthorization refreshAuthorization(String userId, String documentId);

    OAuth2Status authorizationStatus(String userId, String documentId);

    boolean revokeAuthorization(String userId, String documentId);

    /**
     * Attaches an authentication configuration to a document, or to every document when it is
     * flagged global.
     */
    AuthConfig addAuthConfig(AuthConfig config);

    List<AuthConfig> listAuthConfigs(String documentId);

    ApiDocument getDocument(String documentId);

    List<ApiDocument> listDocuments();

    List<Endpoint> listEndpoints(String documentId);

    Endpoint getEndpoint(String endpointId);

    List<CallLog> recentCalls(String endpointId, int limit);

    List<InboundMessage> drainMessages(String subscriptionId, int max);

    void cancelSubscription(String subscriptionId);

    List<GatewaySubscriptions.SubscriptionInfo> listSubscriptions();

    /**
     * Removes a document with everything attached to it.
     */
    void unregisterDocument(String documentId);
}
