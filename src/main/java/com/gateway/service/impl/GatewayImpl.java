package com.gateway.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateway.auth.OAuth2AuthorizationService;
import com.gateway.auth.OAuth2Status;
import com.gateway.dto.request.CallRequest;
import com.gateway.dto.request.RegisterSpecificationRequest;
import com.gateway.dto.response.AuthorizationRequest;
import com.gateway.dto.response.CallResult;
import com.gateway.dto.response.RegistrationResult;
import com.gateway.exception.EndpointNotFoundException;
import com.gateway.exception.ErrorKind;
import com.gateway.exception.GatewayException;
import com.gateway.exception.InvalidSpecificationException;
import com.gateway.exception.UnsupportedFamilyException;
import com.gateway.exception.UnsupportedProtocolException;
import com.gateway.model.ApiDocument;
import com.gateway.model.AuthConfig;
import com.gateway.model.CallLog;
import com.gateway.model.Endpoint;
import com.gateway.model.ServerInfo;
import com.gateway.model.Specification;
import com.gateway.model.UserAuthorization;
import com.gateway.protocol.InboundMessage;
import com.gateway.protocol.ProtocolAdapter;
import com.gateway.protocol.WireRequest;
import com.gateway.protocol.WireResponse;
import com.gateway.registry.SpecRegistry;
import com.gateway.request.AddressPattern;
import com.gateway.request.RequestBuilder;
import com.gateway.resolver.DocumentFetcher;
import com.gateway.resolver.DocumentReader;
import com.gateway.resolver.RefResolver;
import com.gateway.service.api.Gateway;
import com.gateway.service.api.GatewayStore;
import com.gateway.spec.SpecModel;
import com.gateway.spec.asyncapi.GatewaySubscriptions;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * The default {@link Gateway}: wires document reading, reference resolution, the registry's
 * family and protocol plug-ins, request building and the store together.
 */
@Service
@Slf4j
public class GatewayImpl implements Gateway {

    private final SpecRegistry registry;
    private final DocumentReader documentReader;
    private final DocumentFetcher documentFetcher;
    private final RefResolver refResolver;
    private final RequestBuilder requestBuilder;
    private final GatewayStore store;
    private final OAuth2AuthorizationService authorizationService;
    private final GatewaySubscriptions subscriptions;
    private final Clock clock;

    public GatewayImpl(SpecRegistry registry, DocumentReader documentReader, DocumentFetcher documentFetcher,
                       RefResolver refResolver, RequestBuilder requestBuilder, GatewayStore store,
                       OAuth2AuthorizationService authorizationService, GatewaySubscriptions subscriptions, Clock clock) {
        this.registry = registry;
        this.documentReader = documentReader;
        this.documentFetcher = documentFetcher;
        this.refResolver = refResolver;
        this.requestBuilder = requestBuilder;
        this.store = store;
        this.authorizationService = authorizationService;
        this.subscriptions = subscriptions;
        this.clock = clock;
    }

    @Override
    public RegistrationResult registerSpecification(String name, String rawContent, String familyHint, String baseAddress) {
        JsonNode rawDocument = documentReader.read(rawContent);

        String family = familyHint != null && !familyHint.isBlank()
                ? familyHint.toLowerCase(Locale.ROOT)
                : registry.detectFamily(rawDocument).orElseThrow(() -> new UnsupportedFamilyException(
                        "Document is neither OpenAPI 3.x nor AsyncAPI 2.x"));
        SpecRegistry.RegistrationStatus status = registry.validateCompleteness(family);
        if (!status.complete()) {
            throw new UnsupportedFamilyException("Specification family '" + family + "' is not fully registered: " + status);
        }

        JsonNode resolved = refResolver.resolve(rawDocument);
        SpecModel model = registry.modelFactory(family).create(resolved);
        List<Endpoint> endpoints = registry.parser(family).extractEndpoints(model);
        for (Endpoint endpoint : endpoints) {
            if (!registry.hasProtocol(endpoint.getProtocol())) {
                throw new UnsupportedProtocolException("Endpoint " + endpoint.getOperationKind() + " "
                        + endpoint.getAddressPattern() + " uses unsupported protocol '" + endpoint.getProtocol() + "'");
            }
        }

        Instant now = clock.instant();
        Specification specification = new Specification();
        specification.setSpecId(UUID.randomUUID().toString());
        specification.setName(name != null && !name.isBlank() ? name : model.title());
        specification.setSpecFamily(family);
        specification.setRawContent(rawContent);
        specification.setResolvedContent(resolved);
        specification.setVersion(model.version());
        specification.setServers(model.servers());
        specification.setCreatedAt(now);

        ApiDocument document = new ApiDocument();
        document.setId(UUID.randomUUID().toString());
        document.setSpecId(specification.getSpecId());
        document.setName(specification.getName());
        document.setVersion(model.version());
        document.setSpecFamily(family);
        document.setBaseAddress(baseAddress != null && !baseAddress.isBlank()
                ? baseAddress
                : model.servers().stream().map(ServerInfo::url).findFirst().orElse(null));
        document.setCreatedAt(now);
        endpoints.forEach(endpoint -> endpoint.setApiDocumentId(document.getId()));

        store.saveRegistration(specification, document, endpoints);
        log.info("Registered {} document '{}' ({}) with {} endpoints", family, document.getName(), document.getId(), endpoints.size());
        return new RegistrationResult(document.getId(), specification.getSpecId(), family, endpoints);
    }

    @Override
    public RegistrationResult registerSpecification(RegisterSpecificationRequest request) {
        log.info("Loading specification from: {}", request.source());
        return registerSpecification(request.name(), loadSource(request.source()), request.familyHint(), request.baseAddress());
    }

    private String loadSource(String source) {
        if (source == null || source.isBlank()) {
            throw new InvalidSpecificationException("source", "no source given");
        }
        String lower = source.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return documentFetcher.fetch(source);
        }
        try {
            return Files.readString(Path.of(source), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidSpecificationException("source", "cannot read " + source + ": " + e.getMessage());
        }
    }

    @Override
    public CallResult callEndpoint(String endpointId, CallRequest call) {
        long start = System.nanoTime();
        String callId = UUID.randomUUID().toString();
        Endpoint endpoint = null;
        WireRequest request = null;
        try {
            endpoint = store.findEndpoint(endpointId)
                    .orElseThrow(() -> new EndpointNotFoundException("No endpoint with id " + endpointId));
            ApiDocument document = findDocument(endpoint.getApiDocumentId());
            request = requestBuilder.build(endpoint, document, call);
            ProtocolAdapter adapter = registry.adapter(endpoint.getProtocol());
            WireResponse response = registry.executor(document.getSpecFamily()).execute(endpoint, request, adapter);

            long latencyMs = elapsedMillis(start);
            log.info("{} {} -> {} in {} ms", request.getMethod(), request.getUrl() != null ? request.getUrl() : request.getAddress(),
                    response.status() != null ? response.status() : "acknowledged", latencyMs);
            record(callId, endpointId, endpoint, request, response.body(), response.status(), true, null, latencyMs);
            return new CallResult(callId, endpointId, true, response.status(), response.headers(), response.body(), null, null, latencyMs);
        } catch (GatewayException e) {
            long latencyMs = elapsedMillis(start);
            log.warn("Call to endpoint {} failed [{}]: {} request={}", endpointId, e.getKind(), e.getMessage(),
                    request != null ? request.redacted() : null);
            record(callId, endpointId, endpoint, request, null, null, false, e.getMessage(), latencyMs);
            return new CallResult(callId, endpointId, false, null, Map.of(), null, e.getKind(), e.getMessage(), latencyMs);
        } catch (RuntimeException e) {
            long latencyMs = elapsedMillis(start);
            log.error("Unexpected failure calling endpoint {} request={}", endpointId, request != null ? request.redacted() : null, e);
            String message = "Unexpected error: " + e.getClass().getSimpleName();
            record(callId, endpointId, endpoint, request, null, null, false, message, latencyMs);
            return new CallResult(callId, endpointId, false, null, Map.of(), null, ErrorKind.INTERNAL, message, latencyMs);
        }
    }

    private void record(String callId, String endpointId, Endpoint endpoint, WireRequest request, Object responseBody,
                        Integer status, boolean success, String error, long latencyMs) {
        CallLog entry = new CallLog();
        entry.setId(callId);
        entry.setEndpointId(endpointId);
        entry.setProtocol(endpoint != null ? endpoint.getProtocol() : null);
        entry.setRequest(request != null ? request.redacted() : null);
        entry.setResponse(responseBody);
        entry.setStatus(status);
        entry.setSuccess(success);
        entry.setError(error);
        entry.setLatencyMs(latencyMs);
        entry.setTimestamp(clock.instant());
        store.recordCall(entry);
    }

    @Override
    public CallResult callByAddress(String address, String operationKind, String documentId, CallRequest call) {
        UriComponentsBuilder components = UriComponentsBuilder.fromUriString(address);
        String path = address.contains("?") ? address.substring(0, address.indexOf('?')) : address;
        MultiValueMap<String, String> query = components.build().getQueryParams();

        Optional<Map.Entry<Endpoint, Map<String, String>>> match = store.listEndpoints(documentId).stream()
                .filter(endpoint -> operationKind == null || operationKind.equalsIgnoreCase(endpoint.getOperationKind()))
                .map(endpoint -> Map.entry(endpoint, AddressPattern.compile(endpoint.getAddressPattern())))
                .sorted(Comparator.<Map.Entry<Endpoint, AddressPattern>>comparingInt(entry -> entry.getValue().placeholderCount())
                        .thenComparingInt(entry -> -entry.getValue().literalLength()))
                .flatMap(entry -> entry.getValue().match(path).map(values -> Map.entry(entry.getKey(), values)).stream())
                .findFirst();

        if (match.isEmpty()) {
            String message = "No " + (operationKind != null ? operationKind.toUpperCase(Locale.ROOT) + " " : "")
                    + "endpoint of document " + documentId + " matches " + path;
            log.warn(message);
            return new CallResult(UUID.randomUUID().toString(), null, false, null, Map.of(), null,
                    ErrorKind.ENDPOINT_NOT_FOUND, message, 0);
        }

        Map<String, Object> params = new LinkedHashMap<>(call.params());
        query.forEach((name, values) -> params.putIfAbsent(name,
                values.size() == 1 ? decode(values.get(0)) : values.stream().map(this::decode).toList()));
        params.putAll(match.get().getValue());
        Endpoint endpoint = match.get().getKey();
        log.debug("Address {} matched endpoint {} ({})", path, endpoint.getId(), endpoint.getAddressPattern());
        return callEndpoint(endpoint.getId(), new CallRequest(params, call.headers(), call.body(), call.userId()));
    }

    private String decode(String value) {
        return value == null ? "" : UriUtils.decode(value, StandardCharsets.UTF_8);
    }

    @Override
    public AuthorizationRequest beginAuthorization(String userId, String documentId) {
        findDocument(documentId);
        return authorizationService.initiateAuthorization(userId, documentId);
    }

    @Override
    public UserAuthorization completeAuthorization(String stateId, String code, String state) {
        return authorizationService.handleCallback(stateId, code, state);
    }

    @Override
    public UserAuthorization refreshAuthorization(String userId, String documentId) {
        return authorizationService.refreshAuthorization(userId, documentId);
    }

    @Override
    public OAuth2Status authorizationStatus(String userId, String documentId) {
        return authorizationService.authorizationStatus(userId, documentId);
    }

    @Override
    public boolean revokeAuthorization(String userId, String documentId) {
        return authorizationService.revokeAuthorization(userId, documentId);
    }

    @Override
    public AuthConfig addAuthConfig(AuthConfig config) {
        if (config.getScheme() == null) {
            throw new InvalidSpecificationException("scheme", "auth config has no scheme");
        }
        if (!config.isGlobal()) {
            findDocument(config.getApiDocumentId());
        }
        if (config.getId() == null) {
            config.setId(UUID.randomUUID().toString());
        }
        return store.saveAuthConfig(config);
    }

    @Override
    public List<AuthConfig> listAuthConfigs(String documentId) {
        return store.listAuthConfigs(documentId);
    }

    @Override
    public ApiDocument getDocument(String documentId) {
        return findDocument(documentId);
    }

    @Override
    public List<ApiDocument> listDocuments() {
        return store.listDocuments();
    }

    @Override
    public List<Endpoint> listEndpoints(String documentId) {
        return store.listEndpoints(documentId);
    }

    @Override
    public Endpoint getEndpoint(String endpointId) {
        return store.findEndpoint(endpointId)
                .orElseThrow(() -> new EndpointNotFoundException("No endpoint with id " + endpointId));
    }

    @Override
    public List<CallLog> recentCalls(String endpointId, int limit) {
        return store.recentCalls(endpointId, limit);
    }

    @Override
    public List<InboundMessage> drainMessages(String subscriptionId, int max) {
        return subscriptions.drain(subscriptionId, max);
    }

    @Override
    public void cancelSubscription(String subscriptionId) {
        subscriptions.cancel(subscriptionId);
    }

    @Override
    public List<GatewaySubscriptions.SubscriptionInfo> listSubscriptions() {
        return subscriptions.list();
    }

    @Override
    public void unregisterDocument(String documentId) {
        if (!store.deleteDocument(documentId)) {
            throw new EndpointNotFoundException("No document with id " + documentId);
        }
    }

    private ApiDocument findDocument(String documentId) {
        return store.findDocument(documentId)
                .orElseThrow(() -> new EndpointNotFoundException("No document with id " + documentId));
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
