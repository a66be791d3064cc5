package com.gateway.service.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.auth.ApiKeyAuthStrategy;
import com.gateway.auth.AuthDispatcher;
import com.gateway.auth.BasicAuthStrategy;
import com.gateway.auth.BearerAuthStrategy;
import com.gateway.auth.OAuth2AuthStrategy;
import com.gateway.auth.OAuth2AuthorizationService;
import com.gateway.auth.WebClientTokenEndpointClient;
import com.gateway.config.GatewayProperties;
import com.gateway.config.PluginConfiguration;
import com.gateway.dto.request.CallRequest;
import com.gateway.dto.response.CallResult;
import com.gateway.dto.response.RegistrationResult;
import com.gateway.exception.EndpointNotFoundException;
import com.gateway.exception.ErrorKind;
import com.gateway.exception.UnsupportedFamilyException;
import com.gateway.exception.UnsupportedProtocolException;
import com.gateway.model.AuthConfig;
import com.gateway.model.AuthScheme;
import com.gateway.model.CallLog;
import com.gateway.model.Endpoint;
import com.gateway.registry.SpecRegistry;
import com.gateway.request.RequestBuilder;
import com.gateway.resolver.DocumentFetcher;
import com.gateway.resolver.DocumentReader;
import com.gateway.resolver.RefResolver;
import com.gateway.spec.asyncapi.GatewaySubscriptions;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.jasypt.encryption.StringEncryptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

/**
 * Wires the real registry, resolver, request builder and in-memory store together and calls a
 * {@link MockWebServer} backend.
 */
class GatewayImplTest {

    private MockWebServer backend;
    private SpecRegistry registry;
    private JsonFileGatewayStore store;
    private GatewayImpl gateway;

    @BeforeEach
    void setUp() throws IOException {
        backend = new MockWebServer();
        backend.start();

        GatewayProperties properties = new GatewayProperties();
        properties.getHttp().setTimeout(Duration.ofSeconds(5));
        store = spy(new JsonFileGatewayStore(properties, mock(StringEncryptor.class)));
        store.init();
        Clock clock = Clock.systemUTC();
        WebClient webClient = WebClient.builder().build();
        GatewaySubscriptions subscriptions = new GatewaySubscriptions(properties);
        registry = new PluginConfiguration().specRegistry(webClient, new ObjectMapper(), properties, subscriptions);

        DocumentReader reader = new DocumentReader();
        DocumentFetcher fetcher = mock(DocumentFetcher.class);
        AuthDispatcher dispatcher = new AuthDispatcher(List.of(new BasicAuthStrategy(), new BearerAuthStrategy(),
                new ApiKeyAuthStrategy(), new OAuth2AuthStrategy(store, clock)), store);
        OAuth2AuthorizationService authorizationService = new OAuth2AuthorizationService(store,
                new WebClientTokenEndpointClient(webClient, properties), dispatcher, properties, clock);
        gateway = new GatewayImpl(registry, reader, fetcher, new RefResolver(fetcher, reader),
                new RequestBuilder(dispatcher, properties), store, authorizationService, subscriptions, clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        registry.destroy();
        backend.shutdown();
    }

    private static String load(String resource) throws IOException {
        try (InputStream in = GatewayImplTest.class.getClassLoader().getResourceAsStream(resource)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private RegistrationResult registerPetstore() throws IOException {
        return gateway.registerSpecification("Petstore", load("specs/petstore.json"), null, backend.url("/v1").toString());
    }

    private static String endpointId(RegistrationResult result, String operationId) {
        return result.endpoints().stream()
                .filter(endpoint -> operationId.equals(endpoint.getOperationId()))
                .map(Endpoint::getId)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void registerSpecification_detectsOpenApiAndStoresEndpoints() throws IOException {
        RegistrationResult result = registerPetstore();

        assertThat(result.specFamily()).isEqualTo("rest");
        assertThat(result.endpoints()).extracting(Endpoint::getOperationId)
                .containsExactlyInAnyOrder("listPets", "post_pets", "listMyPets", "showPetById", "deletePet", "showCategory");
        assertThat(gateway.getDocument(result.documentId()).getBaseAddress()).isEqualTo(backend.url("/v1").toString());
        assertThat(gateway.listEndpoints(result.documentId())).hasSize(6)
                .allSatisfy(endpoint -> assertThat(endpoint.getApiDocumentId()).isEqualTo(result.documentId()));
    }

    @Test
    void registerSpecification_minimalDocumentYieldsOneEndpoint() {
        String raw = "{\"openapi\":\"3.0.0\",\"info\":{\"title\":\"T\",\"version\":\"1.0.0\"},"
                + "\"paths\":{\"/users\":{\"get\":{\"operationId\":\"getUsers\"}}}}";

        RegistrationResult result = gateway.registerSpecification(null, raw, null, null);

        assertThat(result.endpoints()).singleElement().satisfies(endpoint -> {
            assertThat(endpoint.getAddressPattern()).isEqualTo("/users");
            assertThat(endpoint.getOperationKind()).isEqualTo("get");
        });
        assertThat(gateway.getDocument(result.documentId()).getName()).isEqualTo("T");
    }

    @Test
    void registerSpecification_detectsAsyncApiWithoutConnecting() throws IOException {
        RegistrationResult result = gateway.registerSpecification(null, load("specs/chat.yaml"), null, null);

        assertThat(result.specFamily()).isEqualTo("pubsub");
        assertThat(gateway.getDocument(result.documentId()).getName()).isEqualTo("Chat Service");
        assertThat(result.endpoints()).extracting(Endpoint::getProtocol).containsExactlyInAnyOrder("mqtt", "mqtt", "kafka");
    }

    @Test
    void registerSpecification_channelWithoutBindingIsRejectedAndNothingSaved() {
        String raw = """
                asyncapi: '2.6.0'
                info:
                  title: Unbound
                  version: 1.0.0
                servers:
                  broker:
                    url: localhost:1883
                    protocol: mqtt
                channels:
                  alerts:
                    subscribe:
                      message:
                        payload:
                          type: string
                """;

        assertThatThrownBy(() -> gateway.registerSpecification(null, raw, null, null))
                .isInstanceOf(UnsupportedProtocolException.class)
                .hasMessageContaining("alerts");
        verify(store, never()).saveRegistration(any(), any(), anyList());
        assertThat(gateway.listDocuments()).isEmpty();
    }

    @Test
    void registerSpecification_rejectsUnknownFamilies() {
        assertThatThrownBy(() -> gateway.registerSpecification("old", "{\"swagger\":\"2.0\",\"paths\":{}}", null, null))
                .isInstanceOf(UnsupportedFamilyException.class)
                .hasMessage("Document is neither OpenAPI 3.x nor AsyncAPI 2.x");
        assertThat(gateway.listDocuments()).isEmpty();
    }

    @Test
    void callEndpoint_substitutesPathAndUpdatesStatistics() throws Exception {
        String showPet = endpointId(registerPetstore(), "showPetById");
        backend.enqueue(new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody("{\"id\":42,\"name\":\"Rex\"}"));

        CallResult result = gateway.callEndpoint(showPet, CallRequest.of(Map.of("petId", "42")));

        assertThat(result.success()).isTrue();
        assertThat(result.status()).isEqualTo(200);
        assertThat(((JsonNode) result.body()).path("name").asText()).isEqualTo("Rex");
        RecordedRequest recorded = backend.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("GET");
        assertThat(recorded.getPath()).isEqualTo("/v1/pets/42");

        Endpoint endpoint = gateway.getEndpoint(showPet);
        assertThat(endpoint.getCallCount()).isEqualTo(1);
        assertThat(endpoint.getSuccessCount()).isEqualTo(1);
        assertThat(gateway.recentCalls(showPet, 10)).singleElement()
                .satisfies(entry -> assertThat(entry.getStatus()).isEqualTo(200));
    }

    @Test
    void callEndpoint_backendErrorStatusIsAResultNotAFailure() throws IOException {
        String deletePet = endpointId(registerPetstore(), "deletePet");
        backend.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));

        CallResult result = gateway.callEndpoint(deletePet, CallRequest.of(Map.of("petId", 1)));

        assertThat(result.success()).isTrue();
        assertThat(result.status()).isEqualTo(500);
        assertThat(result.body()).isEqualTo("boom");
        assertThat(gateway.getEndpoint(deletePet).getErrorCount()).isEqualTo(1);
    }

    @Test
    void callEndpoint_missingParameterIsAStructuredFailure() throws IOException {
        String showPet = endpointId(registerPetstore(), "showPetById");

        CallResult result = gateway.callEndpoint(showPet, CallRequest.of(Map.of()));

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.MISSING_REQUIRED_PARAMETER);
        assertThat(result.error()).contains("petId");
        assertThat(backend.getRequestCount()).isZero();
        assertThat(gateway.recentCalls(showPet, 10)).singleElement()
                .satisfies(entry -> assertThat(entry.isSuccess()).isFalse());
        assertThat(gateway.getEndpoint(showPet).getErrorCount()).isEqualTo(1);
    }

    @Test
    void callEndpoint_typeMismatchIsAStructuredFailure() throws IOException {
        String showPet = endpointId(registerPetstore(), "showPetById");

        CallResult result = gateway.callEndpoint(showPet, CallRequest.of(Map.of("petId", "rex")));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.TYPE_MISMATCH);
    }

    @Test
    void callEndpoint_unknownEndpoint() {
        CallResult result = gateway.callEndpoint("missing", CallRequest.of(Map.of()));

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.ENDPOINT_NOT_FOUND);
    }

    @Test
    void callEndpoint_pubSubChannelParameterIsCheckedBeforeConnecting() throws IOException {
        RegistrationResult chat = gateway.registerSpecification(null, load("specs/chat.yaml"), null, null);

        CallResult result = gateway.callEndpoint(endpointId(chat, "sendMessage"),
                new CallRequest(Map.of(), Map.of(), Map.of("text", "hi"), null));

        assertThat(result.errorKind()).isEqualTo(ErrorKind.MISSING_REQUIRED_PARAMETER);
        assertThat(result.error()).contains("roomId");
    }

    @Test
    void callByAddress_prefersTheMostLiteralPattern() throws Exception {
        RegistrationResult petstore = registerPetstore();
        backend.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("[]"));
        backend.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{\"id\":7}"));

        CallResult mine = gateway.callByAddress("/pets/mine", "get", petstore.documentId(), CallRequest.of(Map.of()));
        CallResult seven = gateway.callByAddress("/pets/7?verbose=true", "GET", petstore.documentId(), CallRequest.of(Map.of()));

        assertThat(mine.endpointId()).isEqualTo(endpointId(petstore, "listMyPets"));
        assertThat(seven.endpointId()).isEqualTo(endpointId(petstore, "showPetById"));
        assertThat(backend.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/v1/pets/mine");
        assertThat(backend.takeRequest(1, TimeUnit.SECONDS).getPath()).isEqualTo("/v1/pets/7?verbose=true");
    }

    @Test
    void callByAddress_noMatchingEndpoint() throws IOException {
        RegistrationResult petstore = registerPetstore();

        CallResult result = gateway.callByAddress("/owners/1", "get", petstore.documentId(), CallRequest.of(Map.of()));

        assertThat(result.success()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ErrorKind.ENDPOINT_NOT_FOUND);
        assertThat(result.error()).contains("/owners/1");
    }

    @Test
    void bearerConfigIsSentButNeverLogged() throws Exception {
        RegistrationResult petstore = registerPetstore();
        AuthConfig config = new AuthConfig();
        config.setApiDocumentId(petstore.documentId());
        config.setScheme(AuthScheme.BEARER);
        config.getConfig().put("token", "top-secret-token");
        gateway.addAuthConfig(config);
        backend.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("[]"));

        String listPets = endpointId(petstore, "listPets");
        gateway.callEndpoint(listPets, CallRequest.of(Map.of("limit", 5)));

        RecordedRequest recorded = backend.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getHeader("Authorization")).isEqualTo("Bearer top-secret-token");
        assertThat(recorded.getPath()).isEqualTo("/v1/pets?limit=5");
        List<CallLog> calls = gateway.recentCalls(listPets, 1);
        assertThat(calls.get(0).getRequest().toString()).doesNotContain("top-secret-token");
    }

    @Test
    void addAuthConfig_requiresAnExistingDocument() {
        AuthConfig config = new AuthConfig();
        config.setApiDocumentId("nope");
        config.setScheme(AuthScheme.BEARER);

        assertThatThrownBy(() -> gateway.addAuthConfig(config)).isInstanceOf(EndpointNotFoundException.class);
    }

    @Test
    void unregisterDocument_removesItsEndpoints() throws IOException {
        RegistrationResult petstore = registerPetstore();

        gateway.unregisterDocument(petstore.documentId());

        assertThat(gateway.listDocuments()).isEmpty();
        assertThat(gateway.listEndpoints(null)).isEmpty();
        assertThatThrownBy(() -> gateway.unregisterDocument(petstore.documentId())).isInstanceOf(EndpointNotFoundException.class);
    }
}
