package com.gateway.spec.asyncapi;

import com.gateway.config.GatewayProperties;
import com.gateway.exception.InvalidSpecificationException;
import com.gateway.exception.UnsupportedProtocolException;
import com.gateway.model.Endpoint;
import com.gateway.protocol.ConnectionHandle;
import com.gateway.protocol.MessageEnvelope;
import com.gateway.protocol.PubSubAdapter;
import com.gateway.protocol.RequestResponseAdapter;
import com.gateway.protocol.ServerConfig;
import com.gateway.protocol.SubscriptionHandle;
import com.gateway.protocol.WireRequest;
import com.gateway.protocol.WireResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PubSubExecutorTest {

    private static final ConnectionHandle CONNECTION = new ConnectionHandle("mqtt_tcp://localhost:1883", "mqtt", "tcp://localhost:1883");

    @Mock
    private PubSubAdapter adapter;

    private GatewaySubscriptions subscriptions;
    private PubSubExecutor executor;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        subscriptions = new GatewaySubscriptions(properties);
        executor = new PubSubExecutor(subscriptions, properties);
    }

    private static Endpoint endpoint(String kind) {
        Endpoint endpoint = new Endpoint();
        endpoint.setId("ep-" + kind);
        endpoint.setProtocol("mqtt");
        endpoint.setOperationKind(kind);
        endpoint.setAddressPattern("chat/{roomId}");
        return endpoint;
    }

    private static WireRequest request() {
        WireRequest request = new WireRequest();
        request.setProtocol("mqtt");
        request.setAddress("chat/lobby");
        request.setServerAddress("tcp://localhost:1883");
        request.getHeaders().put("Content-Type", "application/json");
        request.getChannelParams().put("roomId", "lobby");
        request.setBody(Map.of("text", "hi"));
        return request;
    }

    @Test
    void publish_sendsTheBodyWithChannelParamsAsHeaders() {
        when(adapter.connect(any(ServerConfig.class))).thenReturn(CONNECTION);
        MessageEnvelope sent = MessageEnvelope.publish("chat/lobby", Map.of(), Map.of("text", "hi"));
        when(adapter.publish(eq(CONNECTION), eq("chat/lobby"), any(), anyMap())).thenReturn(sent);

        WireResponse response = executor.execute(endpoint("publish"), request(), adapter);

        assertThat(response.status()).isNull();
        assertThat(response.isSuccessful()).isTrue();
        assertThat(body(response)).containsEntry("messageId", sent.id()).containsEntry("channel", "chat/lobby");
        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(adapter).publish(eq(CONNECTION), eq("chat/lobby"), eq(Map.of("text", "hi")), headers.capture());
        assertThat(headers.getValue()).containsEntry("roomId", "lobby").containsEntry("Content-Type", "application/json");
        ArgumentCaptor<ServerConfig> server = ArgumentCaptor.forClass(ServerConfig.class);
        verify(adapter).connect(server.capture());
        assertThat(server.getValue().url()).isEqualTo("tcp://localhost:1883");
    }

    @Test
    void publish_keepsCredentialsOutOfTheMessageAndUsesThemToConnect() {
        when(adapter.connect(any(ServerConfig.class))).thenReturn(CONNECTION);
        when(adapter.publish(eq(CONNECTION), eq("chat/lobby"), any(), anyMap()))
                .thenReturn(MessageEnvelope.publish("chat/lobby", Map.of(), Map.of("text", "hi")));
        WireRequest request = request();
        request.getHeaders().put("Authorization", "Bearer SECRET-TOKEN");
        request.getHeaders().put("X-API-Key", "k-123");
        request.getSensitiveHeaders().add("X-API-Key");
        request.getHeaders().put("Cookie", "session=abc");
        request.getHeaders().put("X-Trace", "t-1");
        request.getConnectionOptions().put("username", "alice");
        request.getConnectionOptions().put("password", "s3cret");

        executor.execute(endpoint("publish"), request, adapter);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Map<String, String>> headers = ArgumentCaptor.forClass(Map.class);
        verify(adapter).publish(eq(CONNECTION), eq("chat/lobby"), any(), headers.capture());
        assertThat(headers.getValue())
                .doesNotContainKeys("Authorization", "X-API-Key", "Cookie")
                .containsEntry("X-Trace", "t-1")
                .containsEntry("roomId", "lobby");
        assertThat(headers.getValue().values()).noneMatch(value -> value.contains("SECRET-TOKEN"));
        ArgumentCaptor<ServerConfig> server = ArgumentCaptor.forClass(ServerConfig.class);
        verify(adapter).connect(server.capture());
        assertThat(server.getValue().option("username")).isEqualTo("alice");
        assertThat(server.getValue().option("password")).isEqualTo("s3cret");
    }

    @Test
    void subscribe_opensABufferedSubscription() {
        when(adapter.connect(any(ServerConfig.class))).thenReturn(CONNECTION);
        when(adapter.subscribe(eq(CONNECTION), eq("chat/lobby"), any()))
                .thenReturn(new SubscriptionHandle("sub-9", CONNECTION, "chat/lobby"));

        WireResponse response = executor.execute(endpoint("subscribe"), request(), adapter);

        assertThat(body(response)).containsEntry("subscriptionId", "sub-9");
        assertThat(subscriptions.list()).extracting(GatewaySubscriptions.SubscriptionInfo::endpointId).containsExactly("ep-subscribe");
        verify(adapter, never()).publish(any(), any(), any(), any());
    }

    @Test
    void missingServerIsAnInvalidSpecification() {
        WireRequest request = request();
        request.setServerAddress(null);

        assertThatThrownBy(() -> executor.execute(endpoint("publish"), request, adapter))
                .isInstanceOf(InvalidSpecificationException.class);
        verifyNoInteractions(adapter);
    }

    @Test
    void requestResponseAdapterIsRejected() {
        RequestResponseAdapter http = mock(RequestResponseAdapter.class);
        when(http.protocol()).thenReturn("http");

        assertThatThrownBy(() -> executor.execute(endpoint("publish"), request(), http))
                .isInstanceOf(UnsupportedProtocolException.class)
                .hasMessageContaining("http");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> body(WireResponse response) {
        return (Map<String, Object>) response.body();
    }
}
