package com.gateway.spec.asyncapi;

import com.gateway.config.GatewayProperties;
import com.gateway.exception.EndpointNotFoundException;
import com.gateway.protocol.ConnectionHandle;
import com.gateway.protocol.InboundMessage;
import com.gateway.protocol.MessageHandler;
import com.gateway.protocol.PubSubAdapter;
import com.gateway.protocol.SubscriptionHandle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GatewaySubscriptionsTest {

    private static final ConnectionHandle CONNECTION = new ConnectionHandle("mqtt_tcp://broker:1883", "mqtt", "tcp://broker:1883");

    @Mock
    private PubSubAdapter adapter;

    private GatewaySubscriptions subscriptions;

    @BeforeEach
    void setUp() {
        GatewayProperties properties = new GatewayProperties();
        properties.getPubsub().setInboxCapacity(3);
        subscriptions = new GatewaySubscriptions(properties);
    }

    private MessageHandler open(String subscriptionId, String channel) {
        when(adapter.subscribe(eq(CONNECTION), eq(channel), any()))
                .thenReturn(new SubscriptionHandle(subscriptionId, CONNECTION, channel));
        GatewaySubscriptions.SubscriptionInfo info = subscriptions.open(adapter, CONNECTION, "receiveMessages", channel);
        assertThat(info.id()).isEqualTo(subscriptionId);

        ArgumentCaptor<MessageHandler> handler = ArgumentCaptor.forClass(MessageHandler.class);
        verify(adapter).subscribe(eq(CONNECTION), eq(channel), handler.capture());
        return handler.getValue();
    }

    private static InboundMessage message(String id) {
        return new InboundMessage("chat/lobby", id, Map.of(), id, Instant.now());
    }

    @Test
    void open_describesTheSubscription() {
        open("sub-1", "chat/lobby");

        assertThat(subscriptions.list()).containsExactly(
                new GatewaySubscriptions.SubscriptionInfo("sub-1", "receiveMessages", "mqtt", "chat/lobby"));
    }

    @Test
    void drain_returnsOldestFirstUpToMax() {
        MessageHandler handler = open("sub-1", "chat/lobby");
        handler.onMessage(message("m1"));
        handler.onMessage(message("m2"));
        handler.onMessage(message("m3"));

        assertThat(subscriptions.drain("sub-1", 2)).extracting(InboundMessage::messageId).containsExactly("m1", "m2");
        assertThat(subscriptions.drain("sub-1", 10)).extracting(InboundMessage::messageId).containsExactly("m3");
        assertThat(subscriptions.drain("sub-1", 10)).isEmpty();
    }

    @Test
    void fullInbox_dropsTheOldestMessage() {
        MessageHandler handler = open("sub-1", "chat/lobby");
        for (String id : List.of("m1", "m2", "m3", "m4", "m5")) {
            handler.onMessage(message(id));
        }

        assertThat(subscriptions.drain("sub-1", 10)).extracting(InboundMessage::messageId).containsExactly("m3", "m4", "m5");
    }

    @Test
    void cancel_unsubscribesAndForgets() {
        open("sub-1", "chat/lobby");

        subscriptions.cancel("sub-1");

        verify(adapter).unsubscribe(new SubscriptionHandle("sub-1", CONNECTION, "chat/lobby"));
        assertThat(subscriptions.list()).isEmpty();
        assertThatThrownBy(() -> subscriptions.drain("sub-1", 1)).isInstanceOf(EndpointNotFoundException.class);
    }

    @Test
    void unknownSubscription_isNotFound() {
        assertThatThrownBy(() -> subscriptions.cancel("nope"))
                .isInstanceOf(EndpointNotFoundException.class)
                .hasMessageContaining("nope");
        assertThatThrownBy(() -> subscriptions.drain("nope", 1)).isInstanceOf(EndpointNotFoundException.class);
    }

    @Test
    void destroy_cancelsEverySubscriptionEvenWhenOneFails() {
        open("sub-1", "chat/lobby");
        open("sub-2", "chat/other");
        doThrow(new IllegalStateException("gone")).when(adapter).unsubscribe(new SubscriptionHandle("sub-1", CONNECTION, "chat/lobby"));

        subscriptions.destroy();

        verify(adapter, times(2)).unsubscribe(any());
        assertThat(subscriptions.list()).isEmpty();
    }
}
