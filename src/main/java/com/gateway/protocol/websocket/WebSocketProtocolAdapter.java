package com.gateway.protocol.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.gateway.exception.TransportConnectionException;
import com.gateway.protocol.ConnectionHandle;
import com.gateway.protocol.InboundMessage;
import com.gateway.protocol.MessageCodec;
import com.gateway.protocol.MessageDispatcher;
import com.gateway.protocol.MessageEnvelope;
import com.gateway.protocol.MessageHandler;
import com.gateway.protocol.PubSubAdapter;
import com.gateway.protocol.PubSubConnections;
import com.gateway.protocol.ServerConfig;
import com.gateway.protocol.SubscriptionHandle;
import com.gateway.protocol.TransportErrors;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.WebSocketClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Pub/sub over a single WebSocket per server.
 * <p>
 * Channels are multiplexed on the socket: published envelopes carry their channel, and
 * subscriptions are announced to the server with {@code {"type":"subscribe","channel":..,
 * "subscription_id":..}} control messages ({@code unsubscribe} on teardown). Control messages
 * echoed back by the server are ignored.
 */
@Slf4j
public class WebSocketProtocolAdapter implements PubSubAdapter {

    private final WebSocketClient client;
    private final MessageCodec codec;
    private final MessageDispatcher dispatcher;
    private final PubSubConnections<Session, Listener> connections =
            new PubSubConnections<>("websocket", Session::isOpen, this::teardown);

    public WebSocketProtocolAdapter(WebSocketClient client, MessageCodec codec, MessageDispatcher dispatcher) {
        this.client = client;
        this.codec = codec;
        this.dispatcher = dispatcher;
    }

    @Override
    public String protocol() {
        return "websocket";
    }

    @Override
    public ConnectionHandle connect(ServerConfig server) {
        return connections.open(server, this::openSession);
    }

    private Session openSession(ServerConfig server) {
        Session session = new Session(server.url());
        Sinks.Empty<Void> ready = Sinks.empty();
        Mono<Void> run = client.execute(URI.create(server.url()), ws -> {
            ready.tryEmitEmpty();
            Mono<Void> outbound = ws.send(session.outbound.asFlux().map(ws::textMessage));
            Mono<Void> inbound = ws.receive()
                    .map(WebSocketMessage::getPayloadAsText)
                    .doOnNext(session::onText)
                    .doFinally(signal -> session.closed = true)
                    .then();
            return Mono.zip(outbound, inbound).then();
        });
        session.disposable = run.subscribe(
                unused -> { },
                error -> {
                    session.closed = true;
                    ready.tryEmitError(error);
                    log.warn("WebSocket session to {} terminated with error: {}", server.url(), error.getMessage());
                },
                () -> {
                    session.closed = true;
                    log.info("WebSocket session to {} closed", server.url());
                });
        try {
            ready.asMono().timeout(server.connectTimeout()).block();
        } catch (RuntimeException e) {
            session.disposable.dispose();
            throw TransportErrors.translate(server.url(), e);
        }
        log.info("Connected WebSocket to {}", server.url());
        return session;
    }

    @Override
    public MessageEnvelope publish(ConnectionHandle connection, String channel, Object payload, Map<String, String> headers) {
        MessageEnvelope envelope = MessageEnvelope.publish(channel, headers, payload);
        Session session = connections.client(connection);
        if (!session.isOpen()) {
            connections.evict(connection);
            throw new TransportConnectionException(TransportConnectionException.Reason.IO,
                    "WebSocket to " + connection.serverAddress() + " was closed");
        }
        try {
            session.send(codec.encodeText(envelope));
        } catch (TransportConnectionException e) {
            connections.evict(connection);
            throw e;
        }
        log.debug("Published message {} to WebSocket channel '{}'", envelope.id(), channel);
        return envelope;
    }

    @Override
    public SubscriptionHandle subscribe(ConnectionHandle connection, String channel, MessageHandler handler) {
        Session session = connections.client(connection);
        SubscriptionHandle subscription = new SubscriptionHandle(UUID.randomUUID().toString(), connection, channel);
        Listener listener = new Listener(channel, handler);
        session.listeners.put(subscription.id(), listener);
        connections.addSubscription(subscription, listener);
        session.send(codec.encodeText(control("subscribe", channel, subscription.id())));
        log.info("Subscribed to WebSocket channel '{}' on {}", channel, connection.serverAddress());
        return subscription;
    }

    @Override
    public void unsubscribe(SubscriptionHandle subscription) {
        if (connections.removeSubscription(subscription) == null) {
            return;
        }
        Session session = connections.client(subscription.connection());
        session.listeners.remove(subscription.id());
        session.send(codec.encodeText(control("unsubscribe", subscription.channel(), subscription.id())));
    }

    @Override
    public void disconnect(ConnectionHandle connection) {
        PubSubConnections.Connection<Session, Listener> removed = connections.remove(connection);
        if (removed != null) {
            teardown(removed);
        }
    }

    @Override
    public void close() {
        connections.removeAll().forEach(this::teardown);
        dispatcher.close();
    }

    private void teardown(PubSubConnections.Connection<Session, Listener> connection) {
        Session session = connection.client();
        connection.subscriptions().forEach((id, listener) -> {
            session.listeners.remove(id);
            session.trySend(codec.encodeText(control("unsubscribe", listener.channel(), id)));
        });
        session.outbound.tryEmitComplete();
        if (session.disposable != null) {
            session.disposable.dispose();
        }
        log.info("Disconnected WebSocket from {}", connection.handle().serverAddress());
    }

    private static Map<String, Object> control(String type, String channel, String subscriptionId) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", type);
        message.put("channel", channel);
        message.put("subscription_id", subscriptionId);
        return message;
    }

    private record Listener(String channel, MessageHandler handler) {
    }

    private final class Session {

        private final String url;
        private final Sinks.Many<String> outbound = Sinks.many().unicast().onBackpressureBuffer();
        private final Map<String, Listener> listeners = new ConcurrentHashMap<>();
        private volatile Disposable disposable;
        private volatile boolean closed;

        private Session(String url) {
            this.url = url;
        }

        private boolean isOpen() {
            return !closed;
        }

        private synchronized void send(String text) {
            Sinks.EmitResult result = outbound.tryEmitNext(text);
            if (result.isFailure()) {
                throw new TransportConnectionException(TransportConnectionException.Reason.IO,
                        "WebSocket to " + url + " is not accepting messages (" + result + ")");
            }
        }

        private synchronized void trySend(String text) {
            outbound.tryEmitNext(text);
        }

        private void onText(String text) {
            InboundMessage message = codec.decode(null, text, Map.of());
            if (message.payload() instanceof JsonNode node && isControl(node)) {
                return;
            }
            listeners.values().stream()
                    .filter(listener -> message.channel() == null || listener.channel().equals(message.channel()))
                    .forEach(listener -> dispatcher.dispatch(listener.handler(), message));
        }

        private boolean isControl(JsonNode node) {
            String type = node.path("type").asText("");
            return node.has("subscription_id") && ("subscribe".equals(type) || "unsubscribe".equals(type));
        }
    }
}
