package com.gateway.protocol.mqtt;

import com.gateway.exception.GatewayException;
import com.gateway.exception.TransportConnectionException;
import com.gateway.exception.TransportTimeoutException;
import com.gateway.protocol.ConnectionHandle;
import com.gateway.protocol.MessageCodec;
import com.gateway.protocol.MessageDispatcher;
import com.gateway.protocol.MessageEnvelope;
import com.gateway.protocol.MessageHandler;
import com.gateway.protocol.PubSubAdapter;
import com.gateway.protocol.PubSubConnections;
import com.gateway.protocol.ServerConfig;
import com.gateway.protocol.SubscriptionHandle;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;

/**
 * Pub/sub over MQTT with the Eclipse Paho client. Channels map one to one onto topics.
 * <p>
 * Paho keeps a single listener per topic filter, so the adapter subscribes at the broker once
 * per topic and fans messages out to every local subscription of that topic.
 */
@Slf4j
public class MqttProtocolAdapter implements PubSubAdapter {

    private static final int QOS = 1;

    private final MessageCodec codec;
    private final MessageDispatcher dispatcher;
    private final PubSubConnections<Broker, Listener> connections =
            new PubSubConnections<>("mqtt", broker -> broker.client().isConnected(), this::teardown);

    public MqttProtocolAdapter(MessageCodec codec, MessageDispatcher dispatcher) {
        this.codec = codec;
        this.dispatcher = dispatcher;
    }

    @Override
    public String protocol() {
        return "mqtt";
    }

    @Override
    public ConnectionHandle connect(ServerConfig server) {
        return connections.open(server, this::openClient);
    }

    private Broker openClient(ServerConfig server) {
        String uri = toBrokerUri(server.url());
        String clientId = server.option("clientId") != null ? server.option("clientId") : "gateway-" + UUID.randomUUID();
        try {
            MqttClient client = new MqttClient(uri, clientId, new MemoryPersistence());
            MqttConnectOptions options = new MqttConnectOptions();
            options.setCleanSession(true);
            options.setAutomaticReconnect(false);
            options.setConnectionTimeout((int) Math.max(1, server.connectTimeout().toSeconds()));
            if (server.option("username") != null) {
                options.setUserName(server.option("username"));
            }
            if (server.option("password") != null) {
                options.setPassword(server.option("password").toCharArray());
            }
            client.connect(options);
            log.info("Connected to MQTT broker {} as {}", uri, clientId);
            return new Broker(client);
        } catch (MqttException e) {
            throw translate(uri, e);
        }
    }

    @Override
    public MessageEnvelope publish(ConnectionHandle connection, String channel, Object payload, Map<String, String> headers) {
        MessageEnvelope envelope = MessageEnvelope.publish(channel, headers, payload);
        try {
            connections.client(connection).client().publish(channel, codec.encode(envelope), QOS, false);
        } catch (MqttException e) {
            connections.evict(connection);
            throw translate(connection.serverAddress(), e);
        }
        log.debug("Published message {} to MQTT topic '{}'", envelope.id(), channel);
        return envelope;
    }

    @Override
    public SubscriptionHandle subscribe(ConnectionHandle connection, String channel, MessageHandler handler) {
        Broker broker = connections.client(connection);
        SubscriptionHandle subscription = new SubscriptionHandle(UUID.randomUUID().toString(), connection, channel);
        synchronized (broker) {
            List<MessageHandler> handlers = broker.handlers.computeIfAbsent(channel, topic -> new CopyOnWriteArrayList<>());
            if (handlers.isEmpty()) {
                try {
                    broker.client().subscribe(channel, QOS, (topic, message) -> {
                        var inbound = codec.decode(topic, message.getPayload(), Map.of());
                        broker.handlers.getOrDefault(channel, List.of()).forEach(h -> dispatcher.dispatch(h, inbound));
                    });
                } catch (MqttException e) {
                    broker.handlers.remove(channel);
                    throw translate(connection.serverAddress(), e);
                }
            }
            handlers.add(handler);
        }
        connections.addSubscription(subscription, new Listener(channel, handler));
        log.info("Subscribed to MQTT topic '{}' on {}", channel, connection.serverAddress());
        return subscription;
    }

    @Override
    public void unsubscribe(SubscriptionHandle subscription) {
        Listener listener = connections.removeSubscription(subscription);
        if (listener == null) {
            return;
        }
        release(connections.client(subscription.connection()), listener);
    }

    private void release(Broker broker, Listener listener) {
        String channel = listener.channel();
        synchronized (broker) {
            List<MessageHandler> handlers = broker.handlers.get(channel);
            if (handlers == null) {
                return;
            }
            handlers.remove(listener.handler());
            if (handlers.isEmpty()) {
                broker.handlers.remove(channel);
                try {
                    broker.client().unsubscribe(channel);
                } catch (MqttException e) {
                    log.warn("Could not unsubscribe from MQTT topic '{}': {}", channel, e.getMessage());
                }
            }
        }
    }

    @Override
    public void disconnect(ConnectionHandle connection) {
        PubSubConnections.Connection<Broker, Listener> removed = connections.remove(connection);
        if (removed != null) {
            teardown(removed);
        }
    }

    @Override
    public void close() {
        connections.removeAll().forEach(this::teardown);
        dispatcher.close();
    }

    private void teardown(PubSubConnections.Connection<Broker, Listener> connection) {
        Broker broker = connection.client();
        connection.subscriptions().values().forEach(listener -> release(broker, listener));
        try {
            if (broker.client().isConnected()) {
                broker.client().disconnect();
            }
            broker.client().close();
            log.info("Disconnected from MQTT broker {}", connection.handle().serverAddress());
        } catch (MqttException e) {
            log.warn("Error while disconnecting from MQTT broker {}: {}", connection.handle().serverAddress(), e.getMessage());
        }
    }

    /**
     * Paho only understands {@code tcp://}, {@code ssl://} and {@code ws(s)://} URIs.
     */
    static String toBrokerUri(String url) {
        if (url.startsWith("mqtt://")) {
            return "tcp://" + url.substring("mqtt://".length());
        }
        if (url.startsWith("mqtts://")) {
            return "ssl://" + url.substring("mqtts://".length());
        }
        if (!url.contains("://")) {
            return "tcp://" + url;
        }
        return url;
    }

    private static GatewayException translate(String target, MqttException e) {
        if (e.getReasonCode() == MqttException.REASON_CODE_CLIENT_TIMEOUT) {
            return new TransportTimeoutException("MQTT operation on " + target + " timed out", e);
        }
        TransportConnectionException.Reason reason = e.getReasonCode() == MqttException.REASON_CODE_SERVER_CONNECT_ERROR
                ? TransportConnectionException.Reason.CONNECTION_REFUSED
                : TransportConnectionException.Reason.IO;
        return new TransportConnectionException(reason, "MQTT failure on " + target + ": " + e.getMessage(), e);
    }

    private record Listener(String channel, MessageHandler handler) {
    }

    private record Broker(MqttClient client, Map<String, List<MessageHandler>> handlers) {

        private Broker(MqttClient client) {
            this(client, new ConcurrentHashMap<>());
        }
    }
}
