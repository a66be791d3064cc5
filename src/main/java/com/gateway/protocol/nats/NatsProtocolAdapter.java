package com.gateway.protocol.nats;

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
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;

/**
 * Pub/sub over NATS core with the jnats client. Channel names become subjects with {@code /}
 * replaced by {@code .}; each subscription owns a jnats {@link Dispatcher}.
 */
@Slf4j
public class NatsProtocolAdapter implements PubSubAdapter {

    private final MessageCodec codec;
    private final MessageDispatcher dispatcher;
    private final Duration publishTimeout;
    private final PubSubConnections<Connection, Dispatcher> connections =
            new PubSubConnections<>("nats", nats -> nats.getStatus() == Connection.Status.CONNECTED, this::teardown);

    public NatsProtocolAdapter(MessageCodec codec, MessageDispatcher dispatcher, Duration publishTimeout) {
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.publishTimeout = publishTimeout;
    }

    @Override
    public String protocol() {
        return "nats";
    }

    public static String subjectName(String channel) {
        return channel.replace('/', '.');
    }

    @Override
    public ConnectionHandle connect(ServerConfig server) {
        return connections.open(server, this::openConnection);
    }

    private Connection openConnection(ServerConfig server) {
        String url = server.url().contains("://") ? server.url() : "nats://" + server.url();
        Options.Builder options = new Options.Builder()
                .server(url)
                .connectionTimeout(server.connectTimeout())
                .maxReconnects(0);
        if (server.option("username") != null && server.option("password") != null) {
            options.userInfo(server.option("username"), server.option("password"));
        } else if (server.option("token") != null) {
            options.token(server.option("token").toCharArray());
        }
        try {
            Connection connection = Nats.connect(options.build());
            log.info("Connected to NATS server {}", url);
            return connection;
        } catch (IOException e) {
            throw new TransportConnectionException(TransportConnectionException.Reason.CONNECTION_REFUSED,
                    "Could not connect to NATS server " + url + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportConnectionException(TransportConnectionException.Reason.IO, "Interrupted while connecting to " + url, e);
        }
    }

    @Override
    public MessageEnvelope publish(ConnectionHandle connection, String channel, Object payload, Map<String, String> headers) {
        MessageEnvelope envelope = MessageEnvelope.publish(channel, headers, payload);
        Connection nats = connections.client(connection);
        String subject = subjectName(channel);
        try {
            nats.publish(subject, codec.encode(envelope));
            nats.flush(publishTimeout);
        } catch (TimeoutException e) {
            throw new TransportTimeoutException("Flushing NATS subject " + subject + " timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportConnectionException(TransportConnectionException.Reason.IO, "Interrupted while publishing to " + subject, e);
        } catch (IllegalStateException e) {
            connections.evict(connection);
            throw new TransportConnectionException(TransportConnectionException.Reason.IO,
                    "NATS connection to " + connection.serverAddress() + " is closed", e);
        }
        log.debug("Published message {} to NATS subject '{}'", envelope.id(), subject);
        return envelope;
    }

    @Override
    public SubscriptionHandle subscribe(ConnectionHandle connection, String channel, MessageHandler handler) {
        Connection nats = connections.client(connection);
        SubscriptionHandle subscription = new SubscriptionHandle(UUID.randomUUID().toString(), connection, channel);
        String subject = subjectName(channel);
        Dispatcher natsDispatcher = nats.createDispatcher(message ->
                dispatcher.dispatch(handler, codec.decode(channel, message.getData(), Map.of())));
        natsDispatcher.subscribe(subject);
        connections.addSubscription(subscription, natsDispatcher);
        log.info("Subscribed to NATS subject '{}' on {}", subject, connection.serverAddress());
        return subscription;
    }

    @Override
    public void unsubscribe(SubscriptionHandle subscription) {
        Dispatcher natsDispatcher = connections.removeSubscription(subscription);
        if (natsDispatcher != null) {
            connections.client(subscription.connection()).closeDispatcher(natsDispatcher);
        }
    }

    @Override
    public void disconnect(ConnectionHandle connection) {
        PubSubConnections.Connection<Connection, Dispatcher> removed = connections.remove(connection);
        if (removed != null) {
            teardown(removed);
        }
    }

    @Override
    public void close() {
        connections.removeAll().forEach(this::teardown);
        dispatcher.close();
    }

    private void teardown(PubSubConnections.Connection<Connection, Dispatcher> connection) {
        Connection nats = connection.client();
        if (nats.getStatus() != Connection.Status.CLOSED) {
            connection.subscriptions().values().forEach(nats::closeDispatcher);
        }
        try {
            nats.close();
            log.info("Disconnected from NATS server {}", connection.handle().serverAddress());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing NATS connection to {}", connection.handle().serverAddress());
        }
    }
}
