package com.gateway.protocol.amqp;

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
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessageBuilder;
import org.springframework.amqp.core.MessageListener;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitAdmin;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.rabbit.listener.SimpleMessageListenerContainer;

/**
 * Pub/sub over AMQP 0-9-1 (RabbitMQ) with Spring AMQP.
 * <p>
 * Messages are published to the default exchange with the channel as routing key, so they
 * land in the queue named after the channel. Subscribing declares that durable queue and
 * attaches a listener container to it.
 */
@Slf4j
public class AmqpProtocolAdapter implements PubSubAdapter {

    private final MessageCodec codec;
    private final MessageDispatcher dispatcher;
    private final PubSubConnections<Broker, SimpleMessageListenerContainer> connections = new PubSubConnections<>("amqp");

    public AmqpProtocolAdapter(MessageCodec codec, MessageDispatcher dispatcher) {
        this.codec = codec;
        this.dispatcher = dispatcher;
    }

    @Override
    public String protocol() {
        return "amqp";
    }

    @Override
    public ConnectionHandle connect(ServerConfig server) {
        return connections.open(server, this::openBroker);
    }

    private Broker openBroker(ServerConfig server) {
        String url = server.url().contains("://") ? server.url() : "amqp://" + server.url();
        CachingConnectionFactory connectionFactory = new CachingConnectionFactory(URI.create(url));
        connectionFactory.setConnectionTimeout((int) server.connectTimeout().toMillis());
        if (server.option("username") != null) {
            connectionFactory.setUsername(server.option("username"));
        }
        if (server.option("password") != null) {
            connectionFactory.setPassword(server.option("password"));
        }
        try {
            // opens and caches the shared connection, failing fast when the broker is unreachable
            connectionFactory.createConnection();
        } catch (AmqpException e) {
            connectionFactory.destroy();
            throw translate(url, e);
        }
        log.info("Connected to AMQP broker {}", connectionFactory.getHost() + ":" + connectionFactory.getPort());
        return new Broker(connectionFactory, new RabbitTemplate(connectionFactory), new RabbitAdmin(connectionFactory));
    }

    @Override
    public MessageEnvelope publish(ConnectionHandle connection, String channel, Object payload, Map<String, String> headers) {
        MessageEnvelope envelope = MessageEnvelope.publish(channel, headers, payload);
        Message message = MessageBuilder.withBody(codec.encode(envelope))
                .setContentType(MessageProperties.CONTENT_TYPE_JSON)
                .setMessageId(envelope.id())
                .build();
        try {
            connections.client(connection).template().send("", channel, message);
        } catch (AmqpException e) {
            throw translate(connection.serverAddress(), e);
        }
        log.debug("Published message {} to AMQP queue '{}'", envelope.id(), channel);
        return envelope;
    }

    @Override
    public SubscriptionHandle subscribe(ConnectionHandle connection, String channel, MessageHandler handler) {
        Broker broker = connections.client(connection);
        SubscriptionHandle subscription = new SubscriptionHandle(UUID.randomUUID().toString(), connection, channel);
        try {
            broker.admin().declareQueue(new Queue(channel, true));
            SimpleMessageListenerContainer container = new SimpleMessageListenerContainer(broker.connectionFactory());
            container.setQueueNames(channel);
            container.setMessageListener((MessageListener) message ->
                    dispatcher.dispatch(handler, codec.decode(channel, message.getBody(), headersOf(message))));
            container.start();
            connections.addSubscription(subscription, container);
        } catch (AmqpException e) {
            throw translate(connection.serverAddress(), e);
        }
        log.info("Subscribed to AMQP queue '{}' on {}", channel, connection.serverAddress());
        return subscription;
    }

    @Override
    public void unsubscribe(SubscriptionHandle subscription) {
        SimpleMessageListenerContainer container = connections.removeSubscription(subscription);
        if (container != null) {
            container.stop();
        }
    }

    @Override
    public void disconnect(ConnectionHandle connection) {
        PubSubConnections.Connection<Broker, SimpleMessageListenerContainer> removed = connections.remove(connection);
        if (removed != null) {
            teardown(removed);
        }
    }

    @Override
    public void close() {
        connections.removeAll().forEach(this::teardown);
        dispatcher.close();
    }

    private void teardown(PubSubConnections.Connection<Broker, SimpleMessageListenerContainer> connection) {
        connection.subscriptions().values().forEach(SimpleMessageListenerContainer::stop);
        connection.client().connectionFactory().destroy();
        log.info("Disconnected from AMQP broker {}", connection.handle().serverAddress());
    }

    private static Map<String, String> headersOf(Message message) {
        Map<String, String> headers = new LinkedHashMap<>();
        message.getMessageProperties().getHeaders().forEach((name, value) -> headers.put(name, String.valueOf(value)));
        return headers;
    }

    private static GatewayException translate(String target, AmqpException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) {
                return new TransportTimeoutException("AMQP operation on " + target + " timed out", e);
            }
            if (t instanceof UnknownHostException) {
                return new TransportConnectionException(TransportConnectionException.Reason.UNKNOWN_HOST,
                        "Unknown AMQP host " + target, e);
            }
            if (t instanceof ConnectException) {
                return new TransportConnectionException(TransportConnectionException.Reason.CONNECTION_REFUSED,
                        "AMQP broker " + target + " refused the connection", e);
            }
        }
        return new TransportConnectionException(TransportConnectionException.Reason.IO,
                "AMQP failure on " + target + ": " + e.getMessage(), e);
    }

    private record Broker(CachingConnectionFactory connectionFactory, RabbitTemplate template, RabbitAdmin admin) {
    }
}
