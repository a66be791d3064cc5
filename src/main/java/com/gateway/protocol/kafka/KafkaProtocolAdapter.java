package com.gateway.protocol.kafka;

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
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.KafkaMessageListenerContainer;
import org.springframework.kafka.listener.MessageListener;

/**
 * Pub/sub over Apache Kafka with Spring for Apache Kafka.
 * <p>
 * Channel names become topic names with {@code /} replaced by {@code .}. Every subscription
 * gets its own consumer group ({@code gateway-<subscriptionId>}) so each one sees every
 * message published after it started.
 */
@Slf4j
public class KafkaProtocolAdapter implements PubSubAdapter {

    private final MessageCodec codec;
    private final MessageDispatcher dispatcher;
    private final Duration publishTimeout;
    private final PubSubConnections<Cluster, KafkaMessageListenerContainer<String, byte[]>> connections =
            new PubSubConnections<>("kafka");

    public KafkaProtocolAdapter(MessageCodec codec, MessageDispatcher dispatcher, Duration publishTimeout) {
        this.codec = codec;
        this.dispatcher = dispatcher;
        this.publishTimeout = publishTimeout;
    }

    @Override
    public String protocol() {
        return "kafka";
    }

    public static String topicName(String channel) {
        return channel.replace('/', '.');
    }

    @Override
    public ConnectionHandle connect(ServerConfig server) {
        return connections.open(server, this::openCluster);
    }

    private Cluster openCluster(ServerConfig server) {
        String bootstrap = bootstrapServers(server.url());
        Map<String, Object> adminProps = new HashMap<>();
        adminProps.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        adminProps.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) server.connectTimeout().toMillis());
        try (AdminClient admin = AdminClient.create(adminProps)) {
            admin.describeCluster().nodes().get(server.connectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TransportTimeoutException("Kafka cluster " + bootstrap + " did not answer within "
                    + server.connectTimeout().toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw translate(bootstrap, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportConnectionException(TransportConnectionException.Reason.IO, "Interrupted while connecting to " + bootstrap, e);
        }

        Map<String, Object> producerProps = new HashMap<>();
        producerProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrap);
        producerProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        producerProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class);
        producerProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, publishTimeout.toMillis());
        DefaultKafkaProducerFactory<String, byte[]> producerFactory = new DefaultKafkaProducerFactory<>(producerProps);
        log.info("Connected to Kafka cluster {}", bootstrap);
        return new Cluster(bootstrap, producerFactory, new KafkaTemplate<>(producerFactory));
    }

    @Override
    public MessageEnvelope publish(ConnectionHandle connection, String channel, Object payload, Map<String, String> headers) {
        MessageEnvelope envelope = MessageEnvelope.publish(channel, headers, payload);
        Cluster cluster = connections.client(connection);
        String topic = topicName(channel);
        try {
            cluster.template().send(topic, envelope.id(), codec.encode(envelope))
                    .get(publishTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TransportTimeoutException("Publishing to Kafka topic " + topic + " timed out", e);
        } catch (ExecutionException e) {
            throw translate(cluster.bootstrap(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportConnectionException(TransportConnectionException.Reason.IO, "Interrupted while publishing to " + topic, e);
        } catch (org.apache.kafka.common.KafkaException e) {
            throw translate(cluster.bootstrap(), e);
        }
        log.debug("Published message {} to Kafka topic '{}'", envelope.id(), topic);
        return envelope;
    }

    @Override
    public SubscriptionHandle subscribe(ConnectionHandle connection, String channel, MessageHandler handler) {
        Cluster cluster = connections.client(connection);
        SubscriptionHandle subscription = new SubscriptionHandle(UUID.randomUUID().toString(), connection, channel);
        String topic = topicName(channel);

        Map<String, Object> consumerProps = new HashMap<>();
        consumerProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, cluster.bootstrap());
        consumerProps.put(ConsumerConfig.GROUP_ID_CONFIG, "gateway-" + subscription.id());
        consumerProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
        consumerProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        consumerProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class);

        ContainerProperties containerProperties = new ContainerProperties(topic);
        containerProperties.setMessageListener((MessageListener<String, byte[]>) record ->
                dispatcher.dispatch(handler, codec.decode(channel, record.value(), headersOf(record))));
        KafkaMessageListenerContainer<String, byte[]> container =
                new KafkaMessageListenerContainer<>(new DefaultKafkaConsumerFactory<>(consumerProps), containerProperties);
        container.setBeanName("gateway-" + subscription.id());
        container.start();
        connections.addSubscription(subscription, container);
        log.info("Subscribed to Kafka topic '{}' on {}", topic, cluster.bootstrap());
        return subscription;
    }

    @Override
    public void unsubscribe(SubscriptionHandle subscription) {
        KafkaMessageListenerContainer<String, byte[]> container = connections.removeSubscription(subscription);
        if (container != null) {
            container.stop();
        }
    }

    @Override
    public void disconnect(ConnectionHandle connection) {
        PubSubConnections.Connection<Cluster, KafkaMessageListenerContainer<String, byte[]>> removed = connections.remove(connection);
        if (removed != null) {
            teardown(removed);
        }
    }

    @Override
    public void close() {
        connections.removeAll().forEach(this::teardown);
        dispatcher.close();
    }

    private void teardown(PubSubConnections.Connection<Cluster, KafkaMessageListenerContainer<String, byte[]>> connection) {
        connection.subscriptions().values().forEach(KafkaMessageListenerContainer::stop);
        connection.client().producerFactory().destroy();
        log.info("Disconnected from Kafka cluster {}", connection.client().bootstrap());
    }

    private static String bootstrapServers(String url) {
        int scheme = url.indexOf("://");
        return scheme >= 0 ? url.substring(scheme + 3) : url;
    }

    private static Map<String, String> headersOf(ConsumerRecord<String, byte[]> record) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Header header : record.headers()) {
            headers.put(header.key(), header.value() == null ? "" : new String(header.value(), StandardCharsets.UTF_8));
        }
        return headers;
    }

    private static GatewayException translate(String target, Throwable cause) {
        if (cause instanceof org.apache.kafka.common.errors.TimeoutException) {
            return new TransportTimeoutException("Kafka operation on " + target + " timed out", cause);
        }
        return new TransportConnectionException(TransportConnectionException.Reason.IO,
                "Kafka failure on " + target + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
    }

    private record Cluster(String bootstrap, DefaultKafkaProducerFactory<String, byte[]> producerFactory,
                           KafkaTemplate<String, byte[]> template) {
    }
}
