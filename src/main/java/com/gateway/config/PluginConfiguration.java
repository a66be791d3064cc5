package com.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.protocol.MessageCodec;
import com.gateway.protocol.MessageDispatcher;
import com.gateway.protocol.amqp.AmqpProtocolAdapter;
import com.gateway.protocol.http.HttpProtocolAdapter;
import com.gateway.protocol.kafka.KafkaProtocolAdapter;
import com.gateway.protocol.mqtt.MqttProtocolAdapter;
import com.gateway.protocol.nats.NatsProtocolAdapter;
import com.gateway.protocol.websocket.WebSocketProtocolAdapter;
import com.gateway.registry.SpecRegistry;
import com.gateway.spec.asyncapi.AsyncApiParser;
import com.gateway.spec.asyncapi.AsyncApiSpecModel;
import com.gateway.spec.asyncapi.GatewaySubscriptions;
import com.gateway.spec.asyncapi.PubSubExecutor;
import com.gateway.spec.openapi.OpenApiParser;
import com.gateway.spec.openapi.OpenApiSpecModel;
import com.gateway.spec.openapi.RestExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;

/**
 * Wires the built-in specification families and protocol adapters into the registry.
 */
@Configuration
public class PluginConfiguration {

    @Bean
    public SpecRegistry specRegistry(WebClient webClient, ObjectMapper objectMapper, GatewayProperties properties,
                                     GatewaySubscriptions subscriptions) {
        SpecRegistry registry = new SpecRegistry();

        registry.registerSpecFamily(OpenApiSpecModel.FAMILY);
        registry.registerModelFactory(OpenApiSpecModel.FAMILY, OpenApiSpecModel::from);
        registry.registerParser(OpenApiSpecModel.FAMILY, new OpenApiParser());
        registry.registerExecutor(OpenApiSpecModel.FAMILY, new RestExecutor());

        registry.registerSpecFamily(AsyncApiSpecModel.FAMILY);
        registry.registerModelFactory(AsyncApiSpecModel.FAMILY, AsyncApiSpecModel::from);
        registry.registerParser(AsyncApiSpecModel.FAMILY, new AsyncApiParser());
        registry.registerExecutor(AsyncApiSpecModel.FAMILY, new PubSubExecutor(subscriptions, properties));

        MessageCodec codec = new MessageCodec(objectMapper);
        int queueCapacity = properties.getPubsub().getDispatchQueueCapacity();

        registry.registerProtocol("http", () -> new HttpProtocolAdapter(webClient, objectMapper, properties.getHttp().getTimeout()));
        registry.registerProtocol("websocket", () -> new WebSocketProtocolAdapter(new ReactorNettyWebSocketClient(), codec,
                new MessageDispatcher("websocket", queueCapacity)));
        registry.registerProtocol("mqtt", () -> new MqttProtocolAdapter(codec, new MessageDispatcher("mqtt", queueCapacity)));
        registry.registerProtocol("amqp", () -> new AmqpProtocolAdapter(codec, new MessageDispatcher("amqp", queueCapacity)));
        registry.registerProtocol("kafka", () -> new KafkaProtocolAdapter(codec, new MessageDispatcher("kafka", queueCapacity),
                properties.getPubsub().getPublishTimeout()));
        registry.registerProtocol("nats", () -> new NatsProtocolAdapter(codec, new MessageDispatcher("nats", queueCapacity),
                properties.getPubsub().getPublishTimeout()));
        return registry;
    }
}
