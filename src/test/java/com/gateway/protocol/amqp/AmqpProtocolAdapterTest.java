package com.gateway.protocol.amqp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gateway.exception.TransportConnectionException;
import com.gateway.protocol.MessageCodec;
import com.gateway.protocol.MessageDispatcher;
import com.gateway.protocol.ServerConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AmqpProtocolAdapterTest {

    private AmqpProtocolAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new AmqpProtocolAdapter(new MessageCodec(new ObjectMapper()), new MessageDispatcher("amqp-test", 16));
    }

    @AfterEach
    void tearDown() {
        adapter.close();
    }

    @Test
    void connect_refusedBrokerIsConnectionError() {
        ServerConfig server = new ServerConfig("amqp://localhost:1", Map.of(), Duration.ofSeconds(2));

        assertThatThrownBy(() -> adapter.connect(server))
                .isInstanceOf(TransportConnectionException.class)
                .extracting(e -> ((TransportConnectionException) e).getReason())
                .isEqualTo(TransportConnectionException.Reason.CONNECTION_REFUSED);
    }
}
