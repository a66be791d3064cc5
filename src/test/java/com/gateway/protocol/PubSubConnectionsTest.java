package com.gateway.protocol;

import com.gateway.exception.TransportConnectionException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PubSubConnectionsTest {

    private final ServerConfig server = new ServerConfig("mqtt://broker:1883", Map.of(), Duration.ofSeconds(1));
    private final AtomicBoolean alive = new AtomicBoolean(true);
    private final List<String> tornDown = new ArrayList<>();
    private final PubSubConnections<String, String> connections =
            new PubSubConnections<>("mqtt", client -> alive.get(), connection -> tornDown.add(connection.client()));

    @Test
    void open_reusesALiveClient() {
        AtomicInteger opened = new AtomicInteger();

        ConnectionHandle first = connections.open(server, config -> "client-" + opened.incrementAndGet());
        ConnectionHandle second = connections.open(server, config -> "client-" + opened.incrementAndGet());

        assertThat(second).isEqualTo(first);
        assertThat(opened.get()).isEqualTo(1);
        assertThat(connections.client(first)).isEqualTo("client-1");
        assertThat(tornDown).isEmpty();
    }

    @Test
    void open_replacesADeadClient() {
        AtomicInteger opened = new AtomicInteger();
        ConnectionHandle handle = connections.open(server, config -> "client-" + opened.incrementAndGet());
        connections.addSubscription(new SubscriptionHandle("sub-1", handle, "news"), "native-sub");

        alive.set(false);
        connections.open(server, config -> "client-" + opened.incrementAndGet());

        assertThat(opened.get()).isEqualTo(2);
        assertThat(tornDown).containsExactly("client-1");
        assertThat(connections.client(handle)).isEqualTo("client-2");
        assertThat(connections.removeSubscription(new SubscriptionHandle("sub-1", handle, "news"))).isNull();
    }

    @Test
    void evict_forgetsTheConnectionAndTearsItDown() {
        ConnectionHandle handle = connections.open(server, config -> "client-1");

        connections.evict(handle);
        connections.evict(handle);

        assertThat(tornDown).containsExactly("client-1");
        assertThat(connections.isOpen(handle)).isFalse();
        assertThatThrownBy(() -> connections.client(handle))
                .isInstanceOf(TransportConnectionException.class)
                .hasMessageContaining("is not open");
    }

    @Test
    void open_failingOpenerLeavesNothingCached() {
        assertThatThrownBy(() -> connections.open(server, config -> {
            throw new TransportConnectionException(TransportConnectionException.Reason.CONNECTION_REFUSED, "refused");
        })).isInstanceOf(TransportConnectionException.class);

        assertThat(connections.open(server, config -> "client-1")).isNotNull();
        assertThat(tornDown).isEmpty();
    }
}
