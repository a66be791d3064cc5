package com.gateway.protocol;

import com.gateway.exception.TransportConnectionException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;

/**
 * The connection cache shared by the pub/sub adapters: one native client per
 * (protocol, server), plus the native subscription objects that depend on it.
 * <p>
 * A cached client that is no longer alive is torn down and replaced on the next
 * {@link #open}.
 *
 * @param <C> The native client type.
 * @param <S> The native subscription type.
 */
@Slf4j
public class PubSubConnections<C, S> {

    private final String protocol;
    private final Predicate<C> alive;
    private final Consumer<Connection<C, S>> teardown;
    private final Map<String, Connection<C, S>> connections = new ConcurrentHashMap<>();

    /**
     * A cache for clients that reconnect by themselves and are always considered alive.
     */
    public PubSubConnections(String protocol) {
        this(protocol, client -> true, connection -> { });
    }

    /**
     * @param alive    Tells whether a cached client can still be used.
     * @param teardown Releases a dead connection after it left the cache.
     */
    public PubSubConnections(String protocol, Predicate<C> alive, Consumer<Connection<C, S>> teardown) {
        this.protocol = protocol;
        this.alive = alive;
        this.teardown = teardown;
    }

    /**
     * Returns the handle of the cached connection to the server, calling {@code opener} to
     * create the native client when there is none. A failing opener leaves the cache untouched.
     */
    public synchronized ConnectionHandle open(ServerConfig server, Function<ServerConfig, C> opener) {
        String key = protocol + "_" + server.url();
        Connection<C, S> existing = connections.get(key);
        if (existing != null) {
            if (alive.test(existing.client())) {
                return existing.handle();
            }
            connections.remove(key);
            log.info("Cached {} connection to {} is no longer alive, reconnecting", protocol, server.url());
            teardown.accept(existing);
        }
        C client = opener.apply(server);
        ConnectionHandle handle = new ConnectionHandle(key, protocol, server.url());
        connections.put(key, new Connection<>(handle, client, new LinkedHashMap<>()));
        return handle;
    }

    public C client(ConnectionHandle handle) {
        return connection(handle).client();
    }

    public synchronized void addSubscription(SubscriptionHandle subscription, S nativeSubscription) {
        connection(subscription.connection()).subscriptions().put(subscription.id(), nativeSubscription);
    }

    /**
     * Forgets the subscription and returns its native object, or {@code null} if it is unknown.
     */
    public synchronized S removeSubscription(SubscriptionHandle subscription) {
        Connection<C, S> connection = connections.get(subscription.connection().key());
        return connection == null ? null : connection.subscriptions().remove(subscription.id());
    }

    /**
     * Removes the connection from the cache. The caller tears down the returned subscriptions
     * before closing the client.
     */
    public synchronized Connection<C, S> remove(ConnectionHandle handle) {
        return connections.remove(handle.key());
    }

    /**
     * Drops the connection after a transport failure so the next {@link #open} reconnects.
     */
    public void evict(ConnectionHandle handle) {
        Connection<C, S> removed = remove(handle);
        if (removed != null) {
            log.info("Evicted {} connection to {} after a transport failure", protocol, handle.serverAddress());
            teardown.accept(removed);
        }
    }

    public synchronized List<Connection<C, S>> removeAll() {
        List<Connection<C, S>> all = new ArrayList<>(connections.values());
        connections.clear();
        return all;
    }

    public boolean isOpen(ConnectionHandle handle) {
        return connections.containsKey(handle.key());
    }

    private Connection<C, S> connection(ConnectionHandle handle) {
        Connection<C, S> connection = connections.get(handle.key());
        if (connection == null) {
            throw new TransportConnectionException(TransportConnectionException.Reason.IO,
                    "Connection to " + handle.serverAddress() + " is not open");
        }
        return connection;
    }

    public record Connection<C, S>(ConnectionHandle handle, C client, Map<String, S> subscriptions) {
    }
}
