package com.gateway.protocol;

import java.util.Map;

/**
 * An adapter for publish/subscribe transports.
 * <p>
 * Connections are cached per server and shared by every caller. Inbound messages are handed
 * to a dispatcher thread, so {@link MessageHandler}s never run on the transport's network
 * thread. Connect, publish and subscribe fail synchronously.
 */
public interface PubSubAdapter extends ProtocolAdapter {

    /**
     * Returns the cached connection to the server, opening it first if needed.
     */
    ConnectionHandle connect(ServerConfig server);

    /**
     * Wraps the payload in a {@link MessageEnvelope} and publishes it on the channel.
     *
     * @return The envelope that was sent.
     */
    MessageEnvelope publish(ConnectionHandle connection, String channel, Object payload, Map<String, String> headers);

    SubscriptionHandle subscribe(ConnectionHandle connection, String channel, MessageHandler handler);

    void unsubscribe(SubscriptionHandle subscription);

    /**
     * Closes the connection after tearing down every subscription that depends on it.
     */
    void disconnect(ConnectionHandle connection);
}
