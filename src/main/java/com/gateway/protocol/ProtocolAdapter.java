package com.gateway.protocol;

/**
 * A transport the gateway can call endpoints over. Adapters are created once per protocol by
 * the registry and closed when it shuts down.
 */
public interface ProtocolAdapter extends AutoCloseable {

    /**
     * The protocol name endpoints refer to, for example {@code http} or {@code mqtt}.
     */
    String protocol();

    /**
     * Releases every connection held by the adapter.
     */
    @Override
    void close();
}
