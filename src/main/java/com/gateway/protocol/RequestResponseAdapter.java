package com.gateway.protocol;

/**
 * An adapter for request/response transports.
 */
public interface RequestResponseAdapter extends ProtocolAdapter {

    /**
     * Sends the request and waits for the response. Any response the backend returns, whatever
     * its status, is a completed call.
     *
     * @throws com.gateway.exception.TransportTimeoutException    if no response arrives in time.
     * @throws com.gateway.exception.TransportConnectionException if the backend cannot be reached.
     */
    WireResponse execute(WireRequest request);
}
