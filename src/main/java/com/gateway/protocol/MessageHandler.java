package com.gateway.protocol;

/**
 * Receives inbound messages of a subscription. Invoked on the adapter's dispatcher thread;
 * an exception thrown here is logged and does not affect the connection.
 */
@FunctionalInterface
public interface MessageHandler {

    void onMessage(InboundMessage message);
}
