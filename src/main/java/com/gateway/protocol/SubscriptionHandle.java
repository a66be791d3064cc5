package com.gateway.protocol;

/**
 * Identifies an active subscription of a handler to a channel.
 */
public record SubscriptionHandle(String id, ConnectionHandle connection, String channel) {
}
