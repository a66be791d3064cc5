package com.gateway.protocol;

/**
 * Identifies a cached pub/sub connection.
 *
 * @param key           The cache key, unique per (protocol, server).
 * @param protocol      The adapter protocol.
 * @param serverAddress The server the connection points at.
 */
public record ConnectionHandle(String key, String protocol, String serverAddress) {
}
