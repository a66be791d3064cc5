package com.gateway.model;

/**
 * A server entry declared by a specification.
 *
 * @param name     The server name (AsyncAPI server key), or {@code null} for OpenAPI servers.
 * @param url      The server address as written in the document.
 * @param protocol The normalized protocol name, for example {@code http} or {@code mqtt}.
 */
public record ServerInfo(String name, String url, String protocol) {
}
