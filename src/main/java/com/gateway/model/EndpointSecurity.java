package com.gateway.model;

import java.util.List;

/**
 * One security requirement of an endpoint, resolved against the document's security schemes.
 *
 * @param name   The security scheme name.
 * @param type   The scheme type as declared (e.g. "apiKey", "http", "oauth2"), or {@code null}
 *               when the document does not define the scheme.
 * @param scopes The scopes the operation requires.
 */
public record EndpointSecurity(String name, String type, List<String> scopes) {
}
