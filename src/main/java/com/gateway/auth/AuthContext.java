package com.gateway.auth;

/**
 * Who a request is authenticated for.
 *
 * @param userId        The calling user, {@code null} for anonymous calls.
 * @param apiDocumentId The document the called endpoint belongs to.
 */
public record AuthContext(String userId, String apiDocumentId) {
}
