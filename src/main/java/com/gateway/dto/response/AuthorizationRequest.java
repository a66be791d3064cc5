package com.gateway.dto.response;

import java.time.Instant;

/**
 * The result of starting an OAuth2 authorization-code flow.
 *
 * @param stateId          The identifier of the persisted state, needed by the callback.
 * @param authorizationUrl The provider URL the user has to visit.
 * @param expiresAt        When the pending state stops being accepted.
 */
public record AuthorizationRequest(String stateId, String authorizationUrl, Instant expiresAt) {
}
