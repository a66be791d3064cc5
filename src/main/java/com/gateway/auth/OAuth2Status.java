package com.gateway.auth;

/**
 * Where a user stands in the OAuth2 flow of one document.
 */
public enum OAuth2Status {
    NO_AUTHORIZATION,
    AWAITING_CALLBACK,
    AUTHORIZED,
    EXPIRED
}
