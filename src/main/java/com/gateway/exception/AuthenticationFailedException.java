package com.gateway.exception;

import java.util.List;

/**
 * Raised when none of the authentication configurations applicable to a request could be
 * satisfied. Each attempt contributes one human readable reason; reasons never contain
 * secret material.
 */
public class AuthenticationFailedException extends GatewayException {

    private final List<String> reasons;

    public AuthenticationFailedException(List<String> reasons) {
        super(ErrorKind.AUTHENTICATION_FAILED, "Authentication failed: " + String.join("; ", reasons));
        this.reasons = List.copyOf(reasons);
    }

    public List<String> getReasons() {
        return reasons;
    }
}
