package com.gateway.exception;

/**
 * Raised when the stored OAuth2 token of a user is past its expiry at call time.
 */
public class AuthorizationExpiredException extends GatewayException {

    public AuthorizationExpiredException(String message) {
        super(ErrorKind.AUTHORIZATION_EXPIRED, message);
    }

    public AuthorizationExpiredException(String message, Throwable cause) {
        super(ErrorKind.AUTHORIZATION_EXPIRED, message, cause);
    }
}
