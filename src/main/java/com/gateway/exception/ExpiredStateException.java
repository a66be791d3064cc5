package com.gateway.exception;

/**
 * Raised when an OAuth2 callback arrives after its authorization state expired.
 */
public class ExpiredStateException extends GatewayException {

    public ExpiredStateException(String message) {
        super(ErrorKind.EXPIRED_STATE, message);
    }

    public ExpiredStateException(String message, Throwable cause) {
        super(ErrorKind.EXPIRED_STATE, message, cause);
    }
}
