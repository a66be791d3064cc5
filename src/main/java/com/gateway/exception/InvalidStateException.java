package com.gateway.exception;

/**
 * Raised when an OAuth2 callback carries an unknown, mismatched or already consumed state.
 */
public class InvalidStateException extends GatewayException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }

    public InvalidStateException(String message, Throwable cause) {
        super(ErrorKind.INVALID_STATE, message, cause);
    }
}
