package com.gateway.exception;

/**
 * Raised when no endpoint (or subscription) matches the given identifier or address.
 */
public class EndpointNotFoundException extends GatewayException {

    public EndpointNotFoundException(String message) {
        super(ErrorKind.ENDPOINT_NOT_FOUND, message);
    }

    public EndpointNotFoundException(String message, Throwable cause) {
        super(ErrorKind.ENDPOINT_NOT_FOUND, message, cause);
    }
}
