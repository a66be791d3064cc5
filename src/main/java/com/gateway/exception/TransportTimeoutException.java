package com.gateway.exception;

/**
 * Raised when an outbound wire call does not complete within its configured timeout.
 */
public class TransportTimeoutException extends GatewayException {

    public TransportTimeoutException(String message) {
        super(ErrorKind.TRANSPORT_TIMEOUT, message);
    }

    public TransportTimeoutException(String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_TIMEOUT, message, cause);
    }
}
