package com.gateway.exception;

/**
 * Raised when an endpoint names a protocol that has no registered adapter.
 */
public class UnsupportedProtocolException extends GatewayException {

    public UnsupportedProtocolException(String message) {
        super(ErrorKind.UNSUPPORTED_PROTOCOL, message);
    }

    public UnsupportedProtocolException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_PROTOCOL, message, cause);
    }
}
