package com.gateway.exception;

/**
 * Raised for reference forms the resolver does not follow, such as relative file paths.
 */
public class UnsupportedReferenceException extends GatewayException {

    public UnsupportedReferenceException(String message) {
        super(ErrorKind.UNSUPPORTED_REFERENCE, message);
    }

    public UnsupportedReferenceException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_REFERENCE, message, cause);
    }
}
