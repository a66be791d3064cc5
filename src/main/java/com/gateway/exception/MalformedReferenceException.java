package com.gateway.exception;

/**
 * Raised when a {@code \$ref} pointer cannot be located in its target document.
 */
public class MalformedReferenceException extends GatewayException {

    public MalformedReferenceException(String message) {
        super(ErrorKind.MALFORMED_REFERENCE, message);
    }

    public MalformedReferenceException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_REFERENCE, message, cause);
    }
}
