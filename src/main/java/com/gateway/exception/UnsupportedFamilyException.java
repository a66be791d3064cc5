package com.gateway.exception;

/**
 * Raised when a document belongs to no registered specification family, or the family is incomplete.
 */
public class UnsupportedFamilyException extends GatewayException {

    public UnsupportedFamilyException(String message) {
        super(ErrorKind.UNSUPPORTED_FAMILY, message);
    }

    public UnsupportedFamilyException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_FAMILY, message, cause);
    }
}
