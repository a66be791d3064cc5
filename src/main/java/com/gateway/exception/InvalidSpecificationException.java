package com.gateway.exception;

/**
 * Raised when a specification document fails minimal structural validation. The offending
 * field path (for example {@code info.title}) is kept so callers can point at it.
 */
public class InvalidSpecificationException extends GatewayException {

    private final String field;

    public InvalidSpecificationException(String field, String message) {
        super(ErrorKind.INVALID_SPECIFICATION, "Invalid specification at '" + field + "': " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
