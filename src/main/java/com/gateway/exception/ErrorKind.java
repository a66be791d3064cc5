package com.gateway.exception;

/**
 * The closed set of failure categories the gateway reports. Every {@link GatewayException}
 * carries exactly one kind so callers can branch on the category without inspecting messages.
 */
public enum ErrorKind {
    MALFORMED_REFERENCE,
    UNSUPPORTED_REFERENCE,
    INVALID_SPECIFICATION,
    UNSUPPORTED_FAMILY,
    UNSUPPORTED_PROTOCOL,
    MISSING_REQUIRED_PARAMETER,
    TYPE_MISMATCH,
    ENDPOINT_NOT_FOUND,
    AUTHENTICATION_FAILED,
    INVALID_STATE,
    EXPIRED_STATE,
    AUTHORIZATION_EXPIRED,
    TRANSPORT_TIMEOUT,
    TRANSPORT_CONNECTION,
    /**
     * An unexpected failure that does not belong to any of the categories above.
     */
    INTERNAL
}
