package com.gateway.exception;

/**
 * Raised when a backend or broker cannot be reached. The {@link Reason} separates a refused
 * connection from a host name that does not resolve.
 */
public class TransportConnectionException extends GatewayException {

    public enum Reason {
        CONNECTION_REFUSED,
        UNKNOWN_HOST,
        IO
    }

    private final Reason reason;

    public TransportConnectionException(Reason reason, String message) {
        super(ErrorKind.TRANSPORT_CONNECTION, message);
        this.reason = reason;
    }

    public TransportConnectionException(Reason reason, String message, Throwable cause) {
        super(ErrorKind.TRANSPORT_CONNECTION, message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
