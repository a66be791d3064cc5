package com.gateway.exception;

/**
 * Base runtime exception for every application-specific error raised by the gateway.
 * <p>
 * Each subclass pins the {@link ErrorKind}, so the category survives being caught as a
 * plain {@code GatewayException} at the call boundary, where it is turned into a structured
 * failure result instead of being propagated to the caller.
 */
public class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    /**
     * Constructs a new GatewayException with the specified kind and detail message.
     *
     * @param kind    The failure category.
     * @param message The detail message.
     */
    public GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructs a new GatewayException with the specified kind, detail message and cause.
     *
     * @param kind    The failure category.
     * @param message The detail message.
     * @param cause   The underlying library or I/O failure, may be {@code null}.
     */
    public GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
