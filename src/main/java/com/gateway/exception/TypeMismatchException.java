package com.gateway.exception;

/**
 * Raised when a parameter value cannot be coerced to the type its schema declares.
 */
public class TypeMismatchException extends GatewayException {

    private final String parameterName;
    private final String expectedType;

    public TypeMismatchException(String parameterName, String expectedType) {
        super(ErrorKind.TYPE_MISMATCH, "Parameter '" + parameterName + "' is not a valid " + expectedType);
        this.parameterName = parameterName;
        this.expectedType = expectedType;
    }

    public String getParameterName() {
        return parameterName;
    }

    public String getExpectedType() {
        return expectedType;
    }
}
