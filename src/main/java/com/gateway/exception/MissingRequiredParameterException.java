package com.gateway.exception;

/**
 * Raised when a required endpoint parameter was not supplied by the caller.
 */
public class MissingRequiredParameterException extends GatewayException {

    private final String parameterName;

    public MissingRequiredParameterException(String parameterName) {
        super(ErrorKind.MISSING_REQUIRED_PARAMETER, "Missing required parameter: " + parameterName);
        this.parameterName = parameterName;
    }

    public String getParameterName() {
        return parameterName;
    }
}
