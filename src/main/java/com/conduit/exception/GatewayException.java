package com.conduit.exception;

import lombok.Getter;

/**
 * Base class for every failure the gateway raises. Carries the HTTP status and the
 * {@code type}/{@code code} pair written into the error body.
 */
@Getter
public class GatewayException extends RuntimeException {

    private final int statusCode;
    private final String errorType;
    private final String errorCode;

    public GatewayException(String message, int statusCode, String errorType, String errorCode) {
        super(message);
        this.statusCode = statusCode;
        this.errorType = errorType;
        this.errorCode = errorCode;
    }

    public GatewayException(String message, int statusCode, String errorType, String errorCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorType = errorType;
        this.errorCode = errorCode;
    }
}
