package com.conduit.exception;

/**
 * The inbound body could not be parsed into a valid canonical request.
 */
public class RequestValidationException extends GatewayException {

    public RequestValidationException(String message) {
        super(message, 422, "invalid_request_error", "invalid_request");
    }

    public RequestValidationException(String message, Throwable cause) {
        super(message, 422, "invalid_request_error", "invalid_request", cause);
    }
}
