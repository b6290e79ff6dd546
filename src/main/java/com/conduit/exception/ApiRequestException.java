package com.conduit.exception;

/**
 * The provider rejected the request, or returned a response the gateway cannot read.
 */
public class ApiRequestException extends ApiClientException {

    public ApiRequestException(String message) {
        this(message, null);
    }

    public ApiRequestException(String message, Throwable cause) {
        super(message, 400, "invalid_request_error", "provider_request_error", cause);
    }
}
