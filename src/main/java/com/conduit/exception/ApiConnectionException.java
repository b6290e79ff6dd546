package com.conduit.exception;

/**
 * The provider could not be reached.
 */
public class ApiConnectionException extends ApiClientException {

    public ApiConnectionException(String message) {
        this(message, null);
    }

    public ApiConnectionException(String message, Throwable cause) {
        super(message, 503, "api_connection_error", "provider_unreachable", cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
