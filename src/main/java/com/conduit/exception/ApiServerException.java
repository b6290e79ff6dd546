package com.conduit.exception;

/**
 * The provider failed with a server-side error.
 */
public class ApiServerException extends ApiClientException {

    public ApiServerException(String message) {
        this(message, null);
    }

    public ApiServerException(String message, Throwable cause) {
        super(message, 502, "api_error", "provider_server_error", cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
