package com.conduit.exception;

/**
 * Client-level failure reported by a provider SDK or HTTP API. Subclasses mirror the
 * provider error taxonomy and pass through adapters unchanged.
 */
public abstract class ApiClientException extends GatewayException {

    protected ApiClientException(String message, int statusCode, String errorType, String errorCode, Throwable cause) {
        super(message, statusCode, errorType, errorCode, cause);
    }

    /**
     * @return true when the same call may succeed if retried
     */
    public boolean isRetryable() {
        return false;
    }
}
