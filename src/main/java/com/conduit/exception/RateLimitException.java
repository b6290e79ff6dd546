package com.conduit.exception;

/**
 * The provider throttled the request.
 */
public class RateLimitException extends ApiClientException {

    public RateLimitException(String message) {
        this(message, null);
    }

    public RateLimitException(String message, Throwable cause) {
        super(message, 429, "rate_limit_error", "rate_limit_exceeded", cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
