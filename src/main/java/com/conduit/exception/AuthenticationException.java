package com.conduit.exception;

/**
 * The provider rejected the configured credentials.
 */
public class AuthenticationException extends ApiClientException {

    public AuthenticationException(String message) {
        this(message, null);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, "authentication_error", "provider_authentication_failed", cause);
    }
}
