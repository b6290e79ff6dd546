package com.conduit.exception;

/**
 * No provider or strategy can serve the requested model id.
 */
public class ModelNotFoundException extends GatewayException {

    public ModelNotFoundException(String message) {
        super(message, 404, "invalid_request_error", "model_not_found");
    }

    public ModelNotFoundException(String message, Throwable cause) {
        super(message, 404, "invalid_request_error", "model_not_found", cause);
    }
}
