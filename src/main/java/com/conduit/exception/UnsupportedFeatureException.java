package com.conduit.exception;

/**
 * The request asks for a feature the target provider lacks, such as tools. Raised while preparing the payload.
 */
public class UnsupportedFeatureException extends GatewayException {

    public UnsupportedFeatureException(String message) {
        super(message, 400, "invalid_request_error", "unsupported_feature");
    }

    public UnsupportedFeatureException(String message, Throwable cause) {
        super(message, 400, "invalid_request_error", "unsupported_feature", cause);
    }
}
