package com.conduit.exception;

/**
 * Backend credentials or settings are missing or invalid. Raised before any provider call.
 */
public class ConfigurationException extends GatewayException {

    public ConfigurationException(String message) {
        super(message, 500, "configuration_error", "provider_not_configured");
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, 500, "configuration_error", "provider_not_configured", cause);
    }
}
