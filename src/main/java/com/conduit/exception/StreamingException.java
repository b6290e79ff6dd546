package com.conduit.exception;

/**
 * A provider stream failed after it started.
 */
public class StreamingException extends GatewayException {

    public StreamingException(String message) {
        super(message, 500, "streaming_error", "stream_interrupted");
    }

    public StreamingException(String message, Throwable cause) {
        super(message, 500, "streaming_error", "stream_interrupted", cause);
    }
}
