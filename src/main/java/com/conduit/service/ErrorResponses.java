package com.conduit.service;

import com.conduit.exception.GatewayException;
import com.conduit.model.ErrorResponse;
import org.springframework.http.ResponseEntity;

/**
 * Maps exceptions to HTTP status and structured error bodies.
 */
public final class ErrorResponses {

    static final int INTERNAL_STATUS = 500;
    static final String INTERNAL_ERROR = "internal_error";

    private ErrorResponses() {
    }

    public static ErrorResponse toBody(Throwable error) {
        if (error instanceof GatewayException) {
            GatewayException gateway = (GatewayException) error;
            return ErrorResponse.of(gateway.getMessage(), gateway.getErrorType(), gateway.getErrorCode());
        }
        return ErrorResponse.of("Internal server error: " + error.getMessage(), INTERNAL_ERROR, INTERNAL_ERROR);
    }

    public static int status(Throwable error) {
        return error instanceof GatewayException ? ((GatewayException) error).getStatusCode() : INTERNAL_STATUS;
    }

    public static ResponseEntity<Object> toEntity(Throwable error) {
        return ResponseEntity.status(status(error)).body(toBody(error));
    }
}
