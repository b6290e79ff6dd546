package com.conduit.service;

import com.conduit.exception.ModelNotFoundException;
import com.conduit.exception.RequestValidationException;
import com.conduit.exception.UnsupportedFeatureException;
import com.conduit.model.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ErrorResponses.
 */
class ErrorResponsesTest {

    static ErrorResponse sample() {
        return ErrorResponse.of("m", "t", "c");
    }

    @Test
    void testGatewayExceptionsKeepStatusTypeAndCode() {
        ResponseEntity<Object> notFound = ErrorResponses.toEntity(new ModelNotFoundException("no such model"));
        ErrorResponse body = (ErrorResponse) notFound.getBody();

        assertEquals(404, notFound.getStatusCode().value());
        assertNotNull(body);
        assertEquals("no such model", body.getError().getMessage());
        assertEquals("model_not_found", body.getError().getCode());
        assertEquals(400, ErrorResponses.status(new UnsupportedFeatureException("no tools")));
        assertEquals(422, ErrorResponses.status(new RequestValidationException("bad")));
    }

    @Test
    void testUnexpectedErrorsAreInternal() {
        ErrorResponse body = ErrorResponses.toBody(new IllegalStateException("kaput"));

        assertEquals(500, ErrorResponses.status(new IllegalStateException("kaput")));
        assertEquals("Internal server error: kaput", body.getError().getMessage());
        assertEquals("internal_error", body.getError().getType());
        assertEquals("internal_error", body.getError().getCode());
    }
}
