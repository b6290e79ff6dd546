package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Structured error body: {@code {"error":{"message":..,"type":..,"code":..}}}.
 */
@Value
public class ErrorResponse {

    @JsonProperty("error")
    ErrorDetail error;

    public static ErrorResponse of(String message, String type, String code) {
        return new ErrorResponse(new ErrorDetail(message, type, code));
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorDetail {

        @JsonProperty("message")
        String message;

        @JsonProperty("type")
        String type;

        @JsonProperty("code")
        String code;
    }
}
