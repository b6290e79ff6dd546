package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical reasons a generation stopped. Every provider vocabulary is mapped onto these.
 */
public enum FinishReason {
    STOP("stop"),
    LENGTH("length"),
    TOOL_CALLS("tool_calls"),
    CONTENT_FILTER("content_filter"),
    END_TURN("end_turn"),
    MAX_TOKENS("max_tokens"),
    STOP_SEQUENCE("stop_sequence");

    private final String value;

    FinishReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Look up a canonical reason by its wire value.
     *
     * @param value wire value such as "stop"
     * @return matching reason, or null when the value is not canonical
     */
    public static FinishReason fromValue(String value) {
        for (FinishReason reason : values()) {
            if (reason.value.equals(value)) {
                return reason;
            }
        }
        return null;
    }
}
