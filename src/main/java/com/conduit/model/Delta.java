package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Partial message carried by a streaming chunk.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Delta {

    @JsonProperty("role")
    String role;

    @JsonProperty("content")
    String content;

    @JsonProperty("tool_calls")
    List<ToolCall> toolCalls;

    public static Delta empty() {
        return Delta.builder().build();
    }
}
