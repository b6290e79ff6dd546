package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Claude Messages response shape returned to Bedrock-native callers.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BedrockClaudeResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("type")
    @Builder.Default
    String type = "message";

    @JsonProperty("role")
    @Builder.Default
    String role = "assistant";

    @JsonProperty("content")
    List<BedrockContentBlock> content;

    @JsonProperty("model")
    String model;

    @JsonProperty("stop_reason")
    String stopReason;

    @JsonProperty("stop_sequence")
    String stopSequence;

    @JsonProperty("usage")
    Usage usage;

    @Value
    public static class Usage {

        @JsonProperty("input_tokens")
        int inputTokens;

        @JsonProperty("output_tokens")
        int outputTokens;
    }
}
