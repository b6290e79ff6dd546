package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Titan text response shape returned to Bedrock-native callers.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BedrockTitanResponse {

    @JsonProperty("inputTextTokenCount")
    int inputTextTokenCount;

    @JsonProperty("results")
    List<Result> results;

    @Value
    public static class Result {

        @JsonProperty("tokenCount")
        int tokenCount;

        @JsonProperty("outputText")
        String outputText;

        @JsonProperty("completionReason")
        String completionReason;
    }
}
