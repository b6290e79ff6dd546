package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Titan stream record emitted to Bedrock-native streaming callers.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BedrockTitanStreamChunk {

    @JsonProperty("outputText")
    String outputText;

    @JsonProperty("index")
    int index;

    @JsonProperty("totalOutputTextTokenCount")
    Integer totalOutputTextTokenCount;

    @JsonProperty("completionReason")
    String completionReason;
}
