package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Bedrock Titan text request as a Bedrock-native caller sends it.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BedrockTitanRequest {

    @JsonProperty("model")
    String model;

    @JsonProperty("inputText")
    String inputText;

    @JsonProperty("textGenerationConfig")
    BedrockTitanConfig textGenerationConfig;

    @JsonProperty("stream")
    Boolean stream;

    @Builder
    @JsonCreator
    public BedrockTitanRequest(
            @JsonProperty("model") String model,
            @JsonProperty("inputText") String inputText,
            @JsonProperty("textGenerationConfig") BedrockTitanConfig textGenerationConfig,
            @JsonProperty("stream") Boolean stream) {
        if (inputText == null) {
            throw new IllegalArgumentException("inputText is required");
        }
        if (textGenerationConfig == null) {
            throw new IllegalArgumentException("textGenerationConfig is required");
        }
        this.model = model;
        this.inputText = inputText;
        this.textGenerationConfig = textGenerationConfig;
        this.stream = stream;
    }
}
