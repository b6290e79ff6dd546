package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BedrockTitanConfig {

    @JsonProperty("maxTokenCount")
    int maxTokenCount;

    @JsonProperty("temperature")
    Double temperature;

    @JsonProperty("topP")
    Double topP;

    @JsonProperty("stopSequences")
    List<String> stopSequences;

    @Builder
    @JsonCreator
    public BedrockTitanConfig(
            @JsonProperty("maxTokenCount") Integer maxTokenCount,
            @JsonProperty("temperature") Double temperature,
            @JsonProperty("topP") Double topP,
            @JsonProperty("stopSequences") List<String> stopSequences) {
        if (maxTokenCount == null || maxTokenCount <= 0) {
            throw new IllegalArgumentException("maxTokenCount is required and must be greater than 0");
        }
        if (temperature != null && (temperature < 0.0 || temperature > 1.0)) {
            throw new IllegalArgumentException("temperature must be between 0 and 1, got " + temperature);
        }
        if (topP != null && (topP < 0.0 || topP > 1.0)) {
            throw new IllegalArgumentException("topP must be between 0 and 1, got " + topP);
        }
        this.maxTokenCount = maxTokenCount;
        this.temperature = temperature;
        this.topP = topP;
        this.stopSequences = stopSequences == null ? null : List.copyOf(stopSequences);
    }
}
