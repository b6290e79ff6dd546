package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Token usage statistics.
 */
@Value
@Builder
public class Usage {

    @JsonProperty("prompt_tokens")
    int promptTokens;

    @JsonProperty("completion_tokens")
    int completionTokens;

    @JsonProperty("total_tokens")
    int totalTokens;

    public static Usage of(int promptTokens, int completionTokens) {
        return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
