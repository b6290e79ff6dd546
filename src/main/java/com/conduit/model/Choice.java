package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Choice in a chat completion response.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Choice {

    @JsonProperty("index")
    int index;

    @JsonProperty("message")
    Message message;

    // Canonical value, or the provider's own value when it has no canonical mapping
    @JsonProperty("finish_reason")
    String finishReason;
}
