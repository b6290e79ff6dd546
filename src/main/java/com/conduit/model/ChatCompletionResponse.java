package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * OpenAI-compatible chat completion response.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionResponse {

    public static final String OBJECT = "chat.completion";

    @JsonProperty("id")
    String id;

    @JsonProperty("object")
    @Builder.Default
    String object = OBJECT;

    @JsonProperty("created")
    long created;

    @JsonProperty("model")
    String model;

    @JsonProperty("choices")
    @Builder.Default
    List<Choice> choices = List.of();

    @JsonProperty("usage")
    Usage usage;

    @JsonProperty("system_fingerprint")
    String systemFingerprint;

    /**
     * First choice, or null when the response has none.
     */
    public Choice firstChoice() {
        return choices == null || choices.isEmpty() ? null : choices.get(0);
    }
}
