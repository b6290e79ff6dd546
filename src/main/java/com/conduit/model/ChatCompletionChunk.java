package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Streaming chunk for SSE responses. The id and created timestamp are shared by
 * every chunk of one stream.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChatCompletionChunk {

    public static final String OBJECT = "chat.completion.chunk";

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
    List<ChunkChoice> choices = List.of();

    @JsonProperty("system_fingerprint")
    String systemFingerprint;

    public boolean hasChoices() {
        return choices != null && !choices.isEmpty();
    }

    /**
     * @return true when any choice carries text, tool calls or a finish reason
     */
    public boolean carriesPayload() {
        return hasChoices() && choices.stream().anyMatch(ChunkChoice::carriesPayload);
    }

    /**
     * @return true when any choice carries a finish reason
     */
    @JsonIgnore
    public boolean isTerminal() {
        return hasChoices() && choices.stream().anyMatch(choice -> choice.getFinishReason() != null);
    }

    public ChunkChoice firstChoice() {
        return hasChoices() ? choices.get(0) : null;
    }

    @Value
    @Builder(toBuilder = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ChunkChoice {

        @JsonProperty("index")
        int index;

        @JsonProperty("delta")
        Delta delta;

        // Always written, null until the final chunk
        @JsonProperty("finish_reason")
        @JsonInclude(JsonInclude.Include.ALWAYS)
        String finishReason;

        boolean carriesPayload() {
            if (finishReason != null) {
                return true;
            }
            if (delta == null) {
                return false;
            }
            boolean hasText = delta.getContent() != null && !delta.getContent().isEmpty();
            boolean hasToolCalls = delta.getToolCalls() != null && !delta.getToolCalls().isEmpty();
            return hasText || hasToolCalls;
        }
    }
}
