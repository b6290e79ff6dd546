package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import lombok.Value;

/**
 * Claude stream event emitted to Bedrock-native streaming callers.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BedrockClaudeStreamEvent {

    public static final String CONTENT_BLOCK_START = "content_block_start";
    public static final String CONTENT_BLOCK_DELTA = "content_block_delta";
    public static final String MESSAGE_DELTA = "message_delta";

    @JsonProperty("type")
    String type;

    @JsonProperty("index")
    Integer index;

    @JsonProperty("content_block")
    StartBlock contentBlock;

    @JsonProperty("delta")
    EventDelta delta;

    public static BedrockClaudeStreamEvent textDelta(int index, String text) {
        return new BedrockClaudeStreamEvent(CONTENT_BLOCK_DELTA, index, null,
                new EventDelta("text_delta", text, null, null));
    }

    public static BedrockClaudeStreamEvent toolUseStart(int index, String id, String name) {
        return new BedrockClaudeStreamEvent(CONTENT_BLOCK_START, index,
                new StartBlock("tool_use", id, name, JsonNodeFactory.instance.objectNode()), null);
    }

    public static BedrockClaudeStreamEvent inputJsonDelta(int index, String partialJson) {
        return new BedrockClaudeStreamEvent(CONTENT_BLOCK_DELTA, index, null,
                new EventDelta("input_json_delta", null, partialJson, null));
    }

    public static BedrockClaudeStreamEvent messageDelta(String stopReason) {
        return new BedrockClaudeStreamEvent(MESSAGE_DELTA, null, null, new EventDelta(null, null, null, stopReason));
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StartBlock {

        @JsonProperty("type")
        String type;

        @JsonProperty("id")
        String id;

        @JsonProperty("name")
        String name;

        @JsonProperty("input")
        JsonNode input;
    }

    @Value
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class EventDelta {

        @JsonProperty("type")
        String type;

        @JsonProperty("text")
        String text;

        @JsonProperty("partial_json")
        String partialJson;

        @JsonProperty("stop_reason")
        String stopReason;
    }
}
