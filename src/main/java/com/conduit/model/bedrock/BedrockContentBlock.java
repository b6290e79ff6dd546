package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Claude content block: {@code text}, {@code image}, {@code tool_use} or {@code tool_result}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BedrockContentBlock {

    public static final String TYPE_TEXT = "text";
    public static final String TYPE_IMAGE = "image";
    public static final String TYPE_TOOL_USE = "tool_use";
    public static final String TYPE_TOOL_RESULT = "tool_result";

    @JsonProperty("type")
    String type;

    @JsonProperty("text")
    String text;

    @JsonProperty("source")
    BedrockImageSource source;

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("input")
    JsonNode input;

    @JsonProperty("tool_use_id")
    String toolUseId;

    // String or list of text blocks
    @JsonProperty("content")
    JsonNode content;

    @Builder
    @JsonCreator
    public BedrockContentBlock(
            @JsonProperty("type") String type,
            @JsonProperty("text") String text,
            @JsonProperty("source") BedrockImageSource source,
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("input") JsonNode input,
            @JsonProperty("tool_use_id") String toolUseId,
            @JsonProperty("content") JsonNode content) {
        this.type = Objects.requireNonNull(type, "content block requires type");
        this.text = text;
        this.source = source;
        this.id = id;
        this.name = name;
        this.input = input;
        this.toolUseId = toolUseId;
        this.content = content;
    }

    public static BedrockContentBlock text(String text) {
        return builder().type(TYPE_TEXT).text(text).build();
    }

    public static BedrockContentBlock toolUse(String id, String name, JsonNode input) {
        return builder().type(TYPE_TOOL_USE).id(id).name(name).input(input).build();
    }

    /**
     * Text of a {@code tool_result} block, joining text parts when the result is a list.
     */
    public String toolResultText() {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        StringBuilder builder = new StringBuilder();
        for (JsonNode part : content) {
            if (part.hasNonNull("text")) {
                builder.append(part.get("text").asText());
            }
        }
        return builder.toString();
    }
}
