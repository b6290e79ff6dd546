package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolUseBlock implements ContentBlock {

    public static final String TYPE = "tool_use";

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("input")
    JsonNode input;

    @JsonCreator
    public ToolUseBlock(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("input") JsonNode input) {
        this.id = id;
        this.name = name;
        this.input = input;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
