package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Claude tool definition.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class BedrockTool {

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("input_schema")
    JsonNode inputSchema;

    @JsonCreator
    public BedrockTool(
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("input_schema") JsonNode inputSchema) {
        if (name == null || description == null || inputSchema == null) {
            throw new IllegalArgumentException("Claude tool requires name, description and input_schema");
        }
        this.name = name;
        this.description = description;
        this.inputSchema = inputSchema;
    }
}
