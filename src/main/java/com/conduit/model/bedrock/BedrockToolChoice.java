package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Set;

/**
 * Claude tool choice. Accepts the object form or a bare {@code "auto"} / {@code "any"} string.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BedrockToolChoice {

    public static final String AUTO = "auto";
    public static final String ANY = "any";
    public static final String TOOL = "tool";

    private static final Set<String> TYPES = Set.of(AUTO, ANY, TOOL);

    @JsonProperty("type")
    String type;

    @JsonProperty("name")
    String name;

    @JsonCreator
    public BedrockToolChoice(@JsonProperty("type") String type, @JsonProperty("name") String name) {
        if (!TYPES.contains(type)) {
            throw new IllegalArgumentException("Claude tool_choice type must be auto, any or tool, got " + type);
        }
        if (TOOL.equals(type) && name == null) {
            throw new IllegalArgumentException("Claude tool_choice of type 'tool' requires a name");
        }
        this.type = type;
        this.name = name;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static BedrockToolChoice of(String type) {
        return new BedrockToolChoice(type, null);
    }
}
