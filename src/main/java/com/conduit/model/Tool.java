package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * A tool the model may call.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Tool {

    @JsonProperty("type")
    String type;

    @JsonProperty("function")
    ToolFunction function;

    @JsonCreator
    public Tool(@JsonProperty("type") String type, @JsonProperty("function") ToolFunction function) {
        this.type = type;
        this.function = function;
    }

    public static Tool function(String name, String description, JsonNode parameters) {
        return new Tool(ToolCall.TYPE_FUNCTION, new ToolFunction(name, description, parameters));
    }

    /**
     * @return true when type and function name, description and parameters are all present
     */
    @JsonIgnore
    public boolean isComplete() {
        return type != null
                && function != null
                && function.getName() != null
                && function.getDescription() != null
                && function.getParameters() != null;
    }
}
