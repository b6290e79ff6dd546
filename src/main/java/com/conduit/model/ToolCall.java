package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * A tool call made by the assistant. In streamed deltas only {@code index} is
 * guaranteed; complete calls inside a {@link Message} are validated there.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ToolCall {

    public static final String TYPE_FUNCTION = "function";

    @JsonProperty("index")
    Integer index;

    @JsonProperty("id")
    String id;

    @JsonProperty("type")
    String type;

    @JsonProperty("function")
    FunctionCall function;

    @Builder(toBuilder = true)
    @JsonCreator
    public ToolCall(
            @JsonProperty("index") Integer index,
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("function") FunctionCall function) {
        this.index = index;
        this.id = id;
        this.type = type;
        this.function = function;
    }

    public static ToolCall function(String id, String name, String arguments) {
        return new ToolCall(null, id, TYPE_FUNCTION, new FunctionCall(name, arguments));
    }

    /**
     * @return true when id, type, function name and arguments are all present
     */
    @JsonIgnore
    public boolean isComplete() {
        return id != null
                && type != null
                && function != null
                && function.getName() != null
                && function.getArguments() != null;
    }
}
