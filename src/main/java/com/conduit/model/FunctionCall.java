package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Function name and JSON-encoded arguments of a tool call. Either field may be
 * absent in a streamed delta.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class FunctionCall {

    @JsonProperty("name")
    String name;

    @JsonProperty("arguments")
    String arguments;

    @Builder
    @JsonCreator
    public FunctionCall(@JsonProperty("name") String name, @JsonProperty("arguments") String arguments) {
        this.name = name;
        this.arguments = arguments;
    }
}
