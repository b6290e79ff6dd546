package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Objects;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class TextBlock implements ContentBlock {

    public static final String TYPE = "text";

    @JsonProperty("text")
    String text;

    @JsonCreator
    public TextBlock(@JsonProperty("text") String text) {
        this.text = Objects.requireNonNull(text, "text block requires text");
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
