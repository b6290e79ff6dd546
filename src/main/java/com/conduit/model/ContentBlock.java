package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One element of a multi-part message content list.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextBlock.class, name = TextBlock.TYPE),
        @JsonSubTypes.Type(value = ImageBlock.class, name = ImageBlock.TYPE),
        @JsonSubTypes.Type(value = ToolUseBlock.class, name = ToolUseBlock.TYPE)
})
public interface ContentBlock {

    String getType();
}
