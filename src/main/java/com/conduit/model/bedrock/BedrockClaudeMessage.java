package com.conduit.model.bedrock;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.Value;

import java.util.List;

@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class BedrockClaudeMessage {

    @JsonProperty("role")
    String role;

    @JsonProperty("content")
    List<BedrockContentBlock> content;

    @JsonCreator
    public BedrockClaudeMessage(
            @JsonProperty("role") String role,
            @JsonProperty("content") @JsonDeserialize(using = BedrockContentListDeserializer.class)
            List<BedrockContentBlock> content) {
        if (!"user".equals(role) && !"assistant".equals(role)) {
            throw new IllegalArgumentException("Claude message role must be 'user' or 'assistant', got " + role);
        }
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("Claude message content must not be empty");
        }
        this.role = role;
        this.content = List.copyOf(content);
    }
}
