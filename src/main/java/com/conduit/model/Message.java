package com.conduit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Set;

/**
 * Chat message. Validated on construction: the role must be known, a non-tool message
 * needs content or tool calls, and every tool call must be complete.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private static final Set<String> ROLES = Set.of(ROLE_SYSTEM, ROLE_USER, ROLE_ASSISTANT, ROLE_TOOL);

    @JsonProperty("role")
    String role;

    @JsonProperty("content")
    MessageContent content;

    @JsonProperty("name")
    String name;

    @JsonProperty("tool_call_id")
    String toolCallId;

    @JsonProperty("tool_calls")
    List<ToolCall> toolCalls;

    @Builder(toBuilder = true)
    @JsonCreator
    public Message(
            @JsonProperty("role") String role,
            @JsonProperty("content") MessageContent content,
            @JsonProperty("name") String name,
            @JsonProperty("tool_call_id") String toolCallId,
            @JsonProperty("tool_calls") List<ToolCall> toolCalls) {
        if (role == null || !ROLES.contains(role)) {
            throw new IllegalArgumentException("Invalid message role: " + role
                    + ". Must be one of system, user, assistant, tool");
        }
        if (toolCalls != null) {
            for (int i = 0; i < toolCalls.size(); i++) {
                ToolCall call = toolCalls.get(i);
                if (call == null || !call.isComplete()) {
                    throw new IllegalArgumentException("tool_calls[" + i
                            + "] must have id, type, function.name and function.arguments");
                }
            }
        }
        boolean hasToolCalls = toolCalls != null && !toolCalls.isEmpty();
        if (!ROLE_TOOL.equals(role) && content == null && !hasToolCalls) {
            throw new IllegalArgumentException("Message with role '" + role
                    + "' must have content or tool_calls");
        }

        this.role = role;
        this.content = content;
        this.name = name;
        this.toolCallId = toolCallId;
        this.toolCalls = toolCalls == null ? null : List.copyOf(toolCalls);
    }

    public static Message system(String text) {
        return builder().role(ROLE_SYSTEM).text(text).build();
    }

    public static Message user(String text) {
        return builder().role(ROLE_USER).text(text).build();
    }

    public static Message assistant(String text) {
        return builder().role(ROLE_ASSISTANT).text(text).build();
    }

    /**
     * Content flattened to text, or an empty string when there is none.
     */
    public String textContent() {
        return content != null ? content.asText() : "";
    }

    @JsonIgnore
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public static class MessageBuilder {

        public MessageBuilder text(String text) {
            this.content = MessageContent.text(text);
            return this;
        }
    }
}
