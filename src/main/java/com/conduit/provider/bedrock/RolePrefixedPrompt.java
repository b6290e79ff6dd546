package com.conduit.provider.bedrock;

import com.conduit.model.Message;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Renders a conversation as role-prefixed lines ({@code System:}, {@code User:} and an
 * assistant label), ending with a bare assistant cue unless the assistant spoke last.
 */
final class RolePrefixedPrompt {

    private final String assistantLabel;
    private final String separator;
    private final Function<Message, String> toolLabel;

    private RolePrefixedPrompt(String assistantLabel, String separator, Function<Message, String> toolLabel) {
        this.assistantLabel = assistantLabel;
        this.separator = separator;
        this.toolLabel = toolLabel;
    }

    static RolePrefixedPrompt of(String assistantLabel, String separator) {
        return new RolePrefixedPrompt(assistantLabel, separator, message -> "User (Tool Response)");
    }

    /**
     * Variant that names the tool in the label of tool responses.
     */
    static RolePrefixedPrompt withNamedTools(String assistantLabel, String separator) {
        return new RolePrefixedPrompt(assistantLabel, separator, message ->
                "User (Tool Response - " + (message.getName() != null ? message.getName() : "unknown_tool") + ")");
    }

    String render(String systemPrompt, List<Message> conversation, Function<Message, String> text) {
        List<String> parts = new ArrayList<>();
        if (systemPrompt != null) {
            parts.add("System: " + systemPrompt);
        }
        for (Message message : conversation) {
            String label = switch (message.getRole()) {
                case Message.ROLE_ASSISTANT -> assistantLabel;
                case Message.ROLE_TOOL -> toolLabel.apply(message);
                default -> "User";
            };
            parts.add(label + ": " + text.apply(message));
        }
        boolean assistantSpokeLast = !conversation.isEmpty()
                && Message.ROLE_ASSISTANT.equals(conversation.get(conversation.size() - 1).getRole());
        if (!assistantSpokeLast) {
            parts.add(assistantLabel + ":");
        }
        return String.join(separator, parts);
    }
}
