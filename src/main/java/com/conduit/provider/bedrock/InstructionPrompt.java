package com.conduit.provider.bedrock;

import com.conduit.model.Message;

import java.util.List;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Renders a conversation with {@code <s>[INST] ... [/INST]} instruction tokens, as used by
 * the Llama 2 and Mistral instruct formats.
 */
final class InstructionPrompt {

    private static final String OPEN = "<s>[INST] ";
    private static final String CLOSE = " [/INST]";

    private final UnaryOperator<String> systemBlock;
    private final String assistantClose;

    private InstructionPrompt(UnaryOperator<String> systemBlock, String assistantClose) {
        this.systemBlock = systemBlock;
        this.assistantClose = assistantClose;
    }

    static InstructionPrompt llama() {
        return new InstructionPrompt(system -> "<<SYS>>\n" + system + "\n<</SYS>>\n\n", " </s>");
    }

    static InstructionPrompt mistral() {
        return new InstructionPrompt(system -> system + "\n\n", "</s>");
    }

    String render(String systemPrompt, List<Message> conversation, Function<Message, String> text) {
        StringBuilder prompt = new StringBuilder(OPEN);
        if (systemPrompt != null) {
            prompt.append(systemBlock.apply(systemPrompt));
        }
        boolean started = false;
        for (Message message : conversation) {
            if (Message.ROLE_ASSISTANT.equals(message.getRole())) {
                prompt.append(' ').append(text.apply(message)).append(assistantClose);
                continue;
            }
            String turn = Message.ROLE_TOOL.equals(message.getRole())
                    ? "Tool Response: " + text.apply(message)
                    : text.apply(message);
            if (started) {
                prompt.append(OPEN);
            }
            prompt.append(turn).append(CLOSE);
            started = true;
        }
        boolean assistantSpokeLast = !conversation.isEmpty()
                && Message.ROLE_ASSISTANT.equals(conversation.get(conversation.size() - 1).getRole());
        if (!assistantSpokeLast && !prompt.toString().endsWith(CLOSE.trim())) {
            prompt.append(CLOSE);
        }
        return prompt.toString();
    }
}
