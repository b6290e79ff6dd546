package com.conduit.provider.reverse;

import com.conduit.exception.ApiRequestException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.Choice;
import com.conduit.model.ContentBlock;
import com.conduit.model.FinishReason;
import com.conduit.model.ImageBlock;
import com.conduit.model.Message;
import com.conduit.model.MessageContent;
import com.conduit.model.TextBlock;
import com.conduit.model.Tool;
import com.conduit.model.ToolCall;
import com.conduit.model.Usage;
import com.conduit.model.bedrock.BedrockClaudeMessage;
import com.conduit.model.bedrock.BedrockClaudeRequest;
import com.conduit.model.bedrock.BedrockClaudeResponse;
import com.conduit.model.bedrock.BedrockClaudeStreamEvent;
import com.conduit.model.bedrock.BedrockContentBlock;
import com.conduit.model.bedrock.BedrockTitanConfig;
import com.conduit.model.bedrock.BedrockTitanRequest;
import com.conduit.model.bedrock.BedrockTitanResponse;
import com.conduit.model.bedrock.BedrockTitanStreamChunk;
import com.conduit.model.bedrock.BedrockTool;
import com.conduit.model.bedrock.BedrockToolChoice;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts Bedrock-native Claude and Titan shapes to the canonical model and back.
 */
@Slf4j
public class BedrockFormatConverter {

    private static final Map<String, String> CLAUDE_STOP_REASONS = Map.of(
            FinishReason.STOP.value(), "end_turn",
            FinishReason.LENGTH.value(), "max_tokens",
            FinishReason.TOOL_CALLS.value(), "tool_use",
            FinishReason.CONTENT_FILTER.value(), "stop_sequence"
    );

    private static final Map<String, String> TITAN_COMPLETION_REASONS = Map.of(
            FinishReason.STOP.value(), "FINISH",
            FinishReason.LENGTH.value(), "LENGTH",
            FinishReason.CONTENT_FILTER.value(), "CONTENT_FILTERED"
    );

    private final ObjectMapper objectMapper;

    public BedrockFormatConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ---- Bedrock request -> canonical ----

    /**
     * Canonical request for a Claude-shaped request. Consecutive tool results in a user turn
     * become canonical tool messages; tool_use blocks become assistant tool calls.
     *
     * @throws IllegalArgumentException when the converted messages are not valid canonical messages
     */
    public ChatCompletionRequest fromClaude(BedrockClaudeRequest request, String model) {
        List<Message> messages = new ArrayList<>();
        if (request.getSystem() != null && !request.getSystem().isEmpty()) {
            messages.add(Message.system(request.getSystem()));
        }
        for (BedrockClaudeMessage message : request.getMessages()) {
            if (Message.ROLE_ASSISTANT.equals(message.getRole())) {
                messages.add(assistantMessage(message.getContent()));
            } else {
                messages.addAll(userMessages(message.getContent()));
            }
        }

        return ChatCompletionRequest.builder()
                .model(model)
                .messages(messages)
                .maxTokens(request.getMaxTokens())
                .temperature(request.getTemperature())
                .topP(request.getTopP())
                .topK(request.getTopK())
                .stop(request.getStopSequences())
                .tools(convertTools(request.getTools()))
                .toolChoice(convertToolChoice(request.getToolChoice()))
                .stream(request.getStream())
                .build();
    }

    public ChatCompletionRequest fromTitan(BedrockTitanRequest request, String model) {
        BedrockTitanConfig config = request.getTextGenerationConfig();
        return ChatCompletionRequest.builder()
                .model(model)
                .messages(List.of(Message.user(request.getInputText())))
                .maxTokens(config.getMaxTokenCount())
                .temperature(config.getTemperature())
                .topP(config.getTopP())
                .stop(config.getStopSequences())
                .stream(request.getStream())
                .build();
    }

    private List<Message> userMessages(List<BedrockContentBlock> blocks) {
        List<Message> messages = new ArrayList<>();
        List<ContentBlock> content = new ArrayList<>();
        for (BedrockContentBlock block : blocks) {
            switch (block.getType()) {
                case BedrockContentBlock.TYPE_TOOL_RESULT -> messages.add(Message.builder()
                        .role(Message.ROLE_TOOL)
                        .toolCallId(block.getToolUseId())
                        .text(block.toolResultText())
                        .build());
                case BedrockContentBlock.TYPE_TEXT -> content.add(new TextBlock(nullToEmpty(block.getText())));
                case BedrockContentBlock.TYPE_IMAGE -> {
                    if (block.getSource() != null) {
                        content.add(ImageBlock.fromBase64(block.getSource().getMediaType(),
                                block.getSource().getData()));
                    }
                }
                default -> log.warn("Dropping unsupported Claude content block of type {} in user turn",
                        block.getType());
            }
        }
        if (!content.isEmpty()) {
            messages.add(Message.builder()
                    .role(Message.ROLE_USER)
                    .content(toContent(content))
                    .build());
        }
        return messages;
    }

    private Message assistantMessage(List<BedrockContentBlock> blocks) {
        List<ContentBlock> content = new ArrayList<>();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (BedrockContentBlock block : blocks) {
            switch (block.getType()) {
                case BedrockContentBlock.TYPE_TEXT -> content.add(new TextBlock(nullToEmpty(block.getText())));
                case BedrockContentBlock.TYPE_TOOL_USE -> toolCalls.add(ToolCall.function(
                        block.getId(),
                        block.getName(),
                        block.getInput() != null ? block.getInput().toString() : "{}"));
                default -> log.warn("Dropping unsupported Claude content block of type {} in assistant turn",
                        block.getType());
            }
        }
        Message.MessageBuilder builder = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls);
        if (!content.isEmpty()) {
            builder.content(toContent(content));
        }
        return builder.build();
    }

    /**
     * A single text block collapses to plain text content.
     */
    private static MessageContent toContent(List<ContentBlock> blocks) {
        if (blocks.size() == 1 && blocks.get(0) instanceof TextBlock) {
            return MessageContent.text(((TextBlock) blocks.get(0)).getText());
        }
        return MessageContent.blocks(blocks);
    }

    private static List<Tool> convertTools(List<BedrockTool> tools) {
        if (tools == null || tools.isEmpty()) {
            return null;
        }
        List<Tool> converted = new ArrayList<>(tools.size());
        for (BedrockTool tool : tools) {
            converted.add(Tool.function(tool.getName(), tool.getDescription(), tool.getInputSchema()));
        }
        return converted;
    }

    private JsonNode convertToolChoice(BedrockToolChoice choice) {
        if (choice == null) {
            return null;
        }
        return switch (choice.getType()) {
            case BedrockToolChoice.ANY -> TextNode.valueOf("required");
            case BedrockToolChoice.TOOL -> {
                ObjectNode named = objectMapper.createObjectNode();
                named.put("type", ToolCall.TYPE_FUNCTION);
                named.putObject("function").put("name", choice.getName());
                yield named;
            }
            default -> TextNode.valueOf("auto");
        };
    }

    // ---- canonical response -> Bedrock ----

    public BedrockClaudeResponse toClaudeResponse(ChatCompletionResponse response) {
        Choice choice = requireChoice(response);
        Message message = choice.getMessage();

        List<BedrockContentBlock> content = new ArrayList<>();
        String text = message != null ? message.textContent() : "";
        if (!text.isEmpty()) {
            content.add(BedrockContentBlock.text(text));
        }
        if (message != null && message.hasToolCalls()) {
            for (ToolCall call : message.getToolCalls()) {
                content.add(BedrockContentBlock.toolUse(call.getId(), call.getFunction().getName(),
                        parseArguments(call.getFunction().getArguments())));
            }
        }

        Usage usage = response.getUsage();
        return BedrockClaudeResponse.builder()
                .id(response.getId())
                .content(content)
                .model(response.getModel())
                .stopReason(claudeStopReason(choice.getFinishReason()))
                .usage(new BedrockClaudeResponse.Usage(
                        usage != null ? usage.getPromptTokens() : 0,
                        usage != null ? usage.getCompletionTokens() : 0))
                .build();
    }

    public BedrockTitanResponse toTitanResponse(ChatCompletionResponse response) {
        Choice choice = requireChoice(response);
        Usage usage = response.getUsage();
        String text = choice.getMessage() != null ? choice.getMessage().textContent() : "";
        return BedrockTitanResponse.builder()
                .inputTextTokenCount(usage != null ? usage.getPromptTokens() : 0)
                .results(List.of(new BedrockTitanResponse.Result(
                        usage != null ? usage.getCompletionTokens() : 0,
                        text,
                        titanCompletionReason(choice.getFinishReason()))))
                .build();
    }

    // ---- canonical chunk -> Bedrock stream events ----

    /**
     * Claude events for one chunk: a {@code content_block_delta} for text, a
     * {@code content_block_start} for each tool call whose id or name first appears here,
     * an {@code input_json_delta} for each argument fragment, and a {@code message_delta}
     * for a finish reason. Role-only and empty chunks yield nothing.
     *
     * <p>Text is block 0; tool call {@code n} is block {@code n + 1}.
     */
    public List<BedrockClaudeStreamEvent> toClaudeStreamEvents(ChatCompletionChunk chunk) {
        ChatCompletionChunk.ChunkChoice choice = chunk.firstChoice();
        if (choice == null) {
            return List.of();
        }
        List<BedrockClaudeStreamEvent> events = new ArrayList<>(2);
        String text = choice.getDelta() != null ? choice.getDelta().getContent() : null;
        if (text != null && !text.isEmpty()) {
            events.add(BedrockClaudeStreamEvent.textDelta(choice.getIndex(), text));
        }
        List<ToolCall> toolCalls = choice.getDelta() != null ? choice.getDelta().getToolCalls() : null;
        if (toolCalls != null) {
            for (int i = 0; i < toolCalls.size(); i++) {
                addToolUseEvents(events, toolCalls.get(i), i);
            }
        }
        if (choice.getFinishReason() != null) {
            events.add(BedrockClaudeStreamEvent.messageDelta(claudeStopReason(choice.getFinishReason())));
        }
        return events;
    }

    private static void addToolUseEvents(List<BedrockClaudeStreamEvent> events, ToolCall call, int position) {
        int block = (call.getIndex() != null ? call.getIndex() : position) + 1;
        String name = call.getFunction() != null ? call.getFunction().getName() : null;
        if (call.getId() != null || name != null) {
            events.add(BedrockClaudeStreamEvent.toolUseStart(block, call.getId(), name));
        }
        String fragment = call.getFunction() != null ? call.getFunction().getArguments() : null;
        if (fragment != null && !fragment.isEmpty()) {
            events.add(BedrockClaudeStreamEvent.inputJsonDelta(block, fragment));
        }
    }

    /**
     * Titan record for one chunk, or null when the chunk has neither text nor a finish reason.
     */
    public BedrockTitanStreamChunk toTitanStreamChunk(ChatCompletionChunk chunk) {
        ChatCompletionChunk.ChunkChoice choice = chunk.firstChoice();
        if (choice == null) {
            return null;
        }
        String text = choice.getDelta() != null ? choice.getDelta().getContent() : null;
        boolean hasText = text != null && !text.isEmpty();
        if (!hasText && choice.getFinishReason() == null) {
            return null;
        }
        return new BedrockTitanStreamChunk(
                hasText ? text : "",
                choice.getIndex(),
                null,
                choice.getFinishReason() != null ? titanCompletionReason(choice.getFinishReason()) : null);
    }

    static String claudeStopReason(String finishReason) {
        return finishReason == null ? "end_turn" : CLAUDE_STOP_REASONS.getOrDefault(finishReason, "end_turn");
    }

    static String titanCompletionReason(String finishReason) {
        return finishReason == null ? "FINISH" : TITAN_COMPLETION_REASONS.getOrDefault(finishReason, "FINISH");
    }

    private static Choice requireChoice(ChatCompletionResponse response) {
        Choice choice = response.firstChoice();
        if (choice == null) {
            throw new ApiRequestException("Response has no choices to convert to Bedrock format (model: "
                    + response.getModel() + ")");
        }
        return choice;
    }

    private JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            throw new ApiRequestException("Tool call arguments are not valid JSON: " + arguments, e);
        }
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
