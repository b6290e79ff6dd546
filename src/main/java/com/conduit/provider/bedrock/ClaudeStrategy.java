package com.conduit.provider.bedrock;

import com.conduit.exception.ApiRequestException;
import com.conduit.exception.RequestValidationException;
import com.conduit.exception.UnsupportedFeatureException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.ContentBlock;
import com.conduit.model.Delta;
import com.conduit.model.FinishReason;
import com.conduit.model.FunctionCall;
import com.conduit.model.ImageBlock;
import com.conduit.model.Message;
import com.conduit.model.ModelFamily;
import com.conduit.model.TextBlock;
import com.conduit.model.Tool;
import com.conduit.model.ToolCall;
import com.conduit.model.ToolUseBlock;
import com.conduit.model.Usage;
import com.conduit.provider.GenerationDefaults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Anthropic Claude Messages API on Bedrock. Supports tools natively.
 *
 * <p>Finish reasons follow one priority rule: a {@code tool_use} stop reason always maps
 * to {@code tool_calls}; any other present stop reason goes through the mapping table; only
 * when the provider sends no stop reason is the result inferred from tool_use blocks.
 */
@Slf4j
public class ClaudeStrategy extends AbstractBedrockStrategy {

    static final String ANTHROPIC_VERSION = "bedrock-2023-05-31";

    private static final String STOP_REASON_TOOL_USE = "tool_use";

    private static final Map<String, FinishReason> FINISH_REASONS = Map.of(
            "end_turn", FinishReason.STOP,
            "max_tokens", FinishReason.LENGTH,
            "stop_sequence", FinishReason.STOP,
            STOP_REASON_TOOL_USE, FinishReason.TOOL_CALLS
    );

    public ClaudeStrategy(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper) {
        super(modelId, defaults, objectMapper);
        log.info("ClaudeStrategy initialized for model: {}", modelId);
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.CLAUDE;
    }

    @Override
    protected String providerName() {
        return "Claude";
    }

    @Override
    protected Map<String, FinishReason> finishReasons() {
        return FINISH_REASONS;
    }

    // Claude stop reasons are already lowercase and compared exactly
    @Override
    protected String normalizeFinishKey(String providerReason) {
        return providerReason;
    }

    @Override
    public ObjectNode prepareRequestPayload(ChatCompletionRequest request) {
        PromptParts parts = splitSystemPrompt(request.getMessages());

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("anthropic_version", ANTHROPIC_VERSION);
        payload.put("max_tokens", resolveMaxTokens(request));
        payload.put("temperature", resolveTemperature(request));
        if (parts.hasSystemPrompt()) {
            payload.put("system", parts.getSystemPrompt());
        }
        payload.set("messages", convertMessages(parts.getConversation()));
        putSamplingParameters(payload, request, "top_p", "top_k", "stop_sequences");

        boolean toolChoiceNone = request.getToolChoice() != null
                && "none".equals(request.getToolChoice().asText(null));
        if (request.getTools() != null && !request.getTools().isEmpty() && !toolChoiceNone) {
            payload.set("tools", convertTools(request.getTools()));
            if (request.getToolChoice() != null) {
                payload.set("tool_choice", convertToolChoice(request.getToolChoice()));
            }
        }

        log.debug("Claude formatted request payload for {}: {} messages", modelId, parts.getConversation().size());
        return payload;
    }

    private ArrayNode convertMessages(List<Message> conversation) {
        ArrayNode messages = objectMapper.createArrayNode();
        ObjectNode pendingToolResults = null;

        for (Message message : conversation) {
            if (Message.ROLE_TOOL.equals(message.getRole())) {
                // Consecutive tool results travel together in one user turn
                if (pendingToolResults == null) {
                    pendingToolResults = objectMapper.createObjectNode();
                    pendingToolResults.put("role", Message.ROLE_USER);
                    pendingToolResults.set("content", objectMapper.createArrayNode());
                    messages.add(pendingToolResults);
                }
                ObjectNode result = ((ArrayNode) pendingToolResults.get("content")).addObject();
                result.put("type", "tool_result");
                result.put("tool_use_id", message.getToolCallId());
                result.put("content", message.textContent());
                continue;
            }
            pendingToolResults = null;

            ObjectNode converted = messages.addObject();
            converted.put("role", message.getRole());
            if (Message.ROLE_ASSISTANT.equals(message.getRole()) && message.hasToolCalls()) {
                converted.set("content", assistantToolUseContent(message));
            } else if (message.getContent() != null && !message.getContent().isText()) {
                converted.set("content", convertBlocks(message.getContent().asBlocks()));
            } else {
                converted.put("content", message.textContent());
            }
        }
        return messages;
    }

    private ArrayNode assistantToolUseContent(Message message) {
        ArrayNode content = objectMapper.createArrayNode();
        String text = message.textContent();
        if (!text.isEmpty()) {
            content.addObject().put("type", "text").put("text", text);
        }
        for (ToolCall call : message.getToolCalls()) {
            ObjectNode toolUse = content.addObject();
            toolUse.put("type", "tool_use");
            toolUse.put("id", call.getId());
            toolUse.put("name", call.getFunction().getName());
            toolUse.set("input", parseArguments(call));
        }
        return content;
    }

    private JsonNode parseArguments(ToolCall call) {
        String arguments = call.getFunction().getArguments();
        if (arguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            throw new RequestValidationException("Arguments of tool call " + call.getId()
                    + " are not valid JSON", e);
        }
    }

    private ArrayNode convertBlocks(List<ContentBlock> blocks) {
        ArrayNode content = objectMapper.createArrayNode();
        for (ContentBlock block : blocks) {
            if (block instanceof TextBlock) {
                content.addObject().put("type", "text").put("text", ((TextBlock) block).getText());
            } else if (block instanceof ImageBlock) {
                ImageBlock image = (ImageBlock) block;
                if (!image.isDataUrl()) {
                    throw new UnsupportedFeatureException("Claude on Bedrock only accepts base64 data URL images");
                }
                ObjectNode imageNode = content.addObject();
                imageNode.put("type", "image");
                imageNode.putObject("source")
                        .put("type", "base64")
                        .put("media_type", image.mediaType())
                        .put("data", image.base64Data());
            } else if (block instanceof ToolUseBlock) {
                ToolUseBlock toolUse = (ToolUseBlock) block;
                content.addObject()
                        .put("type", "tool_use")
                        .put("id", toolUse.getId())
                        .put("name", toolUse.getName())
                        .set("input", toolUse.getInput() != null ? toolUse.getInput() : objectMapper.createObjectNode());
            }
        }
        return content;
    }

    private ArrayNode convertTools(List<Tool> tools) {
        ArrayNode converted = objectMapper.createArrayNode();
        for (Tool tool : tools) {
            ObjectNode node = converted.addObject();
            node.put("name", tool.getFunction().getName());
            node.put("description", tool.getFunction().getDescription());
            node.set("input_schema", tool.getFunction().getParameters());
        }
        return converted;
    }

    // OpenAI tool_choice -> Claude: "auto" -> auto, "required" -> any, named function -> tool
    private ObjectNode convertToolChoice(JsonNode toolChoice) {
        ObjectNode choice = objectMapper.createObjectNode();
        if (toolChoice.isTextual()) {
            choice.put("type", "required".equals(toolChoice.asText()) ? "any" : "auto");
            return choice;
        }
        String functionName = toolChoice.path("function").path("name").asText(null);
        if (functionName != null) {
            choice.put("type", "tool");
            choice.put("name", functionName);
        } else {
            choice.put("type", "auto");
        }
        return choice;
    }

    @Override
    public ChatCompletionResponse parseResponse(JsonNode providerResponse, ChatCompletionRequest request) {
        JsonNode content = providerResponse.path("content");
        if (!content.isArray()) {
            throw new ApiRequestException("Claude response contained no 'content' array (model: " + modelId + ")");
        }

        StringBuilder text = new StringBuilder();
        List<ToolCall> toolCalls = new ArrayList<>();
        for (JsonNode block : content) {
            String type = textField(block, "type");
            if ("text".equals(type)) {
                text.append(block.path("text").asText(""));
            } else if ("tool_use".equals(type)) {
                toolCalls.add(ToolCall.function(
                        textField(block, "id"),
                        textField(block, "name"),
                        block.has("input") ? block.get("input").toString() : "{}"));
            }
        }

        String finishReason = resolveFinishReason(textField(providerResponse, "stop_reason"), !toolCalls.isEmpty());

        JsonNode usage = providerResponse.path("usage");
        String id = textField(providerResponse, "id");
        String model = textField(providerResponse, "model");

        return buildResponse(
                id != null ? id : responseId(),
                model != null ? model : modelId,
                assistantMessage(text.toString(), toolCalls),
                finishReason,
                Usage.of(tokenCount(usage.get("input_tokens")), tokenCount(usage.get("output_tokens"))));
    }

    String resolveFinishReason(String stopReason, boolean hasToolUse) {
        if (STOP_REASON_TOOL_USE.equals(stopReason)) {
            return FinishReason.TOOL_CALLS.value();
        }
        if (stopReason != null) {
            return mapFinishReason(stopReason);
        }
        return hasToolUse ? FinishReason.TOOL_CALLS.value() : FinishReason.STOP.value();
    }

    /**
     * Translate a Claude stream event. Tool-call deltas are indexed by the content block
     * index reported by Claude.
     */
    @Override
    public ChatCompletionChunk handleStreamChunk(JsonNode event, ChatCompletionRequest request,
                                                 String streamId, long created) {
        String type = textField(event, "type");
        if (type == null) {
            return emptyChunk(streamId, created);
        }

        return switch (type) {
            case "content_block_start" -> blockStart(event, streamId, created);
            case "content_block_delta" -> blockDelta(event, streamId, created);
            case "message_delta" -> messageDelta(event, streamId, created);
            // message_start, content_block_stop, message_stop, ping
            default -> emptyChunk(streamId, created);
        };
    }

    private ChatCompletionChunk blockStart(JsonNode event, String streamId, long created) {
        JsonNode block = event.path("content_block");
        if (!"tool_use".equals(textField(block, "type"))) {
            return emptyChunk(streamId, created);
        }
        ToolCall call = new ToolCall(event.path("index").asInt(0), textField(block, "id"),
                ToolCall.TYPE_FUNCTION, new FunctionCall(textField(block, "name"), ""));
        return toolCallChunk(streamId, created, call);
    }

    private ChatCompletionChunk blockDelta(JsonNode event, String streamId, long created) {
        JsonNode delta = event.path("delta");
        if ("input_json_delta".equals(textField(delta, "type"))) {
            ToolCall call = new ToolCall(event.path("index").asInt(0), null, null,
                    new FunctionCall(null, delta.path("partial_json").asText("")));
            return toolCallChunk(streamId, created, call);
        }
        // text_delta, or a bare text field
        String text = textField(delta, "text");
        return text != null ? textChunk(streamId, created, text, null) : emptyChunk(streamId, created);
    }

    private ChatCompletionChunk messageDelta(JsonNode event, String streamId, long created) {
        String stopReason = textField(event.path("delta"), "stop_reason");
        if (stopReason == null) {
            return emptyChunk(streamId, created);
        }
        return chunk(streamId, created, Delta.empty(), resolveFinishReason(stopReason, false));
    }

    private ChatCompletionChunk toolCallChunk(String streamId, long created, ToolCall call) {
        Delta delta = Delta.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(List.of(call))
                .build();
        return chunk(streamId, created, delta, null);
    }
}
