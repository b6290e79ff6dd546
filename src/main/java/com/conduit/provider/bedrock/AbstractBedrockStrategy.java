package com.conduit.provider.bedrock;

import com.conduit.exception.ApiRequestException;
import com.conduit.exception.UnsupportedFeatureException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.Choice;
import com.conduit.model.Delta;
import com.conduit.model.FinishReason;
import com.conduit.model.Message;
import com.conduit.model.MessageContent;
import com.conduit.model.ToolCall;
import com.conduit.model.Usage;
import com.conduit.provider.GenerationDefaults;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Shared plumbing for Bedrock strategies: system prompt extraction, default resolution,
 * finish-reason mapping and response/chunk construction.
 */
@Slf4j
public abstract class AbstractBedrockStrategy implements BedrockStrategy {

    protected final String modelId;
    protected final GenerationDefaults defaults;
    protected final ObjectMapper objectMapper;

    protected AbstractBedrockStrategy(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper) {
        this.modelId = modelId;
        this.defaults = defaults;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    /**
     * Human-readable provider name for logs and error messages.
     */
    protected abstract String providerName();

    /**
     * Provider stop vocabulary, keyed by {@link #normalizeFinishKey(String)}.
     */
    protected abstract Map<String, FinishReason> finishReasons();

    protected String normalizeFinishKey(String providerReason) {
        return providerReason.toLowerCase(Locale.ROOT);
    }

    /**
     * Map a provider stop reason to its canonical value. Unmapped values pass through.
     */
    protected String mapFinishReason(String providerReason) {
        if (providerReason == null) {
            return null;
        }
        FinishReason mapped = finishReasons().get(normalizeFinishKey(providerReason));
        return mapped != null ? mapped.value() : providerReason;
    }

    // ---- request side ----

    /**
     * Pull every system message out of the conversation and join their text with newlines.
     */
    protected PromptParts splitSystemPrompt(List<Message> messages) {
        List<String> systemParts = new ArrayList<>();
        List<Message> conversation = new ArrayList<>();
        for (Message message : messages) {
            if (Message.ROLE_SYSTEM.equals(message.getRole())) {
                systemParts.add(message.textContent());
            } else {
                conversation.add(message);
            }
        }
        String systemPrompt = systemParts.isEmpty() ? null : String.join("\n", systemParts);
        return new PromptParts(systemPrompt, List.copyOf(conversation));
    }

    protected void rejectTools(ChatCompletionRequest request) {
        if (request.isToolUseRequested()) {
            throw new UnsupportedFeatureException(providerName() + " models on Bedrock do not support tools "
                    + "or tool_choice (model: " + modelId + ")");
        }
    }

    protected int resolveMaxTokens(ChatCompletionRequest request) {
        return request.getMaxTokens() != null ? request.getMaxTokens() : defaults.getMaxTokens();
    }

    protected double resolveTemperature(ChatCompletionRequest request) {
        return request.getTemperature() != null ? request.getTemperature() : defaults.getTemperature();
    }

    protected Double resolveTopP(ChatCompletionRequest request) {
        return request.getTopP() != null ? request.getTopP() : defaults.getTopP();
    }

    protected Integer resolveTopK(ChatCompletionRequest request) {
        return request.getTopK() != null ? request.getTopK() : defaults.getTopK();
    }

    /**
     * @return the stop sequences to send, or null when there are none
     */
    protected List<String> resolveStopSequences(ChatCompletionRequest request) {
        List<String> stop = request.getStop() != null ? request.getStop() : defaults.getStopSequences();
        return stop == null || stop.isEmpty() ? null : stop;
    }

    /**
     * Write the optional sampling parameters under this provider's field names.
     * A null field name means the provider has no such parameter.
     */
    protected void putSamplingParameters(ObjectNode target, ChatCompletionRequest request,
                                         String topPField, String topKField, String stopField) {
        Double topP = resolveTopP(request);
        if (topPField != null && topP != null) {
            target.put(topPField, topP);
        }
        Integer topK = resolveTopK(request);
        if (topKField != null && topK != null) {
            target.put(topKField, topK);
        }
        List<String> stop = resolveStopSequences(request);
        if (stopField != null && stop != null) {
            target.set(stopField, stringArray(stop));
        }
    }

    /**
     * Flatten message content to text. Non-text blocks are dropped with a warning.
     */
    protected String textOf(Message message) {
        MessageContent content = message.getContent();
        if (content != null && !content.isText()) {
            boolean hasNonText = content.asBlocks().stream().anyMatch(block -> !"text".equals(block.getType()));
            if (hasNonText) {
                log.warn("{} model {} does not accept non-text content; only text parts are sent",
                        providerName(), modelId);
            }
        }
        return message.textContent();
    }

    protected boolean endsWithAssistantTurn(List<Message> conversation) {
        return !conversation.isEmpty()
                && Message.ROLE_ASSISTANT.equals(conversation.get(conversation.size() - 1).getRole());
    }

    protected ArrayNode stringArray(List<String> values) {
        ArrayNode array = objectMapper.createArrayNode();
        values.forEach(array::add);
        return array;
    }

    // ---- response side ----

    /**
     * First element of an array field, failing when the array is missing or empty.
     */
    protected JsonNode firstResult(JsonNode response, String field) {
        JsonNode results = response.path(field);
        if (!results.isArray() || results.isEmpty()) {
            throw new ApiRequestException(providerName() + " response contained no '" + field + "' (model: "
                    + modelId + ")");
        }
        return results.get(0);
    }

    protected String responseId() {
        return "bedrock-" + getFamily().configKey() + "-" + UUID.randomUUID();
    }

    protected static long now() {
        return Instant.now().getEpochSecond();
    }

    protected Message assistantMessage(String text, List<ToolCall> toolCalls) {
        boolean hasToolCalls = toolCalls != null && !toolCalls.isEmpty();
        Message.MessageBuilder builder = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .toolCalls(hasToolCalls ? toolCalls : null);
        if (!text.isEmpty() || !hasToolCalls) {
            builder.text(text);
        }
        return builder.build();
    }

    protected ChatCompletionResponse buildResponse(String id, String model, Message message,
                                                   String finishReason, Usage usage) {
        return ChatCompletionResponse.builder()
                .id(id)
                .created(now())
                .model(model)
                .choices(List.of(Choice.builder()
                        .index(0)
                        .message(message)
                        .finishReason(finishReason)
                        .build()))
                .usage(usage)
                .build();
    }

    protected ChatCompletionResponse textResponse(String text, String finishReason, int promptTokens,
                                                  int completionTokens) {
        return buildResponse(responseId(), modelId, assistantMessage(text, null), finishReason,
                Usage.of(promptTokens, completionTokens));
    }

    // ---- stream side ----

    protected ChatCompletionChunk chunk(String streamId, long created, Delta delta, String finishReason) {
        return ChatCompletionChunk.builder()
                .id(streamId)
                .created(created)
                .model(modelId)
                .choices(List.of(ChatCompletionChunk.ChunkChoice.builder()
                        .index(0)
                        .delta(delta)
                        .finishReason(finishReason)
                        .build()))
                .build();
    }

    /**
     * Chunk with optional text and optional finish reason; the role is always assistant.
     */
    protected ChatCompletionChunk textChunk(String streamId, long created, String text, String finishReason) {
        Delta delta = Delta.builder()
                .role(Message.ROLE_ASSISTANT)
                .content(text)
                .build();
        return chunk(streamId, created, delta, finishReason);
    }

    /**
     * Chunk carrying no choices, for metadata-only events.
     */
    protected ChatCompletionChunk emptyChunk(String streamId, long created) {
        return ChatCompletionChunk.builder()
                .id(streamId)
                .created(created)
                .model(modelId)
                .choices(List.of())
                .build();
    }

    // ---- JSON helpers ----

    /**
     * Text of a scalar field, or null when absent or JSON null.
     */
    protected static String textField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.isContainerNode() ? null : value.asText();
    }

    /**
     * Token count from a numeric field, or from the length of a token list. Absent means 0.
     */
    protected static int tokenCount(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return 0;
        }
        if (node.isArray()) {
            return node.size();
        }
        return node.asInt(0);
    }

    /**
     * Remaining conversation after system messages were extracted.
     */
    @Value
    protected static class PromptParts {
        String systemPrompt;
        List<Message> conversation;

        boolean hasSystemPrompt() {
            return systemPrompt != null;
        }
    }
}
