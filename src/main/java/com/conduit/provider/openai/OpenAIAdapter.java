package com.conduit.provider.openai;

import com.conduit.client.OpenAIChatClient;
import com.conduit.exception.ApiRequestException;
import com.conduit.exception.ConfigurationException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.Choice;
import com.conduit.model.Delta;
import com.conduit.model.Message;
import com.conduit.model.ModelFamily;
import com.conduit.model.ToolCall;
import com.conduit.model.Usage;
import com.conduit.provider.ChatAdapter;
import com.conduit.provider.GenerationDefaults;
import com.conduit.provider.GenerationDefaultsProvider;
import com.conduit.provider.StreamTermination;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Adapter for native OpenAI chat models. The canonical shape already is the OpenAI shape,
 * so requests map field for field; responses are normalized and streamed tool-call
 * deltas are reassembled by index.
 */
@Slf4j
public class OpenAIAdapter implements ChatAdapter {

    private final String modelId;
    private final OpenAIChatClient client;
    private final GenerationDefaults defaults;
    private final ObjectMapper objectMapper;

    public OpenAIAdapter(String modelId, OpenAIChatClient client, GenerationDefaultsProvider defaults,
                         ObjectMapper objectMapper) {
        if (!client.isConfigured()) {
            throw new ConfigurationException("OpenAI client is not configured; set conduit.openai.api-key "
                    + "(OPENAI_API_KEY)");
        }
        this.modelId = modelId;
        this.client = client;
        this.defaults = defaults.defaultsFor(ModelFamily.OPENAI);
        this.objectMapper = objectMapper;
        log.info("OpenAIAdapter initialized for model: {}", modelId);
    }

    @Override
    public String getName() {
        return "openai";
    }

    @Override
    public String getModelId() {
        return modelId;
    }

    @Override
    public Mono<ChatCompletionResponse> chatCompletion(ChatCompletionRequest request) {
        if (request.isStreaming()) {
            return Mono.error(new ApiRequestException(
                    "chatCompletion called with stream=true; use streamChatCompletion for streaming"));
        }
        return Mono.defer(() -> {
            ObjectNode payload = buildPayload(request, false);
            log.info("Forwarding request to OpenAI: model={}", modelId);
            return client.createChatCompletion(payload).map(this::toResponse);
        });
    }

    @Override
    public Flux<ChatCompletionChunk> streamChatCompletion(ChatCompletionRequest request) {
        ObjectNode payload = buildPayload(request, true);
        String fallbackId = "chatcmpl-" + UUID.randomUUID();
        long created = Instant.now().getEpochSecond();

        Flux<ChatCompletionChunk> chunks = Flux.defer(() -> {
            log.info("Streaming from OpenAI: model={}", modelId);
            ToolCallAccumulator toolCalls = new ToolCallAccumulator();
            return client.streamChatCompletion(payload)
                    .map(event -> toChunk(event, toolCalls, fallbackId, created))
                    .filter(ChatCompletionChunk::hasChoices)
                    .doOnComplete(() -> log.debug("OpenAI stream for {} finished with {} tool call(s)",
                            modelId, toolCalls.assembled().size()));
        });
        return StreamTermination.endOnce(chunks, fallbackId, created, modelId);
    }

    /**
     * Native OpenAI payload for a canonical request.
     */
    ObjectNode buildPayload(ChatCompletionRequest request, boolean stream) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", modelId);
        payload.set("messages", objectMapper.valueToTree(request.getMessages()));
        payload.put("temperature", request.getTemperature() != null
                ? request.getTemperature() : defaults.getTemperature());
        payload.put("max_tokens", request.getMaxTokens() != null
                ? request.getMaxTokens() : defaults.getMaxTokens());

        Double topP = request.getTopP() != null ? request.getTopP() : defaults.getTopP();
        if (topP != null) {
            payload.put("top_p", topP);
        }
        if (request.getStop() != null && !request.getStop().isEmpty()) {
            payload.set("stop", objectMapper.valueToTree(request.getStop()));
        }
        if (request.getPresencePenalty() != null) {
            payload.put("presence_penalty", request.getPresencePenalty());
        }
        if (request.getFrequencyPenalty() != null) {
            payload.put("frequency_penalty", request.getFrequencyPenalty());
        }
        if (request.getUser() != null) {
            payload.put("user", request.getUser());
        }
        if (request.getTools() != null && !request.getTools().isEmpty()) {
            payload.set("tools", objectMapper.valueToTree(request.getTools()));
        }
        if (request.getToolChoice() != null) {
            payload.set("tool_choice", request.getToolChoice());
        }
        if (stream) {
            payload.put("stream", true);
        }
        log.debug("OpenAI request payload: {}", payload);
        return payload;
    }

    ChatCompletionResponse toResponse(JsonNode body) {
        JsonNode choices = body.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new ApiRequestException("OpenAI response contained no choices (model: " + modelId + ")");
        }
        List<Choice> converted = new ArrayList<>(choices.size());
        for (JsonNode choice : choices) {
            JsonNode message = choice.path("message");
            List<ToolCall> toolCalls = readToolCalls(message.get("tool_calls"));
            JsonNode content = message.get("content");
            converted.add(Choice.builder()
                    .index(choice.path("index").asInt(converted.size()))
                    .message(Message.builder()
                            .role(message.path("role").asText(Message.ROLE_ASSISTANT))
                            .text(content == null || content.isNull() ? "" : content.asText())
                            .toolCalls(toolCalls)
                            .build())
                    .finishReason(textOrNull(choice.get("finish_reason")))
                    .build());
        }

        JsonNode usage = body.get("usage");
        return ChatCompletionResponse.builder()
                .id(body.path("id").asText("chatcmpl-" + UUID.randomUUID()))
                .created(body.path("created").asLong(Instant.now().getEpochSecond()))
                .model(body.path("model").asText(modelId))
                .choices(converted)
                .usage(usage == null || usage.isNull() ? null : Usage.builder()
                        .promptTokens(usage.path("prompt_tokens").asInt(0))
                        .completionTokens(usage.path("completion_tokens").asInt(0))
                        .totalTokens(usage.path("total_tokens").asInt(0))
                        .build())
                .systemFingerprint(textOrNull(body.get("system_fingerprint")))
                .build();
    }

    /**
     * Canonical chunk for one OpenAI stream event. Events without an id or created time
     * take the stream's own, so every chunk of a stream shares one id.
     */
    ChatCompletionChunk toChunk(JsonNode event, ToolCallAccumulator toolCalls, String streamId, long created) {
        List<ChatCompletionChunk.ChunkChoice> converted = new ArrayList<>();
        for (JsonNode choice : event.path("choices")) {
            JsonNode delta = choice.path("delta");
            List<ToolCall> deltaCalls = readToolCalls(delta.get("tool_calls"));
            converted.add(ChatCompletionChunk.ChunkChoice.builder()
                    .index(choice.path("index").asInt(0))
                    .delta(Delta.builder()
                            .role(textOrNull(delta.get("role")))
                            .content(textOrNull(delta.get("content")))
                            .toolCalls(deltaCalls != null ? toolCalls.merge(deltaCalls) : null)
                            .build())
                    .finishReason(textOrNull(choice.get("finish_reason")))
                    .build());
        }
        return ChatCompletionChunk.builder()
                .id(event.path("id").asText(streamId))
                .created(event.path("created").asLong(created))
                .model(event.path("model").asText(modelId))
                .choices(converted)
                .systemFingerprint(textOrNull(event.get("system_fingerprint")))
                .build();
    }

    private List<ToolCall> readToolCalls(JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            return null;
        }
        try {
            return Arrays.asList(objectMapper.treeToValue(node, ToolCall[].class));
        } catch (JsonProcessingException e) {
            throw new ApiRequestException("OpenAI returned malformed tool_calls (model: " + modelId + ")", e);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
