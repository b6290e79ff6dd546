package com.conduit.provider.bedrock;

import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.FinishReason;
import com.conduit.model.ModelFamily;
import com.conduit.provider.GenerationDefaults;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;

/**
 * Cohere Command models through the generate API.
 */
@Slf4j
public class CohereStrategy extends AbstractBedrockStrategy {

    private static final RolePrefixedPrompt PROMPT = RolePrefixedPrompt.of("Chatbot", "\n\n");

    private static final Map<String, FinishReason> FINISH_REASONS = Map.of(
            "COMPLETE", FinishReason.STOP,
            "MAX_TOKENS", FinishReason.LENGTH,
            "ERROR", FinishReason.STOP,
            "ERROR_TOXIC", FinishReason.CONTENT_FILTER
    );

    public CohereStrategy(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper) {
        super(modelId, defaults, objectMapper);
        log.info("CohereStrategy initialized for model: {}", modelId);
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.COHERE;
    }

    @Override
    protected String providerName() {
        return "Cohere";
    }

    @Override
    protected Map<String, FinishReason> finishReasons() {
        return FINISH_REASONS;
    }

    @Override
    protected String normalizeFinishKey(String providerReason) {
        return providerReason.toUpperCase(Locale.ROOT);
    }

    @Override
    public ObjectNode prepareRequestPayload(ChatCompletionRequest request) {
        rejectTools(request);
        PromptParts parts = splitSystemPrompt(request.getMessages());

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("prompt", PROMPT.render(parts.getSystemPrompt(), parts.getConversation(), this::textOf));
        payload.put("max_tokens", resolveMaxTokens(request));
        payload.put("temperature", resolveTemperature(request));
        putSamplingParameters(payload, request, "p", "k", "stop_sequences");

        log.debug("Cohere formatted request payload: {}", payload);
        return payload;
    }

    @Override
    public ChatCompletionResponse parseResponse(JsonNode providerResponse, ChatCompletionRequest request) {
        JsonNode generation = firstResult(providerResponse, "generations");
        JsonNode billedUnits = providerResponse.path("meta").path("billed_units");
        String finishReason = mapFinishReason(textField(generation, "finish_reason"));
        return textResponse(
                generation.path("text").asText(""),
                finishReason != null ? finishReason : FinishReason.STOP.value(),
                tokenCount(billedUnits.get("input_tokens")),
                tokenCount(billedUnits.get("output_tokens")));
    }

    @Override
    public ChatCompletionChunk handleStreamChunk(JsonNode event, ChatCompletionRequest request,
                                                 String streamId, long created) {
        String text = textField(event, "text");
        String finishReason = mapFinishReason(textField(event, "finish_reason"));
        if ((text == null || text.isEmpty()) && finishReason == null) {
            return emptyChunk(streamId, created);
        }
        return textChunk(streamId, created, text, finishReason);
    }
}
