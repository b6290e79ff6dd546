package com.conduit.provider.bedrock;

import com.conduit.exception.ModelNotFoundException;
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

import java.util.Map;

/**
 * Amazon Titan text models. Conversation is rendered as {@code User:}/{@code Bot:} lines.
 */
@Slf4j
public class TitanStrategy extends AbstractBedrockStrategy {

    private static final RolePrefixedPrompt PROMPT = RolePrefixedPrompt.withNamedTools("Bot", "\n");

    private static final Map<String, FinishReason> FINISH_REASONS = Map.of(
            "FINISH", FinishReason.STOP,
            "LENGTH", FinishReason.LENGTH,
            "CONTENT_FILTERED", FinishReason.CONTENT_FILTER
    );

    public TitanStrategy(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper) {
        super(modelId, defaults, objectMapper);
        if (modelId.contains("embed")) {
            throw new ModelNotFoundException("Titan embedding model " + modelId
                    + " cannot serve chat completions");
        }
        log.info("TitanStrategy initialized for model: {}", modelId);
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.TITAN;
    }

    @Override
    protected String providerName() {
        return "Titan";
    }

    @Override
    protected Map<String, FinishReason> finishReasons() {
        return FINISH_REASONS;
    }

    @Override
    protected String normalizeFinishKey(String providerReason) {
        return providerReason;
    }

    @Override
    public ObjectNode prepareRequestPayload(ChatCompletionRequest request) {
        rejectTools(request);
        PromptParts parts = splitSystemPrompt(request.getMessages());

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("inputText", PROMPT.render(parts.getSystemPrompt(), parts.getConversation(), this::textOf));

        ObjectNode config = payload.putObject("textGenerationConfig");
        config.put("maxTokenCount", resolveMaxTokens(request));
        config.put("temperature", resolveTemperature(request));
        putSamplingParameters(config, request, "topP", null, "stopSequences");

        log.debug("Titan formatted request payload: {}", payload);
        return payload;
    }

    @Override
    public ChatCompletionResponse parseResponse(JsonNode providerResponse, ChatCompletionRequest request) {
        JsonNode result = firstResult(providerResponse, "results");
        String finishReason = mapFinishReason(textField(result, "completionReason"));
        return textResponse(
                result.path("outputText").asText(""),
                finishReason != null ? finishReason : FinishReason.STOP.value(),
                tokenCount(providerResponse.get("inputTextTokenCount")),
                tokenCount(result.get("tokenCount")));
    }

    @Override
    public ChatCompletionChunk handleStreamChunk(JsonNode event, ChatCompletionRequest request,
                                                 String streamId, long created) {
        String text = textField(event, "outputText");
        String finishReason = mapFinishReason(textField(event, "completionReason"));
        if ((text == null || text.isEmpty()) && finishReason == null) {
            log.debug("Skipping Titan stream chunk with no content or finish reason");
            return emptyChunk(streamId, created);
        }
        return textChunk(streamId, created, text, finishReason);
    }
}
