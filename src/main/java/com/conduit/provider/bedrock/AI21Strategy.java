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

import java.util.Map;

/**
 * AI21 Labs models (Jurassic, Jamba) through the prompt completion API.
 */
@Slf4j
public class AI21Strategy extends AbstractBedrockStrategy {

    private static final RolePrefixedPrompt PROMPT = RolePrefixedPrompt.of("Assistant", "\n\n");

    private static final Map<String, FinishReason> FINISH_REASONS = Map.of(
            "endoftext", FinishReason.STOP,
            "length", FinishReason.LENGTH,
            "stop", FinishReason.STOP
    );

    public AI21Strategy(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper) {
        super(modelId, defaults, objectMapper);
        log.info("AI21Strategy initialized for model: {}", modelId);
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.AI21;
    }

    @Override
    protected String providerName() {
        return "AI21";
    }

    @Override
    protected Map<String, FinishReason> finishReasons() {
        return FINISH_REASONS;
    }

    @Override
    public ObjectNode prepareRequestPayload(ChatCompletionRequest request) {
        rejectTools(request);
        PromptParts parts = splitSystemPrompt(request.getMessages());

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("prompt", PROMPT.render(parts.getSystemPrompt(), parts.getConversation(), this::textOf));
        payload.put("maxTokens", resolveMaxTokens(request));
        payload.put("temperature", resolveTemperature(request));
        putSamplingParameters(payload, request, "topP", null, "stopSequences");

        log.debug("AI21 formatted request payload: {}", payload);
        return payload;
    }

    @Override
    public ChatCompletionResponse parseResponse(JsonNode providerResponse, ChatCompletionRequest request) {
        JsonNode completion = firstResult(providerResponse, "completions");
        JsonNode data = completion.path("data");
        String finishReason = mapFinishReason(textField(completion.path("finishReason"), "reason"));
        return textResponse(
                data.path("text").asText(""),
                finishReason != null ? finishReason : FinishReason.STOP.value(),
                tokenCount(providerResponse.path("prompt").get("tokens")),
                tokenCount(data.get("tokens")));
    }

    @Override
    public ChatCompletionChunk handleStreamChunk(JsonNode event, ChatCompletionRequest request,
                                                 String streamId, long created) {
        JsonNode completion = event.path("completion");
        String text = textField(completion.path("data"), "text");
        String finishReason = mapFinishReason(textField(completion.path("finishReason"), "reason"));
        if ((text == null || text.isEmpty()) && finishReason == null) {
            return emptyChunk(streamId, created);
        }
        return textChunk(streamId, created, text, finishReason);
    }
}
