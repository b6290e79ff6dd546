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
 * Mistral and Mixtral instruct models.
 */
@Slf4j
public class MistralStrategy extends AbstractBedrockStrategy {

    private static final InstructionPrompt PROMPT = InstructionPrompt.mistral();

    private static final Map<String, FinishReason> FINISH_REASONS = Map.of(
            "stop", FinishReason.STOP,
            "length", FinishReason.LENGTH,
            "model_length", FinishReason.LENGTH
    );

    public MistralStrategy(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper) {
        super(modelId, defaults, objectMapper);
        log.info("MistralStrategy initialized for model: {}", modelId);
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.MISTRAL;
    }

    @Override
    protected String providerName() {
        return "Mistral";
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
        payload.put("max_tokens", resolveMaxTokens(request));
        payload.put("temperature", resolveTemperature(request));
        putSamplingParameters(payload, request, "top_p", "top_k", "stop");

        log.debug("Mistral formatted request payload: {}", payload);
        return payload;
    }

    @Override
    public ChatCompletionResponse parseResponse(JsonNode providerResponse, ChatCompletionRequest request) {
        JsonNode output = firstResult(providerResponse, "outputs");
        String finishReason = mapFinishReason(textField(output, "stop_reason"));
        return textResponse(
                output.path("text").asText(""),
                finishReason != null ? finishReason : FinishReason.STOP.value(),
                tokenCount(providerResponse.get("prompt_token_count")),
                tokenCount(providerResponse.get("generation_token_count")));
    }

    @Override
    public ChatCompletionChunk handleStreamChunk(JsonNode event, ChatCompletionRequest request,
                                                 String streamId, long created) {
        JsonNode outputs = event.path("outputs");
        JsonNode output = outputs.isArray() && !outputs.isEmpty() ? outputs.get(0) : event;
        String text = textField(output, "text");
        String finishReason = mapFinishReason(textField(output, "stop_reason"));
        if ((text == null || text.isEmpty()) && finishReason == null) {
            return emptyChunk(streamId, created);
        }
        return textChunk(streamId, created, text, finishReason);
    }
}
