package com.conduit.provider.bedrock;

import com.conduit.exception.ApiRequestException;
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
 * Meta Llama models, prompted with Llama 2 instruction tokens.
 */
@Slf4j
public class MetaStrategy extends AbstractBedrockStrategy {

    private static final InstructionPrompt PROMPT = InstructionPrompt.llama();

    private static final Map<String, FinishReason> FINISH_REASONS = Map.of(
            "stop", FinishReason.STOP,
            "length", FinishReason.LENGTH,
            "max_gen_len", FinishReason.LENGTH
    );

    public MetaStrategy(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper) {
        super(modelId, defaults, objectMapper);
        log.info("MetaStrategy initialized for model: {}", modelId);
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.META;
    }

    @Override
    protected String providerName() {
        return "Meta Llama";
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
        payload.put("max_gen_len", resolveMaxTokens(request));
        payload.put("temperature", resolveTemperature(request));
        putSamplingParameters(payload, request, "top_p", null, null);

        log.debug("Meta Llama formatted request payload: {}", payload);
        return payload;
    }

    @Override
    public ChatCompletionResponse parseResponse(JsonNode providerResponse, ChatCompletionRequest request) {
        JsonNode generation = providerResponse.get("generation");
        if (generation == null || generation.isNull()) {
            throw new ApiRequestException(
                    "Meta Llama response contained no 'generation' (model: " + modelId + ")");
        }
        String finishReason = mapFinishReason(textField(providerResponse, "stop_reason"));
        return textResponse(
                generation.asText(""),
                finishReason != null ? finishReason : FinishReason.STOP.value(),
                tokenCount(providerResponse.get("prompt_token_count")),
                tokenCount(providerResponse.get("generation_token_count")));
    }

    @Override
    public ChatCompletionChunk handleStreamChunk(JsonNode event, ChatCompletionRequest request,
                                                 String streamId, long created) {
        String text = textField(event, "generation");
        String finishReason = mapFinishReason(textField(event, "stop_reason"));
        if ((text == null || text.isEmpty()) && finishReason == null) {
            return emptyChunk(streamId, created);
        }
        return textChunk(streamId, created, text, finishReason);
    }
}
