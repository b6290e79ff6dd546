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
 * Writer Palmyra models.
 */
@Slf4j
public class WriterStrategy extends AbstractBedrockStrategy {

    private static final RolePrefixedPrompt PROMPT = RolePrefixedPrompt.of("Assistant", "\n\n");

    private static final Map<String, FinishReason> FINISH_REASONS = Map.of(
            "stop", FinishReason.STOP,
            "length", FinishReason.LENGTH,
            "maxtokens", FinishReason.LENGTH
    );

    public WriterStrategy(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper) {
        super(modelId, defaults, objectMapper);
        log.info("WriterStrategy initialized for model: {}", modelId);
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.WRITER;
    }

    @Override
    protected String providerName() {
        return "Writer";
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
        putSamplingParameters(payload, request, "topP", "topK", "stopSequences");

        log.debug("Writer formatted request payload: {}", payload);
        return payload;
    }

    @Override
    public ChatCompletionResponse parseResponse(JsonNode providerResponse, ChatCompletionRequest request) {
        JsonNode completion = firstResult(providerResponse, "completions");
        JsonNode usage = providerResponse.path("usage");
        String finishReason = mapFinishReason(textField(completion, "finishReason"));
        return textResponse(
                completion.path("data").path("text").asText(""),
                finishReason != null ? finishReason : FinishReason.STOP.value(),
                tokenCount(usage.get("promptTokens")),
                tokenCount(usage.get("completionTokens")));
    }

    @Override
    public ChatCompletionChunk handleStreamChunk(JsonNode event, ChatCompletionRequest request,
                                                 String streamId, long created) {
        JsonNode completion = event.path("completion");
        String text = textField(completion.path("data"), "text");
        String finishReason = mapFinishReason(textField(completion, "finishReason"));
        if ((text == null || text.isEmpty()) && finishReason == null) {
            return emptyChunk(streamId, created);
        }
        return textChunk(streamId, created, text, finishReason);
    }
}
