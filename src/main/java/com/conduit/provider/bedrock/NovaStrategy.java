package com.conduit.provider.bedrock;

import com.conduit.exception.ApiRequestException;
import com.conduit.exception.UnsupportedFeatureException;
import com.conduit.model.ChatCompletionChunk;
import com.conduit.model.ChatCompletionRequest;
import com.conduit.model.ChatCompletionResponse;
import com.conduit.model.ContentBlock;
import com.conduit.model.Delta;
import com.conduit.model.FinishReason;
import com.conduit.model.ImageBlock;
import com.conduit.model.Message;
import com.conduit.model.ModelFamily;
import com.conduit.model.TextBlock;
import com.conduit.provider.GenerationDefaults;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Amazon Nova models through the {@code messages-v1} schema. Tools are not supported
 * through this path.
 *
 * <p>Stream events arrive either keyed by event name ({@code {"contentBlockDelta":{...}}})
 * or tagged with a {@code type} field; both are accepted.
 */
@Slf4j
public class NovaStrategy extends AbstractBedrockStrategy {

    private static final String SCHEMA_VERSION = "messages-v1";

    private static final Map<String, FinishReason> FINISH_REASONS = Map.of(
            "end_turn", FinishReason.STOP,
            "max_tokens", FinishReason.LENGTH,
            "stop_sequence", FinishReason.STOP,
            "content_filtered", FinishReason.CONTENT_FILTER
    );

    public NovaStrategy(String modelId, GenerationDefaults defaults, ObjectMapper objectMapper) {
        super(modelId, defaults, objectMapper);
        log.info("NovaStrategy initialized for model: {}", modelId);
    }

    @Override
    public ModelFamily getFamily() {
        return ModelFamily.NOVA;
    }

    @Override
    protected String providerName() {
        return "Nova";
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
        payload.put("schemaVersion", SCHEMA_VERSION);

        ArrayNode messages = payload.putArray("messages");
        for (Message message : parts.getConversation()) {
            ObjectNode converted = messages.addObject();
            if (Message.ROLE_TOOL.equals(message.getRole())) {
                converted.put("role", Message.ROLE_USER);
                converted.putArray("content").addObject().put("text", "Tool Response: " + message.textContent());
            } else {
                converted.put("role", message.getRole());
                converted.set("content", convertContent(message));
            }
        }

        if (parts.hasSystemPrompt()) {
            payload.putArray("system").addObject().put("text", parts.getSystemPrompt());
        }

        ObjectNode inferenceConfig = payload.putObject("inferenceConfig");
        inferenceConfig.put("maxTokens", resolveMaxTokens(request));
        inferenceConfig.put("temperature", resolveTemperature(request));
        putSamplingParameters(inferenceConfig, request, "topP", "topK", "stopSequences");

        log.debug("Nova formatted request payload for {}: {} messages", modelId, messages.size());
        return payload;
    }

    private ArrayNode convertContent(Message message) {
        ArrayNode content = objectMapper.createArrayNode();
        if (message.getContent() == null) {
            content.addObject().put("text", "");
            return content;
        }
        for (ContentBlock block : message.getContent().asBlocks()) {
            if (block instanceof TextBlock) {
                content.addObject().put("text", ((TextBlock) block).getText());
            } else if (block instanceof ImageBlock) {
                ImageBlock image = (ImageBlock) block;
                if (!image.isDataUrl()) {
                    throw new UnsupportedFeatureException("Nova on Bedrock only accepts base64 data URL images");
                }
                String mediaType = image.mediaType();
                ObjectNode imageNode = content.addObject().putObject("image");
                imageNode.put("format", mediaType.substring(mediaType.indexOf('/') + 1));
                imageNode.putObject("source").put("bytes", image.base64Data());
            }
        }
        return content;
    }

    @Override
    public ChatCompletionResponse parseResponse(JsonNode providerResponse, ChatCompletionRequest request) {
        JsonNode content = providerResponse.path("output").path("message").path("content");
        if (!content.isArray()) {
            throw new ApiRequestException("Nova response contained no 'output.message.content' (model: "
                    + modelId + ")");
        }

        StringBuilder text = new StringBuilder();
        for (JsonNode block : content) {
            if (block.hasNonNull("text")) {
                text.append(block.get("text").asText());
            }
        }

        String finishReason = mapFinishReason(textField(providerResponse, "stopReason"));
        JsonNode usage = providerResponse.path("usage");
        return textResponse(
                text.toString(),
                finishReason != null ? finishReason : FinishReason.STOP.value(),
                tokenCount(usage.get("inputTokens")),
                tokenCount(usage.get("outputTokens")));
    }

    @Override
    public ChatCompletionChunk handleStreamChunk(JsonNode event, ChatCompletionRequest request,
                                                 String streamId, long created) {
        String type = textField(event, "type");

        JsonNode blockDelta = event.has("contentBlockDelta")
                ? event.path("contentBlockDelta").path("delta")
                : "contentBlockDelta".equals(type) ? event.path("delta") : null;
        if (blockDelta != null) {
            String text = textField(blockDelta, "text");
            return text != null && !text.isEmpty()
                    ? textChunk(streamId, created, text, null)
                    : emptyChunk(streamId, created);
        }

        JsonNode messageStop = event.has("messageStop") ? event.get("messageStop")
                : "messageStop".equals(type) ? event : null;
        if (messageStop != null) {
            String finishReason = mapFinishReason(textField(messageStop, "stopReason"));
            return chunk(streamId, created, Delta.empty(),
                    finishReason != null ? finishReason : FinishReason.STOP.value());
        }

        // messageStart, contentBlockStop, metadata
        return emptyChunk(streamId, created);
    }
}
